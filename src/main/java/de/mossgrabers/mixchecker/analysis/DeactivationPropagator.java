// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.analysis;

import de.mossgrabers.mixchecker.model.RoutingImpact;
import de.mossgrabers.mixchecker.model.RoutingKind;
import de.mossgrabers.mixchecker.model.Track;
import de.mossgrabers.mixchecker.model.TrackAnalysis;
import de.mossgrabers.mixchecker.model.TrackType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;


/**
 * Finds the tracks whose signal path is broken by deactivated tracks. The impact of every
 * deactivated track is followed through the routing graph with a breadth-first search which
 * starts at all deactivated tracks at once. Afterwards the quality checks of all tracks are
 * recomputed.
 *
 * @author Jürgen Moßgraber
 */
public class DeactivationPropagator
{
    /** Paths with more hops are elided. */
    public static final int                MAX_PATH_LENGTH    = 25;
    private static final int               PATH_KEEP          = 5;
    private static final int               MAX_PATH_HOPS      = 50;
    private static final int               MAX_LISTED_SOURCES = 5;

    private static final Pattern           BUS_NAME           = Pattern.compile ("(bus|return|fx|send|recv|receive)", Pattern.CASE_INSENSITIVE);
    private static final List<RoutingKind> ORPHAN_INPUT_KINDS = List.of (RoutingKind.NONE, RoutingKind.MISSING, RoutingKind.UNKNOWN);


    /**
     * Private due to helper class.
     */
    private DeactivationPropagator ()
    {
        // Intentionally empty
    }


    /**
     * Analyse the tracks again. Previous routing impacts are ignored.
     *
     * @param analyses The current analyses
     * @return The new analyses in the same order
     */
    public static List<TrackAnalysis> repropagate (final List<TrackAnalysis> analyses)
    {
        return propagate (analyses.stream ().map (TrackAnalysis::getTrack).collect (Collectors.toList ()));
    }


    /**
     * Compute the routing impact of all deactivated tracks and the final quality check of all
     * tracks.
     *
     * @param tracks The tracks
     * @return The analyses in the order of the tracks, tracks without an ID have no impact
     */
    public static List<TrackAnalysis> propagate (final List<Track> tracks)
    {
        final Map<String, Track> byId = new LinkedHashMap<> ();
        for (final Track track: tracks)
            track.getId ().ifPresent (id -> byId.put (id, track));

        final RoutingGraph graph = RoutingGraphBuilder.build (tracks);
        final Map<String, RoutingImpact.Builder> builders = new HashMap<> ();
        for (final String id: byId.keySet ())
        {
            final RoutingImpact.Builder builder = new RoutingImpact.Builder ();
            graph.getResolvedGroupId (id).ifPresent (builder::setResolvedGroupId);
            builders.put (id, builder);
        }

        markDirectConsumers (byId, graph, builders);
        markDeactivatedSenders (tracks, byId, graph, builders);
        markBuses (byId, graph, builders);
        markReachable (byId, graph, builders);

        final List<TrackAnalysis> result = new ArrayList<> (tracks.size ());
        for (final Track track: tracks)
        {
            RoutingImpact impact = null;
            final Optional<String> id = track.getId ();
            // Duplicated IDs: only the last track with the ID is part of the graph
            if (id.isPresent () && byId.get (id.get ()) == track)
                impact = builders.get (id.get ()).build ();
            result.add (new TrackAnalysis (track, QcFlagSynthesizer.synthesize (track, impact), impact));
        }
        return result;
    }


    /**
     * Tracks which take their audio input from a deactivated track.
     */
    private static void markDirectConsumers (final Map<String, Track> byId, final RoutingGraph graph, final Map<String, RoutingImpact.Builder> builders)
    {
        for (final Map.Entry<String, Track> entry: byId.entrySet ())
        {
            final String sourceId = entry.getKey ();
            if (!entry.getValue ().isDeactivated ())
                continue;
            for (final String consumerId: graph.getConsumers (sourceId))
                builders.get (consumerId).addMessage ("audio_in from deactivated upstream: " + getLabel (byId, sourceId)).setRoutingBreak ();
        }
    }


    /**
     * Deactivated tracks which send their audio to another track or their parent group. Both
     * sides are marked.
     */
    private static void markDeactivatedSenders (final List<Track> tracks, final Map<String, Track> byId, final RoutingGraph graph, final Map<String, RoutingImpact.Builder> builders)
    {
        for (final Track track: tracks)
        {
            final Optional<String> trackId = track.getId ();
            if (trackId.isEmpty () || !track.isDeactivated () || byId.get (trackId.get ()) != track)
                continue;
            final String id = trackId.get ();

            final Optional<String> destinationId = RoutingGraphBuilder.getOutputDestination (track);
            if (destinationId.isPresent () && byId.containsKey (destinationId.get ()) && !destinationId.get ().equals (id))
                builders.get (destinationId.get ()).addMessage ("receives from deactivated child: " + getLabel (byId, id)).setRoutingBreak ();

            final List<String> consumers = graph.getConsumers (id);
            if (consumers.isEmpty () && destinationId.isEmpty ())
                continue;
            final RoutingImpact.Builder builder = builders.get (id);
            for (final String consumerId: consumers)
                builder.addMessage ("deactivated track feeds downstream consumer: " + getLabel (byId, consumerId));
            destinationId.ifPresent (destination -> builder.addMessage ("deactivated track routes audio_out into: " + getLabel (byId, destination)));
            builder.setRoutingBreak ();
        }
    }


    /**
     * Dead buses only receive audio from deactivated tracks. Orphan buses are audio or group
     * tracks which look like a bus but nothing is routed into them.
     */
    private static void markBuses (final Map<String, Track> byId, final RoutingGraph graph, final Map<String, RoutingImpact.Builder> builders)
    {
        for (final Map.Entry<String, Track> entry: byId.entrySet ())
        {
            final String id = entry.getKey ();
            final Track track = entry.getValue ();
            final RoutingImpact.Builder builder = builders.get (id);
            final SortedSet<String> inbound = graph.getPredecessors (id);
            if (!inbound.isEmpty ())
            {
                if (inbound.stream ().allMatch (sourceId -> byId.get (sourceId).isDeactivated ()))
                    builder.setDeadBus ().addMessage ("dead bus: upstream sources exist (" + inbound.size () + ") but all are deactivated").setRoutingBreak ();
                continue;
            }

            final String name = track.getName ().orElse ("");
            if (isBusTrackType (track.getType ()) && BUS_NAME.matcher (name).find () && ORPHAN_INPUT_KINDS.contains (track.getRouting ().getAudioInKind ()))
                builder.setOrphanBus ().addMessage ("orphan bus: bus-like track has no upstream sources").setRoutingBreak ();
        }
    }


    /**
     * Only audio and group tracks can be orphan buses. Return tracks get their input from sends.
     */
    private static boolean isBusTrackType (final TrackType type)
    {
        return type == TrackType.AUDIO || type == TrackType.GROUP;
    }


    /**
     * Multi-source breadth-first search from all deactivated tracks. Every track gets its
     * shortest distance, all deactivated tracks which reach it at that distance and one example
     * path.
     */
    private static void markReachable (final Map<String, Track> byId, final RoutingGraph graph, final Map<String, RoutingImpact.Builder> builders)
    {
        final Map<String, Integer> depths = new HashMap<> ();
        final Map<String, SortedSet<String>> sources = new HashMap<> ();
        final Map<String, String> predecessors = new HashMap<> ();

        List<String> frontier = new ArrayList<> ();
        for (final String id: graph.getTrackIds ())
        {
            if (!byId.get (id).isDeactivated ())
                continue;
            depths.put (id, Integer.valueOf (0));
            final SortedSet<String> own = new TreeSet<> (TrackIdComparator.INSTANCE);
            own.add (id);
            sources.put (id, own);
            frontier.add (id);
        }

        int depth = 0;
        while (!frontier.isEmpty ())
        {
            final int nextDepth = depth + 1;
            final SortedSet<String> next = new TreeSet<> (TrackIdComparator.INSTANCE);
            for (final String id: frontier)
            {
                for (final String successor: graph.getSuccessors (id))
                {
                    final Integer known = depths.get (successor);
                    if (known == null)
                    {
                        depths.put (successor, Integer.valueOf (nextDepth));
                        sources.put (successor, new TreeSet<> (sources.get (id)));
                        predecessors.put (successor, id);
                        next.add (successor);
                    }
                    else if (known.intValue () == nextDepth)
                        sources.get (successor).addAll (sources.get (id));
                }
            }
            frontier = new ArrayList<> (next);
            depth = nextDepth;
        }

        for (final String id: graph.getTrackIds ())
        {
            final Integer trackDepth = depths.get (id);
            if (trackDepth == null)
                continue;

            final List<String> trackSources = new ArrayList<> (sources.get (id));
            final RoutingImpact.Builder builder = builders.get (id);
            builder.setReach (trackDepth.intValue (), trackSources, getPath (id, predecessors));

            if (trackDepth.intValue () >= 1 && !byId.get (id).isDeactivated ())
            {
                final List<String> labels = new ArrayList<> ();
                for (final String sourceId: trackSources.subList (0, Math.min (MAX_LISTED_SOURCES, trackSources.size ())))
                    labels.add (getLabel (byId, sourceId));
                final String more = trackSources.size () > MAX_LISTED_SOURCES ? RoutingImpact.ELISION : "";
                builder.addMessage ("reachable from deactivated source(s) at depth " + trackDepth + ": " + String.join (", ", labels) + more).setRoutingBreak ();
            }
        }
    }


    /**
     * Reconstruct the example path which ends at a track.
     *
     * @param id The ID of the last track on the path
     * @param predecessors The example predecessor of each reached track
     * @return The track IDs from the deactivated source to the track, long paths are elided
     */
    static List<String> getPath (final String id, final Map<String, String> predecessors)
    {
        final List<String> path = new ArrayList<> ();
        String current = id;
        while (current != null && path.size () < MAX_PATH_HOPS)
        {
            path.add (current);
            current = predecessors.get (current);
        }
        Collections.reverse (path);
        return elide (path);
    }


    /**
     * Shorten a path with more than 25 entries to the first 5, the elision marker and the last 5.
     *
     * @param path The path
     * @return The path or the shortened path
     */
    static List<String> elide (final List<String> path)
    {
        if (path.size () <= MAX_PATH_LENGTH)
            return path;
        final List<String> elided = new ArrayList<> (path.subList (0, PATH_KEEP));
        elided.add (RoutingImpact.ELISION);
        elided.addAll (path.subList (path.size () - PATH_KEEP, path.size ()));
        return elided;
    }


    private static String getLabel (final Map<String, Track> byId, final String id)
    {
        final Track track = byId.get (id);
        return track == null ? "Track." + id : track.getLabel ();
    }
}
