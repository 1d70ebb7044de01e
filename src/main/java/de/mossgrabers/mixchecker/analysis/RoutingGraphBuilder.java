// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.analysis;

import de.mossgrabers.mixchecker.model.RoutingEndpoint;
import de.mossgrabers.mixchecker.model.Track;

import java.util.List;
import java.util.Optional;


/**
 * Creates the routing graph from the routing endpoints of the tracks.
 *
 * @author Jürgen Moßgraber
 */
public class RoutingGraphBuilder
{
    private static final String GROUP_OUTPUT = "AudioOut/GroupTrack";


    /**
     * Private due to helper class.
     */
    private RoutingGraphBuilder ()
    {
        // Intentionally empty
    }


    /**
     * Create the graph. Tracks without an ID are not part of the graph. There is an edge from A
     * to B if the audio input of B references A, if the audio output of A references B or if the
     * audio output of A goes to "GroupTrack" without an ID and B is the parent group of A.
     *
     * @param tracks The tracks
     * @return The graph
     */
    public static RoutingGraph build (final List<Track> tracks)
    {
        final RoutingGraph graph = new RoutingGraph ();
        for (final Track track: tracks)
            track.getId ().ifPresent (graph::addTrack);

        for (final Track track: tracks)
        {
            final Optional<String> trackId = track.getId ();
            if (trackId.isEmpty ())
                continue;
            final String consumerId = trackId.get ();
            final Optional<String> sourceId = track.getRouting ().getAudioIn ().flatMap (RoutingEndpoint::getReferencedTrackId);
            if (sourceId.isPresent () && graph.getTrackIds ().contains (sourceId.get ()) && !sourceId.get ().equals (consumerId))
            {
                graph.addConsumer (sourceId.get (), consumerId);
                graph.addEdge (sourceId.get (), consumerId);
            }
        }

        for (final Track track: tracks)
        {
            final Optional<String> trackId = track.getId ();
            if (trackId.isEmpty ())
                continue;
            final String id = trackId.get ();
            final Optional<String> destinationId = getOutputDestination (track);
            if (destinationId.isEmpty ())
                continue;
            if (isGroupOutput (track))
                graph.setResolvedGroupId (id, destinationId.get ());
            graph.addEdge (id, destinationId.get ());
        }

        return graph;
    }


    /**
     * Get the track which receives the audio output of a track. This is either the track which
     * is referenced by the output or the parent group if the output goes to "GroupTrack" without
     * an ID.
     *
     * @param track The track
     * @return The ID of the destination track, which might not exist
     */
    public static Optional<String> getOutputDestination (final Track track)
    {
        final Optional<RoutingEndpoint> audioOut = track.getRouting ().getAudioOut ();
        if (audioOut.isEmpty ())
            return Optional.empty ();
        final Optional<String> referencedId = audioOut.get ().getReferencedTrackId ();
        if (referencedId.isPresent ())
            return referencedId;
        if (isGroupOutput (track))
            return track.getParentGroupId ();
        return Optional.empty ();
    }


    private static boolean isGroupOutput (final Track track)
    {
        final Optional<RoutingEndpoint> audioOut = track.getRouting ().getAudioOut ();
        if (audioOut.isEmpty () || audioOut.get ().getReferencedTrackId ().isPresent ())
            return false;
        final Optional<String> target = audioOut.get ().getTarget ();
        return target.isPresent () && target.get ().contains (GROUP_OUTPUT);
    }
}
