// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;


/**
 * The directed graph of the audio flow between tracks. The nodes are track IDs, an edge from A
 * to B means that audio flows from track A into track B. Adjacent nodes are kept in track ID
 * order.
 *
 * @author Jürgen Moßgraber
 */
public class RoutingGraph
{
    private final SortedSet<String>              trackIds         = new TreeSet<> (TrackIdComparator.INSTANCE);
    private final Map<String, SortedSet<String>> successors       = new HashMap<> ();
    private final Map<String, SortedSet<String>> predecessors     = new HashMap<> ();
    private final Map<String, List<String>>      consumers        = new HashMap<> ();
    private final Map<String, String>            resolvedGroupIds = new HashMap<> ();
    private int                                  edgeCount;


    /**
     * Add a node.
     *
     * @param trackId The ID of the track
     */
    void addTrack (final String trackId)
    {
        this.trackIds.add (trackId);
    }


    /**
     * Add an edge. Self-edges and edges which touch unknown tracks are ignored. Adding an
     * existing edge has no effect.
     *
     * @param sourceId The ID of the track the audio comes from
     * @param destinationId The ID of the track which receives the audio
     * @return True if the edge was added
     */
    boolean addEdge (final String sourceId, final String destinationId)
    {
        if (sourceId == null || destinationId == null || sourceId.equals (destinationId))
            return false;
        if (!this.trackIds.contains (sourceId) || !this.trackIds.contains (destinationId))
            return false;
        if (!this.successors.computeIfAbsent (sourceId, id -> new TreeSet<> (TrackIdComparator.INSTANCE)).add (destinationId))
            return false;
        this.predecessors.computeIfAbsent (destinationId, id -> new TreeSet<> (TrackIdComparator.INSTANCE)).add (sourceId);
        this.edgeCount++;
        return true;
    }


    /**
     * Register a track which takes its audio input from another track.
     *
     * @param sourceId The ID of the track which is referenced by the audio input
     * @param consumerId The ID of the consuming track
     */
    void addConsumer (final String sourceId, final String consumerId)
    {
        final List<String> list = this.consumers.computeIfAbsent (sourceId, id -> new ArrayList<> ());
        if (!list.contains (consumerId))
            list.add (consumerId);
    }


    /**
     * Store the parent group which receives the audio output of a track routed to "GroupTrack".
     *
     * @param trackId The ID of the track
     * @param groupId The ID of the parent group
     */
    void setResolvedGroupId (final String trackId, final String groupId)
    {
        this.resolvedGroupIds.put (trackId, groupId);
    }


    /**
     * Get all nodes.
     *
     * @return The track IDs in track ID order
     */
    public SortedSet<String> getTrackIds ()
    {
        return Collections.unmodifiableSortedSet (this.trackIds);
    }


    /**
     * Get the tracks which receive audio from a track.
     *
     * @param trackId The ID of the track
     * @return The IDs of the destinations in track ID order
     */
    public SortedSet<String> getSuccessors (final String trackId)
    {
        final SortedSet<String> set = this.successors.get (trackId);
        return set == null ? Collections.emptySortedSet () : Collections.unmodifiableSortedSet (set);
    }


    /**
     * Get the tracks which send audio to a track.
     *
     * @param trackId The ID of the track
     * @return The IDs of the sources in track ID order
     */
    public SortedSet<String> getPredecessors (final String trackId)
    {
        final SortedSet<String> set = this.predecessors.get (trackId);
        return set == null ? Collections.emptySortedSet () : Collections.unmodifiableSortedSet (set);
    }


    /**
     * Get the tracks whose audio input references a track.
     *
     * @param trackId The ID of the referenced track
     * @return The IDs of the consuming tracks in the order of the tracks
     */
    public List<String> getConsumers (final String trackId)
    {
        final List<String> list = this.consumers.get (trackId);
        return list == null ? Collections.emptyList () : Collections.unmodifiableList (list);
    }


    /**
     * Get the parent group which receives the audio output of a track routed to "GroupTrack".
     *
     * @param trackId The ID of the track
     * @return The ID of the group
     */
    public Optional<String> getResolvedGroupId (final String trackId)
    {
        return Optional.ofNullable (this.resolvedGroupIds.get (trackId));
    }


    /**
     * Check if there is an edge between two tracks.
     *
     * @param sourceId The ID of the source track
     * @param destinationId The ID of the destination track
     * @return True if audio flows from the source to the destination
     */
    public boolean hasEdge (final String sourceId, final String destinationId)
    {
        return this.getSuccessors (sourceId).contains (destinationId);
    }


    /**
     * Get the number of (distinct) edges.
     *
     * @return The number
     */
    public int getEdgeCount ()
    {
        return this.edgeCount;
    }
}
