// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;


/**
 * The impact of deactivated tracks on the routing of one track. Instances are immutable, use the
 * builder to create one.
 *
 * @author Jürgen Moßgraber
 */
public class RoutingImpact
{
    /** The placeholder in an elided path. */
    public static final String ELISION = "...";

    private final boolean      routingBreak;
    private final Integer      depth;
    private final List<String> sources;
    private final List<String> path;
    private final boolean      deadBus;
    private final boolean      orphanBus;
    private final List<String> messages;
    private final String       resolvedGroupId;


    private RoutingImpact (final Builder builder)
    {
        this.routingBreak = builder.routingBreak;
        this.depth = builder.depth;
        this.sources = Collections.unmodifiableList (new ArrayList<> (builder.sources));
        this.path = Collections.unmodifiableList (new ArrayList<> (builder.path));
        this.deadBus = builder.deadBus;
        this.orphanBus = builder.orphanBus;
        this.messages = Collections.unmodifiableList (new ArrayList<> (builder.messages));
        this.resolvedGroupId = builder.resolvedGroupId;
    }


    /**
     * Is the routing of the track broken by a deactivated track?
     *
     * @return True if broken
     */
    public boolean isRoutingBreak ()
    {
        return this.routingBreak;
    }


    /**
     * Get the shortest number of hops from a deactivated track. 0 for deactivated tracks.
     *
     * @return The depth, empty if the track is not reachable from a deactivated track
     */
    public OptionalInt getDepth ()
    {
        return this.depth == null ? OptionalInt.empty () : OptionalInt.of (this.depth.intValue ());
    }


    /**
     * Get the IDs of all deactivated tracks which reach this track with the shortest depth.
     *
     * @return The IDs in track ID order
     */
    public List<String> getSources ()
    {
        return this.sources;
    }


    /**
     * Get one shortest path from a deactivated track to this track. Long paths contain the
     * elision marker.
     *
     * @return The track IDs of the path
     */
    public List<String> getPath ()
    {
        return this.path;
    }


    /**
     * Is this a bus which has only deactivated sources?
     *
     * @return True if dead
     */
    public boolean isDeadBus ()
    {
        return this.deadBus;
    }


    /**
     * Is this a bus-like track without any sources?
     *
     * @return True if orphaned
     */
    public boolean isOrphanBus ()
    {
        return this.orphanBus;
    }


    /**
     * Get the human readable descriptions of the impact.
     *
     * @return The messages
     */
    public List<String> getMessages ()
    {
        return this.messages;
    }


    /**
     * Get the ID of the parent group which was used for an output routed to "GroupTrack".
     *
     * @return The ID
     */
    public Optional<String> getResolvedGroupId ()
    {
        return Optional.ofNullable (this.resolvedGroupId);
    }


    /** {@inheritDoc} */
    @Override
    public boolean equals (final Object obj)
    {
        if (this == obj)
            return true;
        if (!(obj instanceof final RoutingImpact other))
            return false;
        return this.routingBreak == other.routingBreak && this.deadBus == other.deadBus && this.orphanBus == other.orphanBus && Objects.equals (this.depth, other.depth) && this.sources.equals (other.sources) && this.path.equals (other.path) && this.messages.equals (other.messages) && Objects.equals (this.resolvedGroupId, other.resolvedGroupId);
    }


    /** {@inheritDoc} */
    @Override
    public int hashCode ()
    {
        return Objects.hash (Boolean.valueOf (this.routingBreak), this.depth, this.sources, this.path, Boolean.valueOf (this.deadBus), Boolean.valueOf (this.orphanBus), this.messages, this.resolvedGroupId);
    }


    /**
     * Collects the impact during the propagation.
     */
    public static class Builder
    {
        private boolean            routingBreak;
        private Integer            depth;
        private List<String>       sources  = new ArrayList<> ();
        private List<String>       path     = new ArrayList<> ();
        private boolean            deadBus;
        private boolean            orphanBus;
        private final List<String> messages = new ArrayList<> ();
        private String             resolvedGroupId;


        /**
         * Mark the routing as broken.
         *
         * @return The builder
         */
        public Builder setRoutingBreak ()
        {
            this.routingBreak = true;
            return this;
        }


        /**
         * Is the routing marked as broken?
         *
         * @return True if broken
         */
        public boolean isRoutingBreak ()
        {
            return this.routingBreak;
        }


        /**
         * Set the shortest path information.
         *
         * @param depth The number of hops
         * @param sources The IDs of the deactivated sources in track ID order
         * @param path One shortest path
         * @return The builder
         */
        public Builder setReach (final int depth, final List<String> sources, final List<String> path)
        {
            this.depth = Integer.valueOf (depth);
            this.sources = new ArrayList<> (sources);
            this.path = new ArrayList<> (path);
            return this;
        }


        /**
         * Mark as dead bus.
         *
         * @return The builder
         */
        public Builder setDeadBus ()
        {
            this.deadBus = true;
            return this;
        }


        /**
         * Mark as orphaned bus.
         *
         * @return The builder
         */
        public Builder setOrphanBus ()
        {
            this.orphanBus = true;
            return this;
        }


        /**
         * Add a message.
         *
         * @param message The message
         * @return The builder
         */
        public Builder addMessage (final String message)
        {
            this.messages.add (message);
            return this;
        }


        /**
         * Set the ID of the parent group used for a "GroupTrack" output.
         *
         * @param resolvedGroupId The ID
         * @return The builder
         */
        public Builder setResolvedGroupId (final String resolvedGroupId)
        {
            this.resolvedGroupId = resolvedGroupId;
            return this;
        }


        /**
         * Create the immutable impact.
         *
         * @return The impact
         */
        public RoutingImpact build ()
        {
            return new RoutingImpact (this);
        }
    }
}
