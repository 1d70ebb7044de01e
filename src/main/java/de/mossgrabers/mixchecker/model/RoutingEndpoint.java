// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * One routing endpoint of a track (audio/MIDI input/output).
 *
 * @author Jürgen Moßgraber
 */
public class RoutingEndpoint
{
    private static final Pattern TRACK_REFERENCE = Pattern.compile ("(?:Track|GroupTrack)\\.(\\d+)");

    private final String         target;
    private final RoutingKind    kind;
    private final String         referencedTrackId;


    /**
     * Constructor.
     *
     * @param target The opaque routing text, might be null if the routing node has no value
     */
    public RoutingEndpoint (final String target)
    {
        this.target = target;
        this.kind = RoutingKind.classify (target);
        this.referencedTrackId = parseTrackReference (target);
    }


    /**
     * Get the routing text.
     *
     * @return The text, empty if not present
     */
    public Optional<String> getTarget ()
    {
        return Optional.ofNullable (this.target);
    }


    /**
     * Get the kind of the routing.
     *
     * @return The kind
     */
    public RoutingKind getKind ()
    {
        return this.kind;
    }


    /**
     * Get the ID of the track which is referenced by the routing, if any.
     *
     * @return The ID of the referenced track
     */
    public Optional<String> getReferencedTrackId ()
    {
        return Optional.ofNullable (this.referencedTrackId);
    }


    /**
     * Extracts the ID from a "Track.N" or "GroupTrack.N" reference.
     *
     * @param routing The routing text, might be null
     * @return The ID or null
     */
    static String parseTrackReference (final String routing)
    {
        if (routing == null)
            return null;
        final Matcher matcher = TRACK_REFERENCE.matcher (routing);
        return matcher.find () ? matcher.group (1) : null;
    }
}
