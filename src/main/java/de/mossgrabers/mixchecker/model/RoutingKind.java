// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

/**
 * The kind of a routing endpoint, derived from the routing text.
 *
 * @author Jürgen Moßgraber
 */
public enum RoutingKind
{
    /** Explicitly routed nowhere. */
    NONE ("n"),
    /** No routing information present. */
    MISSING ("m"),
    /** Routed to the master. */
    MASTER ("M"),
    /** Routed to a group. */
    GROUP ("G"),
    /** Routed to or from another track. */
    TRACK ("T"),
    /** Routed to or from an external (hardware) port. */
    EXTERNAL ("E"),
    /** Could not be classified. */
    UNKNOWN ("u");


    private final String code;


    private RoutingKind (final String code)
    {
        this.code = code;
    }


    /**
     * Get the short code used in the compact report.
     *
     * @return The code
     */
    public String getCode ()
    {
        return this.code;
    }


    /**
     * Classify a routing text.
     *
     * @param routing The routing text, e.g. "AudioIn/Track.12/PostFxOut", might be null
     * @return The kind
     */
    public static RoutingKind classify (final String routing)
    {
        if (routing == null || routing.isEmpty ())
            return MISSING;
        if (routing.endsWith ("/None") || routing.contains ("AudioIn/None") || routing.contains ("AudioOut/None"))
            return NONE;
        if (routing.contains ("AudioOut/Master") || routing.endsWith ("/Master"))
            return MASTER;
        if (routing.contains ("GroupTrack"))
            return GROUP;
        if (routing.contains ("AudioIn/Track.") || routing.contains ("AudioOut/Track."))
            return TRACK;
        if (routing.contains ("Ext"))
            return EXTERNAL;
        return UNKNOWN;
    }
}
