// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

/**
 * The reasons why a track fails the quality check. The order of the constants is the order in
 * which they are reported.
 *
 * @author Jürgen Moßgraber
 */
public enum QcReason
{
    /** The track is muted. */
    MUTED ("m", "muted"),
    /** The track activator is off. */
    DEACTIVATED ("d", "track deactivated (gray power button)"),
    /** The fader is at minus infinity. */
    SILENT ("s", "silent track guess (volume very low / -inf)"),
    /** All devices are switched off. */
    ALL_DEVICES_OFF ("x", "all devices explicitly off and none automated"),
    /** A device is switched off and not automated. */
    DEVICE_OFF ("o", "device off AND not automated (export risk)"),
    /** The routing is broken by a deactivated track. */
    ROUTING_BROKEN ("r", "routing impacted by deactivated track (bus/group/return chain break)");


    private final String code;
    private final String description;


    private QcReason (final String code, final String description)
    {
        this.code = code;
        this.description = description;
    }


    /**
     * Get the single character code.
     *
     * @return The code
     */
    public String getCode ()
    {
        return this.code;
    }


    /**
     * Get the description for the legend.
     *
     * @return The description
     */
    public String getDescription ()
    {
        return this.description;
    }
}
