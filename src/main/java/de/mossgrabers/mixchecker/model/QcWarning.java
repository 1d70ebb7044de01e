// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

/**
 * Informational findings of the quality check which do not fail a track.
 *
 * @author Jürgen Moßgraber
 */
public enum QcWarning
{
    /** At least one device has an automated power button. */
    ON_AUTOMATION ("a", "device On/Off is automated (likely intentional)");


    private final String code;
    private final String description;


    private QcWarning (final String code, final String description)
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
