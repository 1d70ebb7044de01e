// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format;

/**
 * Utility functions for converting values.
 *
 * @author Jürgen Moßgraber
 */
public class Conversions
{
    private static final double MIN_LEVEL_DB = -150.0;
    private static final double MIN_LINEAR   = 0.0000000298023223876953125;


    /**
     * Private constructor since this is a utility class.
     */
    private Conversions ()
    {
        // Intentionally empty
    }


    /**
     * Converts a linear gain value (1 is 0dB) to a dB value.
     *
     * @param linearValue The linear value to convert
     * @return The dB value, not lower than -150dB
     */
    public static double valueToDb (final double linearValue)
    {
        if (Double.isNaN (linearValue) || linearValue < MIN_LINEAR)
            return MIN_LEVEL_DB;
        return Math.max (MIN_LEVEL_DB, 20.0 * Math.log10 (linearValue));
    }
}
