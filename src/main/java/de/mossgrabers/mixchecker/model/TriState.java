// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

/**
 * A boolean which might not be known. Unknown is a value of its own and must never be read as
 * false.
 *
 * @author Jürgen Moßgraber
 */
public enum TriState
{
    /** The value is known to be true. */
    TRUE,
    /** The value is known to be false. */
    FALSE,
    /** The value could not be resolved. */
    UNKNOWN;


    /**
     * Wrap a boolean.
     *
     * @param value The value
     * @return The matching state
     */
    public static TriState of (final boolean value)
    {
        return value ? TRUE : FALSE;
    }


    /**
     * Wrap a boolean object.
     *
     * @param value The value, null is unknown
     * @return The matching state
     */
    public static TriState of (final Boolean value)
    {
        if (value == null)
            return UNKNOWN;
        return of (value.booleanValue ());
    }


    /**
     * Is the value known to be true?
     *
     * @return True if known and true
     */
    public boolean isTrue ()
    {
        return this == TRUE;
    }


    /**
     * Is the value known to be false?
     *
     * @return True if known and false
     */
    public boolean isFalse ()
    {
        return this == FALSE;
    }


    /**
     * Is the value known?
     *
     * @return True if true or false
     */
    public boolean isKnown ()
    {
        return this != UNKNOWN;
    }


    /**
     * Negate the state. Unknown stays unknown.
     *
     * @return The negated state
     */
    public TriState not ()
    {
        switch (this)
        {
            case TRUE:
                return FALSE;
            case FALSE:
                return TRUE;
            default:
                return UNKNOWN;
        }
    }


    /**
     * Get the value as a boolean object, e.g. for serialization.
     *
     * @return The value, null if unknown
     */
    public Boolean toBoolean ()
    {
        return this == UNKNOWN ? null : Boolean.valueOf (this == TRUE);
    }
}
