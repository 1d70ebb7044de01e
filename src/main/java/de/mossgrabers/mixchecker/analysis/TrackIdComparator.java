// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.analysis;

import java.math.BigInteger;
import java.util.Comparator;


/**
 * Orders track IDs: numeric IDs by their value first, all others lexicographically after them.
 *
 * @author Jürgen Moßgraber
 */
public class TrackIdComparator implements Comparator<String>
{
    /** The shared instance. */
    public static final TrackIdComparator INSTANCE = new TrackIdComparator ();


    /** {@inheritDoc} */
    @Override
    public int compare (final String id1, final String id2)
    {
        final boolean isNumber1 = isNumber (id1);
        final boolean isNumber2 = isNumber (id2);
        if (isNumber1 && isNumber2)
        {
            final int result = new BigInteger (id1).compareTo (new BigInteger (id2));
            return result == 0 ? id1.compareTo (id2) : result;
        }
        if (isNumber1)
            return -1;
        if (isNumber2)
            return 1;
        return id1.compareTo (id2);
    }


    private static boolean isNumber (final String id)
    {
        if (id.isEmpty ())
            return false;
        for (int i = 0; i < id.length (); i++)
        {
            final char ch = id.charAt (i);
            if (ch < '0' || ch > '9')
                return false;
        }
        return true;
    }
}
