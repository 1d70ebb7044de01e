// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;


class TrackIdComparatorTest
{
    @Test
    void testNumericBeforeText ()
    {
        final List<String> ids = new ArrayList<> (List.of ("b", "10", "9", "a", "123456789012345678901234567890", "2"));
        ids.sort (TrackIdComparator.INSTANCE);
        assertThat (ids).containsExactly ("2", "9", "10", "123456789012345678901234567890", "a", "b");
    }
}
