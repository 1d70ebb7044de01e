// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;


class ConversionsTest
{
    @Test
    void testValueToDb ()
    {
        assertThat (Conversions.valueToDb (1.0)).isEqualTo (0.0);
        assertThat (Conversions.valueToDb (10.0)).isCloseTo (20.0, within (1e-9));
        assertThat (Conversions.valueToDb (0.5)).isCloseTo (-6.0206, within (1e-4));
        assertThat (Conversions.valueToDb (0)).isEqualTo (-150.0);
        assertThat (Conversions.valueToDb (-1)).isEqualTo (-150.0);
        assertThat (Conversions.valueToDb (Double.NaN)).isEqualTo (-150.0);
    }
}
