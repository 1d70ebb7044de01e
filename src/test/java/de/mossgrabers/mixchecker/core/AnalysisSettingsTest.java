// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.core;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Properties;


class AnalysisSettingsTest
{
    @Test
    void testDefaults () throws IOException
    {
        final AnalysisSettings settings = AnalysisSettings.loadDefaults ();
        assertThat (settings.getMaxParamsPerDevice ()).isEqualTo (AnalysisSettings.DEFAULT_MAX_PARAMS);
        assertThat (settings.isMixSettings ()).isFalse ();
        assertThat (settings.isFullDedupe ()).isTrue ();
        assertThat (settings.isStripNullKeys ()).isTrue ();
        assertThat (settings.isMinify ()).isFalse ();
    }


    @Test
    void testFromProperties ()
    {
        final Properties properties = new Properties ();
        properties.setProperty ("maxParamsPerDevice", " 10 ");
        properties.setProperty ("mixSettings", "true");
        properties.setProperty ("stripNullKeys", "false");

        final AnalysisSettings settings = AnalysisSettings.fromProperties (properties);
        assertThat (settings.getMaxParamsPerDevice ()).isEqualTo (10);
        assertThat (settings.isMixSettings ()).isTrue ();
        assertThat (settings.isStripNullKeys ()).isFalse ();
        // Missing keys keep the defaults
        assertThat (settings.isFullDedupe ()).isTrue ();
        assertThat (settings.isMinify ()).isFalse ();
    }


    @Test
    void testNegativeMaximum ()
    {
        final AnalysisSettings settings = new AnalysisSettings ();
        settings.setMaxParamsPerDevice (-5);
        assertThat (settings.getMaxParamsPerDevice ()).isZero ();
    }
}
