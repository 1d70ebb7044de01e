// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;


class ModelTest
{
    @Test
    void testDeviceFormat ()
    {
        assertThat (DeviceFormat.classify ("PluginDevice")).isEqualTo (DeviceFormat.PLUGIN);
        assertThat (DeviceFormat.classify ("Vst3PluginInfo")).isEqualTo (DeviceFormat.VST3);
        assertThat (DeviceFormat.classify ("VstPluginInfo")).isEqualTo (DeviceFormat.VST);
        assertThat (DeviceFormat.classify ("AuPluginInfo")).isEqualTo (DeviceFormat.AU);
        assertThat (DeviceFormat.classify ("AutoPan")).isEqualTo (DeviceFormat.DEVICE);
        assertThat (DeviceFormat.classify ("Eq8")).isEqualTo (DeviceFormat.DEVICE);
        assertThat (DeviceFormat.classify (null)).isEqualTo (DeviceFormat.DEVICE);
        assertThat (DeviceFormat.DEVICE.isThirdParty ()).isFalse ();
        assertThat (DeviceFormat.AU.isThirdParty ()).isTrue ();
    }


    @Test
    void testTrackType ()
    {
        assertThat (TrackType.fromTag ("GroupTrack")).contains (TrackType.GROUP);
        assertThat (TrackType.fromTag ("MainTrack")).contains (TrackType.MASTER);
        assertThat (TrackType.fromTag ("MasterTrack")).contains (TrackType.MASTER);
        assertThat (TrackType.fromTag ("PreHearTrack")).isEmpty ();
    }


    @Test
    void testTriState ()
    {
        assertThat (TriState.of ((Boolean) null)).isEqualTo (TriState.UNKNOWN);
        assertThat (TriState.UNKNOWN.not ()).isEqualTo (TriState.UNKNOWN);
        assertThat (TriState.TRUE.not ()).isEqualTo (TriState.FALSE);
        assertThat (TriState.UNKNOWN.toBoolean ()).isNull ();
    }


    @Test
    void testMixerSilence ()
    {
        assertThat (new Mixer ("0.0000001", null).getVolumeSilent ()).isEqualTo (TriState.TRUE);
        assertThat (new Mixer ("0.5", null).getVolumeSilent ()).isEqualTo (TriState.FALSE);
        assertThat (new Mixer ("abc", null).getVolumeSilent ()).isEqualTo (TriState.UNKNOWN);
    }


    @Test
    void testQcResultCodes ()
    {
        final QcResult result = new QcResult (EnumSet.of (QcReason.ROUTING_BROKEN, QcReason.MUTED), EnumSet.of (QcWarning.ON_AUTOMATION));
        assertThat (result.isFail ()).isTrue ();
        assertThat (result.getReasonCodes ()).isEqualTo ("mr");
        assertThat (result.getWarningCodes ()).isEqualTo ("a");
        assertThat (new QcResult (EnumSet.noneOf (QcReason.class), EnumSet.of (QcWarning.ON_AUTOMATION)).isFail ()).isFalse ();
    }


    @Test
    void testTrackLabel ()
    {
        assertThat (TrackFixtures.track ("3", "Bass").build ().getLabel ()).isEqualTo ("Bass (AudioTrack 3)");
        assertThat (TrackFixtures.track ("3", null).build ().getLabel ()).isEqualTo ("Track.3 (AudioTrack 3)");
    }
}
