// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import static org.assertj.core.api.Assertions.assertThat;

import de.mossgrabers.mixchecker.model.TriState;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;

import java.text.ParseException;
import java.util.Map;


class DeviceKeySettingsTest
{
    @Test
    void testDeviceKinds ()
    {
        assertThat (DeviceKind.fromTag ("StereoGain")).isEqualTo (DeviceKind.UTILITY);
        assertThat (DeviceKind.fromTag ("drumgroupdevice")).isEqualTo (DeviceKind.RACK);
        assertThat (DeviceKind.fromTag ("MxDeviceAudioEffect")).isEqualTo (DeviceKind.MAX_FOR_LIVE);
        assertThat (DeviceKind.fromTag ("Compressor2")).isEqualTo (DeviceKind.GENERIC);
        assertThat (DeviceKind.fromTag (null)).isEqualTo (DeviceKind.GENERIC);
    }


    @Test
    void testGlueCompressor () throws ParseException
    {
        final ObjectNode settings = DeviceKeySettings.extract (AttributeResolverTest.xml ("<GlueCompressor><Threshold><Manual Value=\"-12.5\" /></Threshold><Ratio><Manual Value=\"2\" /></Ratio>" +
                "<SideChain><OnOff><Manual Value=\"true\" /></OnOff><RoutedInput><Routable><Target Value=\"AudioIn/Track.4/PostFxOut\" /></Routable></RoutedInput></SideChain></GlueCompressor>")).orElseThrow ();

        assertThat (settings.get ("Threshold").doubleValue ()).isEqualTo (-12.5);
        assertThat (settings.get ("Ratio").longValue ()).isEqualTo (2);
        assertThat (settings.has ("Attack")).isFalse ();
        assertThat (settings.get ("sidechain_target").textValue ()).isEqualTo ("AudioIn/Track.4/PostFxOut");
        assertThat (settings.has ("sidechain_on")).isFalse ();
    }


    @Test
    void testRack () throws ParseException
    {
        final ObjectNode settings = DeviceKeySettings.extract (AttributeResolverTest.xml ("<InstrumentGroupDevice><ChainSelector><Manual Value=\"3\" /></ChainSelector>" +
                "<MacroDisplayNames.0 Value=\"Cutoff\" /><MacroControls.0><Manual Value=\"64\" /></MacroControls.0>" +
                "<Branches><InstrumentBranch><Name><EffectiveName Value=\"Pad\" /></Name><BranchSelectorRange><Min Value=\"0\" /><Max Value=\"10\" /></BranchSelectorRange><IsSelected Value=\"true\" /><IsSoloed Value=\"false\" /></InstrumentBranch></Branches>" +
                "</InstrumentGroupDevice>")).orElseThrow ();

        assertThat (settings.get ("chain_selector").longValue ()).isEqualTo (3);
        final JsonNode macro = settings.get ("macros").get (0);
        assertThat (macro.get ("i").intValue ()).isZero ();
        assertThat (macro.get ("n").textValue ()).isEqualTo ("Cutoff");
        assertThat (macro.get ("v").longValue ()).isEqualTo (64);

        final JsonNode branch = settings.get ("branches").get (0);
        assertThat (branch.get ("range").get (1).longValue ()).isEqualTo (10);
        assertThat (branch.get ("selected").booleanValue ()).isTrue ();
        assertThat (branch.get ("solo").booleanValue ()).isFalse ();
    }


    @Test
    void testMaxForLive () throws ParseException
    {
        final ObjectNode settings = DeviceKeySettings.extract (AttributeResolverTest.xml ("<MxDeviceAudioEffect><ParameterList><ParameterList>" +
                "<MxDFloatParameter><Name Value=\"Depth\" /><Timeable><Manual Value=\"0.5\" /></Timeable></MxDFloatParameter>" +
                "<MxDFloatParameter><Timeable><Manual Value=\"1\" /></Timeable></MxDFloatParameter>" +
                "</ParameterList></ParameterList></MxDeviceAudioEffect>")).orElseThrow ();

        assertThat (settings.get ("params").size ()).isEqualTo (1);
        assertThat (settings.get ("params").get (0).get ("n").textValue ()).isEqualTo ("Depth");
        assertThat (settings.get ("params").get (0).get ("v").doubleValue ()).isEqualTo (0.5);
    }


    @Test
    void testGenericScan () throws ParseException
    {
        final ObjectNode settings = DeviceKeySettings.extract (AttributeResolverTest.xml ("<Compressor2><Threshold Value=\"0.5\" /><Ratio Value=\"4\" /><Model Value=\"Peak\" /><AttackTime Value=\"yes\" /><Threshold Value=\"0.6\" /></Compressor2>")).orElseThrow ();

        assertThat (settings.get ("Threshold").doubleValue ()).isEqualTo (0.5);
        assertThat (settings.get ("Threshold_2").doubleValue ()).isEqualTo (0.6);
        assertThat (settings.get ("Ratio").doubleValue ()).isEqualTo (4);
        assertThat (settings.get ("AttackTime").booleanValue ()).isTrue ();
        assertThat (settings.has ("Model")).isFalse ();
    }


    @Test
    void testNothingToExtract () throws ParseException
    {
        assertThat (DeviceKeySettings.extract (AttributeResolverTest.xml ("<Compressor2><Model Value=\"Peak\" /></Compressor2>"))).isEmpty ();
    }


    @Test
    void testUtilityNoop ()
    {
        assertThat (DeviceKeySettings.detectNoop ("StereoGain", Map.of ("Gain", "0", "Width", "100"))).isEqualTo (TriState.TRUE);
        assertThat (DeviceKeySettings.detectNoop ("StereoGain", Map.of ("Gain (dB)", "0.0000001", "Stereo Width", "1"))).isEqualTo (TriState.TRUE);
        assertThat (DeviceKeySettings.detectNoop ("StereoGain", Map.of ("Gain", "-6"))).isEqualTo (TriState.FALSE);
        assertThat (DeviceKeySettings.detectNoop ("StereoGain", Map.of ("Gain", "0", "BassMono", "true"))).isEqualTo (TriState.FALSE);
        assertThat (DeviceKeySettings.detectNoop ("StereoGain", Map.of ())).isEqualTo (TriState.UNKNOWN);
    }


    @Test
    void testEqNoop ()
    {
        assertThat (DeviceKeySettings.detectNoop ("Eq8", Map.of ("Band 1 Frequency", "120"))).isEqualTo (TriState.FALSE);
        assertThat (DeviceKeySettings.detectNoop ("Eq8", Map.of ("Scale", "100"))).isEqualTo (TriState.UNKNOWN);
        assertThat (DeviceKeySettings.detectNoop ("Reverb", Map.of ("Gain", "0"))).isEqualTo (TriState.UNKNOWN);
    }
}
