// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import static org.assertj.core.api.Assertions.assertThat;

import de.mossgrabers.mixchecker.format.ableton.model.AbletonProject;
import de.mossgrabers.mixchecker.format.ableton.model.Node;
import de.mossgrabers.mixchecker.model.DeviceIdentity;
import de.mossgrabers.mixchecker.model.RoutingEndpoint;
import de.mossgrabers.mixchecker.model.RoutingKind;
import de.mossgrabers.mixchecker.model.TriState;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;


class AttributeResolverTest
{
    static Node xml (final String xml) throws ParseException
    {
        return AbletonProject.parse (new ByteArrayInputStream (xml.getBytes (StandardCharsets.UTF_8)));
    }


    @Test
    void testTrackName () throws ParseException
    {
        assertThat (AttributeResolver.resolveTrackName (xml ("<AudioTrack><Name><EffectiveName Value=\"1-Audio\" /><UserName Value=\"Bass\" /></Name></AudioTrack>"))).contains ("1-Audio");
        assertThat (AttributeResolver.resolveTrackName (xml ("<AudioTrack><Name><EffectiveName Value=\" \" /><UserName Value=\"Bass\" /></Name></AudioTrack>"))).contains ("Bass");
        assertThat (AttributeResolver.resolveTrackName (xml ("<AudioTrack><Name><EffectiveName Value=\"true\" /></Name></AudioTrack>"))).isEmpty ();
    }


    @Test
    void testFlags () throws ParseException
    {
        final Node track = xml ("<AudioTrack><DeviceChain><Mixer><Speaker><Manual Value=\"true\" /></Speaker><IsMuted Value=\"maybe\" /><TrackMute><Manual Value=\"1\" /></TrackMute></Mixer></DeviceChain><IsSolo Value=\"false\" /></AudioTrack>");
        assertThat (AttributeResolver.resolveActive (track)).isEqualTo (TriState.TRUE);
        assertThat (AttributeResolver.resolveMuted (track)).isEqualTo (TriState.TRUE);
        assertThat (AttributeResolver.resolveSolo (track)).isEqualTo (TriState.FALSE);
        assertThat (AttributeResolver.resolveArmed (track)).isEqualTo (TriState.UNKNOWN);

        final Node withoutMixer = xml ("<AudioTrack><Speaker Value=\"false\" /></AudioTrack>");
        assertThat (AttributeResolver.resolveMuted (withoutMixer)).isEqualTo (TriState.UNKNOWN);
        assertThat (AttributeResolver.resolveActive (withoutMixer)).isEqualTo (TriState.FALSE);
    }


    @Test
    void testMixerValues () throws ParseException
    {
        final Node track = xml ("<AudioTrack><Volume Value=\"0.1\" /><DeviceChain><Mixer><Volume><LomId Value=\"0\" /><Manual Value=\"0.7\" /></Volume></Mixer></DeviceChain><Pan Manual=\"-1\" /></AudioTrack>");
        assertThat (AttributeResolver.resolveVolume (track)).contains ("0.7");
        assertThat (AttributeResolver.resolvePan (track)).contains ("-1");
    }


    @Test
    void testRouting () throws ParseException
    {
        final Node track = xml ("<AudioTrack><AudioOutputRouting><Target Value=\"AudioOut/GroupTrack\" /><UpperDisplayString Value=\"Group\" /></AudioOutputRouting><AudioInputRouting><Value Value=\"AudioIn/Track.3/PostFxOut\" /></AudioInputRouting><MidiInputRouting /></AudioTrack>");

        final RoutingEndpoint audioOut = AttributeResolver.resolveRoutingEndpoint (track, "AudioOutputRouting").orElseThrow ();
        assertThat (audioOut.getTarget ()).contains ("AudioOut/GroupTrack");
        assertThat (audioOut.getKind ()).isEqualTo (RoutingKind.GROUP);

        final RoutingEndpoint audioIn = AttributeResolver.resolveRoutingEndpoint (track, "AudioInputRouting").orElseThrow ();
        assertThat (audioIn.getKind ()).isEqualTo (RoutingKind.TRACK);
        assertThat (audioIn.getReferencedTrackId ()).contains ("3");

        final RoutingEndpoint midiIn = AttributeResolver.resolveRoutingEndpoint (track, "MidiInputRouting").orElseThrow ();
        assertThat (midiIn.getKind ()).isEqualTo (RoutingKind.MISSING);
        assertThat (AttributeResolver.resolveRoutingEndpoint (track, "MidiOutputRouting")).isEmpty ();
    }


    @Test
    void testParentGroup () throws ParseException
    {
        assertThat (AttributeResolver.resolveParentGroupId (xml ("<AudioTrack><TrackGroupId Value=\"12\" /></AudioTrack>"))).contains ("12");
        assertThat (AttributeResolver.resolveParentGroupId (xml ("<AudioTrack><TrackGroupId Value=\"-1\" /></AudioTrack>"))).isEmpty ();
        assertThat (AttributeResolver.resolveParentGroupId (xml ("<AudioTrack><ParentGroup>7</ParentGroup></AudioTrack>"))).contains ("7");
        assertThat (AttributeResolver.resolveParentGroupId (xml ("<AudioTrack><MyGroupTrackId Value=\"4\" /></AudioTrack>"))).contains ("4");
        assertThat (AttributeResolver.resolveParentGroupId (xml ("<AudioTrack />"))).isEmpty ();
    }


    @Test
    void testDeviceIdentity () throws ParseException
    {
        final DeviceIdentity identity = AttributeResolver.resolveDeviceIdentity (xml ("<PluginDevice><AuPluginInfo><Manufacturer Value=\"FabFilter\" /><Name Value=\"Pro-Q 3\" /><Path Value=\"/Library/Audio/Plug-Ins/Components/FabFilter Pro-Q 3.component\" /></AuPluginInfo></PluginDevice>"));
        assertThat (identity.getVendor ()).contains ("FabFilter");
        assertThat (identity.getProduct ()).contains ("Pro-Q 3");
        assertThat (identity.getIdentifier ()).contains ("/Library/Audio/Plug-Ins/Components/FabFilter Pro-Q 3.component");
    }


    @Test
    void testDeviceEnabled () throws ParseException
    {
        assertThat (AttributeResolver.resolveDeviceEnabled (xml ("<Reverb><On><LomId Value=\"0\" /><Manual Value=\"false\" /></On></Reverb>"))).isEqualTo (TriState.FALSE);
        assertThat (AttributeResolver.resolveDeviceEnabled (xml ("<Reverb><Parameters><DeviceOn><ArrangerAutomation><Manual Value=\"true\" /></ArrangerAutomation></DeviceOn></Parameters></Reverb>"))).isEqualTo (TriState.TRUE);
        assertThat (AttributeResolver.resolveDeviceEnabled (xml ("<Reverb IsOn=\"0\" />"))).isEqualTo (TriState.FALSE);
        assertThat (AttributeResolver.resolveDeviceEnabled (xml ("<Reverb />"))).isEqualTo (TriState.UNKNOWN);
    }


    @Test
    void testUntrustedEnabledTags () throws ParseException
    {
        // A generic enabled flag is not the power button
        assertThat (AttributeResolver.resolveDeviceEnabled (xml ("<Reverb><Enabled Value=\"false\" /></Reverb>"))).isEqualTo (TriState.UNKNOWN);
        assertThat (AttributeResolver.resolveDeviceEnabled (xml ("<Reverb><A><B><C><SomethingEnabled Value=\"false\" /></C></B></A></Reverb>"))).isEqualTo (TriState.UNKNOWN);

        // The power button is searched 4 levels deep
        assertThat (AttributeResolver.resolveDeviceEnabled (xml ("<Reverb><A><B><C><DeviceOn Value=\"false\" /></C></B></A></Reverb>"))).isEqualTo (TriState.FALSE);
        assertThat (AttributeResolver.resolveDeviceEnabled (xml ("<Reverb><A><B><C><D><DeviceOn Value=\"false\" /></D></C></B></A></Reverb>"))).isEqualTo (TriState.UNKNOWN);
    }
}
