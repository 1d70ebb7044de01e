// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.mossgrabers.mixchecker.RecordingNotifier;
import de.mossgrabers.mixchecker.core.AnalysisSettings;
import de.mossgrabers.mixchecker.core.ProjectAnalysis;
import de.mossgrabers.mixchecker.model.Device;
import de.mossgrabers.mixchecker.model.DeviceFormat;
import de.mossgrabers.mixchecker.model.PluginState;
import de.mossgrabers.mixchecker.model.RoutingImpact;
import de.mossgrabers.mixchecker.model.RoutingKind;
import de.mossgrabers.mixchecker.model.Track;
import de.mossgrabers.mixchecker.model.TrackAnalysis;
import de.mossgrabers.mixchecker.model.TrackType;
import de.mossgrabers.mixchecker.model.TriState;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;


class AbletonSourceFormatTest
{
    @Test
    void testTracks () throws IOException, ParseException
    {
        final RecordingNotifier notifier = new RecordingNotifier ();
        final ProjectAnalysis analysis = new AbletonSourceFormat (notifier).read (TestProjects.getDrumGroup (), new AnalysisSettings ());

        assertThat (analysis.getRootTag ()).isEqualTo ("LiveSet");
        assertThat (notifier.getMessages ()).contains ("Found 7 tracks.");

        final List<TrackAnalysis> tracks = analysis.getTracks ();
        assertThat (tracks).extracting (analysisEntry -> analysisEntry.getTrack ().getName ().orElse (null)).containsExactly ("Kick", "Snare", "Kick Resample", "Lead", "Reverb Return", "Master", "Drums");
        assertThat (tracks).extracting (analysisEntry -> analysisEntry.getTrack ().getType ()).containsExactly (TrackType.AUDIO, TrackType.AUDIO, TrackType.AUDIO, TrackType.MIDI, TrackType.RETURN, TrackType.MASTER, TrackType.GROUP);
        assertThat (tracks).allMatch (analysisEntry -> analysisEntry.getImpact ().isEmpty ());

        final Track kick = tracks.get (0).getTrack ();
        assertThat (kick.getId ()).contains ("1");
        assertThat (kick.isDeactivated ()).isTrue ();
        assertThat (kick.getFlags ().getMuted ()).isEqualTo (TriState.UNKNOWN);
        assertThat (kick.getFlags ().getArmed ()).isEqualTo (TriState.FALSE);
        assertThat (kick.getParentGroupId ()).contains ("10");
        assertThat (kick.getMixer ().getVolumeRaw ()).contains ("0.5");
        assertThat (kick.getMixer ().getPan ()).hasValue (0);
        assertThat (kick.getRouting ().getAudioInKind ()).isEqualTo (RoutingKind.EXTERNAL);
        assertThat (kick.getRouting ().getAudioOutKind ()).isEqualTo (RoutingKind.GROUP);
        assertThat (kick.getRouting ().getMidiIn ().orElseThrow ().getTarget ()).contains ("MidiIn/External.All/-1");
        assertThat (tracks.get (0).getQc ().getReasonCodes ()).isEqualTo ("do");
        assertThat (tracks.get (0).getQc ().getWarningCodes ()).isEqualTo ("a");

        final Track lead = tracks.get (3).getTrack ();
        assertThat (lead.getParentGroupId ()).isEmpty ();
        assertThat (lead.getMixer ().getPan ()).hasValue (-0.25);

        final Track master = tracks.get (5).getTrack ();
        assertThat (master.getId ()).isEmpty ();
        assertThat (master.getRouting ().getAudioIn ()).isEmpty ();
        assertThat (master.getRouting ().getAudioInKind ()).isEqualTo (RoutingKind.MISSING);
    }


    @Test
    void testDevices () throws IOException, ParseException
    {
        final ProjectAnalysis analysis = new AbletonSourceFormat (new RecordingNotifier ()).read (TestProjects.getDrumGroup (), new AnalysisSettings ());

        final List<Device> kickDevices = analysis.getTracks ().get (0).getTrack ().getDevices ();
        assertThat (kickDevices).extracting (Device::getName).containsExactly ("Eq8", "Kick Comp");

        final Device eq = kickDevices.get (0);
        assertThat (eq.getFormat ()).isEqualTo (DeviceFormat.DEVICE);
        assertThat (eq.getEnabled ()).isEqualTo (TriState.FALSE);
        assertThat (eq.hasOnAutomation ()).isFalse ();
        assertThat (eq.isOffWithoutAutomation ()).isTrue ();
        assertThat (eq.getSettings ()).isEmpty ();

        final Device compressor = kickDevices.get (1);
        assertThat (compressor.getEnabled ()).isEqualTo (TriState.FALSE);
        assertThat (compressor.hasOnAutomation ()).isTrue ();

        final Device serum = analysis.getTracks ().get (3).getTrack ().getDevices ().get (0);
        assertThat (serum.getName ()).isEqualTo ("Serum");
        assertThat (serum.getFormat ()).isEqualTo (DeviceFormat.PLUGIN);
        assertThat (serum.getEnabled ()).isEqualTo (TriState.TRUE);
        assertThat (serum.getIdentity ().getVendor ()).contains ("Xfer Records");
        assertThat (serum.getIdentity ().getIdentifier ()).contains ("com.xferrecords.serum");
        assertThat (serum.getNamedParameters ()).containsEntry ("MasterVol", "0.7");
        assertThat (serum.getParameters ()).isEmpty ();

        final PluginState state = serum.getPluginState ().orElseThrow ();
        assertThat (state.getLength ()).isEqualTo (85);
        assertThat (state.getSha ()).hasSize (16);
        assertThat (state.getHintTags ()).containsExactly ("xfer");
        assertThat (state.getHints ()).isEmpty ();
        assertThat (state.getDecoded ()).isEmpty ();
    }


    @Test
    void testMixSettings () throws IOException, ParseException
    {
        final AnalysisSettings settings = new AnalysisSettings ();
        settings.setMixSettings (true);
        final ProjectAnalysis analysis = new AbletonSourceFormat (new RecordingNotifier ()).read (TestProjects.getDrumGroup (), settings);

        final ObjectNode eqSettings = analysis.getTracks ().get (0).getTrack ().getDevices ().get (0).getSettings ().orElseThrow ();
        assertThat (eqSettings.get ("AdaptiveQFactor").booleanValue ()).isTrue ();
        final ObjectNode band = (ObjectNode) eqSettings.get ("bands").get (0);
        assertThat (band.get ("i").intValue ()).isZero ();
        assertThat (band.get ("A").get ("Freq").longValue ()).isEqualTo (120);
        assertThat (band.get ("A").get ("Gain").doubleValue ()).isEqualTo (-3.5);
        assertThat (band.get ("B").isNull ()).isTrue ();

        final PluginState state = analysis.getTracks ().get (3).getTrack ().getDevices ().get (0).getPluginState ().orElseThrow ();
        assertThat (state.getHints ()).hasSize (1);
        assertThat (state.getHints ().get (0)).startsWith ("XferJson{");
        final ObjectNode decoded = state.getDecoded ().orElseThrow ();
        assertThat (decoded.get ("json").get ("product").textValue ()).isEqualTo ("Serum");
        assertThat (decoded.get ("json").get ("presetName").textValue ()).isEqualTo ("Init");
        assertThat (decoded.get ("json").has ("extra")).isFalse ();
        final List<String> keys = new ArrayList<> ();
        decoded.get ("json_keys").forEach (node -> keys.add (node.textValue ()));
        assertThat (keys).containsExactly ("extra", "presetName", "product", "productVersion");
    }


    @Test
    void testRoutingImpact () throws IOException, ParseException
    {
        final List<TrackAnalysis> tracks = TestProjects.analyseDrumGroup (new AnalysisSettings (), new RecordingNotifier ()).getTracks ();

        final RoutingImpact kick = tracks.get (0).getImpact ().orElseThrow ();
        assertThat (kick.getResolvedGroupId ()).contains ("10");
        assertThat (kick.getMessages ()).containsExactly ("deactivated track feeds downstream consumer: Kick Resample (AudioTrack 5)", "deactivated track routes audio_out into: Drums (GroupTrack 10)");
        assertThat (tracks.get (0).getQc ().getReasonCodes ()).isEqualTo ("dor");

        assertThat (tracks.get (1).getQc ().isFail ()).isFalse ();
        final RoutingImpact resample = tracks.get (2).getImpact ().orElseThrow ();
        assertThat (resample.isDeadBus ()).isTrue ();
        assertThat (resample.getDepth ()).hasValue (1);

        assertThat (tracks.get (3).getQc ().isFail ()).isFalse ();
        final RoutingImpact reverbReturn = tracks.get (4).getImpact ().orElseThrow ();
        assertThat (reverbReturn.isOrphanBus ()).isFalse ();
        assertThat (reverbReturn.isRoutingBreak ()).isFalse ();
        assertThat (tracks.get (4).getQc ().isFail ()).isFalse ();
        assertThat (tracks.get (5).getImpact ()).isEmpty ();

        final RoutingImpact drums = tracks.get (6).getImpact ().orElseThrow ();
        assertThat (drums.isDeadBus ()).isFalse ();
        assertThat (drums.getPath ()).containsExactly ("1", "10");
        assertThat (tracks.get (6).getQc ().getReasonCodes ()).isEqualTo ("r");
    }


    @Test
    void testCompressedSet (@TempDir final Path folder) throws IOException, ParseException
    {
        final File compressed = folder.resolve ("DrumGroup.als").toFile ();
        try (final OutputStream out = new GZIPOutputStream (Files.newOutputStream (compressed.toPath ())))
        {
            Files.copy (TestProjects.getDrumGroup ().toPath (), out);
        }

        final ProjectAnalysis analysis = new AbletonSourceFormat (new RecordingNotifier ()).read (compressed, new AnalysisSettings ());
        assertThat (analysis.getTracks ()).hasSize (7);
        assertThat (analysis.getSourceFile ()).isEqualTo (compressed);
    }


    @Test
    void testBrokenSet (@TempDir final Path folder) throws IOException
    {
        final File broken = folder.resolve ("Broken.als").toFile ();
        Files.writeString (broken.toPath (), "<Ableton><LiveSet>");

        final AbletonSourceFormat format = new AbletonSourceFormat (new RecordingNotifier ());
        assertThatThrownBy ( () -> format.read (broken, new AnalysisSettings ())).isInstanceOf (ParseException.class);
        assertThat (format.getFileEndings ()).containsExactly ("als", "xml");
    }
}
