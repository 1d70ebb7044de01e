// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import de.mossgrabers.mixchecker.RecordingNotifier;
import de.mossgrabers.mixchecker.core.AnalysisSettings;
import de.mossgrabers.mixchecker.core.ProjectAnalysis;
import de.mossgrabers.mixchecker.format.ableton.TestProjects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;


class FullReportFormatTest
{
    @TempDir
    Path folder;


    private static ObjectNode createReport (final AnalysisSettings settings) throws IOException, ParseException
    {
        final RecordingNotifier notifier = new RecordingNotifier ();
        final ProjectAnalysis analysis = TestProjects.analyseDrumGroup (settings, notifier);
        return new FullReportFormat (notifier).createReport (analysis, settings);
    }


    private static List<String> toTexts (final JsonNode array)
    {
        final List<String> texts = new ArrayList<> ();
        array.forEach (node -> texts.add (node.textValue ()));
        return texts;
    }


    @Test
    void testHeader () throws IOException, ParseException
    {
        final ObjectNode report = createReport (new AnalysisSettings ());
        assertThat (report.get ("version").textValue ()).isEqualTo ("1.0.0");
        assertThat (report.get ("root_tag").textValue ()).isEqualTo ("LiveSet");
        assertThat (report.get ("track_count").intValue ()).isEqualTo (7);
        assertThat (report.get ("tracks").size ()).isEqualTo (7);
        assertThat (report.get ("qc_reason_legend").get ("x").textValue ()).isEqualTo ("all devices explicitly off and none automated");
        assertThat (report.get ("qc_warning_legend").get ("a").textValue ()).startsWith ("device On/Off is automated");

        final JsonNode summary = report.get ("qc_summary");
        assertThat (summary.get ("fail_track_count").intValue ()).isEqualTo (3);
        assertThat (summary.get ("deactivated_track_count").intValue ()).isEqualTo (1);
        assertThat (summary.get ("fail_tracks_preview").get (0).get ("name").textValue ()).isEqualTo ("Kick");
    }


    @Test
    void testTracks () throws IOException, ParseException
    {
        final ArrayNode tracks = (ArrayNode) createReport (new AnalysisSettings ()).get ("tracks");

        final JsonNode kick = tracks.get (0);
        assertThat (kick.get ("track_type").textValue ()).isEqualTo ("AudioTrack");
        assertThat (kick.get ("track_id").textValue ()).isEqualTo ("1");
        assertThat (kick.get ("flags").get ("deactivated").booleanValue ()).isTrue ();
        assertThat (kick.get ("routing").get ("audio_out_resolved_group_id").textValue ()).isEqualTo ("10");
        assertThat (kick.get ("mixer").get ("volume").doubleValue ()).isEqualTo (0.5);
        assertThat (kick.get ("mixer").get ("volume_db").doubleValue ()).isCloseTo (-6.0206, within (1e-4));
        assertThat (toTexts (kick.get ("final_qc").get ("reasons"))).containsExactly ("d", "o", "r");
        assertThat (toTexts (kick.get ("final_qc").get ("warnings"))).containsExactly ("a");
        assertThat (kick.get ("routing_impact").size ()).isEqualTo (2);

        final JsonNode drums = tracks.get (6);
        assertThat (drums.get ("routing_break").booleanValue ()).isTrue ();
        assertThat (toTexts (drums.get ("routing_break_path_ids"))).containsExactly ("1", "10");
        assertThat (drums.get ("routing_break_path").get (0).get ("name").textValue ()).isEqualTo ("Kick");
        assertThat (drums.get ("routing_break_sources").get (0).get ("type").textValue ()).isEqualTo ("AudioTrack");
        assertThat (drums.has ("routing_dead_bus")).isFalse ();

        // Return tracks are never orphan buses
        assertThat (tracks.get (4).has ("routing_orphan_bus")).isFalse ();
        assertThat (tracks.get (4).has ("routing_break")).isFalse ();

        // Null values are removed by default
        final JsonNode master = tracks.get (5);
        assertThat (master.has ("track_id")).isFalse ();
        assertThat (master.has ("parent_group_id")).isFalse ();
    }


    @Test
    void testPools () throws IOException, ParseException
    {
        final AnalysisSettings settings = new AnalysisSettings ();
        settings.setMixSettings (true);
        final ObjectNode report = createReport (settings);

        final JsonNode eq = report.get ("tracks").get (0).get ("devices").get (0);
        assertThat (eq.has ("settings")).isFalse ();
        final String reference = eq.get ("settings_ref").textValue ();
        assertThat (reference).hasSize (12);
        assertThat (report.get ("pools").get ("device_settings_pool").get (reference).get ("AdaptiveQFactor").booleanValue ()).isTrue ();

        final JsonNode serum = report.get ("tracks").get (3).get ("devices").get (0);
        assertThat (serum.get ("plugin_format").textValue ()).isEqualTo ("Plugin");
        assertThat (serum.get ("plugin_state_len").intValue ()).isEqualTo (85);
        assertThat (toTexts (serum.get ("plugin_meta").get ("hint_tags"))).containsExactly ("xfer");
        final String decodedReference = serum.get ("plugin_decoded_ref").textValue ();
        assertThat (report.get ("pools").get ("plugin_decoded_pool").get (decodedReference).get ("json").get ("product").textValue ()).isEqualTo ("Serum");
    }


    @Test
    void testWithoutDedupe () throws IOException, ParseException
    {
        final AnalysisSettings settings = new AnalysisSettings ();
        settings.setMixSettings (true);
        settings.setFullDedupe (false);
        settings.setStripNullKeys (false);
        final ObjectNode report = createReport (settings);

        assertThat (report.has ("pools")).isFalse ();
        final JsonNode eq = report.get ("tracks").get (0).get ("devices").get (0);
        assertThat (eq.get ("settings").get ("AdaptiveQFactor").booleanValue ()).isTrue ();
        assertThat (eq.has ("settings_ref")).isFalse ();

        final JsonNode master = report.get ("tracks").get (5);
        assertThat (master.get ("track_id").isNull ()).isTrue ();
    }


    @Test
    void testPoolSharesEqualBlocks ()
    {
        final ArrayNode tracks = JsonHelper.FACTORY.arrayNode ();
        for (int i = 0; i < 2; i++)
        {
            final ObjectNode device = tracks.addObject ().putArray ("devices").addObject ();
            device.putObject ("settings").put ("Gain", 0);
            device.putObject ("plugin_decoded");
        }
        tracks.addObject ();

        final ObjectNode pools = FullReportFormat.pool (tracks);
        assertThat (pools.get ("device_settings_pool").size ()).isEqualTo (1);
        assertThat (pools.get ("plugin_decoded_pool").isEmpty ()).isTrue ();

        final JsonNode first = tracks.get (0).get ("devices").get (0);
        assertThat (first.get ("settings").isNull ()).isTrue ();
        assertThat (first.get ("settings_ref").textValue ()).isEqualTo (tracks.get (1).get ("devices").get (0).get ("settings_ref").textValue ());
        // Empty blocks stay in place
        assertThat (first.get ("plugin_decoded").isObject ()).isTrue ();
    }


    @Test
    void testWrite () throws IOException, ParseException
    {
        final AnalysisSettings settings = new AnalysisSettings ();
        settings.setMinify (true);
        final RecordingNotifier notifier = new RecordingNotifier ();
        final ProjectAnalysis analysis = TestProjects.analyseDrumGroup (settings, notifier);
        final File outputFile = this.folder.resolve ("report.json").toFile ();
        final FullReportFormat format = new FullReportFormat (notifier);
        format.write (analysis, settings, outputFile);

        assertThat (format.getFileEnding ()).isEqualTo ("full.json");
        assertThat (outputFile).exists ();
        assertThat (Files.readAllLines (outputFile.toPath ())).hasSize (1);
    }
}
