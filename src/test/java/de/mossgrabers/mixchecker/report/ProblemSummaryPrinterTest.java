// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.report;

import static org.assertj.core.api.Assertions.assertThat;

import de.mossgrabers.mixchecker.RecordingNotifier;
import de.mossgrabers.mixchecker.core.AnalysisSettings;
import de.mossgrabers.mixchecker.format.ableton.TestProjects;
import de.mossgrabers.mixchecker.model.TrackAnalysis;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.text.ParseException;
import java.util.List;


class ProblemSummaryPrinterTest
{
    @Test
    void testDrumGroup () throws IOException, ParseException
    {
        final RecordingNotifier notifier = new RecordingNotifier ();
        final List<TrackAnalysis> tracks = TestProjects.analyseDrumGroup (new AnalysisSettings (), new RecordingNotifier ()).getTracks ();
        new ProblemSummaryPrinter (notifier).print (tracks);

        final List<String> messages = notifier.getMessages ();
        assertThat (messages.get (0)).isEqualTo ("=== Ableton QA Summary ===");
        assertThat (messages).contains ("FAIL tracks: 3 | WARN tracks: 1", "Deactivated tracks: 1", "Devices OFF: 2 (no-auto: 1, with On/Off auto: 1)");
        assertThat (messages).contains ("Failing tracks (preview):", "  - AudioTrack | dor      | Kick");
        assertThat (messages).contains ("Routing impact (top):", "  - depth=1 src=Kick | Drums", "  - depth=1 src=Kick [DEAD BUS] | Kick Resample");
        assertThat (messages).anyMatch (message -> message.startsWith ("Routing breaks: ") && message.endsWith ("(dead bus: 1, orphan bus: 0)"));
        assertThat (messages).anyMatch (message -> message.startsWith ("Reason codes (R): m=muted, d=track deactivated"));
        assertThat (messages).contains ("Warning codes (W): a=device On/Off is automated (likely intentional)");
    }


    @Test
    void testEmptyProject ()
    {
        final RecordingNotifier notifier = new RecordingNotifier ();
        new ProblemSummaryPrinter (notifier).print (List.of ());

        assertThat (notifier.getMessages ()).contains ("FAIL tracks: 0 | WARN tracks: 0");
        assertThat (notifier.getIds ()).doesNotContain ("IDS_NOTIFY_SUMMARY_FAILING", "IDS_NOTIFY_SUMMARY_IMPACT");
        assertThat (notifier.getErrorIds ()).isEmpty ();
    }
}
