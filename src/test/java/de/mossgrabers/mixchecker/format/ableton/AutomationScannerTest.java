// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import static org.assertj.core.api.Assertions.assertThat;

import de.mossgrabers.mixchecker.format.ableton.model.Node;

import org.junit.jupiter.api.Test;

import java.text.ParseException;
import java.util.Set;


class AutomationScannerTest
{
    private static final String TRACK = "<AudioTrack><AutomationEnvelopes><Envelopes>" +
            "<AutomationEnvelope><EnvelopeTarget><PointeeId Value=\"100\" /></EnvelopeTarget><Automation><Events><BoolEvent Time=\"0\" Value=\"true\" /></Events></Automation></AutomationEnvelope>" +
            "<AutomationEnvelope><EnvelopeTarget><PointeeId Value=\"200\" /></EnvelopeTarget><Automation><Events /></Automation></AutomationEnvelope>" +
            "</Envelopes></AutomationEnvelopes></AudioTrack>";


    @Test
    void testEnvelopeTargets () throws ParseException
    {
        final Node track = AttributeResolverTest.xml (TRACK);
        final Set<String> targets = AutomationScanner.collectEnvelopeTargets (track);
        assertThat (targets).contains ("100").doesNotContain ("200");
    }


    @Test
    void testEmptyEnvelopeBeforeRecordedOne () throws ParseException
    {
        final Node track = AttributeResolverTest.xml ("<AudioTrack><AutomationEnvelopes><Envelopes>" +
                "<AutomationEnvelope><EnvelopeTarget><PointeeId Value=\"10\" /></EnvelopeTarget><Automation><Events /></Automation></AutomationEnvelope>" +
                "<AutomationEnvelope><EnvelopeTarget><PointeeId Value=\"55\" /></EnvelopeTarget><Automation><Events><FloatEvent Time=\"4\" Value=\"0.5\" /></Events></Automation></AutomationEnvelope>" +
                "</Envelopes></AutomationEnvelopes></AudioTrack>");
        final Set<String> targets = AutomationScanner.collectEnvelopeTargets (track);
        assertThat (targets).containsExactly ("55");

        final Node device = AttributeResolverTest.xml ("<Reverb><On><Manual Value=\"false\" /><AutomationTarget Id=\"10\" /></On></Reverb>");
        assertThat (AutomationScanner.hasOnAutomation (device, targets)).isFalse ();
    }


    @Test
    void testOnAutomation () throws ParseException
    {
        final Node automated = AttributeResolverTest.xml ("<Reverb><On><Manual Value=\"false\" /><AutomationTarget Id=\"100\" /></On><DecayTime><AutomationTarget Id=\"300\" /></DecayTime></Reverb>");
        assertThat (AutomationScanner.getOnTargetIds (automated)).containsExactly ("100");
        assertThat (AutomationScanner.hasOnAutomation (automated, Set.of ("100"))).isTrue ();
        assertThat (AutomationScanner.hasOnAutomation (automated, Set.of ("300"))).isFalse ();
        assertThat (AutomationScanner.hasOnAutomation (automated, Set.of ())).isFalse ();

        final Node nested = AttributeResolverTest.xml ("<Reverb><DeviceOn><ArrangerAutomation><Events><AutomationTarget Id=\"7\" /></Events></ArrangerAutomation></DeviceOn></Reverb>");
        assertThat (AutomationScanner.getOnTargetIds (nested)).containsExactly ("7");
    }
}
