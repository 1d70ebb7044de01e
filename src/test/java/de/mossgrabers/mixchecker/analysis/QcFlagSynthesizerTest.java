// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import de.mossgrabers.mixchecker.model.QcResult;
import de.mossgrabers.mixchecker.model.RoutingImpact;
import de.mossgrabers.mixchecker.model.TrackFixtures;
import de.mossgrabers.mixchecker.model.TriState;

import org.junit.jupiter.api.Test;


class QcFlagSynthesizerTest
{
    @Test
    void testCleanTrack ()
    {
        final QcResult result = QcFlagSynthesizer.synthesize (TrackFixtures.track ("1", "Lead").withDevice (TrackFixtures.device ("Eq", TriState.TRUE, false)).build ());
        assertThat (result.isFail ()).isFalse ();
        assertThat (result.getReasonCodes ()).isEmpty ();
        assertThat (result.getWarningCodes ()).isEmpty ();
    }


    @Test
    void testTrackStates ()
    {
        final QcResult result = QcFlagSynthesizer.synthesize (TrackFixtures.track ("1", "Lead").muted ().deactivated ().volume ("0").build ());
        assertThat (result.getReasonCodes ()).isEqualTo ("mds");
    }


    @Test
    void testAllDevicesOff ()
    {
        final QcResult result = QcFlagSynthesizer.synthesize (TrackFixtures.track ("1", "Lead").withDevice (TrackFixtures.device ("Eq", TriState.FALSE, false)).withDevice (TrackFixtures.device ("Comp", TriState.FALSE, false)).build ());
        assertThat (result.getReasonCodes ()).isEqualTo ("xo");
    }


    @Test
    void testAutomatedDeviceIsOnlyAWarning ()
    {
        final QcResult result = QcFlagSynthesizer.synthesize (TrackFixtures.track ("1", "Lead").withDevice (TrackFixtures.device ("Eq", TriState.FALSE, true)).build ());
        assertThat (result.getReasonCodes ()).isEmpty ();
        assertThat (result.getWarningCodes ()).isEqualTo ("a");
    }


    @Test
    void testUnknownDeviceStateIsNotOff ()
    {
        final QcResult result = QcFlagSynthesizer.synthesize (TrackFixtures.track ("1", "Lead").withDevice (TrackFixtures.device ("Eq", TriState.UNKNOWN, false)).build ());
        assertThat (result.isFail ()).isFalse ();
    }


    @Test
    void testRoutingBreak ()
    {
        final RoutingImpact impact = new RoutingImpact.Builder ().setRoutingBreak ().build ();
        assertThat (QcFlagSynthesizer.synthesize (TrackFixtures.track ("1", "Lead").build (), impact).getReasonCodes ()).isEqualTo ("r");
        assertThat (QcFlagSynthesizer.synthesize (TrackFixtures.track ("1", "Lead").build (), new RoutingImpact.Builder ().build ()).isFail ()).isFalse ();
    }
}
