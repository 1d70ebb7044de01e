// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.analysis;

import de.mossgrabers.mixchecker.model.Device;
import de.mossgrabers.mixchecker.model.QcReason;
import de.mossgrabers.mixchecker.model.QcResult;
import de.mossgrabers.mixchecker.model.QcWarning;
import de.mossgrabers.mixchecker.model.RoutingImpact;
import de.mossgrabers.mixchecker.model.Track;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;


/**
 * Derives the final quality check of a track: the reasons why a track fails and informational
 * warnings.
 *
 * @author Jürgen Moßgraber
 */
public class QcFlagSynthesizer
{
    /**
     * Private due to helper class.
     */
    private QcFlagSynthesizer ()
    {
        // Intentionally empty
    }


    /**
     * Check a track without any routing information.
     *
     * @param track The track to check
     * @return The result
     */
    public static QcResult synthesize (final Track track)
    {
        return synthesize (track, null);
    }


    /**
     * Check a track.
     *
     * @param track The track to check
     * @param impact The routing impact on the track, might be null
     * @return The result
     */
    public static QcResult synthesize (final Track track, final RoutingImpact impact)
    {
        final Set<QcReason> reasons = EnumSet.noneOf (QcReason.class);
        final Set<QcWarning> warnings = EnumSet.noneOf (QcWarning.class);

        if (track.getFlags ().getMuted ().isTrue ())
            reasons.add (QcReason.MUTED);
        if (track.getFlags ().getDeactivated ().isTrue ())
            reasons.add (QcReason.DEACTIVATED);
        if (track.getMixer ().getVolumeSilent ().isTrue ())
            reasons.add (QcReason.SILENT);

        final List<Device> devices = track.getDevices ();
        if (!devices.isEmpty ())
        {
            final boolean anyAutomated = devices.stream ().anyMatch (Device::hasOnAutomation);
            if (!anyAutomated && devices.stream ().allMatch (device -> device.getEnabled ().isFalse ()))
                reasons.add (QcReason.ALL_DEVICES_OFF);
            if (devices.stream ().anyMatch (Device::isOffWithoutAutomation))
                reasons.add (QcReason.DEVICE_OFF);
            if (anyAutomated)
                warnings.add (QcWarning.ON_AUTOMATION);
        }

        if (impact != null && impact.isRoutingBreak ())
            reasons.add (QcReason.ROUTING_BROKEN);

        return new QcResult (reasons, warnings);
    }
}
