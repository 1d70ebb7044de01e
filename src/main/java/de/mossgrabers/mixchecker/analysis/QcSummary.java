// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.analysis;

import de.mossgrabers.mixchecker.model.Device;
import de.mossgrabers.mixchecker.model.Track;
import de.mossgrabers.mixchecker.model.TrackAnalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * Counts the problems of a project for a quick overview.
 *
 * @author Jürgen Moßgraber
 */
public class QcSummary
{
    /** The maximum number of failing tracks in the preview. */
    public static final int           MAX_PREVIEW = 12;

    private int                       failTrackCount;
    private int                       warnTrackCount;
    private final List<TrackAnalysis> failTracksPreview = new ArrayList<> ();
    private int                       deactivatedTrackCount;
    private int                       mutedTrackCount;
    private int                       silentTrackCount;
    private int                       routingBreakTrackCount;
    private int                       deadBusTrackCount;
    private int                       orphanBusTrackCount;
    private int                       deviceCount;
    private int                       devicesOffCount;
    private int                       devicesOffNoAutomationCount;
    private int                       devicesOnAutomationCount;


    /**
     * Constructor.
     *
     * @param analyses The analysed tracks
     */
    public QcSummary (final List<TrackAnalysis> analyses)
    {
        for (final TrackAnalysis analysis: analyses)
        {
            final Track track = analysis.getTrack ();
            if (analysis.getQc ().isFail ())
            {
                this.failTrackCount++;
                if (this.failTracksPreview.size () < MAX_PREVIEW)
                    this.failTracksPreview.add (analysis);
            }
            if (!analysis.getQc ().getWarnings ().isEmpty ())
                this.warnTrackCount++;

            if (track.isDeactivated ())
                this.deactivatedTrackCount++;
            if (track.getFlags ().getMuted ().isTrue ())
                this.mutedTrackCount++;
            if (track.getMixer ().getVolumeSilent ().isTrue ())
                this.silentTrackCount++;
            if (analysis.isRoutingBreak ())
                this.routingBreakTrackCount++;
            if (analysis.getImpact ().isPresent () && analysis.getImpact ().get ().isDeadBus ())
                this.deadBusTrackCount++;
            if (analysis.getImpact ().isPresent () && analysis.getImpact ().get ().isOrphanBus ())
                this.orphanBusTrackCount++;

            for (final Device device: track.getDevices ())
            {
                this.deviceCount++;
                if (device.getEnabled ().isFalse ())
                {
                    this.devicesOffCount++;
                    if (!device.hasOnAutomation ())
                        this.devicesOffNoAutomationCount++;
                }
                if (device.hasOnAutomation ())
                    this.devicesOnAutomationCount++;
            }
        }
    }


    /**
     * Get the number of failing tracks.
     *
     * @return The number
     */
    public int getFailTrackCount ()
    {
        return this.failTrackCount;
    }


    /**
     * Get the number of tracks with warnings.
     *
     * @return The number
     */
    public int getWarnTrackCount ()
    {
        return this.warnTrackCount;
    }


    /**
     * Get the first failing tracks.
     *
     * @return At most 12 tracks in track order
     */
    public List<TrackAnalysis> getFailTracksPreview ()
    {
        return Collections.unmodifiableList (this.failTracksPreview);
    }


    /**
     * Get the number of deactivated tracks.
     *
     * @return The number
     */
    public int getDeactivatedTrackCount ()
    {
        return this.deactivatedTrackCount;
    }


    /**
     * Get the number of muted tracks.
     *
     * @return The number
     */
    public int getMutedTrackCount ()
    {
        return this.mutedTrackCount;
    }


    /**
     * Get the number of tracks with a silent fader.
     *
     * @return The number
     */
    public int getSilentTrackCount ()
    {
        return this.silentTrackCount;
    }


    /**
     * Get the number of tracks with a broken routing.
     *
     * @return The number
     */
    public int getRoutingBreakTrackCount ()
    {
        return this.routingBreakTrackCount;
    }


    /**
     * Get the number of dead buses.
     *
     * @return The number
     */
    public int getDeadBusTrackCount ()
    {
        return this.deadBusTrackCount;
    }


    /**
     * Get the number of orphaned buses.
     *
     * @return The number
     */
    public int getOrphanBusTrackCount ()
    {
        return this.orphanBusTrackCount;
    }


    /**
     * Get the number of all devices.
     *
     * @return The number
     */
    public int getDeviceCount ()
    {
        return this.deviceCount;
    }


    /**
     * Get the number of devices which are switched off.
     *
     * @return The number
     */
    public int getDevicesOffCount ()
    {
        return this.devicesOffCount;
    }


    /**
     * Get the number of devices which are switched off and whose power button is not automated.
     *
     * @return The number
     */
    public int getDevicesOffNoAutomationCount ()
    {
        return this.devicesOffNoAutomationCount;
    }


    /**
     * Get the number of devices whose power button is automated.
     *
     * @return The number
     */
    public int getDevicesOnAutomationCount ()
    {
        return this.devicesOnAutomationCount;
    }
}
