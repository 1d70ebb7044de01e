// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import java.util.Optional;


/**
 * The final view of a track: the track, its quality check result and, after the propagation,
 * the impact of deactivated tracks on its routing.
 *
 * @author Jürgen Moßgraber
 */
public class TrackAnalysis
{
    private final Track         track;
    private final QcResult      qc;
    private final RoutingImpact impact;


    /**
     * Constructor.
     *
     * @param track The track
     * @param qc The quality check result
     * @param impact The routing impact, null before the propagation
     */
    public TrackAnalysis (final Track track, final QcResult qc, final RoutingImpact impact)
    {
        this.track = track;
        this.qc = qc;
        this.impact = impact;
    }


    /**
     * Get the track.
     *
     * @return The track
     */
    public Track getTrack ()
    {
        return this.track;
    }


    /**
     * Get the quality check result.
     *
     * @return The result
     */
    public QcResult getQc ()
    {
        return this.qc;
    }


    /**
     * Get the routing impact.
     *
     * @return The impact, empty before the propagation
     */
    public Optional<RoutingImpact> getImpact ()
    {
        return Optional.ofNullable (this.impact);
    }


    /**
     * Is the routing of the track broken?
     *
     * @return True if there is an impact which breaks the routing
     */
    public boolean isRoutingBreak ()
    {
        return this.impact != null && this.impact.isRoutingBreak ();
    }
}
