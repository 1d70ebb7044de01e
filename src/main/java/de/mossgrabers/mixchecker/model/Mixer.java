// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import de.mossgrabers.mixchecker.utils.TextUtils;

import java.util.Optional;
import java.util.OptionalDouble;


/**
 * The mixer settings of a track.
 *
 * @author Jürgen Moßgraber
 */
public class Mixer
{
    /** Volumes at or below this (linear) value are considered silent. */
    public static final double   SILENCE_THRESHOLD = 1e-6;

    private final String         volumeRaw;
    private final String         panRaw;
    private final OptionalDouble volume;
    private final OptionalDouble pan;


    /**
     * Constructor.
     *
     * @param volumeRaw The volume as found in the project, might be null
     * @param panRaw The panorama as found in the project, might be null
     */
    public Mixer (final String volumeRaw, final String panRaw)
    {
        this.volumeRaw = volumeRaw;
        this.panRaw = panRaw;
        this.volume = TextUtils.parseDouble (volumeRaw);
        this.pan = TextUtils.parseDouble (panRaw);
    }


    /**
     * Get the raw volume text.
     *
     * @return The text
     */
    public Optional<String> getVolumeRaw ()
    {
        return Optional.ofNullable (this.volumeRaw);
    }


    /**
     * Get the raw panorama text.
     *
     * @return The text
     */
    public Optional<String> getPanRaw ()
    {
        return Optional.ofNullable (this.panRaw);
    }


    /**
     * Get the linear volume.
     *
     * @return The volume if it could be parsed
     */
    public OptionalDouble getVolume ()
    {
        return this.volume;
    }


    /**
     * Get the panorama.
     *
     * @return The panorama (-1..1) if it could be parsed
     */
    public OptionalDouble getPan ()
    {
        return this.pan;
    }


    /**
     * Is the fader pulled down to (almost) minus infinity?
     *
     * @return Unknown if the volume is not known
     */
    public TriState getVolumeSilent ()
    {
        if (this.volume.isEmpty ())
            return TriState.UNKNOWN;
        return TriState.of (this.volume.getAsDouble () <= SILENCE_THRESHOLD);
    }
}
