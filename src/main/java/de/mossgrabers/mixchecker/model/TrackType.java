// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import java.util.Optional;


/**
 * The types of tracks (channel strips) in a project.
 *
 * @author Jürgen Moßgraber
 */
public enum TrackType
{
    /** An audio track. */
    AUDIO ("AudioTrack"),
    /** A MIDI (instrument) track. */
    MIDI ("MidiTrack"),
    /** A return (effect) track. */
    RETURN ("ReturnTrack"),
    /** The master track. */
    MASTER ("MasterTrack"),
    /** A group track. */
    GROUP ("GroupTrack");


    private final String tag;


    private TrackType (final String tag)
    {
        this.tag = tag;
    }


    /**
     * Get the tag which is used for this track type in the project file.
     *
     * @return The tag
     */
    public String getTag ()
    {
        return this.tag;
    }


    /**
     * Lookup the track type for a tag. Newer Live versions call the master track main track.
     *
     * @param tag The tag
     * @return The track type or empty if the tag is not a track
     */
    public static Optional<TrackType> fromTag (final String tag)
    {
        if ("MainTrack".equals (tag))
            return Optional.of (MASTER);
        for (final TrackType type: values ())
        {
            if (type.tag.equals (tag))
                return Optional.of (type);
        }
        return Optional.empty ();
    }
}
