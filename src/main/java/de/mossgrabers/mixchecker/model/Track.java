// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;


/**
 * One channel strip of the project. Instances are immutable.
 *
 * @author Jürgen Moßgraber
 */
public class Track
{
    private final String       id;
    private final TrackType    type;
    private final String       name;
    private final TrackFlags   flags;
    private final Routing      routing;
    private final Mixer        mixer;
    private final String       parentGroupId;
    private final List<Device> devices;


    /**
     * Constructor.
     *
     * @param id The ID of the track, might be null
     * @param type The type of the track
     * @param name The name of the track, might be null
     * @param flags The mute, solo, arm and activator states
     * @param routing The routing
     * @param mixer The mixer settings
     * @param parentGroupId The ID of the group which contains the track, might be null
     * @param devices The devices in chain order
     */
    public Track (final String id, final TrackType type, final String name, final TrackFlags flags, final Routing routing, final Mixer mixer, final String parentGroupId, final List<Device> devices)
    {
        this.id = id;
        this.type = type;
        this.name = name;
        this.flags = flags;
        this.routing = routing;
        this.mixer = mixer;
        this.parentGroupId = parentGroupId;
        this.devices = Collections.unmodifiableList (devices);
    }


    /**
     * Get the ID of the track.
     *
     * @return The ID, tracks without an ID do not take part in the routing graph
     */
    public Optional<String> getId ()
    {
        return Optional.ofNullable (this.id);
    }


    /**
     * Get the type.
     *
     * @return The type
     */
    public TrackType getType ()
    {
        return this.type;
    }


    /**
     * Get the name.
     *
     * @return The name
     */
    public Optional<String> getName ()
    {
        return Optional.ofNullable (this.name);
    }


    /**
     * Get the flags.
     *
     * @return The flags
     */
    public TrackFlags getFlags ()
    {
        return this.flags;
    }


    /**
     * Get the routing.
     *
     * @return The routing
     */
    public Routing getRouting ()
    {
        return this.routing;
    }


    /**
     * Get the mixer settings.
     *
     * @return The mixer
     */
    public Mixer getMixer ()
    {
        return this.mixer;
    }


    /**
     * Get the ID of the enclosing group track.
     *
     * @return The ID
     */
    public Optional<String> getParentGroupId ()
    {
        return Optional.ofNullable (this.parentGroupId);
    }


    /**
     * Get the devices.
     *
     * @return The devices in chain order
     */
    public List<Device> getDevices ()
    {
        return this.devices;
    }


    /**
     * Is the track deactivated?
     *
     * @return True only if known to be deactivated
     */
    public boolean isDeactivated ()
    {
        return this.flags.getDeactivated ().isTrue ();
    }


    /**
     * Formats the track for messages, e.g. "Drums (GroupTrack 12)".
     *
     * @return The label
     */
    public String getLabel ()
    {
        final String displayName = this.name == null ? "Track." + this.id : this.name;
        return displayName + " (" + this.type.getTag () + " " + this.id + ")";
    }
}
