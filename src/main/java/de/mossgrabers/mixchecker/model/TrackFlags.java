// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

/**
 * The state of the buttons of a channel strip.
 *
 * @author Jürgen Moßgraber
 */
public class TrackFlags
{
    private final TriState muted;
    private final TriState solo;
    private final TriState armed;
    private final TriState active;


    /**
     * Constructor.
     *
     * @param muted The mute state
     * @param solo The solo state
     * @param armed The record arm state
     * @param active The track activator state
     */
    public TrackFlags (final TriState muted, final TriState solo, final TriState armed, final TriState active)
    {
        this.muted = muted;
        this.solo = solo;
        this.armed = armed;
        this.active = active;
    }


    /**
     * Is the track muted?
     *
     * @return The mute state
     */
    public TriState getMuted ()
    {
        return this.muted;
    }


    /**
     * Is the track soloed?
     *
     * @return The solo state
     */
    public TriState getSolo ()
    {
        return this.solo;
    }


    /**
     * Is the track armed for recording?
     *
     * @return The arm state
     */
    public TriState getArmed ()
    {
        return this.armed;
    }


    /**
     * Is the track active (not deactivated)?
     *
     * @return The activator state
     */
    public TriState getActive ()
    {
        return this.active;
    }


    /**
     * Is the whole channel strip deactivated? Only known if the activator state is known.
     *
     * @return The deactivation state
     */
    public TriState getDeactivated ()
    {
        return this.active.not ();
    }
}
