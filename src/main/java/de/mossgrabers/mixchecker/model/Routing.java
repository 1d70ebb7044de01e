// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import java.util.Optional;


/**
 * The routing of a track. Each of the 4 endpoints is optional since the routing nodes might not
 * be present in the project.
 *
 * @author Jürgen Moßgraber
 */
public class Routing
{
    private final RoutingEndpoint audioIn;
    private final RoutingEndpoint audioOut;
    private final RoutingEndpoint midiIn;
    private final RoutingEndpoint midiOut;


    /**
     * Constructor.
     *
     * @param audioIn The audio input, might be null
     * @param audioOut The audio output, might be null
     * @param midiIn The MIDI input, might be null
     * @param midiOut The MIDI output, might be null
     */
    public Routing (final RoutingEndpoint audioIn, final RoutingEndpoint audioOut, final RoutingEndpoint midiIn, final RoutingEndpoint midiOut)
    {
        this.audioIn = audioIn;
        this.audioOut = audioOut;
        this.midiIn = midiIn;
        this.midiOut = midiOut;
    }


    /**
     * Get the audio input.
     *
     * @return The endpoint
     */
    public Optional<RoutingEndpoint> getAudioIn ()
    {
        return Optional.ofNullable (this.audioIn);
    }


    /**
     * Get the audio output.
     *
     * @return The endpoint
     */
    public Optional<RoutingEndpoint> getAudioOut ()
    {
        return Optional.ofNullable (this.audioOut);
    }


    /**
     * Get the MIDI input.
     *
     * @return The endpoint
     */
    public Optional<RoutingEndpoint> getMidiIn ()
    {
        return Optional.ofNullable (this.midiIn);
    }


    /**
     * Get the MIDI output.
     *
     * @return The endpoint
     */
    public Optional<RoutingEndpoint> getMidiOut ()
    {
        return Optional.ofNullable (this.midiOut);
    }


    /**
     * Get the kind of the audio input. A missing endpoint is reported as missing.
     *
     * @return The kind
     */
    public RoutingKind getAudioInKind ()
    {
        return this.audioIn == null ? RoutingKind.MISSING : this.audioIn.getKind ();
    }


    /**
     * Get the kind of the audio output. A missing endpoint is reported as missing.
     *
     * @return The kind
     */
    public RoutingKind getAudioOutKind ()
    {
        return this.audioOut == null ? RoutingKind.MISSING : this.audioOut.getKind ();
    }
}
