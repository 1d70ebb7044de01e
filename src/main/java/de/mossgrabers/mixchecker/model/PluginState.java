// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.List;
import java.util.Optional;


/**
 * Metadata about the opaque state of a third party plug-in.
 *
 * @author Jürgen Moßgraber
 */
public class PluginState
{
    private final int          length;
    private final String       sha;
    private final String       role;
    private final List<String> hintTags;
    private final List<String> hints;
    private final ObjectNode   decoded;


    /**
     * Constructor.
     *
     * @param length The number of bytes of the state
     * @param sha The first 16 hex characters of the SHA-256 of the state
     * @param role The role guessed from the identifier, might be null
     * @param hintTags Vendor and technology tags found in the state
     * @param hints Readable strings found in the state, empty if not requested
     * @param decoded The best-effort decoded JSON content, might be null
     */
    public PluginState (final int length, final String sha, final String role, final List<String> hintTags, final List<String> hints, final ObjectNode decoded)
    {
        this.length = length;
        this.sha = sha;
        this.role = role;
        this.hintTags = Collections.unmodifiableList (hintTags);
        this.hints = Collections.unmodifiableList (hints);
        this.decoded = decoded;
    }


    /**
     * Get the length of the state in bytes.
     *
     * @return The length
     */
    public int getLength ()
    {
        return this.length;
    }


    /**
     * Get the shortened SHA-256 fingerprint of the state.
     *
     * @return 16 hex characters
     */
    public String getSha ()
    {
        return this.sha;
    }


    /**
     * Get the role of the plug-in, e.g. "limiter".
     *
     * @return The role
     */
    public Optional<String> getRole ()
    {
        return Optional.ofNullable (this.role);
    }


    /**
     * Get the vendor and technology tags, e.g. "juce".
     *
     * @return The tags
     */
    public List<String> getHintTags ()
    {
        return this.hintTags;
    }


    /**
     * Get the readable strings extracted from the state.
     *
     * @return The strings
     */
    public List<String> getHints ()
    {
        return this.hints;
    }


    /**
     * Get the decoded content.
     *
     * @return The decoded content
     */
    public Optional<ObjectNode> getDecoded ()
    {
        return Optional.ofNullable (this.decoded);
    }
}
