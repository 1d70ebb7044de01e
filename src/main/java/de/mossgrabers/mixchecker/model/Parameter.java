// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import java.util.Optional;


/**
 * A raw parameter node of a device.
 *
 * @author Jürgen Moßgraber
 */
public class Parameter
{
    private final String id;
    private final String name;
    private final String valueRaw;
    private final String tag;


    /**
     * Constructor.
     *
     * @param id The ID of the parameter, might be null
     * @param name The name of the parameter, might be null
     * @param valueRaw The value as found in the project, might be null
     * @param tag The tag of the parameter node
     */
    public Parameter (final String id, final String name, final String valueRaw, final String tag)
    {
        this.id = id;
        this.name = name;
        this.valueRaw = valueRaw;
        this.tag = tag;
    }


    /**
     * Get the ID.
     *
     * @return The ID
     */
    public Optional<String> getId ()
    {
        return Optional.ofNullable (this.id);
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
     * Get the raw value.
     *
     * @return The value
     */
    public Optional<String> getValueRaw ()
    {
        return Optional.ofNullable (this.valueRaw);
    }


    /**
     * Get the tag of the parameter node.
     *
     * @return The tag
     */
    public String getTag ()
    {
        return this.tag;
    }
}
