// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;


/**
 * One processing unit in the device chain of a track. Instances are immutable.
 *
 * @author Jürgen Moßgraber
 */
public class Device
{
    private final String                 tag;
    private final String                 name;
    private final DeviceFormat           format;
    private final DeviceIdentity         identity;
    private final TriState               enabled;
    private final boolean                hasOnAutomation;
    private final Map<String, String>    namedParameters;
    private final Map<String, Parameter> parameters;
    private final PluginState            pluginState;
    private final ObjectNode             settings;
    private final TriState               noop;


    /**
     * Constructor.
     *
     * @param tag The tag of the device node
     * @param name The resolved name, never a boolean literal
     * @param format The format
     * @param identity The vendor, product and identifier
     * @param enabled The state of the power button
     * @param hasOnAutomation True if the power button is automated
     * @param namedParameters The named parameters (name to raw value) in document order
     * @param parameters The pruned raw parameters by their key, empty for third party plug-ins
     * @param pluginState The metadata of the plug-in state, might be null
     * @param settings The key settings, might be null
     * @param noop Is the device a stock device which does nothing?
     */
    public Device (final String tag, final String name, final DeviceFormat format, final DeviceIdentity identity, final TriState enabled, final boolean hasOnAutomation, final Map<String, String> namedParameters, final Map<String, Parameter> parameters, final PluginState pluginState, final ObjectNode settings, final TriState noop)
    {
        this.tag = tag;
        this.name = name;
        this.format = format;
        this.identity = identity;
        this.enabled = enabled;
        this.hasOnAutomation = hasOnAutomation;
        this.namedParameters = Collections.unmodifiableMap (namedParameters);
        this.parameters = Collections.unmodifiableMap (parameters);
        this.pluginState = pluginState;
        this.settings = settings;
        this.noop = noop;
    }


    /**
     * Get the tag of the device node.
     *
     * @return The tag, e.g. "Eq8"
     */
    public String getTag ()
    {
        return this.tag;
    }


    /**
     * Get the name of the device.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Get the format.
     *
     * @return The format
     */
    public DeviceFormat getFormat ()
    {
        return this.format;
    }


    /**
     * Get the identity.
     *
     * @return The identity
     */
    public DeviceIdentity getIdentity ()
    {
        return this.identity;
    }


    /**
     * Get the state of the power button.
     *
     * @return Unknown if it could not be resolved with confidence
     */
    public TriState getEnabled ()
    {
        return this.enabled;
    }


    /**
     * Is the power button automated on the track?
     *
     * @return True if automated
     */
    public boolean hasOnAutomation ()
    {
        return this.hasOnAutomation;
    }


    /**
     * Is the device explicitly switched off and not automated?
     *
     * @return True if off without automation
     */
    public boolean isOffWithoutAutomation ()
    {
        return this.enabled.isFalse () && !this.hasOnAutomation;
    }


    /**
     * Get the named parameters.
     *
     * @return The parameter names mapped to their raw values
     */
    public Map<String, String> getNamedParameters ()
    {
        return this.namedParameters;
    }


    /**
     * Get the pruned raw parameters.
     *
     * @return The parameters by their key, e.g. "name:Gain"
     */
    public Map<String, Parameter> getParameters ()
    {
        return this.parameters;
    }


    /**
     * Get the metadata of the plug-in state.
     *
     * @return The metadata, present only for third party plug-ins with a state
     */
    public Optional<PluginState> getPluginState ()
    {
        return Optional.ofNullable (this.pluginState);
    }


    /**
     * Get the key settings.
     *
     * @return The settings, present only if requested and available
     */
    public Optional<ObjectNode> getSettings ()
    {
        return Optional.ofNullable (this.settings);
    }


    /**
     * Is this a stock device which does not change the signal?
     *
     * @return Unknown if it cannot be told
     */
    public TriState getNoop ()
    {
        return this.noop;
    }
}
