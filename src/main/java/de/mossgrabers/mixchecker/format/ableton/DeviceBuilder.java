// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import de.mossgrabers.mixchecker.core.AnalysisSettings;
import de.mossgrabers.mixchecker.format.ableton.model.Node;
import de.mossgrabers.mixchecker.model.Device;
import de.mossgrabers.mixchecker.model.DeviceFormat;
import de.mossgrabers.mixchecker.model.DeviceIdentity;
import de.mossgrabers.mixchecker.model.Parameter;
import de.mossgrabers.mixchecker.model.PluginState;
import de.mossgrabers.mixchecker.model.TriState;
import de.mossgrabers.mixchecker.plugin.PluginStateInspector;
import de.mossgrabers.mixchecker.utils.TextUtils;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;


/**
 * Creates the devices of a track in chain order.
 *
 * @author Jürgen Moßgraber
 */
public class DeviceBuilder
{
    private static final int           MAX_DEVICE_CANDIDATES = 128;

    private final AnalysisSettings     settings;
    private final PluginStateInspector pluginStateInspector;


    /**
     * Constructor.
     *
     * @param settings The analysis settings
     * @param pluginStateInspector Inspects the state of third party plug-ins
     */
    public DeviceBuilder (final AnalysisSettings settings, final PluginStateInspector pluginStateInspector)
    {
        this.settings = settings;
        this.pluginStateInspector = pluginStateInspector;
    }


    /**
     * Create all devices of a track.
     *
     * @param track The track node
     * @return The devices in chain order
     */
    public List<Device> buildDevices (final Node track)
    {
        final Set<String> envelopeTargets = AutomationScanner.collectEnvelopeTargets (track);
        final List<Device> devices = new ArrayList<> ();
        for (final Node deviceNode: findDeviceNodes (track))
        {
            final String tag = deviceNode.getName ();
            if (AbletonTags.DEVICE_CHAIN.equals (tag) || AbletonTags.DEVICES.equals (tag))
                continue;
            devices.add (this.buildDevice (deviceNode, envelopeTargets));
        }
        return devices;
    }


    /**
     * Create one device.
     *
     * @param deviceNode The device node
     * @param envelopeTargets The targets of the envelopes of the track which contain events
     * @return The device
     */
    public Device buildDevice (final Node deviceNode, final Set<String> envelopeTargets)
    {
        final String tag = deviceNode.getName ();
        final DeviceIdentity identity = AttributeResolver.resolveDeviceIdentity (deviceNode);
        final DeviceFormat format = DeviceFormat.classify (tag);
        final String identifier = identity.getIdentifier ().orElse (null);

        PluginState pluginState = null;
        if (format.isThirdParty ())
            pluginState = this.pluginStateInspector.inspect (deviceNode, identifier, this.settings.isMixSettings ()).orElse (null);

        final String name = resolveName (deviceNode, identity);
        final TriState enabled = AttributeResolver.resolveDeviceEnabled (deviceNode);
        final boolean hasOnAutomation = AutomationScanner.hasOnAutomation (deviceNode, envelopeTargets);
        final Map<String, String> namedParameters = ParameterExtractor.extractNamedParameters (deviceNode);

        // The raw parameters of plug-ins are only generic wrappers
        final Map<String, Parameter> parameters;
        if (format.isThirdParty ())
            parameters = Collections.emptyMap ();
        else
            parameters = ParameterExtractor.extractParameters (deviceNode, this.settings.getMaxParamsPerDevice (), namedParameters);

        ObjectNode keySettings = null;
        if (this.settings.isMixSettings () && !format.isThirdParty ())
            keySettings = DeviceKeySettings.extract (deviceNode).orElse (null);

        final TriState noop = DeviceKeySettings.detectNoop (tag, namedParameters);
        return new Device (tag, name, format, identity, enabled, hasOnAutomation, namedParameters, parameters, pluginState, keySettings, noop);
    }


    /**
     * Find the device nodes of a track. These are the children of the first Devices node. If
     * there is none, all nodes which look like a device are used.
     *
     * @param track The track node
     * @return The device nodes
     */
    static List<Node> findDeviceNodes (final Node track)
    {
        final Optional<Node> container = track.findFirst (AbletonTags.DEVICES);
        if (container.isPresent ())
            return container.get ().getChildNodes ();

        final List<Node> candidates = new ArrayList<> ();
        for (final Node node: track.iterate ())
        {
            final String tag = node.getName ();
            if (tag.endsWith ("Device") || tag.contains ("Plugin"))
            {
                candidates.add (node);
                if (candidates.size () >= MAX_DEVICE_CANDIDATES)
                    break;
            }
        }
        return candidates;
    }


    private static String resolveName (final Node deviceNode, final DeviceIdentity identity)
    {
        final String tag = deviceNode.getName ();
        Optional<String> name = AttributeResolver.resolveDeviceDisplayName (deviceNode);
        if (name.isEmpty ())
            name = identity.getProduct ();
        return name.flatMap (TextUtils::normalizeNonBoolean).orElse (tag);
    }
}
