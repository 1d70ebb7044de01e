// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import de.mossgrabers.mixchecker.format.ableton.model.Node;
import de.mossgrabers.mixchecker.format.json.JsonHelper;
import de.mossgrabers.mixchecker.model.TriState;
import de.mossgrabers.mixchecker.utils.TextUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;


/**
 * Extracts the settings of stock devices which matter for mixing and loudness, e.g. the EQ bands
 * or the threshold of a compressor. The extraction is bounded.
 *
 * @author Jürgen Moßgraber
 */
public class DeviceKeySettings
{
    private static final int          MAX_EQ_BANDS        = 8;
    private static final int          MAX_MACROS          = 16;
    private static final int          MAX_BRANCHES        = 128;
    private static final int          MAX_MXD_PARAMETERS  = 64;
    private static final int          MAX_GENERIC_ITEMS   = 60;
    private static final int          MAX_GENERIC_DEPTH   = 12;
    private static final int          MAX_SUFFIX          = 50;
    private static final int          MAX_TEXT_LENGTH     = 80;
    private static final double       EPSILON             = 1e-6;

    private static final List<String> EQ_BAND_PARAMETERS  = List.of ("IsOn", "Mode", "Freq", "Gain", "Q");
    private static final List<String> GENERIC_KEY_TERMS   = List.of ("threshold", "ratio", "attack", "release", "gain", "ceiling", "lookahead", "freq", "q", "width", "drive", "drywet", "mix", "feedback", "decay", "time");


    /**
     * Private due to helper class.
     */
    private DeviceKeySettings ()
    {
        // Intentionally empty
    }


    /**
     * Extract the key settings of a device.
     *
     * @param device The device node
     * @return The settings, empty if none were found
     */
    public static Optional<ObjectNode> extract (final Node device)
    {
        final DeviceKind kind = DeviceKind.fromTag (device.getName ());
        final ObjectNode settings = JsonHelper.FACTORY.objectNode ();

        switch (kind)
        {
            case EQ8:
                final ArrayNode bands = extractEq8Bands (device);
                if (!bands.isEmpty ())
                    settings.set ("bands", bands);
                putParameters (settings, device, kind.getKeys ());
                break;

            case GLUE_COMPRESSOR:
                putParameters (settings, device, kind.getKeys ());
                putIfPresent (settings, "sidechain_target", getParameterAttribute (device, ".//SideChain/RoutedInput/Routable/Target"));
                putIfPresent (settings, "sidechain_on", getParameterAttribute (device, ".//SideChain/OnOff"));
                break;

            case RACK:
                extractRackStructure (settings, device);
                break;

            case DRUM_CELL:
                Object sample = getParameterAttribute (device, ".//UserSample/Value/SampleRef/FileRef/RelativePath");
                if (sample == null)
                    sample = getParameterAttribute (device, ".//UserSample/Value/SampleRef/FileRef/Path");
                putIfPresent (settings, "sample", sample);
                putParameters (settings, device, kind.getKeys ());
                break;

            case MAX_FOR_LIVE:
                final ArrayNode parameters = extractMaxForLiveParameters (device);
                if (!parameters.isEmpty ())
                    settings.set ("params", parameters);
                break;

            case GENERIC:
                settings.setAll (scanKeyTerms (device, GENERIC_KEY_TERMS, MAX_GENERIC_ITEMS, MAX_GENERIC_DEPTH));
                break;

            default:
                putParameters (settings, device, kind.getKeys ());
                break;
        }

        return settings.isEmpty () ? Optional.empty () : Optional.of (settings);
    }


    /**
     * Guess if a stock device does not change the signal. Only Utility and EQ Eight are
     * supported.
     *
     * @param deviceTag The tag of the device
     * @param namedParameters The named parameters of the device
     * @return True if the device does nothing, unknown if it cannot be told
     */
    public static TriState detectNoop (final String deviceTag, final Map<String, String> namedParameters)
    {
        final DeviceKind kind = DeviceKind.fromTag (deviceTag);

        if (kind == DeviceKind.UTILITY)
        {
            final OptionalDouble gain = TextUtils.parseDouble (getFirst (namedParameters, "Gain", "Gain (dB)"));
            final OptionalDouble width = TextUtils.parseDouble (getFirst (namedParameters, "Width", "Stereo Width"));
            final TriState bassMono = TextUtils.parseBoolean (getFirst (namedParameters, "BassMono", "Bass Mono"));
            final TriState invertLeft = TextUtils.parseBoolean (getFirst (namedParameters, "PhaseInvertL", "Invert Left"));
            final TriState invertRight = TextUtils.parseBoolean (getFirst (namedParameters, "PhaseInvertR", "Invert Right"));

            if (gain.isEmpty () && width.isEmpty () && !bassMono.isKnown () && !invertLeft.isKnown () && !invertRight.isKnown ())
                return TriState.UNKNOWN;

            final boolean gainIsNeutral = gain.isEmpty () || Math.abs (gain.getAsDouble ()) < EPSILON;
            final boolean widthIsNeutral = width.isEmpty () || Math.abs (width.getAsDouble () - 1.0) < EPSILON || Math.abs (width.getAsDouble () - 100.0) < EPSILON;
            return TriState.of (gainIsNeutral && widthIsNeutral && !bassMono.isTrue () && !invertLeft.isTrue () && !invertRight.isTrue ());
        }

        if (kind == DeviceKind.EQ8)
        {
            for (final String key: namedParameters.keySet ())
            {
                final String lowerKey = key.toLowerCase (Locale.ROOT);
                if (lowerKey.contains ("gain") || lowerKey.contains ("freq") || lowerKey.contains ("q") || lowerKey.contains ("band"))
                    return TriState.FALSE;
            }
        }

        return TriState.UNKNOWN;
    }


    /**
     * Scan the device for nodes whose tag contains one of the terms and collect their values.
     *
     * @param device The device node
     * @param terms The lower case terms to look for
     * @param maxItems The maximum number of values
     * @param maxDepth The maximum depth to search
     * @return The values by tag, duplicate tags get a numeric suffix
     */
    static ObjectNode scanKeyTerms (final Node device, final List<String> terms, final int maxItems, final int maxDepth)
    {
        final ObjectNode result = JsonHelper.FACTORY.objectNode ();
        for (final Node.DepthNode entry: device.iterateBreadthFirst (maxDepth))
        {
            if (result.size () >= maxItems)
                break;

            final String tag = entry.getNode ().getName ();
            if (tag.isEmpty () || !containsAny (tag.toLowerCase (Locale.ROOT), terms))
                continue;

            final String raw = TextUtils.normalize (ParameterExtractor.getValue (entry.getNode ()));
            if (raw == null)
                continue;

            final JsonNode value;
            final TriState booleanValue = TextUtils.parseBoolean (raw);
            final OptionalDouble numberValue = TextUtils.parseDouble (raw);
            if (booleanValue.isKnown ())
                value = JsonHelper.FACTORY.booleanNode (booleanValue.isTrue ());
            else if (numberValue.isPresent () && Double.isFinite (numberValue.getAsDouble ()))
                value = JsonHelper.FACTORY.numberNode (numberValue.getAsDouble ());
            else if (raw.length () <= MAX_TEXT_LENGTH)
                value = JsonHelper.FACTORY.textNode (raw);
            else
                continue;

            String key = tag;
            if (result.has (key))
            {
                int suffix = 2;
                while (result.has (tag + "_" + suffix) && suffix < MAX_SUFFIX)
                    suffix++;
                key = tag + "_" + suffix;
            }
            result.set (key, value);
        }
        return result;
    }


    /**
     * Get the value of a parameter node. Most parameters store their value in a nested Manual
     * node.
     *
     * @param parameter The parameter node, might be null
     * @return The normalized scalar or null
     */
    static Object getManualValue (final Node parameter)
    {
        if (parameter == null)
            return null;

        final Optional<Node> manual = parameter.find (".//" + AbletonTags.MANUAL);
        if (manual.isPresent ())
            return TextUtils.normalizeScalar (getValueOrText (manual.get ()));

        final String value = parameter.getAttribute (AbletonTags.ATTR_VALUE);
        if (value != null)
            return TextUtils.normalizeScalar (value);
        return TextUtils.normalizeScalar (parameter.getText ());
    }


    private static void putParameters (final ObjectNode settings, final Node device, final List<String> keys)
    {
        for (final String key: keys)
            putIfPresent (settings, key, getManualValue (device.find (".//" + key).orElse (null)));
    }


    private static Object getParameterAttribute (final Node scope, final String path)
    {
        if (scope == null)
            return null;
        final Optional<Node> node = scope.find (path);
        return node.isPresent () ? TextUtils.normalizeScalar (getValueOrText (node.get ())) : null;
    }


    private static String getValueOrText (final Node node)
    {
        final String value = node.getAttribute (AbletonTags.ATTR_VALUE);
        if (value == null && node.getText () != null)
            return node.getText ().strip ();
        return value;
    }


    private static ArrayNode extractEq8Bands (final Node device)
    {
        final ArrayNode bands = JsonHelper.FACTORY.arrayNode ();
        for (int i = 0; i < MAX_EQ_BANDS; i++)
        {
            final Optional<Node> band = device.find (".//Bands." + i);
            if (band.isEmpty ())
                continue;

            final ObjectNode sideA = extractEq8BandSide (band.get (), "ParameterA");
            final ObjectNode sideB = extractEq8BandSide (band.get (), "ParameterB");
            if (sideA.isEmpty () && sideB.isEmpty ())
                continue;

            final ObjectNode bandNode = bands.addObject ();
            bandNode.put ("i", i);
            bandNode.set ("A", sideA.isEmpty () ? null : sideA);
            bandNode.set ("B", sideB.isEmpty () ? null : sideB);
        }
        return bands;
    }


    private static ObjectNode extractEq8BandSide (final Node band, final String sideTag)
    {
        final ObjectNode result = JsonHelper.FACTORY.objectNode ();
        final Optional<Node> side = band.getChildNode (sideTag);
        if (side.isPresent ())
        {
            for (final String key: EQ_BAND_PARAMETERS)
                putIfPresent (result, key, getManualValue (side.get ().getChildNode (key).orElse (null)));
        }
        return result;
    }


    private static void extractRackStructure (final ObjectNode settings, final Node rack)
    {
        final Optional<Node> chainSelector = rack.find (".//ChainSelector");
        if (chainSelector.isPresent ())
            settings.set ("chain_selector", JsonHelper.toNode (getManualValue (chainSelector.get ())));

        final ArrayNode macros = JsonHelper.FACTORY.arrayNode ();
        for (int i = 0; i < MAX_MACROS; i++)
        {
            final Optional<Node> nameNode = rack.find (".//MacroDisplayNames." + i);
            final Optional<Node> valueNode = rack.find (".//MacroControls." + i);
            if (nameNode.isEmpty () && valueNode.isEmpty ())
                continue;
            final Object name = getParameterAttribute (rack, ".//MacroDisplayNames." + i);
            final Object value = getManualValue (valueNode.orElse (null));
            if (name == null && value == null)
                continue;
            final ObjectNode macro = macros.addObject ();
            macro.put ("i", i);
            macro.set ("n", JsonHelper.toNode (name));
            macro.set ("v", JsonHelper.toNode (value));
        }
        if (!macros.isEmpty ())
            settings.set ("macros", macros);

        final Optional<Node> branchesNode = rack.find (".//Branches");
        if (branchesNode.isEmpty ())
            return;
        final ArrayNode branches = JsonHelper.FACTORY.arrayNode ();
        final List<Node> children = branchesNode.get ().getChildNodes ();
        for (int i = 0; i < Math.min (MAX_BRANCHES, children.size ()); i++)
        {
            final Node branch = children.get (i);
            final ObjectNode branchNode = branches.addObject ();
            branchNode.set ("n", JsonHelper.toNode (getParameterAttribute (branch, "Name")));

            final Node range = branch.getChildNode ("BranchSelectorRange").orElse (null);
            final Object low = getParameterAttribute (range, "Min");
            final Object high = getParameterAttribute (range, "Max");
            if (low == null && high == null)
                branchNode.putNull ("range");
            else
                branchNode.putArray ("range").add (JsonHelper.toNode (low)).add (JsonHelper.toNode (high));

            branchNode.set ("selected", JsonHelper.toNode (getParameterAttribute (branch, "IsSelected")));
            branchNode.set ("solo", JsonHelper.toNode (getParameterAttribute (branch, "IsSoloed")));
        }
        if (!branches.isEmpty ())
            settings.set ("branches", branches);
    }


    private static ArrayNode extractMaxForLiveParameters (final Node device)
    {
        final ArrayNode result = JsonHelper.FACTORY.arrayNode ();
        final Optional<Node> parameterList = device.find (".//ParameterList/ParameterList");
        if (parameterList.isEmpty ())
            return result;

        final List<Node> children = parameterList.get ().getChildNodes ();
        for (int i = 0; i < Math.min (MAX_MXD_PARAMETERS, children.size ()); i++)
        {
            final Node parameter = children.get (i);
            final Object name = getParameterAttribute (parameter, "Name");
            if (name == null)
                continue;
            final ObjectNode parameterNode = result.addObject ();
            parameterNode.put ("n", name.toString ());
            parameterNode.set ("v", JsonHelper.toNode (getManualValue (parameter.find (".//Timeable").orElse (null))));
        }
        return result;
    }


    private static void putIfPresent (final ObjectNode settings, final String key, final Object value)
    {
        if (value != null)
            settings.set (key, JsonHelper.toNode (value));
    }


    private static String getFirst (final Map<String, String> namedParameters, final String key, final String alternativeKey)
    {
        final String value = namedParameters.get (key);
        return value != null ? value : namedParameters.get (alternativeKey);
    }


    private static boolean containsAny (final String text, final List<String> terms)
    {
        for (final String term: terms)
        {
            if (text.contains (term))
                return true;
        }
        return false;
    }
}
