// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import de.mossgrabers.mixchecker.format.ableton.model.Node;
import de.mossgrabers.mixchecker.model.Parameter;
import de.mossgrabers.mixchecker.utils.TextUtils;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;


/**
 * Extracts the named and the raw parameters of a device. Both are bounded and the raw parameters
 * are pruned to keep only the values which matter for a mix check.
 *
 * @author Jürgen Moßgraber
 */
public class ParameterExtractor
{
    /** The maximum number of named parameters. */
    public static final int           MAX_NAMED_PARAMETERS  = 200;

    private static final int          MAX_NAMED_IN_RAW      = 50;
    private static final int          MAX_CHILDREN_TO_SCAN  = 50;
    private static final int          MAX_TEXT_VALUE_LENGTH = 80;
    private static final String       NAMED_PARAMETER_TAG   = "NamedParam";

    private static final Set<String>  DROP_EXACT            = Set.of ("ParametersListWrapperLomId", "ParameterName", "ParameterId", "ParameterIdFlankBool", "StoredAllParameters", "AllParameters", "ParameterInfo", "ParameterInfoList", "ParameterValueList", "AutomationLaneList", "AutomationLane", "SourceContext");
    private static final List<String> DROP_CONTAINS         = List.of ("StoredAllParameters", "AllParameters", "ParameterIdFlankBool", "ParametersListWrapper", "ParameterInfo", "AutomationLane", "SourceContext");
    private static final Set<String>  SENTINEL_VALUES       = Set.of ("0.1234567687", "0.0.0.0");
    private static final Pattern      PATH_LIKE             = Pattern.compile ("[/\\\\]{2,}|\\.[a-zA-Z0-9]{3,4}$");


    /**
     * Private due to helper class.
     */
    private ParameterExtractor ()
    {
        // Intentionally empty
    }


    /**
     * Extract the named parameters of a device. These are nodes with a Name attribute and a
     * value as well as pairs of ParameterName and ParameterValue children.
     *
     * @param device The device node
     * @return The parameter names mapped to their value, the first occurrence wins
     */
    public static Map<String, String> extractNamedParameters (final Node device)
    {
        final Map<String, String> named = new LinkedHashMap<> ();
        final List<Node> nodes = device.iterate ();

        for (final Node node: nodes)
        {
            if (named.size () >= MAX_NAMED_PARAMETERS)
                return named;
            final String name = TextUtils.normalize (node.getAttribute (AbletonTags.ATTR_NAME));
            final String value = TextUtils.normalize (getValue (node));
            if (name != null && value != null)
                named.putIfAbsent (name, value);
        }

        for (final Node node: nodes)
        {
            if (named.size () >= MAX_NAMED_PARAMETERS)
                break;

            String parameterName = null;
            String parameterValue = null;
            final List<Node> children = node.getChildNodes ();
            for (int i = 0; i < Math.min (MAX_CHILDREN_TO_SCAN, children.size ()); i++)
            {
                final Node child = children.get (i);
                final String tag = child.getName ();
                if (tag.endsWith ("ParameterName"))
                    parameterName = child.getAttribute (AbletonTags.ATTR_VALUE);
                else if (tag.endsWith ("ParameterValue") || tag.endsWith ("PluginFloatParameter"))
                    parameterValue = child.getAttribute (AbletonTags.ATTR_VALUE);
            }

            final String name = TextUtils.normalize (parameterName);
            final String value = TextUtils.normalize (parameterValue);
            if (name != null && value != null)
                named.putIfAbsent (name, value);
        }

        return named;
    }


    /**
     * Extract the raw parameter nodes of a device and prune them.
     *
     * @param device The device node
     * @param maxParameters The maximum number of parameter nodes to capture before pruning, 0
     *            disables the extraction
     * @param namedParameters The already extracted named parameters, added to the result
     * @return The pruned parameters by their key
     */
    public static Map<String, Parameter> extractParameters (final Node device, final int maxParameters, final Map<String, String> namedParameters)
    {
        final Map<String, Parameter> parameters = new LinkedHashMap<> ();
        if (maxParameters <= 0)
            return parameters;

        int captured = 0;
        for (final Node node: device.iterate ())
        {
            if (captured >= maxParameters)
                break;
            final String tag = node.getName ();
            if (!tag.contains ("Parameter") && !tag.endsWith ("Param"))
                continue;

            final String id = TextUtils.normalize (node.getFirstAttribute (AbletonTags.ATTR_ID, "ParameterId").orElse (null));
            final String name = TextUtils.normalize (node.getAttribute (AbletonTags.ATTR_NAME));
            final String value = TextUtils.normalize (getValue (node));

            final String key;
            if (name != null)
                key = "name:" + name;
            else if (id != null)
                key = "id:" + id;
            else
                key = "param:" + captured;
            parameters.put (key, new Parameter (id, name, value, tag));
            captured++;
        }

        int count = 0;
        for (final Map.Entry<String, String> entry: namedParameters.entrySet ())
        {
            if (count++ >= MAX_NAMED_IN_RAW)
                break;
            parameters.putIfAbsent ("named:" + entry.getKey (), new Parameter (null, entry.getKey (), entry.getValue (), NAMED_PARAMETER_TAG));
        }

        prune (parameters);
        return parameters;
    }


    /**
     * Removes wrapper and list nodes, sentinel values and values which do not look like a setting.
     *
     * @param parameters The parameters to prune
     */
    static void prune (final Map<String, Parameter> parameters)
    {
        final Iterator<Parameter> iterator = parameters.values ().iterator ();
        while (iterator.hasNext ())
        {
            if (!isRelevant (iterator.next ()))
                iterator.remove ();
        }
    }


    private static boolean isRelevant (final Parameter parameter)
    {
        final String tag = parameter.getTag () == null ? "" : parameter.getTag ().strip ();
        if (tag.isEmpty () || DROP_EXACT.contains (tag) || isContainerTag (tag))
            return false;
        for (final String marker: DROP_CONTAINS)
        {
            if (tag.contains (marker))
                return false;
        }

        final String value = parameter.getValueRaw ().orElse (null);
        if (value == null)
            return false;
        if (value.equals (parameter.getName ().orElse (null)))
            return false;
        final String trimmed = value.strip ();
        if (tag.toLowerCase (Locale.ROOT).startsWith ("parameterid") && ("-1".equals (trimmed) || trimmed.isEmpty ()))
            return false;
        if (SENTINEL_VALUES.contains (trimmed))
            return false;

        if (TextUtils.parseBoolean (trimmed).isKnown () || TextUtils.parseDouble (trimmed).isPresent ())
            return true;
        return !trimmed.isEmpty () && trimmed.length () <= MAX_TEXT_VALUE_LENGTH && !PATH_LIKE.matcher (trimmed).find ();
    }


    private static boolean isContainerTag (final String tag)
    {
        final String lowerTag = tag.toLowerCase (Locale.ROOT);
        return lowerTag.endsWith ("list") || lowerTag.contains ("wrapper") || lowerTag.contains ("container") || lowerTag.contains ("bank") && lowerTag.contains ("parameter");
    }


    /**
     * Get the first non-empty value of the Value, Manual and Amount attributes.
     *
     * @param node The node
     * @return The value or null
     */
    static String getValue (final Node node)
    {
        return node.getFirstAttribute (AbletonTags.ATTR_VALUE, AbletonTags.ATTR_MANUAL, AbletonTags.ATTR_AMOUNT).orElse (null);
    }
}
