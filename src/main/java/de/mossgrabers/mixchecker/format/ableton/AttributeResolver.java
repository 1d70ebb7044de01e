// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import de.mossgrabers.mixchecker.format.ableton.model.Node;
import de.mossgrabers.mixchecker.model.DeviceIdentity;
import de.mossgrabers.mixchecker.model.RoutingEndpoint;
import de.mossgrabers.mixchecker.model.TriState;
import de.mossgrabers.mixchecker.utils.TextUtils;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;


/**
 * Resolves the semantic attributes of tracks and devices. The same value might be stored under
 * different tags and encodings. Tags are matched by pattern in document order. If a value cannot
 * be resolved with confidence the result is unknown (or empty) and never a guessed default.
 *
 * @author Jürgen Moßgraber
 */
public class AttributeResolver
{
    private static final int           MAX_MANUAL_CHILDREN    = 25;
    private static final int           DEVICE_ON_SEARCH_DEPTH = 4;
    private static final String        NO_GROUP               = "-1";

    private static final List<Pattern> TRACK_NAME_RULES       = List.of (AbletonTags.TRACK_EFFECTIVE_NAME, AbletonTags.TRACK_USER_NAME, AbletonTags.TRACK_TRACK_NAME, AbletonTags.ANY_NAME);
    private static final List<Pattern> DEVICE_NAME_RULES      = List.of (AbletonTags.DEVICE_DISPLAY_NAME, AbletonTags.DEVICE_PLUGIN_NAME, AbletonTags.ANY_NAME);


    /**
     * Private due to helper class.
     */
    private AttributeResolver ()
    {
        // Intentionally empty
    }


    /**
     * Resolve the name of a track.
     *
     * @param track The track node
     * @return The name, never a boolean literal
     */
    public static Optional<String> resolveTrackName (final Node track)
    {
        return resolveName (track, TRACK_NAME_RULES);
    }


    /**
     * Resolve the display name of a device.
     *
     * @param device The device node
     * @return The name, never a boolean literal
     */
    public static Optional<String> resolveDeviceDisplayName (final Node device)
    {
        return resolveName (device, DEVICE_NAME_RULES);
    }


    /**
     * Resolve the mute state of a track. Only the mixer is searched since devices have mute
     * parameters as well (e.g. Utility).
     *
     * @param track The track node
     * @return The mute state
     */
    public static TriState resolveMuted (final Node track)
    {
        final Optional<Node> mixer = track.find (AbletonTags.MIXER_PATH);
        if (mixer.isEmpty ())
            return TriState.UNKNOWN;
        final TriState muted = findFlag (mixer.get (), AbletonTags.MUTE);
        if (muted.isKnown ())
            return muted;
        return findFlag (mixer.get (), AbletonTags.MUTE_ALTERNATIVE);
    }


    /**
     * Resolve the state of the track activator.
     *
     * @param track The track node
     * @return The active state
     */
    public static TriState resolveActive (final Node track)
    {
        final Optional<Node> speaker = track.find (AbletonTags.SPEAKER_PATH);
        if (speaker.isPresent ())
        {
            final TriState active = booleanFromNode (speaker.get ());
            if (active.isKnown ())
                return active;
        }
        return findFlag (track, AbletonTags.SPEAKER);
    }


    /**
     * Resolve the solo state of a track.
     *
     * @param track The track node
     * @return The solo state
     */
    public static TriState resolveSolo (final Node track)
    {
        return findFlag (track, AbletonTags.SOLO);
    }


    /**
     * Resolve the record arm state of a track.
     *
     * @param track The track node
     * @return The arm state
     */
    public static TriState resolveArmed (final Node track)
    {
        return findFlag (track, AbletonTags.ARM);
    }


    /**
     * Resolve the raw volume of a track. The mixer is searched first.
     *
     * @param track The track node
     * @return The raw volume
     */
    public static Optional<String> resolveVolume (final Node track)
    {
        return resolveMixerValue (track, AbletonTags.VOLUME);
    }


    /**
     * Resolve the raw panorama of a track. The mixer is searched first.
     *
     * @param track The track node
     * @return The raw panorama
     */
    public static Optional<String> resolvePan (final Node track)
    {
        return resolveMixerValue (track, AbletonTags.PAN);
    }


    /**
     * Resolve one routing endpoint of a track.
     *
     * @param track The track node
     * @param routingTag The tag of the routing node, e.g. "AudioInputRouting"
     * @return Empty if the routing node does not exist, otherwise the endpoint (which might have
     *         no text)
     */
    public static Optional<RoutingEndpoint> resolveRoutingEndpoint (final Node track, final String routingTag)
    {
        final Optional<Node> routing = track.findFirst (routingTag);
        if (routing.isEmpty ())
            return Optional.empty ();
        final Node routingNode = routing.get ();
        Optional<String> target = findAttribute (routingNode, AbletonTags.ROUTING_TARGET, AbletonTags.ATTR_VALUE);
        if (target.isEmpty ())
            target = findAttribute (routingNode, AbletonTags.ROUTING_VALUE, AbletonTags.ATTR_VALUE);
        return Optional.of (new RoutingEndpoint (target.orElse (null)));
    }


    /**
     * Resolve the ID of the group track which contains the track.
     *
     * @param track The track node
     * @return The ID, empty if the track is not in a group
     */
    public static Optional<String> resolveParentGroupId (final Node track)
    {
        for (final String tag: AbletonTags.PARENT_GROUP_TAGS)
        {
            final Optional<Node> groupNode = track.findFirst (tag);
            if (groupNode.isEmpty ())
                continue;
            final Node node = groupNode.get ();
            String value = node.getFirstAttribute (AbletonTags.ATTR_VALUE, AbletonTags.ATTR_ID).orElse (null);
            if (value == null)
                value = node.getText ();
            final Optional<String> id = TextUtils.normalizeNonBoolean (value);
            if (id.isPresent ())
                return NO_GROUP.equals (id.get ()) ? Optional.empty () : id;
        }

        final Optional<String> id = findAttribute (track, AbletonTags.PARENT_GROUP, AbletonTags.ATTR_VALUE).flatMap (TextUtils::normalizeNonBoolean);
        if (id.isPresent () && NO_GROUP.equals (id.get ()))
            return Optional.empty ();
        return id;
    }


    /**
     * Resolve the vendor, product and identifier of a (plug-in) device.
     *
     * @param device The device node
     * @return The identity
     */
    public static DeviceIdentity resolveDeviceIdentity (final Node device)
    {
        final String vendor = findAttribute (device, AbletonTags.VENDOR, AbletonTags.ATTR_VALUE).flatMap (TextUtils::normalizeNonBoolean).orElse (null);
        final String product = findAttribute (device, AbletonTags.PRODUCT, AbletonTags.ATTR_VALUE).flatMap (TextUtils::normalizeNonBoolean).orElse (null);
        Optional<String> identifier = findAttribute (device, AbletonTags.IDENTIFIER, AbletonTags.ATTR_VALUE).flatMap (TextUtils::normalizeNonBoolean);
        if (identifier.isEmpty ())
            identifier = findAttribute (device, AbletonTags.PATH, AbletonTags.ATTR_VALUE).flatMap (TextUtils::normalizeNonBoolean);
        return new DeviceIdentity (vendor, product, identifier.orElse (null));
    }


    /**
     * Resolve the state of the power button of a device. Only tags which represent the power
     * button are trusted, a generic "Enabled" is ignored.
     *
     * @param device The device node
     * @return The enabled state, unknown if it cannot be resolved with confidence
     */
    public static TriState resolveDeviceEnabled (final Node device)
    {
        for (final Node.DepthNode entry: device.iterateBreadthFirst (DEVICE_ON_SEARCH_DEPTH))
        {
            final Node node = entry.getNode ();
            if (!isDeviceOnTag (node.getName ()))
                continue;
            final TriState state = booleanFromNode (node);
            if (state.isKnown ())
                return state;
        }

        for (final String attribute: new String []
        {
            "IsOn",
            "On"
        })
        {
            final TriState state = TextUtils.parseBoolean (device.getAttribute (attribute));
            if (state.isKnown ())
                return state;
        }
        return TriState.UNKNOWN;
    }


    /**
     * Extracts a boolean from a node. The value is taken from the Value or Manual attribute or
     * from a nested Manual child or grand-child.
     *
     * @param node The node
     * @return The boolean, unknown if none is found
     */
    public static TriState booleanFromNode (final Node node)
    {
        final TriState state = TextUtils.parseBoolean (node.getFirstAttribute (AbletonTags.ATTR_VALUE, AbletonTags.ATTR_MANUAL).orElse (null));
        if (state.isKnown ())
            return state;

        final List<Node> children = node.getChildNodes ();
        for (int i = 0; i < Math.min (MAX_MANUAL_CHILDREN, children.size ()); i++)
        {
            final Node child = children.get (i);
            if (isManualTag (child.getName ()))
            {
                final TriState childState = TextUtils.parseBoolean (child.getFirstAttribute (AbletonTags.ATTR_VALUE, AbletonTags.ATTR_MANUAL).orElse (null));
                if (childState.isKnown ())
                    return childState;
            }

            final List<Node> grandChildren = child.getChildNodes ();
            for (int j = 0; j < Math.min (MAX_MANUAL_CHILDREN, grandChildren.size ()); j++)
            {
                final Node grandChild = grandChildren.get (j);
                if (!isManualTag (grandChild.getName ()))
                    continue;
                final TriState grandChildState = TextUtils.parseBoolean (grandChild.getFirstAttribute (AbletonTags.ATTR_VALUE, AbletonTags.ATTR_MANUAL).orElse (null));
                if (grandChildState.isKnown ())
                    return grandChildState;
            }
        }
        return TriState.UNKNOWN;
    }


    /**
     * Extracts a numeric text from a node. The value is taken from the Manual or Value attribute
     * or from a nested Manual child.
     *
     * @param node The node
     * @return The text, empty if none is found
     */
    public static Optional<String> numberFromNode (final Node node)
    {
        final Optional<String> value = node.getFirstAttribute (AbletonTags.ATTR_MANUAL, AbletonTags.ATTR_VALUE);
        if (value.isPresent ())
            return value;

        final List<Node> children = node.getChildNodes ();
        for (int i = 0; i < Math.min (MAX_MANUAL_CHILDREN, children.size ()); i++)
        {
            final Node child = children.get (i);
            if (isManualTag (child.getName ()))
            {
                final Optional<String> childValue = child.getFirstAttribute (AbletonTags.ATTR_VALUE);
                if (childValue.isPresent ())
                    return childValue;
            }
        }
        return Optional.empty ();
    }


    /**
     * Find the first node (in document order, the scope included) whose tag matches the pattern
     * and which has a non-empty value for the attribute.
     *
     * @param scope The node to search
     * @param tagPattern The pattern to search in the tag names
     * @param attribute The name of the attribute
     * @return The value of the attribute
     */
    public static Optional<String> findAttribute (final Node scope, final Pattern tagPattern, final String attribute)
    {
        final Optional<Node> node = scope.findFirst (n -> tagPattern.matcher (n.getName ()).find () && isNotEmpty (n.getAttribute (attribute)));
        return node.map (n -> n.getAttribute (attribute));
    }


    /**
     * Find the first node (in document order, the scope included) whose tag matches the pattern
     * and which carries a boolean.
     *
     * @param scope The node to search
     * @param tagPattern The pattern to search in the tag names
     * @return The first boolean found, unknown if none
     */
    public static TriState findFlag (final Node scope, final Pattern tagPattern)
    {
        final Optional<Node> node = scope.findFirst (n -> tagPattern.matcher (n.getName ()).find () && booleanFromNode (n).isKnown ());
        return node.isPresent () ? booleanFromNode (node.get ()) : TriState.UNKNOWN;
    }


    private static Optional<String> resolveName (final Node scope, final List<Pattern> rules)
    {
        for (final Pattern rule: rules)
        {
            final Optional<String> value = findAttribute (scope, rule, AbletonTags.ATTR_VALUE).flatMap (TextUtils::normalizeNonBoolean);
            if (value.isPresent ())
                return value;
        }
        return Optional.empty ();
    }


    private static Optional<String> resolveMixerValue (final Node track, final Pattern tagPattern)
    {
        Optional<Node> mixer = track.find (AbletonTags.MIXER_PATH);
        if (mixer.isEmpty ())
            mixer = track.findFirst (AbletonTags.MIXER);
        if (mixer.isPresent ())
        {
            final Optional<String> value = findNumber (mixer.get (), tagPattern);
            if (value.isPresent ())
                return value;
        }
        return findNumber (track, tagPattern);
    }


    private static Optional<String> findNumber (final Node scope, final Pattern tagPattern)
    {
        final Optional<Node> node = scope.findFirst (n -> tagPattern.matcher (n.getName ()).find () && numberFromNode (n).isPresent ());
        return node.flatMap (AttributeResolver::numberFromNode);
    }


    private static boolean isDeviceOnTag (final String tag)
    {
        for (final String onTag: AbletonTags.DEVICE_ON_TAGS)
        {
            if (tag.endsWith (onTag))
                return true;
        }
        return false;
    }


    private static boolean isManualTag (final String tag)
    {
        return tag.endsWith (AbletonTags.MANUAL);
    }


    private static boolean isNotEmpty (final String value)
    {
        return value != null && !value.isEmpty ();
    }
}
