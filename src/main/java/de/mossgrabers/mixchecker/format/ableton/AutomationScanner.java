// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton;

import de.mossgrabers.mixchecker.format.ableton.model.Node;
import de.mossgrabers.mixchecker.utils.TextUtils;

import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;


/**
 * Detects if the power button of a device is automated. The automation target IDs of the power
 * button are matched against the targets of the automation envelopes of the track which contain
 * recorded events.
 *
 * @author Jürgen Moßgraber
 */
public class AutomationScanner
{
    private static final Pattern DIGITS          = Pattern.compile ("\\d+");
    private static final int     MAX_PARENT_HOPS = 4;


    /**
     * Private due to helper class.
     */
    private AutomationScanner ()
    {
        // Intentionally empty
    }


    /**
     * Collect the targets (pointee IDs) of all envelopes of a track which contain events. Only
     * single envelopes are checked, not the containers which group them.
     *
     * @param track The track node
     * @return The IDs
     */
    public static Set<String> collectEnvelopeTargets (final Node track)
    {
        final Set<String> ids = new LinkedHashSet<> ();
        for (final Node envelope: track.iterate ())
        {
            if (isSingleEnvelope (envelope) && hasEvents (envelope))
                getPointeeId (envelope).ifPresent (ids::add);
        }
        return ids;
    }


    /**
     * Get the automation target IDs of the power button of a device. These are all automation
     * targets which are located (at most 4 levels) below a power button node.
     *
     * @param device The device node
     * @return The IDs in document order
     */
    public static Set<String> getOnTargetIds (final Node device)
    {
        final Map<Node, Node> parents = new IdentityHashMap<> ();
        for (final Node node: device.iterate ())
        {
            for (final Node child: node.getChildNodes ())
                parents.put (child, node);
        }

        final Set<String> ids = new LinkedHashSet<> ();
        for (final Node node: device.iterate ())
        {
            if (!AbletonTags.AUTOMATION_TARGET.equals (node.getName ()))
                continue;
            final String id = node.getAttribute (AbletonTags.ATTR_ID);
            if (!isDigits (id))
                continue;

            Node current = node;
            for (int i = 0; i < MAX_PARENT_HOPS; i++)
            {
                current = parents.get (current);
                if (current == null)
                    break;
                if (AbletonTags.ON_CONTAINER.matcher (current.getName ()).matches ())
                {
                    ids.add (id);
                    break;
                }
            }
        }
        return ids;
    }


    /**
     * Check if the power button of a device is automated.
     *
     * @param device The device node
     * @param envelopeTargets The targets of the envelopes of the track which contain events
     * @return True if automated
     */
    public static boolean hasOnAutomation (final Node device, final Set<String> envelopeTargets)
    {
        if (envelopeTargets.isEmpty ())
            return false;
        for (final String id: getOnTargetIds (device))
        {
            if (envelopeTargets.contains (id))
                return true;
        }
        return false;
    }


    private static boolean isEnvelope (final String tag)
    {
        return tag.endsWith ("Envelope");
    }


    /**
     * An envelope which does not contain other envelopes.
     *
     * @param node The node to check
     * @return True if it is a single envelope
     */
    private static boolean isSingleEnvelope (final Node node)
    {
        if (!isEnvelope (node.getName ()))
            return false;
        for (final Node child: node.getChildNodes ())
        {
            if (child.findFirst (descendant -> isEnvelope (descendant.getName ())).isPresent ())
                return false;
        }
        return true;
    }


    /**
     * Get the target of an envelope. The pointee of the own envelope target is preferred.
     *
     * @param envelope The envelope
     * @return The pointee ID
     */
    private static Optional<String> getPointeeId (final Node envelope)
    {
        final Optional<String> target = envelope.getChildNode (AbletonTags.ENVELOPE_TARGET).flatMap (node -> node.getChildNode (AbletonTags.POINTEE_ID)).map (node -> node.getAttribute (AbletonTags.ATTR_VALUE)).filter (AutomationScanner::isDigits);
        if (target.isPresent ())
            return target;
        return envelope.findFirst (node -> AbletonTags.POINTEE_ID.equals (node.getName ()) && isDigits (node.getAttribute (AbletonTags.ATTR_VALUE))).map (node -> node.getAttribute (AbletonTags.ATTR_VALUE));
    }


    /**
     * An envelope has events if it contains an event node or a node with a numeric time.
     *
     * @param envelope The envelope node
     * @return True if there is at least one event
     */
    private static boolean hasEvents (final Node envelope)
    {
        return envelope.findFirst (node -> node.getName ().endsWith ("Event") || TextUtils.parseDouble (node.getAttribute (AbletonTags.ATTR_TIME)).isPresent ()).isPresent ();
    }


    private static boolean isDigits (final String value)
    {
        return value != null && DIGITS.matcher (value).matches ();
    }
}
