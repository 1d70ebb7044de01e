// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.plugin;

import de.mossgrabers.mixchecker.INotifier;
import de.mossgrabers.mixchecker.format.ableton.model.Node;
import de.mossgrabers.mixchecker.format.json.JsonHelper;
import de.mossgrabers.mixchecker.model.PluginState;
import de.mossgrabers.mixchecker.utils.StreamHelper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * Extracts metadata from the opaque state of third party plug-ins: a fingerprint, the role of the
 * plug-in, vendor hints and (if requested) the content of embedded JSON documents. The state
 * itself is never interpreted.
 *
 * @author Jürgen Moßgraber
 */
public class PluginStateInspector
{
    private static final String []    STATE_TAGS          =
    {
        "ProcessorState",
        "PluginState",
        "State",
        "Chunk",
        "VstState",
        "AUState"
    };

    private static final Pattern      NON_HEX             = Pattern.compile ("[^0-9a-fA-F]+");
    private static final Pattern      UTF16_RUN           = Pattern.compile ("[\\w\\s\\-.:/#]{6,}");
    private static final int          MIN_HEX_LENGTH      = 32;
    private static final int          MAX_HINTS           = 40;
    private static final int          MAX_HINT_LENGTH     = 96;
    private static final int          MIN_ASCII_RUN       = 4;
    private static final int          MAX_HINT_TAGS       = 6;
    private static final int          MAX_TEXT_LENGTH     = 400000;
    private static final int          MAX_JSON_LENGTH     = 200000;
    private static final int          MAX_JSON_PROPERTIES = 40;
    private static final int          MAX_JSON_KEYS       = 60;
    private static final String       XFER_MARKER         = "XferJson";
    private static final List<String> XFER_KEYS           = List.of ("product", "productVersion", "vendor", "hash", "preset", "presetName", "name", "version");
    private static final List<String> DECODABLE_PLUGINS   = List.of ("infiltrator", "xferjson", "serum");

    private final INotifier           notifier;
    private final ObjectMapper        mapper              = new ObjectMapper ();


    /**
     * Constructor.
     *
     * @param notifier Where to report states which cannot be decoded
     */
    public PluginStateInspector (final INotifier notifier)
    {
        this.notifier = notifier;
    }


    /**
     * Inspect the state of a plug-in device.
     *
     * @param device The device node
     * @param identifier The identifier of the plug-in, might be null
     * @param detailed If true, readable strings are extracted and embedded JSON is decoded for
     *            plug-ins which are known to store it
     * @return The metadata, empty if the device has no state
     */
    public Optional<PluginState> inspect (final Node device, final String identifier, final boolean detailed)
    {
        final Optional<byte []> stateBytes = extractStateBytes (device);
        if (stateBytes.isEmpty () || stateBytes.get ().length == 0)
            return Optional.empty ();

        final byte [] state = stateBytes.get ();
        final String sha = JsonHelper.hash ("SHA-256", state).substring (0, 16);
        final String role = getRole (identifier).orElse (null);
        final List<String> hintTags = getHintTags (state);
        final List<String> hints = detailed ? extractHints (state) : new ArrayList<> ();
        ObjectNode decoded = null;
        if (detailed && isDecodable (identifier))
            decoded = this.decode (identifier, state).orElse (null);
        return Optional.of (new PluginState (state.length, sha, role, hintTags, hints, decoded));
    }


    /**
     * Get the opaque state of a plug-in. It is usually stored as hex encoded binary. If it is not
     * hex the text itself is the state.
     *
     * @param device The device node
     * @return The state
     */
    public static Optional<byte []> extractStateBytes (final Node device)
    {
        for (final String tag: STATE_TAGS)
        {
            final Optional<Node> stateNode = device.find (".//" + tag);
            if (stateNode.isEmpty ())
                continue;
            final String text = stateNode.get ().getText () == null ? "" : stateNode.get ().getText ().strip ();
            if (text.isEmpty ())
                continue;

            final String cleaned = NON_HEX.matcher (text).replaceAll ("");
            if (cleaned.length () >= MIN_HEX_LENGTH && cleaned.length () % 2 == 0)
                return Optional.of (HexFormat.of ().parseHex (cleaned));
            return Optional.of (text.getBytes (StandardCharsets.UTF_8));
        }
        return Optional.empty ();
    }


    /**
     * Guess the role of a plug-in from its identifier.
     *
     * @param identifier The identifier, might be null
     * @return The role, e.g. "limiter"
     */
    public static Optional<String> getRole (final String identifier)
    {
        if (identifier == null)
            return Optional.empty ();
        final String low = identifier.toLowerCase (Locale.ROOT);
        if (low.contains ("limiter"))
            return Optional.of ("limiter");
        if (low.contains ("clip"))
            return Optional.of ("clipper");
        if (low.contains ("comp"))
            return Optional.of ("compressor");
        if (low.contains ("transient"))
            return Optional.of ("transient_shaper");
        if (low.contains ("exciter"))
            return Optional.of ("exciter");
        if (low.contains ("satur") || low.contains ("distort") || low.contains ("drive"))
            return Optional.of ("saturator");
        if (low.contains ("eq"))
            return Optional.of ("eq");
        if (low.contains ("reverb"))
            return Optional.of ("reverb");
        if (low.contains ("delay") || low.contains ("echo"))
            return Optional.of ("delay");
        return Optional.empty ();
    }


    /**
     * Get a small set of vendor and technology tags found in the state.
     *
     * @param state The state
     * @return At most 6 tags
     */
    public static List<String> getHintTags (final byte [] state)
    {
        final List<String> tags = new ArrayList<> ();
        if (containsAny (state, "FFBS", "FFPB", "FFpr", "FFQ", "FabFilter"))
            tags.add ("fabfilter");
        if (containsAny (state, "JUCE", "juce"))
            tags.add ("juce");
        if (containsAny (state, "iZotope", "izotope", "Ozone", "Neutron"))
            tags.add ("izotope");
        if (containsAny (state, "KClip", "kazrog", "Kazrog"))
            tags.add ("kazrog");
        if (containsAny (state, "Xfer", "Serum"))
            tags.add ("xfer");
        if (containsAny (state, "Infiltrator", "devious", "Devious"))
            tags.add ("devious");
        if (containsAny (state, "VST3", "VST2", "VST "))
            tags.add ("vst");
        if (StreamHelper.containsAscii (state, "AudioUnit"))
            tags.add ("au");
        return tags.size () > MAX_HINT_TAGS ? new ArrayList<> (tags.subList (0, MAX_HINT_TAGS)) : tags;
    }


    /**
     * Extract readable strings from the state. Runs of printable ASCII characters are collected
     * first, then runs found in the UTF-16LE decoding.
     *
     * @param state The state
     * @return At most 40 distinct strings, each cut to 96 characters
     */
    public static List<String> extractHints (final byte [] state)
    {
        final Set<String> hints = new LinkedHashSet<> ();

        int start = -1;
        for (int i = 0; i <= state.length; i++)
        {
            final boolean printable = i < state.length && state[i] >= 0x20 && state[i] <= 0x7E;
            if (printable)
            {
                if (start < 0)
                    start = i;
                continue;
            }
            if (start >= 0 && i - start >= MIN_ASCII_RUN)
            {
                final String run = new String (state, start, i - start, StandardCharsets.US_ASCII).strip ();
                if (!run.isEmpty ())
                    hints.add (shorten (run));
                if (hints.size () >= MAX_HINTS)
                    return new ArrayList<> (hints);
            }
            start = -1;
        }

        final Matcher matcher = UTF16_RUN.matcher (new String (state, StandardCharsets.UTF_16LE));
        while (matcher.find () && hints.size () < MAX_HINTS)
        {
            final String run = matcher.group ().strip ();
            if (!run.isEmpty () && run.chars ().anyMatch (Character::isLetter))
                hints.add (shorten (run));
        }
        return new ArrayList<> (hints);
    }


    /**
     * Decode an embedded JSON document. Xfer plug-ins store it after a marker, otherwise the
     * first JSON object in the state is used.
     *
     * @param identifier The identifier of the plug-in, might be null
     * @param state The state
     * @return The decoded subset, empty if nothing could be decoded
     */
    public Optional<ObjectNode> decode (final String identifier, final byte [] state)
    {
        final ObjectNode result = JsonHelper.FACTORY.objectNode ();
        getRole (identifier).ifPresent (role -> result.put ("role", role));

        String text = new String (state, StandardCharsets.UTF_8);
        if (text.length () > MAX_TEXT_LENGTH)
            text = text.substring (0, MAX_TEXT_LENGTH);

        final int markerPos = text.indexOf (XFER_MARKER);
        if (markerPos >= 0)
        {
            final Optional<ObjectNode> json = this.parseJsonObject (identifier, findBalancedJson (text, markerPos).orElse (null));
            if (json.isPresent ())
            {
                final ObjectNode subset = result.putObject ("json");
                for (final String key: XFER_KEYS)
                {
                    if (json.get ().has (key))
                        subset.set (key, json.get ().get (key));
                }
                result.set ("json_keys", getSortedKeys (json.get ()));
            }
        }

        if (!result.has ("json"))
        {
            final Optional<ObjectNode> json = this.parseJsonObject (identifier, findBalancedJson (text, 0).orElse (null));
            if (json.isPresent ())
            {
                final ObjectNode subset = result.putObject ("json");
                final Iterator<String> names = json.get ().fieldNames ();
                for (int i = 0; i < MAX_JSON_PROPERTIES && names.hasNext (); i++)
                {
                    final String name = names.next ();
                    subset.set (name, json.get ().get (name));
                }
                result.set ("json_keys", getSortedKeys (json.get ()));
            }
        }

        return result.isEmpty () ? Optional.empty () : Optional.of (result);
    }


    /**
     * Find a JSON object which starts at or after the given position by balancing the braces.
     * Braces in strings are ignored.
     *
     * @param text The text to search
     * @param start The position to start from
     * @return The JSON text, empty if there is no balanced object within the size limit
     */
    public static Optional<String> findBalancedJson (final String text, final int start)
    {
        final int begin = text.indexOf ('{', start);
        if (begin < 0)
            return Optional.empty ();

        final int end = Math.min (text.length (), begin + MAX_JSON_LENGTH);
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = begin; i < end; i++)
        {
            final char ch = text.charAt (i);
            if (inString)
            {
                if (escaped)
                    escaped = false;
                else if (ch == '\\')
                    escaped = true;
                else if (ch == '"')
                    inString = false;
                continue;
            }

            if (ch == '"')
                inString = true;
            else if (ch == '{')
                depth++;
            else if (ch == '}')
            {
                depth--;
                if (depth == 0)
                    return Optional.of (text.substring (begin, i + 1));
            }
        }
        return Optional.empty ();
    }


    private Optional<ObjectNode> parseJsonObject (final String identifier, final String json)
    {
        if (json == null)
            return Optional.empty ();
        try
        {
            final JsonNode node = this.mapper.readTree (json);
            return node instanceof final ObjectNode objectNode ? Optional.of (objectNode) : Optional.empty ();
        }
        catch (final JsonProcessingException ex)
        {
            this.notifier.logError ("IDS_NOTIFY_COULD_NOT_DECODE_PLUGIN_STATE", identifier, ex.getOriginalMessage ());
            return Optional.empty ();
        }
    }


    private static ArrayNode getSortedKeys (final ObjectNode json)
    {
        final Set<String> sorted = new TreeSet<> ();
        json.fieldNames ().forEachRemaining (sorted::add);
        final ArrayNode keys = JsonHelper.FACTORY.arrayNode ();
        for (final String key: sorted)
        {
            if (keys.size () >= MAX_JSON_KEYS)
                break;
            keys.add (key);
        }
        return keys;
    }


    private static boolean isDecodable (final String identifier)
    {
        if (identifier == null)
            return false;
        final String low = identifier.toLowerCase (Locale.ROOT);
        for (final String plugin: DECODABLE_PLUGINS)
        {
            if (low.contains (plugin))
                return true;
        }
        return false;
    }


    private static boolean containsAny (final byte [] state, final String... texts)
    {
        for (final String text: texts)
        {
            if (StreamHelper.containsAscii (state, text))
                return true;
        }
        return false;
    }


    private static String shorten (final String text)
    {
        return text.length () > MAX_HINT_LENGTH ? text.substring (0, MAX_HINT_LENGTH) + "…" : text;
    }
}
