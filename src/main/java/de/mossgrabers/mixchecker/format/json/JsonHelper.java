// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;


/**
 * Helper functions for building and normalizing the JSON trees of the reports.
 *
 * @author Jürgen Moßgraber
 */
public class JsonHelper
{
    /** The factory for all JSON nodes. */
    public static final JsonNodeFactory FACTORY        = JsonNodeFactory.instance;

    private static final ObjectMapper   COMPACT_MAPPER = new ObjectMapper ();


    /**
     * Private due to helper class.
     */
    private JsonHelper ()
    {
        // Intentionally empty
    }


    /**
     * Create a mapper for writing the reports.
     *
     * @param minify Write everything into one line if true, otherwise indent
     * @return The mapper
     */
    public static ObjectMapper createMapper (final boolean minify)
    {
        final ObjectMapper mapper = new ObjectMapper ();
        if (!minify)
            mapper.enable (SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }


    /**
     * Converts a scalar (as created by the scalar normalization) into a JSON node.
     *
     * @param value A Long, Double, Boolean or String, might be null
     * @return The JSON node
     */
    public static JsonNode toNode (final Object value)
    {
        if (value == null)
            return FACTORY.nullNode ();
        if (value instanceof final Long longValue)
            return FACTORY.numberNode (longValue);
        if (value instanceof final Double doubleValue)
            return FACTORY.numberNode (doubleValue);
        if (value instanceof final Boolean booleanValue)
            return FACTORY.booleanNode (booleanValue.booleanValue ());
        return FACTORY.textNode (value.toString ());
    }


    /**
     * Creates a copy of the node without all object properties which have a null value. Empty
     * objects and arrays are kept.
     *
     * @param node The node
     * @return The copy
     */
    public static JsonNode stripNullKeys (final JsonNode node)
    {
        if (node.isObject ())
        {
            final ObjectNode result = FACTORY.objectNode ();
            final Iterator<Map.Entry<String, JsonNode>> fields = node.fields ();
            while (fields.hasNext ())
            {
                final Map.Entry<String, JsonNode> field = fields.next ();
                if (!field.getValue ().isNull ())
                    result.set (field.getKey (), stripNullKeys (field.getValue ()));
            }
            return result;
        }
        if (node.isArray ())
        {
            final ArrayNode result = FACTORY.arrayNode ();
            for (final JsonNode element: node)
                result.add (stripNullKeys (element));
            return result;
        }
        return node;
    }


    /**
     * Creates the canonical text of a JSON node: object properties are sorted and there is no
     * white space.
     *
     * @param node The node
     * @return The canonical text
     */
    public static String toCanonicalJson (final JsonNode node)
    {
        try
        {
            return COMPACT_MAPPER.writeValueAsString (sortProperties (node));
        }
        catch (final JsonProcessingException ex)
        {
            // A tree which only consists of JSON nodes can always be written
            throw new IllegalStateException (ex);
        }
    }


    /**
     * Calculates a stable hash of a JSON node which does not depend on the order of the object
     * properties.
     *
     * @param node The node
     * @return The first 12 hex characters of the SHA-1 of the canonical text
     */
    public static String hash12 (final JsonNode node)
    {
        return hash ("SHA-1", toCanonicalJson (node).getBytes (StandardCharsets.UTF_8)).substring (0, 12);
    }


    /**
     * Calculates a hash.
     *
     * @param algorithm The name of the algorithm, e.g. "SHA-256"
     * @param data The data to hash
     * @return The hash as lower case hex characters
     */
    public static String hash (final String algorithm, final byte [] data)
    {
        try
        {
            return HexFormat.of ().formatHex (MessageDigest.getInstance (algorithm).digest (data));
        }
        catch (final NoSuchAlgorithmException ex)
        {
            // SHA-1 and SHA-256 are available on every Java platform
            throw new IllegalStateException (ex);
        }
    }


    private static JsonNode sortProperties (final JsonNode node)
    {
        if (node.isObject ())
        {
            final Map<String, JsonNode> sorted = new TreeMap<> ();
            final Iterator<Map.Entry<String, JsonNode>> fields = node.fields ();
            while (fields.hasNext ())
            {
                final Map.Entry<String, JsonNode> field = fields.next ();
                sorted.put (field.getKey (), sortProperties (field.getValue ()));
            }
            final ObjectNode result = FACTORY.objectNode ();
            result.setAll (sorted);
            return result;
        }
        if (node.isArray ())
        {
            final ArrayNode result = FACTORY.arrayNode ();
            for (final JsonNode element: node)
                result.add (sortProperties (element));
            return result;
        }
        return node;
    }
}
