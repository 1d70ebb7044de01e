// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.utils;

import de.mossgrabers.mixchecker.model.TriState;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;


/**
 * Helper functions for normalizing the loosely typed text values of a project file.
 *
 * @author Jürgen Moßgraber
 */
public class TextUtils
{
    private static final Set<String> BOOLEAN_LITERALS = Set.of ("true", "false", "0", "1", "yes", "no");
    private static final Pattern     INTEGER_PATTERN  = Pattern.compile ("-?\\d+");
    private static final Pattern     DECIMAL_PATTERN  = Pattern.compile ("-?\\d+(?:\\.\\d+)?(?:[eE]-?\\d+)?");
    private static final Pattern     FLOAT_PATTERN    = Pattern.compile ("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");


    /**
     * Private due to helper class.
     */
    private TextUtils ()
    {
        // Intentionally empty
    }


    /**
     * Trims the text.
     *
     * @param text The text, might be null
     * @return The trimmed text or null if the text is null or blank
     */
    public static String normalize (final String text)
    {
        if (text == null)
            return null;
        final String trimmed = text.strip ();
        return trimmed.isEmpty () ? null : trimmed;
    }


    /**
     * Checks if the text is one of the boolean literals (true, false, 0, 1, yes, no).
     *
     * @param text The text to check, might be null
     * @return True if it is a boolean literal
     */
    public static boolean isBooleanLiteral (final String text)
    {
        return text != null && BOOLEAN_LITERALS.contains (text.strip ().toLowerCase (Locale.ROOT));
    }


    /**
     * Normalizes the text and rejects boolean literals. Use this for everything which is used as
     * a name or an identity.
     *
     * @param text The text, might be null
     * @return The normalized text, empty if blank or a boolean literal
     */
    public static Optional<String> normalizeNonBoolean (final String text)
    {
        final String normalized = normalize (text);
        if (normalized == null || isBooleanLiteral (normalized))
            return Optional.empty ();
        return Optional.of (normalized);
    }


    /**
     * Parses a boolean flag. Accepts true/false, yes/no and 1/0.
     *
     * @param text The text to parse, might be null
     * @return The parsed state, unknown if it is not a boolean
     */
    public static TriState parseBoolean (final String text)
    {
        if (text == null)
            return TriState.UNKNOWN;
        switch (text.strip ().toLowerCase (Locale.ROOT))
        {
            case "true":
            case "1":
            case "yes":
                return TriState.TRUE;
            case "false":
            case "0":
            case "no":
                return TriState.FALSE;
            default:
                return TriState.UNKNOWN;
        }
    }


    /**
     * Parses a floating point number. Accepts the usual decimal notation and the infinity and
     * not-a-number tokens.
     *
     * @param text The text to parse, might be null
     * @return The value or empty if the text is not a number
     */
    public static OptionalDouble parseDouble (final String text)
    {
        if (text == null)
            return OptionalDouble.empty ();
        final String value = text.strip ();
        if (FLOAT_PATTERN.matcher (value).matches ())
            return OptionalDouble.of (Double.parseDouble (value));

        switch (value.toLowerCase (Locale.ROOT))
        {
            case "inf":
            case "+inf":
            case "infinity":
            case "+infinity":
                return OptionalDouble.of (Double.POSITIVE_INFINITY);
            case "-inf":
            case "-infinity":
                return OptionalDouble.of (Double.NEGATIVE_INFINITY);
            case "nan":
                return OptionalDouble.of (Double.NaN);
            default:
                return OptionalDouble.empty ();
        }
    }


    /**
     * Converts a text value into an integer, a double, a boolean or keeps it as text. The bare
     * values 0 and 1 are treated as numbers since many device parameters use 0/1 numeric
     * encodings. Only the textual tokens true/false/yes/no become booleans.
     *
     * @param text The text to convert, might be null
     * @return The converted value or null if the text is blank
     */
    public static Object normalizeScalar (final String text)
    {
        final String value = normalize (text);
        if (value == null)
            return null;

        if (INTEGER_PATTERN.matcher (value).matches ())
        {
            try
            {
                return Long.valueOf (value);
            }
            catch (final NumberFormatException ex)
            {
                // Too large for a long, continue as a decimal
            }
        }

        if (DECIMAL_PATTERN.matcher (value).matches ())
            return Double.valueOf (value);

        switch (value.toLowerCase (Locale.ROOT))
        {
            case "true":
            case "yes":
                return Boolean.TRUE;
            case "false":
            case "no":
                return Boolean.FALSE;
            default:
                return value;
        }
    }
}
