// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.utils;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;


/**
 * Helper functions for input streams and byte arrays.
 *
 * @author Jürgen Moßgraber
 */
public class StreamHelper
{
    private static final int GZIP_MAGIC_1 = 0x1F;
    private static final int GZIP_MAGIC_2 = 0x8B;


    /**
     * Private due to helper class.
     */
    private StreamHelper ()
    {
        // Intentionally empty
    }


    /**
     * Checks if the file starts with the GZIP magic bytes.
     *
     * @param file The file to check
     * @return True if it is compressed
     * @throws IOException Could not read the file
     */
    public static boolean isGzip (final File file) throws IOException
    {
        try (final InputStream input = new FileInputStream (file))
        {
            final byte [] magic = input.readNBytes (2);
            return magic.length == 2 && (magic[0] & 0xFF) == GZIP_MAGIC_1 && (magic[1] & 0xFF) == GZIP_MAGIC_2;
        }
    }


    /**
     * Opens a file for reading. GZIP compressed files are decompressed on the fly.
     *
     * @param file The file to open
     * @return The stream to read from, the caller needs to close it
     * @throws IOException Could not open the file
     */
    public static InputStream openDecompressed (final File file) throws IOException
    {
        final InputStream input = new BufferedInputStream (new FileInputStream (file));
        if (!isGzip (file))
            return input;
        try
        {
            return new GZIPInputStream (input);
        }
        catch (final IOException ex)
        {
            input.close ();
            throw ex;
        }
    }


    /**
     * Searches for a byte sequence.
     *
     * @param data The data to search
     * @param pattern The bytes to find
     * @return True if the data contains the pattern
     */
    public static boolean contains (final byte [] data, final byte [] pattern)
    {
        if (pattern.length == 0)
            return true;
        for (int i = 0; i <= data.length - pattern.length; i++)
        {
            int j = 0;
            while (j < pattern.length && data[i + j] == pattern[j])
                j++;
            if (j == pattern.length)
                return true;
        }
        return false;
    }


    /**
     * Searches for an ASCII text in binary data.
     *
     * @param data The data to search
     * @param text The ASCII text to find
     * @return True if the data contains the text
     */
    public static boolean containsAscii (final byte [] data, final String text)
    {
        final byte [] pattern = new byte [text.length ()];
        for (int i = 0; i < text.length (); i++)
            pattern[i] = (byte) text.charAt (i);
        return contains (data, pattern);
    }
}
