// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.utils;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;


class StreamHelperTest
{
    private static final String CONTENT = "<Ableton><LiveSet /></Ableton>";


    @Test
    void testPlainAndCompressedFiles (@TempDir final Path folder) throws IOException
    {
        final File plain = folder.resolve ("plain.xml").toFile ();
        Files.writeString (plain.toPath (), CONTENT, StandardCharsets.UTF_8);

        final File compressed = folder.resolve ("compressed.als").toFile ();
        try (final OutputStream out = new GZIPOutputStream (Files.newOutputStream (compressed.toPath ())))
        {
            out.write (CONTENT.getBytes (StandardCharsets.UTF_8));
        }

        assertThat (StreamHelper.isGzip (plain)).isFalse ();
        assertThat (StreamHelper.isGzip (compressed)).isTrue ();

        try (final InputStream in = StreamHelper.openDecompressed (plain))
        {
            assertThat (new String (in.readAllBytes (), StandardCharsets.UTF_8)).isEqualTo (CONTENT);
        }
        try (final InputStream in = StreamHelper.openDecompressed (compressed))
        {
            assertThat (new String (in.readAllBytes (), StandardCharsets.UTF_8)).isEqualTo (CONTENT);
        }
    }


    @Test
    void testContains ()
    {
        final byte [] data = "\u0000\u0001JUCEPrivateData\u0000".getBytes (StandardCharsets.ISO_8859_1);
        assertThat (StreamHelper.containsAscii (data, "JUCE")).isTrue ();
        assertThat (StreamHelper.containsAscii (data, "Data")).isTrue ();
        assertThat (StreamHelper.containsAscii (data, "Serum")).isFalse ();
        assertThat (StreamHelper.contains (data, new byte [0])).isTrue ();
        assertThat (StreamHelper.contains (new byte [2], new byte [3])).isFalse ();
    }
}
