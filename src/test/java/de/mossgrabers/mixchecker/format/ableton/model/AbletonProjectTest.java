// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;


class AbletonProjectTest
{
    private static Node parse (final String xml) throws ParseException
    {
        final InputStream in = new ByteArrayInputStream (xml.getBytes (StandardCharsets.UTF_8));
        return AbletonProject.parse (in);
    }


    @Test
    void testParse () throws ParseException
    {
        final Node root = parse ("<Ableton Creator=\"Ableton Live 11\"><LiveSet><Tracks><AudioTrack Id=\"7\"><State>  0A0B  </State></AudioTrack></Tracks></LiveSet></Ableton>");
        assertThat (root.getName ()).isEqualTo ("Ableton");
        assertThat (root.getAttribute ("Creator")).isEqualTo ("Ableton Live 11");

        final Node liveSet = AbletonProject.findLiveSetRoot (root);
        assertThat (liveSet.getName ()).isEqualTo ("LiveSet");
        assertThat (AbletonProject.findLiveSetRoot (liveSet)).isSameAs (liveSet);

        final Node track = liveSet.find ("Tracks/AudioTrack").orElseThrow ();
        assertThat (track.getAttribute ("Id")).isEqualTo ("7");
        assertThat (track.getChildNode ("State").orElseThrow ().getText ()).isEqualTo ("  0A0B  ");
        assertThat (liveSet.find (".//State")).isPresent ();
        assertThat (liveSet.find ("State")).isEmpty ();
    }


    @Test
    void testMissingLiveSet () throws ParseException
    {
        final Node root = parse ("<Project><Tracks /></Project>");
        assertThat (AbletonProject.findLiveSetRoot (root)).isSameAs (root);
    }


    @Test
    void testBrokenDocument ()
    {
        assertThatThrownBy ( () -> parse ("<Ableton><LiveSet></Ableton>")).isInstanceOf (ParseException.class);
        assertThatThrownBy ( () -> parse ("")).isInstanceOf (ParseException.class);
    }
}
