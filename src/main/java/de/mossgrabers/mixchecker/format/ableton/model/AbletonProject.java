// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton.model;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import java.io.InputStream;
import java.text.ParseException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;


/**
 * Support for parsing Ableton Live project documents.
 *
 * @author Jürgen Moßgraber
 */
public class AbletonProject
{
    private static final String LIVE_SET = "LiveSet";


    /**
     * Constructor.
     */
    private AbletonProject ()
    {
        // Intentionally empty
    }


    /**
     * Parses the XML of a Live set into a tree of nodes.
     *
     * @param in The stream with the (uncompressed) XML document
     * @return The root node of the document
     * @throws ParseException Error during parsing
     */
    public static Node parse (final InputStream in) throws ParseException
    {
        final XMLInputFactory factory = XMLInputFactory.newInstance ();
        factory.setProperty (XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty (XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);

        try
        {
            final XMLStreamReader reader = factory.createXMLStreamReader (in);
            try
            {
                return readNodes (reader);
            }
            finally
            {
                reader.close ();
            }
        }
        catch (final XMLStreamException ex)
        {
            final int offset = ex.getLocation () == null ? 0 : Math.max (0, ex.getLocation ().getCharacterOffset ());
            final ParseException parseException = new ParseException ("Unsound XML document: " + ex.getMessage (), offset);
            parseException.initCause (ex);
            throw parseException;
        }
    }


    /**
     * Get the LiveSet node. This is either the root itself or the first LiveSet node below it. If
     * there is none the root is used.
     *
     * @param root The root of the document
     * @return The LiveSet node
     */
    public static Node findLiveSetRoot (final Node root)
    {
        if (LIVE_SET.equals (root.getName ()))
            return root;
        final Optional<Node> liveSet = root.findFirst (LIVE_SET);
        return liveSet.isPresent () ? liveSet.get () : root;
    }


    private static Node readNodes (final XMLStreamReader reader) throws XMLStreamException, ParseException
    {
        final Deque<Node> stack = new ArrayDeque<> ();
        final Deque<StringBuilder> texts = new ArrayDeque<> ();
        Node root = null;
        while (reader.hasNext ())
        {
            switch (reader.next ())
            {
                case XMLStreamConstants.START_ELEMENT:
                    final Node node = new Node (reader.getLocalName ());
                    for (int i = 0; i < reader.getAttributeCount (); i++)
                        node.setAttribute (reader.getAttributeLocalName (i), reader.getAttributeValue (i));
                    if (stack.isEmpty ())
                        root = node;
                    else
                        stack.peek ().addChildNode (node);
                    stack.push (node);
                    texts.push (new StringBuilder ());
                    break;

                case XMLStreamConstants.CHARACTERS:
                case XMLStreamConstants.CDATA:
                    if (!texts.isEmpty ())
                        texts.peek ().append (reader.getText ());
                    break;

                case XMLStreamConstants.END_ELEMENT:
                    final Node finished = stack.pop ();
                    final String text = texts.pop ().toString ();
                    if (!text.isBlank ())
                        finished.setText (text);
                    break;

                default:
                    // Comments, processing instructions and whitespace are not needed
                    break;
            }
        }

        if (root == null)
            throw new ParseException ("No XML document. Root element not found.", 0);
        return root;
    }
}
