// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.mixchecker.format.ableton.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;


/**
 * A node (XML element) in an Ableton project. Has a tag name, attributes, an optional text and
 * ordered child nodes.
 *
 * @author Jürgen Moßgraber
 */
public class Node
{
    private final String              name;
    private String                    text;
    private final Map<String, String> attributes = new LinkedHashMap<> ();
    private final List<Node>          childNodes = new ArrayList<> ();


    /**
     * Constructor.
     *
     * @param name The (tag) name of the node
     */
    public Node (final String name)
    {
        this.name = name;
    }


    /**
     * Get the name of the node.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Set the text content of the node.
     *
     * @param text The text
     */
    public void setText (final String text)
    {
        this.text = text;
    }


    /**
     * Get the text content of the node.
     *
     * @return The text, might be null
     */
    public String getText ()
    {
        return this.text;
    }


    /**
     * Set an attribute.
     *
     * @param key The name of the attribute
     * @param value The value
     */
    public void setAttribute (final String key, final String value)
    {
        this.attributes.put (key, value);
    }


    /**
     * Get the value of an attribute.
     *
     * @param key The name of the attribute
     * @return The value or null if not present
     */
    public String getAttribute (final String key)
    {
        return this.attributes.get (key);
    }


    /**
     * Get the value of the first of the given attributes which is present and not empty.
     *
     * @param keys The names of the attributes to check in order
     * @return The value or empty if none is present
     */
    public Optional<String> getFirstAttribute (final String... keys)
    {
        for (final String key: keys)
        {
            final String value = this.attributes.get (key);
            if (value != null && !value.isEmpty ())
                return Optional.of (value);
        }
        return Optional.empty ();
    }


    /**
     * Add a child node.
     *
     * @param node The node to add
     */
    public void addChildNode (final Node node)
    {
        this.childNodes.add (node);
    }


    /**
     * Get all child nodes.
     *
     * @return The child nodes
     */
    public List<Node> getChildNodes ()
    {
        return this.childNodes;
    }


    /**
     * Lookup a child node with a certain name.
     *
     * @param name The name of the node to look up
     * @return The first matching node or empty if not found
     */
    public Optional<Node> getChildNode (final String name)
    {
        for (final Node childNode: this.childNodes)
        {
            if (name.equals (childNode.getName ()))
                return Optional.of (childNode);
        }
        return Optional.empty ();
    }


    /**
     * Lookup all child nodes with a certain name.
     *
     * @param name The name of the nodes to look up
     * @return All matching nodes
     */
    public List<Node> getChildNodes (final String name)
    {
        final List<Node> results = new ArrayList<> ();
        for (final Node childNode: this.childNodes)
        {
            if (name.equals (childNode.getName ()))
                results.add (childNode);
        }
        return results;
    }


    /**
     * Find the first node in document order (this node included) which matches the predicate.
     *
     * @param predicate The predicate to test
     * @return The first matching node or empty if none matched
     */
    public Optional<Node> findFirst (final Predicate<Node> predicate)
    {
        final Deque<Node> stack = new ArrayDeque<> ();
        stack.push (this);
        while (!stack.isEmpty ())
        {
            final Node node = stack.pop ();
            if (predicate.test (node))
                return Optional.of (node);
            final List<Node> children = node.childNodes;
            for (int i = children.size () - 1; i >= 0; i--)
                stack.push (children.get (i));
        }
        return Optional.empty ();
    }


    /**
     * Find the first node in document order (this node included) with the given name.
     *
     * @param name The name of the node
     * @return The first matching node or empty if none matched
     */
    public Optional<Node> findFirst (final String name)
    {
        return this.findFirst (node -> name.equals (node.getName ()));
    }


    /**
     * Get this node and all descendants in document order.
     *
     * @return The nodes
     */
    public List<Node> iterate ()
    {
        final List<Node> result = new ArrayList<> ();
        final Deque<Node> stack = new ArrayDeque<> ();
        stack.push (this);
        while (!stack.isEmpty ())
        {
            final Node node = stack.pop ();
            result.add (node);
            final List<Node> children = node.childNodes;
            for (int i = children.size () - 1; i >= 0; i--)
                stack.push (children.get (i));
        }
        return result;
    }


    /**
     * Get this node and all descendants up to the given depth in breadth-first order.
     *
     * @param maxDepth The maximum depth, 0 returns only this node
     * @return The nodes with their depth
     */
    public List<DepthNode> iterateBreadthFirst (final int maxDepth)
    {
        final List<DepthNode> result = new ArrayList<> ();
        final Deque<DepthNode> queue = new ArrayDeque<> ();
        queue.add (new DepthNode (this, 0));
        while (!queue.isEmpty ())
        {
            final DepthNode entry = queue.poll ();
            result.add (entry);
            if (entry.getDepth () >= maxDepth)
                continue;
            for (final Node child: entry.getNode ().childNodes)
                queue.add (new DepthNode (child, entry.getDepth () + 1));
        }
        return result;
    }


    /**
     * Find a node by a simple path expression. The steps are separated by slashes and each step
     * matches a child. If the path starts with <code>.//</code> the first step may match any
     * descendant.
     *
     * @param path The path, e.g. <code>DeviceChain/Mixer</code> or <code>.//SideChain/OnOff</code>
     * @return The first node in document order which matches the path
     */
    public Optional<Node> find (final String path)
    {
        final boolean anyDescendant = path.startsWith (".//");
        String relativePath = anyDescendant ? path.substring (3) : path;
        if (relativePath.startsWith ("./"))
            relativePath = relativePath.substring (2);
        final String [] steps = relativePath.split ("/");

        final List<Node> starts;
        if (anyDescendant)
        {
            starts = this.iterate ();
            starts.remove (0);
        }
        else
            starts = this.childNodes;

        for (final Node start: starts)
        {
            if (!steps[0].equals (start.getName ()))
                continue;
            final Optional<Node> result = findChildPath (start, steps, 1);
            if (result.isPresent ())
                return result;
        }
        return Optional.empty ();
    }


    private static Optional<Node> findChildPath (final Node node, final String [] steps, final int index)
    {
        if (index >= steps.length)
            return Optional.of (node);
        for (final Node child: node.childNodes)
        {
            if (!steps[index].equals (child.getName ()))
                continue;
            final Optional<Node> result = findChildPath (child, steps, index + 1);
            if (result.isPresent ())
                return result;
        }
        return Optional.empty ();
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return "<" + this.name + " " + this.attributes + ">";
    }


    /**
     * A node together with its distance from the node where the traversal started.
     */
    public static final class DepthNode
    {
        private final Node node;
        private final int  depth;


        /**
         * Constructor.
         *
         * @param node The node
         * @param depth The number of hops from the start
         */
        public DepthNode (final Node node, final int depth)
        {
            this.node = node;
            this.depth = depth;
        }


        /**
         * Get the node.
         *
         * @return The node
         */
        public Node getNode ()
        {
            return this.node;
        }


        /**
         * Get the number of hops from the start of the traversal.
         *
         * @return The depth
         */
        public int getDepth ()
        {
            return this.depth;
        }
    }
}
