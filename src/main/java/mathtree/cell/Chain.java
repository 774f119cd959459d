// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import mathtree.util.annotation.Nullable;

/**
 * Operations on whole chains of nodes, identified by their first node.
 * <p>
 * Everything here walks the chain with a loop, never recursion over {@link Node#next()}.
 */
public final class Chain {
    private Chain() {
    }

    /**
     * Retrieves the last node of the content-order chain starting at {@code first}.
     */
    public static Node last(final Node first) {
        var node = first;
        for (var next = node.next(); next != null; next = node.next()) {
            node = next;
        }
        return node;
    }

    /**
     * Retrieves the last node of the draw-order chain starting at {@code first}.
     */
    public static Node lastToDraw(final Node first) {
        var node = first;
        for (var next = node.nextToDraw(); next != null; next = node.nextToDraw()) {
            node = next;
        }
        return node;
    }

    /**
     * Counts the nodes of the content-order chain starting at {@code first}.
     */
    public static int length(final @Nullable Node first) {
        int count = 0;
        for (var node = first; node != null; node = node.next()) {
            count += 1;
        }
        return count;
    }

    /**
     * Counts the nodes of the draw-order chain starting at {@code first}, fragments included.
     */
    public static int drawLength(final @Nullable Node first) {
        int count = 0;
        for (var node = first; node != null; node = node.nextToDraw()) {
            count += 1;
        }
        return count;
    }

    /**
     * Iterates over the content-order chain starting at {@code first}.
     */
    public static Iterable<Node> nodes(final @Nullable Node first) {
        return () -> new ContentIterator(first);
    }

    /**
     * Collects the content-order chain starting at {@code first} into a new list.
     */
    @CheckReturnValue
    public static List<Node> toList(final @Nullable Node first) {
        final var list = new ArrayList<Node>();
        for (final var node : nodes(first)) {
            list.add(node);
        }
        return list;
    }

    /**
     * Returns the string form of a whole chain. Nodes starting with a forced line break start a new line.
     */
    @CheckReturnValue
    public static String toString(final @Nullable Node first) {
        final var builder = new StringBuilder();
        for (var node = first; node != null; node = node.next()) {
            if (node != first && node.forceBreakLineHere()) {
                builder.append('\n');
            }
            builder.append(node);
        }
        return builder.toString();
    }

    /**
     * Checks whether a chain has to be parenthesized when embedded in a one-line string form.
     */
    static boolean isCompound(final @Nullable Node first) {
        return first != null && (first.next() != null || first instanceof CompositeNode);
    }

    /**
     * Runs a layout pass over every node of the chain starting at {@code first}.
     */
    public static void recalculate(final @Nullable Node first, final LayoutContext context, final int fontSize) {
        for (var node = first; node != null; node = node.next()) {
            node.recalculate(context, fontSize);
        }
    }

    /**
     * Sums the widths of the content-order chain starting at {@code first}; the width of a single-line chain.
     */
    public static int width(final @Nullable Node first) {
        int width = 0;
        for (var node = first; node != null; node = node.next()) {
            width += Math.max(0, node.width());
        }
        return width;
    }

    /**
     * Reverses every fragment split in the chain starting at {@code first}.
     */
    public static void unbreakAll(final @Nullable Node first) {
        for (var node = first; node != null; node = node.next()) {
            node.unbreak();
        }
    }

    /**
     * Records {@code group} as the group of every node of the chain starting at {@code first}.
     */
    public static void setGroup(final @Nullable Node first, final @Nullable GroupNode group) {
        for (var node = first; node != null; node = node.next()) {
            node.setGroup(group);
        }
    }

    private static final class ContentIterator implements Iterator<Node> {
        private ContentIterator(final @Nullable Node first) {
            current = first;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public Node next() {
            final var node = current;
            if (node == null) {
                throw new NoSuchElementException("End of chain reached");
            }
            current = node.next();
            return node;
        }

        private @Nullable Node current;
    }
}
