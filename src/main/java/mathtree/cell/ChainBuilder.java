// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import mathtree.util.annotation.Nullable;

/**
 * Builds a content-order chain by appending nodes at a cached tail, linking the draw order alongside.
 */
public final class ChainBuilder {
    /**
     * Initializes a builder for a chain outside of any group.
     */
    public ChainBuilder() {
        this(null);
    }

    /**
     * Initializes a builder whose nodes are all recorded as belonging to {@code group}.
     */
    public ChainBuilder(final @Nullable GroupNode group) {
        this.group = group;
    }

    /**
     * Appends the given node, together with whatever already follows it. {@code null} is ignored.
     */
    public ChainBuilder append(final @Nullable Node node) {
        if (node == null) {
            return this;
        }
        if (tail == null) {
            head = node;
        } else {
            tail.linkNext(node);
        }
        var last = node;
        while (true) {
            if (group != null) {
                last.setGroup(group);
            }
            final var next = last.next();
            if (next == null) {
                break;
            }
            last = next;
        }
        tail = last;
        return this;
    }

    /**
     * Returns the first node of the chain built so far, or {@code null} if nothing was appended.
     */
    public @Nullable Node build() {
        return head;
    }

    private final @Nullable GroupNode group;
    private @Nullable Node head = null;
    private @Nullable Node tail = null;
}
