// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.markup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import mathtree.util.annotation.Nullable;

/**
 * The base interface for markup tree nodes.
 * <p>
 * Markup tree nodes are immutable. Only text and element nodes exist: comments and processing instructions are
 * dropped by {@link MarkupReader}.
 */
public sealed interface MarkupNode {
    /**
     * Returns a new element with the given name, no attributes, and the given children.
     */
    static Element element(final String name, final MarkupNode... children) {
        return new Element(name, Map.of(), List.of(children));
    }

    /**
     * Returns a new element with the given name, attributes and children.
     */
    static Element element(final String name, final Map<String, String> attributes, final MarkupNode... children) {
        return new Element(name, attributes, List.of(children));
    }

    /**
     * Returns a new text node.
     */
    static Text text(final String text) {
        return new Text(text);
    }

    /**
     * Markup node representing character data.
     */
    record Text(String text) implements MarkupNode {
    }

    /**
     * Markup node representing an element, with attributes in document order and children.
     */
    record Element(String name, Map<String, String> attributes, List<MarkupNode> children) implements MarkupNode {
        /**
         * Initializes an element, taking defensive copies of the attribute map and child list.
         */
        public Element {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            children = List.copyOf(children);
        }

        /**
         * Retrieves the value of the named attribute, or {@code null} if absent.
         */
        public @Nullable String attribute(final String attributeName) {
            return attributes.get(attributeName);
        }

        /**
         * Retrieves the value of the named attribute, or {@code defaultValue} if absent.
         */
        public String attribute(final String attributeName, final String defaultValue) {
            return attributes.getOrDefault(attributeName, defaultValue);
        }

        /**
         * Checks whether any child is an element, as opposed to only text.
         */
        public boolean hasElementChildren() {
            for (final var child : children) {
                if (child instanceof Element) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Returns the concatenated text of the direct text children.
         */
        public String content() {
            final var builder = new StringBuilder();
            for (final var child : children) {
                if (child instanceof Text text) {
                    builder.append(text.text());
                }
            }
            return builder.toString();
        }
    }
}
