// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.markup;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import mathtree.util.Trace;
import mathtree.util.annotation.Nullable;
import mathtree.util.condition.ConditionContext;
import mathtree.util.condition.exception.ParserConfigurationExceptionCondition;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Turns markup text into {@link MarkupNode} trees using the JDK's DOM parser.
 */
public final class MarkupReader {
    private MarkupReader() {
    }

    /**
     * Reads the given markup text and returns its root element.
     * <p>
     * Text nodes consisting only of whitespace are dropped, so indentation between elements never turns into
     * content.
     * <p>
     * If the text is not well-formed, a non-fatal {@link MarkupReadErrorCondition} is signaled and {@code null} is
     * returned. If the JDK's parser cannot be configured, a fatal {@link ParserConfigurationExceptionCondition} is
     * signaled.
     */
    public static MarkupNode.@Nullable Element read(final String markup) {
        try (final var trace = new Trace("Reading markup text")) {
            trace.use();
            final var builder = newDocumentBuilder();
            final org.w3c.dom.Document document;
            try {
                document = builder.parse(new InputSource(new StringReader(markup)));
            } catch (final SAXException | IOException e) {
                ConditionContext.signal(new MarkupReadErrorCondition("Malformed markup: " + e.getMessage()));
                return null;
            }
            final var root = document.getDocumentElement();
            return (root == null) ? null : convertElement(root);
        }
    }

    // Iterative: markup may nest deeper than the call stack allows.
    private static MarkupNode.Element convertElement(final org.w3c.dom.Element root) {
        final var pending = new ArrayDeque<PendingElement>();
        pending.push(new PendingElement(root));
        while (true) {
            final var current = pending.element();
            final var child = current.nextChild();
            if (child == null) {
                pending.pop();
                final var converted = current.convert();
                final var parent = pending.peek();
                if (parent == null) {
                    return converted;
                }
                parent.children.add(converted);
                continue;
            }
            switch (child.getNodeType()) {
                case Node.ELEMENT_NODE -> pending.push(new PendingElement((org.w3c.dom.Element) child));
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> {
                    final var text = child.getNodeValue();
                    if (!text.isBlank()) {
                        current.children.add(new MarkupNode.Text(text));
                    }
                }
                default -> {
                    // Comments and processing instructions carry nothing to render.
                }
            }
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        final var factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setCoalescing(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            final var builder = factory.newDocumentBuilder();
            // The default handler prints fatal errors to stderr before throwing; the condition carries them instead.
            builder.setErrorHandler(new DefaultHandler());
            return builder;
        } catch (final ParserConfigurationException e) {
            throw ConditionContext.error(new ParserConfigurationExceptionCondition(e));
        }
    }

    private static final class PendingElement {
        private PendingElement(final org.w3c.dom.Element element) {
            this.element = element;
            nextChild = element.getFirstChild();
        }

        private @Nullable Node nextChild() {
            final var child = nextChild;
            if (child != null) {
                nextChild = child.getNextSibling();
            }
            return child;
        }

        private MarkupNode.Element convert() {
            final var attributes = new LinkedHashMap<String, String>();
            final var attributeNodes = element.getAttributes();
            for (int i = 0; i < attributeNodes.getLength(); i += 1) {
                final var attribute = attributeNodes.item(i);
                attributes.put(attribute.getNodeName(), attribute.getNodeValue());
            }
            return new MarkupNode.Element(element.getTagName(), attributes, children);
        }

        private final org.w3c.dom.Element element;
        private final ArrayList<MarkupNode> children = new ArrayList<>();
        private @Nullable Node nextChild;
    }
}
