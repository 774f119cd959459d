// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

/**
 * The editable source of a group: input code, or the text of a heading or comment. May span several lines.
 */
public final class EditorNode extends Node {
    public EditorNode() {
        setKind(NodeKind.INPUT);
        setStyle(TextStyle.INPUT);
    }

    @Override
    public String value() {
        return value;
    }

    public void setValue(final String value) {
        this.value = value;
        resetSize();
    }

    @Override
    String format() {
        return value;
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        final var lines = value.split("\n", -1);
        final var lineHeight = context.lineHeight(style(), fontSize);
        int textWidth = 0;
        for (final var line : lines) {
            textWidth = Math.max(textWidth, context.textWidth(line, style(), fontSize));
        }
        final var padding = 2 * TextNode.TEXT_PADDING;
        setSize(textWidth + padding, lines.length * lineHeight + padding, lineHeight / 2 + TextNode.TEXT_PADDING);
    }

    private String value = "";
}
