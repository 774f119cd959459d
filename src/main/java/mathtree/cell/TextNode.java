// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

/**
 * A leaf holding a run of text: a variable, number, label, string or operator.
 * <p>
 * The value is what the markup said. The displayed value can differ, for example when a long number is shown
 * elided; re-serialization always uses the value.
 */
public final class TextNode extends Node {
    /**
     * Initializes a text node with the default style.
     */
    public TextNode(final String value) {
        this(value, TextStyle.DEFAULT);
    }

    /**
     * Initializes a text node with the given style.
     */
    public TextNode(final String value, final TextStyle style) {
        this.value = value;
        displayedValue = value;
        setStyle(style);
    }

    @Override
    public String value() {
        return value;
    }

    /**
     * Replaces the value; the displayed value follows it.
     */
    public void setValue(final String value) {
        this.value = value;
        displayedValue = value;
        resetSize();
    }

    public String displayedValue() {
        return displayedValue;
    }

    public void setDisplayedValue(final String displayedValue) {
        this.displayedValue = displayedValue;
        resetSize();
    }

    @Override
    public void setExponentFlag() {
        isExponent = true;
    }

    public boolean isExponent() {
        return isExponent;
    }

    @Override
    String format() {
        return value;
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        final var lineHeight = context.lineHeight(style(), fontSize) + 2 * TEXT_PADDING;
        final var textWidth = isHidden() ? 0 : context.textWidth(displayedValue, style(), fontSize) + 2 * TEXT_PADDING;
        setSize(textWidth, lineHeight, lineHeight / 2);
    }

    static final int TEXT_PADDING = 1;

    private String value;
    private String displayedValue;
    private boolean isExponent = false;
}
