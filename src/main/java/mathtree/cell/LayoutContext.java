// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

/**
 * The font metrics a layout pass measures text with.
 * <p>
 * Implemented by whatever renders the tree; the tree itself never draws.
 */
public interface LayoutContext {
    /**
     * Measures the advance width of the given text.
     */
    int textWidth(String text, TextStyle style, int fontSize);

    /**
     * Measures the height of one line of text.
     */
    int lineHeight(TextStyle style, int fontSize);
}
