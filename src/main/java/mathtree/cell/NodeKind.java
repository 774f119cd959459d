// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

/**
 * The presentation category of a node, which decides how a renderer treats it.
 */
public enum NodeKind {
    DEFAULT,
    MAIN_PROMPT,
    PROMPT,
    /**
     * An output label, such as {@code (%o1)}.
     */
    LABEL,
    /**
     * Input that is sent to the computer algebra system.
     */
    INPUT,
    ERROR,
    /**
     * Text that is never evaluated.
     */
    TEXT,
    SUBSECTION,
    SUBSUBSECTION,
    SECTION,
    TITLE,
    IMAGE,
    /**
     * An animation made of several frames.
     */
    SLIDE,
    GROUP;

    /**
     * Checks whether nodes of this kind hold commentary rather than math: text and headings.
     */
    public boolean isComment() {
        return switch (this) {
            case TEXT, SECTION, SUBSECTION, SUBSUBSECTION, TITLE -> true;
            default -> false;
        };
    }
}
