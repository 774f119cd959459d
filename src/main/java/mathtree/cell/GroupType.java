// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import mathtree.util.annotation.Nullable;

/**
 * The kinds of worksheet groups.
 * <p>
 * Headings carry a sectioning rank: folding a heading hides every following group up to the next heading of the
 * same or a higher rank.
 */
public enum GroupType {
    CODE(Integer.MAX_VALUE, NodeKind.INPUT, TextStyle.INPUT),
    IMAGE(Integer.MAX_VALUE, NodeKind.TEXT, TextStyle.TEXT),
    PAGEBREAK(Integer.MAX_VALUE, null, TextStyle.DEFAULT),
    TEXT(Integer.MAX_VALUE, NodeKind.TEXT, TextStyle.TEXT),
    TITLE(1, NodeKind.TITLE, TextStyle.TITLE),
    SECTION(2, NodeKind.SECTION, TextStyle.SECTION),
    SUBSECTION(3, NodeKind.SUBSECTION, TextStyle.SUBSECTION),
    SUBSUBSECTION(4, NodeKind.SUBSUBSECTION, TextStyle.SUBSUBSECTION);

    GroupType(final int rank, final @Nullable NodeKind editorKind, final TextStyle editorStyle) {
        this.rank = rank;
        this.editorKind = editorKind;
        this.editorStyle = editorStyle;
    }

    /**
     * Checks whether groups of this type are headings that can fold the groups following them.
     */
    public boolean isFoldable() {
        return rank != Integer.MAX_VALUE;
    }

    /**
     * Retrieves the sectioning rank; smaller is more important. Groups that aren't headings share the largest rank.
     */
    public int rank() {
        return rank;
    }

    /**
     * Retrieves the kind of the editable source of groups of this type, or {@code null} if they have none.
     */
    public @Nullable NodeKind editorKind() {
        return editorKind;
    }

    TextStyle editorStyle() {
        return editorStyle;
    }

    private final int rank;
    private final @Nullable NodeKind editorKind;
    private final TextStyle editorStyle;
}
