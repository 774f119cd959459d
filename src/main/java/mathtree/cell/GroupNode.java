// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import mathtree.util.annotation.Nullable;

/**
 * A worksheet group: a heading, a text block, a code block with its output, an image or a page break.
 * <p>
 * Groups form the top-level chain of a document. A heading can be <dfn>folded</dfn>: the groups it governs are
 * cut off the visible chain and kept in the heading's folded chain until it's unfolded again. Folding only
 * relinks pointers, so a fold followed by an unfold gives back the very same nodes in the same order.
 */
public final class GroupNode extends Node {
    public GroupNode(final GroupType type) {
        this.type = type;
        setKind(NodeKind.GROUP);
        setGroup(this);
    }

    public GroupType type() {
        return type;
    }

    public @Nullable EditorNode editor() {
        return editor;
    }

    /**
     * Installs an editable source holding {@code text}, of the kind matching this group's type. Groups without
     * an editable source ignore this.
     */
    public void setEditableContent(final String text) {
        final var editorKind = type.editorKind();
        if (editorKind == null) {
            return;
        }
        final var newEditor = new EditorNode();
        newEditor.setKind(editorKind);
        newEditor.setStyle(type.editorStyle());
        newEditor.setValue(text);
        newEditor.setGroup(this);
        editor = newEditor;
        resetSize();
    }

    /**
     * Retrieves the first node of the output chain, if any.
     */
    public @Nullable Node output() {
        return output;
    }

    /**
     * Appends a chain to the output of this group. {@code null} is ignored.
     */
    public void appendOutput(final @Nullable Node node) {
        if (node == null) {
            return;
        }
        if (outputTail == null) {
            output = node;
        } else {
            outputTail.linkNext(node);
        }
        var last = node;
        while (true) {
            last.setGroup(this);
            final var next = last.next();
            if (next == null) {
                break;
            }
            last = next;
        }
        outputTail = last;
        resetSize();
    }

    public boolean isOutputHidden() {
        return isOutputHidden;
    }

    /**
     * Hides, or shows, the output of this group. Headings have no output to hide, so for them this does nothing.
     */
    public void setOutputHidden(final boolean hidden) {
        if (type.isFoldable()) {
            return;
        }
        isOutputHidden = hidden;
        resetSize();
    }

    public boolean isFoldable() {
        return type.isFoldable();
    }

    /**
     * Retrieves the first group of the folded chain, or {@code null} if this group isn't folded.
     */
    public @Nullable Node hiddenTree() {
        return hiddenTree;
    }

    /**
     * Installs an already detached chain as this group's folded chain.
     *
     * @return {@code false} if this group already holds a folded chain, in which case nothing changes.
     */
    public boolean hideTree(final @Nullable Node tree) {
        if (tree == null || hiddenTree != null) {
            return false;
        }
        hiddenTree = tree;
        return true;
    }

    /**
     * Folds the groups following this heading, up to the next group of the same or a more important sectioning
     * rank, into the folded chain.
     *
     * @return {@code false} if there was nothing to fold, this group isn't a heading, or it's already folded.
     */
    public boolean fold() {
        if (!type.isFoldable() || hiddenTree != null) {
            return false;
        }
        final var start = next();
        if (start == null || endsFold(start)) {
            return false;
        }
        var lastFolded = start;
        for (var candidate = start.next(); candidate != null && !endsFold(candidate); candidate = candidate.next()) {
            lastFolded = candidate;
        }
        final var end = lastFolded.detachNext();
        hiddenTree = detachNext();
        if (end != null) {
            linkNext(end);
        }
        resetSize();
        return true;
    }

    /**
     * Reattaches the folded chain as the visible successor of this group.
     *
     * @return {@code false} if this group wasn't folded.
     */
    public boolean unfold() {
        final var tree = hiddenTree;
        if (tree == null) {
            return false;
        }
        hiddenTree = null;
        final var rest = detachNext();
        linkNext(tree);
        if (rest != null) {
            Chain.last(tree).linkNext(rest);
        }
        resetSize();
        return true;
    }

    @Override
    String format() {
        final var builder = new StringBuilder();
        if (editor != null) {
            builder.append(editor);
        }
        if (output != null && !isOutputHidden) {
            if (editor != null) {
                builder.append('\n');
            }
            builder.append(Chain.toString(output));
        }
        return builder.toString();
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        int width = 0;
        int height = 0;
        int center = -1;
        if (editor != null) {
            editor.recalculate(context, fontSize);
            width = editor.width();
            height = editor.height();
            center = editor.center();
        }
        if (output != null && !isOutputHidden) {
            Chain.recalculate(output, context, fontSize);
            int lineWidth = 0;
            for (Node node = output; node != null; node = node.nextToDraw()) {
                if (node == output || node.breakLineHere()) {
                    width = Math.max(width, lineWidth);
                    lineWidth = 0;
                    height += node.maxHeight() + OUTPUT_LINE_GAP;
                    if (center < 0) {
                        center = node.maxCenter();
                    }
                }
                lineWidth += Math.max(0, node.width());
            }
            width = Math.max(width, lineWidth);
        }
        setSize(width, height, Math.max(0, center));
    }

    private boolean endsFold(final Node node) {
        return node instanceof GroupNode group && group.type.rank() <= type.rank();
    }

    static final int OUTPUT_LINE_GAP = 2;

    private final GroupType type;
    private @Nullable EditorNode editor = null;
    private @Nullable Node output = null;
    private @Nullable Node outputTail = null;
    private @Nullable Node hiddenTree = null;
    private boolean isOutputHidden = false;
}
