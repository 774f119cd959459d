// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import mathtree.util.annotation.Nullable;

/**
 * The base class of presentation tree nodes.
 * <p>
 * A node sits in two chains at once. The <dfn>content-order chain</dfn>, linked through {@link #next()}, reflects
 * the structure of the expression; a node owns its successor, and dropping a node drops its remainder unless it
 * was cut off with {@link #detachNext()} first. The <dfn>draw-order chain</dfn>, linked through
 * {@link #nextToDraw()} and {@link #previousToDraw()}, is the sequence a renderer visits. The two coincide until a
 * composite is {@linkplain #breakUp() broken up}, at which point its fragments are spliced into the draw order
 * only.
 * <p>
 * Geometry is cached: a layout pass fills it with {@link #recalculate(LayoutContext, int)}, and {@code -1} marks
 * a value as stale.
 */
public abstract sealed class Node permits CompositeNode, EditorNode, GroupNode, ImageNode, SlideShowNode, TextNode {
    Node() {
    }

    /**
     * Attaches the given node, with whatever follows it, at the end of this node's content-order chain. The
     * draw order is linked the same way.
     * <p>
     * Walks the whole chain; use {@link ChainBuilder} to build long chains.
     */
    public final void append(final @Nullable Node node) {
        if (node == null) {
            return;
        }
        Chain.last(this).linkNext(node);
    }

    /**
     * Cuts this node off its content-order successor and returns the detached remainder, if any.
     * <p>
     * A broken-up node is {@linkplain #unbreak() unbroken} first, so that no fragment keeps pointing into the
     * detached remainder.
     */
    @CheckReturnValue
    public final @Nullable Node detachNext() {
        unbreak();
        final var rest = next;
        next = null;
        nextToDraw = null;
        if (rest != null) {
            rest.previousToDraw = null;
        }
        return rest;
    }

    /**
     * Retrieves the content-order successor.
     */
    public final @Nullable Node next() {
        return next;
    }

    /**
     * Retrieves the draw-order successor.
     */
    public final @Nullable Node nextToDraw() {
        return nextToDraw;
    }

    /**
     * Retrieves the draw-order predecessor.
     */
    public final @Nullable Node previousToDraw() {
        return previousToDraw;
    }

    /**
     * Retrieves the group this node belongs to, if any.
     */
    public final @Nullable GroupNode group() {
        return group;
    }

    /**
     * Records the group this node, and everything it owns in its slots, belongs to.
     */
    public void setGroup(final @Nullable GroupNode group) {
        this.group = group;
    }

    public final NodeKind kind() {
        return kind;
    }

    public final void setKind(final NodeKind kind) {
        this.kind = kind;
    }

    public final TextStyle style() {
        return style;
    }

    public final void setStyle(final TextStyle style) {
        this.style = style;
    }

    /**
     * Retrieves the textual value of leaf nodes; empty for every other node.
     */
    public String value() {
        return "";
    }

    /**
     * Tells this node it is laid out as an exponent or index. Only text nodes care.
     */
    public void setExponentFlag() {
    }

    public final boolean isHidden() {
        return isHidden;
    }

    public final void setHidden(final boolean hidden) {
        isHidden = hidden;
    }

    public final boolean isHighlighted() {
        return highlight;
    }

    public final void setHighlight(final boolean highlight) {
        this.highlight = highlight;
    }

    /**
     * Retrieves the text copied to the clipboard instead of the string form, if any.
     */
    public final @Nullable String altCopyText() {
        return altCopyText;
    }

    public final void setAltCopyText(final @Nullable String altCopyText) {
        this.altCopyText = altCopyText;
    }

    /**
     * Retrieves the cached width, or {@code -1} if stale.
     */
    public final int width() {
        return width;
    }

    /**
     * Retrieves the cached height, or {@code -1} if stale.
     */
    public final int height() {
        return height;
    }

    /**
     * Retrieves the cached distance from the top to the baseline, or {@code -1} if stale.
     * <p>
     * The center need not be in the middle: a fraction with a tall numerator has its center low.
     */
    public final int center() {
        return center;
    }

    /**
     * Retrieves the cached distance from the baseline to the bottom, or {@code -1} if stale.
     */
    public final int drop() {
        return (height < 0 || center < 0) ? SIZE_UNSET : height - center;
    }

    /**
     * Checks whether the cached geometry needs a layout pass.
     */
    public final boolean isSizeDirty() {
        return width < 0 || height < 0 || center < 0;
    }

    /**
     * Marks the cached geometry, including line aggregates, as stale.
     */
    public final void resetSize() {
        width = SIZE_UNSET;
        height = SIZE_UNSET;
        center = SIZE_UNSET;
        resetLineData();
    }

    /**
     * Recomputes the geometry of this node, and of everything in its slots, for the given font size.
     */
    public final void recalculate(final LayoutContext context, final int fontSize) {
        resetLineData();
        measure(context, fontSize);
    }

    /**
     * Retrieves the largest center on the visual line starting at this node.
     * <p>
     * The line runs along the draw order up to, but excluding, the next node where {@link #breakLineHere()} holds.
     */
    public final int maxCenter() {
        if (maxCenter < 0) {
            computeLineData();
        }
        return maxCenter;
    }

    /**
     * Retrieves the largest drop on the visual line starting at this node.
     */
    public final int maxDrop() {
        if (maxDrop < 0) {
            computeLineData();
        }
        return maxDrop;
    }

    /**
     * Retrieves the height of the visual line starting at this node.
     */
    public final int maxHeight() {
        return maxCenter() + maxDrop();
    }

    /**
     * Checks whether a line break is placed before this node.
     * <p>
     * True iff a break is allowed here and the node hasn't been broken up: the fragments of a broken-up node carry
     * its breaks instead.
     */
    public final boolean breakLineHere() {
        return breakLine && !isBroken;
    }

    /**
     * Allows, or disallows, a line break before this node.
     */
    public final void setBreakLine(final boolean breakLine) {
        this.breakLine = breakLine;
    }

    /**
     * Inserts, or removes, a forced line break before this node. Forcing a break also allows one.
     */
    public final void forceBreakLine(final boolean force) {
        forceBreakLine = force;
        breakLine = force;
    }

    public final boolean forceBreakLineHere() {
        return forceBreakLine;
    }

    public final void setBreakPage(final boolean breakPage) {
        this.breakPage = breakPage;
    }

    public final boolean breakPageHere() {
        return breakPage;
    }

    /**
     * Checks whether this node's fragments are currently spliced into the draw order in its place.
     */
    public final boolean isBroken() {
        return isBroken;
    }

    /**
     * Splits this node into drawable fragments, splicing them into the draw order right after it. The content
     * order is never touched.
     *
     * @return {@code true} if the node was split by this call.
     */
    public boolean breakUp() {
        return false;
    }

    /**
     * Reverses {@link #breakUp()}: the fragments leave the draw order and this node is drawn whole again, followed
     * by whatever followed its last fragment. Nodes broken up inside its slots are unbroken too.
     */
    public void unbreak() {
        if (isBroken) {
            restoreDrawOrder(next);
        }
    }

    /**
     * Reports how many drawable fragments this node turns into when broken up; 1 for nodes that never split.
     * <p>
     * The count assumes every slot is filled. Empty slots have nothing to draw and are left out of the draw order,
     * so a node with an empty slot splits into one fragment fewer per empty slot.
     */
    public int fragmentCount() {
        return 1;
    }

    /**
     * Returns the string form of this node alone, or its alternate copy text if one was set.
     * <p>
     * Use {@link Chain#toString(Node)} for a whole chain.
     */
    @Override
    public final String toString() {
        return (altCopyText != null) ? altCopyText : format();
    }

    abstract String format();

    abstract void measure(LayoutContext context, int fontSize);

    final void setSize(final int width, final int height, final int center) {
        this.width = width;
        this.height = height;
        this.center = center;
    }

    final void markBroken() {
        isBroken = true;
        resetLineData();
    }

    final void linkNext(final Node node) {
        next = node;
        drawExit().linkNextToDraw(node);
    }

    final void linkNextToDraw(final @Nullable Node node) {
        nextToDraw = node;
        if (node != null) {
            node.previousToDraw = this;
        }
    }

    final void clearPreviousToDraw() {
        previousToDraw = null;
    }

    /**
     * Retrieves the last node drawn for this node: itself, unless it is broken up.
     */
    Node drawExit() {
        return this;
    }

    final void restoreDrawOrder(final @Nullable Node successor) {
        isBroken = false;
        linkNextToDraw(successor);
        resetSize();
    }

    private void resetLineData() {
        maxCenter = SIZE_UNSET;
        maxDrop = SIZE_UNSET;
    }

    // Must stay iterative: a single line may hold an expression of any length.
    private void computeLineData() {
        int lineCenter = 0;
        int lineDrop = 0;
        Node node = this;
        do {
            if (!node.isBroken) {
                lineCenter = Math.max(lineCenter, node.center);
                lineDrop = Math.max(lineDrop, node.drop());
            }
            node = node.nextToDraw;
        } while (node != null && !node.breakLineHere());
        maxCenter = lineCenter;
        maxDrop = lineDrop;
    }

    static final int SIZE_UNSET = -1;

    private NodeKind kind = NodeKind.DEFAULT;
    private TextStyle style = TextStyle.DEFAULT;
    private int width = SIZE_UNSET;
    private int height = SIZE_UNSET;
    private int center = SIZE_UNSET;
    private int maxCenter = SIZE_UNSET;
    private int maxDrop = SIZE_UNSET;
    private boolean breakLine = false;
    private boolean forceBreakLine = false;
    private boolean breakPage = false;
    private boolean isBroken = false;
    private boolean isHidden = false;
    private boolean highlight = false;
    private @Nullable String altCopyText = null;
    private @Nullable GroupNode group = null;
    private @Nullable Node next = null;
    private @Nullable Node nextToDraw = null;
    private @Nullable Node previousToDraw = null;
}
