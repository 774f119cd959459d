// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import mathtree.util.annotation.Nullable;

/**
 * The base class of nodes that own child chains in fixed structural slots.
 * <p>
 * A slot holds the first node of a chain, or {@code null} when the markup gave nothing usable for it. Composites
 * that can be broken up splice their slot chains, plus a few punctuation fragments they own, into the draw order
 * in their own place.
 */
public abstract sealed class CompositeNode extends Node
    permits AbsNode, AtNode, ConjugateNode, DiffNode, FractionNode, FunctionNode, IntegralNode, LimitNode,
    MatrixNode, ParenNode, PowerNode, RootNode, SubSupNode, SubscriptNode, SumNode {
    CompositeNode() {
    }

    /**
     * Returns the slot chains in slot order. Empty slots are {@code null}.
     */
    public abstract List<@Nullable Node> slots();

    @Override
    public final void setGroup(final @Nullable GroupNode group) {
        super.setGroup(group);
        for (final var slot : slots()) {
            Chain.setGroup(slot, group);
        }
    }

    @Override
    public final void unbreak() {
        for (final var slot : slots()) {
            Chain.unbreakAll(slot);
        }
        if (!isBroken()) {
            return;
        }
        final var after = drawExit().nextToDraw();
        for (final var piece : pieces) {
            Chain.last(piece).drawExit().linkNextToDraw(null);
            piece.clearPreviousToDraw();
        }
        pieces = List.of();
        ownFragments.clear();
        restoreDrawOrder(after);
    }

    /**
     * Splices the given chains into the draw order between this node and its current draw-order successor.
     * {@code null} pieces stand for empty slots and are skipped.
     */
    final boolean splice(final @Nullable Node... pieces) {
        if (isBroken()) {
            return false;
        }
        final var after = nextToDraw();
        final var spliced = new ArrayList<Node>(pieces.length);
        Node previous = this;
        for (final var piece : pieces) {
            if (piece == null) {
                continue;
            }
            previous.linkNextToDraw(piece);
            previous = Chain.last(piece).drawExit();
            spliced.add(piece);
        }
        if (spliced.isEmpty()) {
            return false;
        }
        previous.linkNextToDraw(after);
        this.pieces = spliced;
        markBroken();
        return true;
    }

    // Looks through broken-up nodes ending the last piece, however deeply nested.
    @Override
    final Node drawExit() {
        Node node = this;
        while (node instanceof CompositeNode composite && composite.isBroken()) {
            node = Chain.last(composite.pieces.get(composite.pieces.size() - 1));
        }
        return node;
    }

    /**
     * Creates a punctuation fragment presented like this node.
     */
    final TextNode fragment(final String text) {
        final var node = new TextNode(text, style());
        node.setKind(kind());
        node.setHighlight(isHighlighted());
        node.setGroup(group());
        ownFragments.add(node);
        return node;
    }

    /**
     * Measures the punctuation fragments created by the last {@link #breakUp()}, if any.
     */
    final void measureFragments(final LayoutContext context, final int fontSize) {
        for (final var fragment : ownFragments) {
            fragment.recalculate(context, fontSize);
        }
    }

    /**
     * Stores the computed geometry. A broken-up node takes no horizontal space: its fragments do.
     */
    final void finish(final int width, final int height, final int center) {
        setSize(isBroken() ? 0 : width, height, center);
    }

    /**
     * Splits a chain at the first node whose value, stripped of surrounding blanks, satisfies {@code separator}.
     *
     * @return the string forms before and after the separator, or {@code null} if there is no separator.
     */
    static String @Nullable [] splitChain(final @Nullable Node first, final Predicate<String> separator) {
        final var before = new StringBuilder();
        for (var node = first; node != null; node = node.next()) {
            if (separator.test(node.value().strip())) {
                final var after = new StringBuilder();
                for (var rest = node.next(); rest != null; rest = rest.next()) {
                    after.append(rest);
                }
                return new String[] {before.toString(), after.toString()};
            }
            before.append(node);
        }
        return null;
    }

    static String slotString(final @Nullable Node slot) {
        return Chain.toString(slot);
    }

    static String wrappedSlotString(final @Nullable Node slot) {
        final var string = Chain.toString(slot);
        return Chain.isCompound(slot) ? "(" + string + ")" : string;
    }

    static int smallerFontSize(final int fontSize) {
        return Math.max(MIN_FONT_SIZE, fontSize - EXPONENT_SHRINK);
    }

    static int slotWidth(final @Nullable Node slot) {
        return Chain.width(slot);
    }

    static int slotCenter(final @Nullable Node slot) {
        return (slot == null) ? 0 : slot.maxCenter();
    }

    static int slotDrop(final @Nullable Node slot) {
        return (slot == null) ? 0 : slot.maxDrop();
    }

    static int slotHeight(final @Nullable Node slot) {
        return (slot == null) ? 0 : slot.maxHeight();
    }

    static final int MIN_FONT_SIZE = 8;
    static final int EXPONENT_SHRINK = 4;

    private List<Node> pieces = List.of();
    private final List<TextNode> ownFragments = new ArrayList<>();
}
