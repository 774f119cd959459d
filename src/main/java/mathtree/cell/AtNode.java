// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Arrays;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * An expression evaluated at a point, drawn with a vertical bar and the point below it.
 */
public final class AtNode extends CompositeNode {
    public AtNode(final @Nullable Node base, final @Nullable Node index) {
        this.base = base;
        this.index = index;
    }

    public @Nullable Node base() {
        return base;
    }

    public @Nullable Node index() {
        return index;
    }

    @Override
    public List<@Nullable Node> slots() {
        return Arrays.asList(base, index);
    }

    @Override
    String format() {
        return "at(" + slotString(base) + "," + slotString(index) + ")";
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(base, context, fontSize);
        Chain.recalculate(index, context, smallerFontSize(fontSize));
        final var center = slotCenter(base);
        finish(
            slotWidth(base) + BAR_WIDTH + slotWidth(index),
            center + Math.max(slotDrop(base), slotHeight(index)),
            center);
    }

    private static final int BAR_WIDTH = 4;

    private final @Nullable Node base;
    private final @Nullable Node index;
}
