// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Arrays;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A base with both a subscript and an exponent, stacked on its right.
 */
public final class SubSupNode extends CompositeNode {
    public SubSupNode(final @Nullable Node base, final @Nullable Node index, final @Nullable Node exponent) {
        this.base = base;
        this.index = index;
        this.exponent = exponent;
        if (index != null) {
            index.setExponentFlag();
        }
        if (exponent != null) {
            exponent.setExponentFlag();
        }
    }

    public @Nullable Node base() {
        return base;
    }

    public @Nullable Node index() {
        return index;
    }

    public @Nullable Node exponent() {
        return exponent;
    }

    @Override
    public List<@Nullable Node> slots() {
        return Arrays.asList(base, index, exponent);
    }

    @Override
    String format() {
        return wrappedSlotString(base) + "[" + slotString(index) + "]^" + wrappedSlotString(exponent);
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        final var smallFontSize = smallerFontSize(fontSize);
        Chain.recalculate(base, context, fontSize);
        Chain.recalculate(index, context, smallFontSize);
        Chain.recalculate(exponent, context, smallFontSize);
        final var center = Math.max(slotCenter(base), slotHeight(exponent));
        finish(
            slotWidth(base) + Math.max(slotWidth(index), slotWidth(exponent)),
            center + Math.max(slotDrop(base), slotHeight(index)),
            center);
    }

    private final @Nullable Node base;
    private final @Nullable Node index;
    private final @Nullable Node exponent;
}
