// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Arrays;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A subscripted base, such as an array element.
 */
public final class SubscriptNode extends CompositeNode {
    public SubscriptNode(final @Nullable Node base, final @Nullable Node index) {
        this.base = base;
        this.index = index;
        if (index != null) {
            index.setExponentFlag();
        }
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
        return wrappedSlotString(base) + "[" + slotString(index) + "]";
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(base, context, fontSize);
        Chain.recalculate(index, context, smallerFontSize(fontSize));
        final var center = slotCenter(base);
        finish(slotWidth(base) + slotWidth(index), center + Math.max(slotDrop(base), slotHeight(index)), center);
    }

    private final @Nullable Node base;
    private final @Nullable Node index;
}
