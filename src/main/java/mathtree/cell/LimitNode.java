// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Arrays;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A limit: the operator name with the approach written under it, followed by the expression.
 */
public final class LimitNode extends CompositeNode {
    public LimitNode(final @Nullable Node name, final @Nullable Node under, final @Nullable Node base) {
        this.name = name;
        this.under = under;
        this.base = base;
    }

    public @Nullable Node name() {
        return name;
    }

    public @Nullable Node under() {
        return under;
    }

    public @Nullable Node base() {
        return base;
    }

    @Override
    public List<@Nullable Node> slots() {
        return Arrays.asList(name, under, base);
    }

    @Override
    String format() {
        final var approach = splitChain(under, value -> value.equals("->") || value.equals("→"));
        final var rest = (approach != null) ? approach[0] + "," + approach[1] : slotString(under);
        return "limit(" + slotString(base) + "," + rest + ")";
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(name, context, fontSize);
        Chain.recalculate(under, context, smallerFontSize(fontSize));
        Chain.recalculate(base, context, fontSize);
        final var center = Math.max(slotCenter(name), slotCenter(base));
        final var drop = Math.max(slotDrop(name) + slotHeight(under), slotDrop(base));
        finish(Math.max(slotWidth(name), slotWidth(under)) + slotWidth(base), center + drop, center);
    }

    private final @Nullable Node name;
    private final @Nullable Node under;
    private final @Nullable Node base;
}
