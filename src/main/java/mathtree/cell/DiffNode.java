// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Arrays;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A derivative: the differential, normally a fraction in {@link FractionStyle#DIFF} style, followed by the
 * differentiated expression.
 */
public final class DiffNode extends CompositeNode {
    public DiffNode(final @Nullable Node differential, final @Nullable Node base) {
        this.differential = differential;
        this.base = base;
    }

    public @Nullable Node differential() {
        return differential;
    }

    public @Nullable Node base() {
        return base;
    }

    @Override
    public List<@Nullable Node> slots() {
        return Arrays.asList(differential, base);
    }

    @Override
    String format() {
        final var part = (differential instanceof FractionNode fraction && differential.next() == null)
            ? fraction.differentialPart()
            : slotString(differential);
        return "'diff(" + slotString(base) + "," + part + ")";
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(differential, context, fontSize);
        Chain.recalculate(base, context, fontSize);
        final var center = Math.max(slotCenter(differential), slotCenter(base));
        finish(
            slotWidth(differential) + slotWidth(base),
            center + Math.max(slotDrop(differential), slotDrop(base)),
            center);
    }

    private final @Nullable Node differential;
    private final @Nullable Node base;
}
