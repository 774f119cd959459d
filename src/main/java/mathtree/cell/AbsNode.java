// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Collections;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * The absolute value of a whole expression, drawn between vertical bars.
 */
public final class AbsNode extends CompositeNode {
    public AbsNode(final @Nullable Node inner) {
        this.inner = inner;
    }

    public @Nullable Node inner() {
        return inner;
    }

    @Override
    public List<@Nullable Node> slots() {
        return Collections.singletonList(inner);
    }

    @Override
    public boolean breakUp() {
        if (isBroken()) {
            return false;
        }
        return splice(fragment("abs("), inner, fragment(")"));
    }

    @Override
    public int fragmentCount() {
        return 3;
    }

    @Override
    String format() {
        return "abs(" + slotString(inner) + ")";
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(inner, context, fontSize);
        measureFragments(context, fontSize);
        finish(slotWidth(inner) + 4, slotHeight(inner) + 4, slotCenter(inner) + 2);
    }

    private final @Nullable Node inner;
}
