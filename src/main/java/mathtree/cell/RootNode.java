// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Collections;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A square root of a whole expression.
 */
public final class RootNode extends CompositeNode {
    public RootNode(final @Nullable Node inner) {
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
        return splice(fragment("sqrt("), inner, fragment(")"));
    }

    @Override
    public int fragmentCount() {
        return 3;
    }

    @Override
    String format() {
        return "sqrt(" + slotString(inner) + ")";
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(inner, context, fontSize);
        measureFragments(context, fontSize);
        final var signWidth = context.textWidth(SIGN, style(), fontSize);
        finish(signWidth + slotWidth(inner), slotHeight(inner) + 3, slotCenter(inner) + 3);
    }

    private static final String SIGN = "√";

    private final @Nullable Node inner;
}
