// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Collections;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * The complex conjugate of a whole expression, drawn with a bar above it.
 */
public final class ConjugateNode extends CompositeNode {
    public ConjugateNode(final @Nullable Node inner) {
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
        return splice(fragment("conjugate("), inner, fragment(")"));
    }

    @Override
    public int fragmentCount() {
        return 3;
    }

    @Override
    String format() {
        return "conjugate(" + slotString(inner) + ")";
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(inner, context, fontSize);
        measureFragments(context, fontSize);
        finish(slotWidth(inner) + 4, slotHeight(inner) + 6, slotCenter(inner) + 6);
    }

    private final @Nullable Node inner;
}
