// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Collections;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A parenthesized expression. Parentheses that aren't printed only group their content.
 */
public final class ParenNode extends CompositeNode {
    public ParenNode(final @Nullable Node inner, final boolean printed) {
        this.inner = inner;
        this.printed = printed;
    }

    public @Nullable Node inner() {
        return inner;
    }

    public boolean isPrinted() {
        return printed;
    }

    @Override
    public List<@Nullable Node> slots() {
        return Collections.singletonList(inner);
    }

    @Override
    public boolean breakUp() {
        if (isBroken() || !printed) {
            return false;
        }
        return splice(fragment("("), inner, fragment(")"));
    }

    @Override
    public int fragmentCount() {
        return printed ? 3 : 1;
    }

    @Override
    String format() {
        final var content = slotString(inner);
        return printed ? "(" + content + ")" : content;
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(inner, context, fontSize);
        measureFragments(context, fontSize);
        final var parenWidth = printed
            ? context.textWidth("(", style(), fontSize) + context.textWidth(")", style(), fontSize)
            : 0;
        final var center = Math.max(slotCenter(inner), context.lineHeight(style(), fontSize) / 2);
        final var drop = Math.max(slotDrop(inner), context.lineHeight(style(), fontSize) / 2);
        finish(slotWidth(inner) + parenWidth, center + drop, center);
    }

    private final @Nullable Node inner;
    private final boolean printed;
}
