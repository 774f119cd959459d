// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Arrays;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A function applied to its argument list. The argument is normally a parenthesized node of its own.
 */
public final class FunctionNode extends CompositeNode {
    public FunctionNode(final @Nullable Node name, final @Nullable Node argument) {
        this.name = name;
        this.argument = argument;
    }

    public @Nullable Node name() {
        return name;
    }

    public @Nullable Node argument() {
        return argument;
    }

    @Override
    public List<@Nullable Node> slots() {
        return Arrays.asList(name, argument);
    }

    @Override
    public boolean breakUp() {
        if (isBroken()) {
            return false;
        }
        return splice(name, argument);
    }

    @Override
    public int fragmentCount() {
        return 2;
    }

    @Override
    String format() {
        return slotString(name) + slotString(argument);
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(name, context, fontSize);
        Chain.recalculate(argument, context, fontSize);
        final var center = Math.max(slotCenter(name), slotCenter(argument));
        finish(
            slotWidth(name) + slotWidth(argument),
            center + Math.max(slotDrop(name), slotDrop(argument)),
            center);
    }

    private final @Nullable Node name;
    private final @Nullable Node argument;
}
