// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Arrays;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A base raised to an exponent. A matrix power prints as {@code ^^}.
 */
public final class PowerNode extends CompositeNode {
    public PowerNode(final @Nullable Node base, final @Nullable Node exponent) {
        this.base = base;
        this.exponent = exponent;
        if (exponent != null) {
            exponent.setExponentFlag();
        }
    }

    public @Nullable Node base() {
        return base;
    }

    public @Nullable Node exponent() {
        return exponent;
    }

    public boolean isMatrixPower() {
        return isMatrixPower;
    }

    public void setMatrixPower(final boolean matrixPower) {
        isMatrixPower = matrixPower;
    }

    @Override
    public List<@Nullable Node> slots() {
        return Arrays.asList(base, exponent);
    }

    @Override
    public boolean breakUp() {
        if (isBroken()) {
            return false;
        }
        final var open = fragment(isMatrixPower ? "^^(" : "^(");
        open.setBreakLine(true);
        return splice(base, open, exponent, fragment(")"));
    }

    @Override
    public int fragmentCount() {
        return 4;
    }

    @Override
    String format() {
        return wrappedSlotString(base) + (isMatrixPower ? "^^" : "^") + wrappedSlotString(exponent);
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(base, context, fontSize);
        Chain.recalculate(exponent, context, smallerFontSize(fontSize));
        measureFragments(context, fontSize);
        final var center = Math.max(slotCenter(base), slotHeight(exponent));
        finish(slotWidth(base) + slotWidth(exponent), center + slotDrop(base), center);
    }

    private final @Nullable Node base;
    private final @Nullable Node exponent;
    private boolean isMatrixPower = false;
}
