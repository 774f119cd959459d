// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Arrays;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A fraction, a binomial coefficient, or the {@code d/dx} part of a derivative, depending on its
 * {@link FractionStyle}.
 */
public final class FractionNode extends CompositeNode {
    public FractionNode(
        final @Nullable Node numerator,
        final @Nullable Node denominator,
        final FractionStyle fractionStyle
    ) {
        this.numerator = numerator;
        this.denominator = denominator;
        this.fractionStyle = fractionStyle;
    }

    public @Nullable Node numerator() {
        return numerator;
    }

    public @Nullable Node denominator() {
        return denominator;
    }

    public FractionStyle fractionStyle() {
        return fractionStyle;
    }

    @Override
    public List<@Nullable Node> slots() {
        return Arrays.asList(numerator, denominator);
    }

    /**
     * Only plain fractions split, into {@code (num)/(denom)}.
     */
    @Override
    public boolean breakUp() {
        if (isBroken() || fractionStyle != FractionStyle.NORMAL) {
            return false;
        }
        final var divide = fragment("/");
        divide.setBreakLine(true);
        return splice(
            fragment("("),
            numerator,
            fragment(")"),
            divide,
            fragment("("),
            denominator,
            fragment(")"));
    }

    @Override
    public int fragmentCount() {
        return (fractionStyle == FractionStyle.NORMAL) ? 7 : 1;
    }

    /**
     * Extracts the variable and the order of a derivative from a {@code d^n/dx^n} fraction, as
     * {@code variable,order}.
     */
    String differentialPart() {
        final var order = (numerator instanceof PowerNode power) ? slotString(power.exponent()) : "1";
        var variable = denominator;
        if (variable != null && variable.value().equals("d")) {
            variable = variable.next();
        }
        var name = (variable instanceof PowerNode power && variable.next() == null)
            ? slotString(power.base())
            : slotString(variable);
        if (name.startsWith("d")) {
            name = name.substring(1);
        }
        return name + "," + order;
    }

    @Override
    String format() {
        if (fractionStyle == FractionStyle.CHOOSE) {
            return "binomial(" + slotString(numerator) + "," + slotString(denominator) + ")";
        }
        return wrappedSlotString(numerator) + "/" + wrappedSlotString(denominator);
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        Chain.recalculate(numerator, context, fontSize);
        Chain.recalculate(denominator, context, fontSize);
        measureFragments(context, fontSize);
        final var numeratorHeight = slotHeight(numerator);
        finish(
            Math.max(slotWidth(numerator), slotWidth(denominator)) + 2 * LINE_OVERHANG,
            numeratorHeight + slotHeight(denominator) + 3,
            numeratorHeight + 1);
    }

    private static final int LINE_OVERHANG = 2;

    private final @Nullable Node numerator;
    private final @Nullable Node denominator;
    private final FractionStyle fractionStyle;
}
