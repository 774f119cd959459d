// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Arrays;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A sum or a product with its bounds written under and over the sign.
 * <p>
 * A lower sum ranges over the elements of a list: it has no upper bound, and its lower bound reads
 * {@code var in list}.
 */
public final class SumNode extends CompositeNode {
    /**
     * Initializes a sum or product running from {@code under} to {@code over}.
     */
    public SumNode(
        final SumStyle sumStyle,
        final @Nullable Node under,
        final @Nullable Node over,
        final @Nullable Node base
    ) {
        this(sumStyle, under, over, base, false);
    }

    private SumNode(
        final SumStyle sumStyle,
        final @Nullable Node under,
        final @Nullable Node over,
        final @Nullable Node base,
        final boolean isLowerSum
    ) {
        this.sumStyle = sumStyle;
        this.under = under;
        this.over = over;
        this.base = base;
        this.isLowerSum = isLowerSum;
    }

    /**
     * Creates a lower sum over the list named in {@code under}.
     */
    public static SumNode lowerSum(final @Nullable Node under, final @Nullable Node base) {
        return new SumNode(SumStyle.SUM, under, null, base, true);
    }

    public SumStyle sumStyle() {
        return sumStyle;
    }

    public boolean isLowerSum() {
        return isLowerSum;
    }

    public @Nullable Node under() {
        return under;
    }

    public @Nullable Node over() {
        return over;
    }

    public @Nullable Node base() {
        return base;
    }

    @Override
    public List<@Nullable Node> slots() {
        return Arrays.asList(under, over, base);
    }

    @Override
    String format() {
        if (isLowerSum) {
            final var range = splitChain(under, value -> value.equals("in") || value.equals("∈"));
            final var rest = (range != null) ? range[0] + "," + range[1] : slotString(under);
            return "lsum(" + slotString(base) + "," + rest + ")";
        }
        final var range = splitChain(under, value -> value.equals("="));
        final var from = (range != null) ? range[0] + "," + range[1] : slotString(under);
        return sumStyle.functionName() + "(" + slotString(base) + "," + from + "," + slotString(over) + ")";
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        final var smallFontSize = smallerFontSize(fontSize);
        Chain.recalculate(under, context, smallFontSize);
        Chain.recalculate(over, context, smallFontSize);
        Chain.recalculate(base, context, fontSize);
        final var signSize = fontSize + SIGN_GROWTH;
        final var signWidth = context.textWidth(sumStyle.sign(), style(), signSize);
        final var signHalf = context.lineHeight(style(), signSize) / 2;
        final var center = Math.max(slotHeight(over) + signHalf, slotCenter(base));
        final var drop = Math.max(signHalf + slotHeight(under), slotDrop(base));
        finish(
            Math.max(signWidth, Math.max(slotWidth(under), slotWidth(over))) + slotWidth(base),
            center + drop,
            center);
    }

    static final int SIGN_GROWTH = 6;

    private final SumStyle sumStyle;
    private final @Nullable Node under;
    private final @Nullable Node over;
    private final @Nullable Node base;
    private final boolean isLowerSum;
}
