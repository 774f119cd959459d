// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import java.util.Arrays;
import java.util.List;
import mathtree.util.annotation.Nullable;

/**
 * A definite or indefinite integral. The variable slot holds the whole {@code dx} part.
 */
public final class IntegralNode extends CompositeNode {
    private IntegralNode(
        final @Nullable Node under,
        final @Nullable Node over,
        final @Nullable Node base,
        final @Nullable Node variable,
        final boolean isDefinite
    ) {
        this.under = under;
        this.over = over;
        this.base = base;
        this.variable = variable;
        this.isDefinite = isDefinite;
    }

    public static IntegralNode definite(
        final @Nullable Node under,
        final @Nullable Node over,
        final @Nullable Node base,
        final @Nullable Node variable
    ) {
        return new IntegralNode(under, over, base, variable, true);
    }

    public static IntegralNode indefinite(final @Nullable Node base, final @Nullable Node variable) {
        return new IntegralNode(null, null, base, variable, false);
    }

    public boolean isDefinite() {
        return isDefinite;
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

    public @Nullable Node variable() {
        return variable;
    }

    @Override
    public List<@Nullable Node> slots() {
        return isDefinite ? Arrays.asList(under, over, base, variable) : Arrays.asList(base, variable);
    }

    @Override
    String format() {
        var differential = variable;
        if (differential != null && differential.value().equals("d")) {
            differential = differential.next();
        }
        final var builder = new StringBuilder("integrate(")
            .append(slotString(base))
            .append(',')
            .append(slotString(differential));
        if (isDefinite) {
            builder.append(',').append(slotString(under)).append(',').append(slotString(over));
        }
        return builder.append(')').toString();
    }

    @Override
    void measure(final LayoutContext context, final int fontSize) {
        final var smallFontSize = smallerFontSize(fontSize);
        Chain.recalculate(under, context, smallFontSize);
        Chain.recalculate(over, context, smallFontSize);
        Chain.recalculate(base, context, fontSize);
        Chain.recalculate(variable, context, fontSize);
        final var signSize = fontSize + SumNode.SIGN_GROWTH;
        final var signWidth = context.textWidth(SIGN, style(), signSize);
        final var signHalf = context.lineHeight(style(), signSize) / 2;
        final var center = Math.max(slotHeight(over) + signHalf, Math.max(slotCenter(base), slotCenter(variable)));
        final var drop = Math.max(signHalf + slotHeight(under), Math.max(slotDrop(base), slotDrop(variable)));
        finish(
            signWidth + Math.max(slotWidth(under), slotWidth(over)) + slotWidth(base) + slotWidth(variable),
            center + drop,
            center);
    }

    private static final String SIGN = "∫";

    private final @Nullable Node under;
    private final @Nullable Node over;
    private final @Nullable Node base;
    private final @Nullable Node variable;
    private final boolean isDefinite;
}
