// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

/**
 * Whether a {@link SumNode} is a sum or a product.
 */
public enum SumStyle {
    SUM("∑", "sum"),
    PRODUCT("∏", "product");

    SumStyle(final String sign, final String functionName) {
        this.sign = sign;
        this.functionName = functionName;
    }

    String sign() {
        return sign;
    }

    String functionName() {
        return functionName;
    }

    private final String sign;
    private final String functionName;
}
