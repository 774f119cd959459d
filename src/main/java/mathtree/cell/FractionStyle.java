// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

/**
 * How a {@link FractionNode} is presented.
 */
public enum FractionStyle {
    NORMAL,
    /**
     * No dividing line: a binomial coefficient.
     */
    CHOOSE,
    /**
     * The {@code d/dx} part of a derivative.
     */
    DIFF
}
