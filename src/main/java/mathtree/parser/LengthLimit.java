// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.parser;

import mathtree.util.annotation.Nullable;

/**
 * The ceiling on the length of markup text {@link MathParser#parseLine(String)} is willing to parse.
 * <p>
 * Longer text is replaced by a placeholder without being read at all.
 */
public enum LengthLimit {
    SHORT(50_000),
    MEDIUM(500_000),
    LONG(5_000_000),
    UNLIMITED(0);

    LengthLimit(final int ceiling) {
        this.ceiling = ceiling;
    }

    /**
     * Maps a configured tier, 0 through 3, to its limit.
     *
     * @return the limit, or {@code null} if there's no such tier.
     */
    public static @Nullable LengthLimit fromTier(final int tier) {
        final var values = values();
        return (tier >= 0 && tier < values.length) ? values[tier] : null;
    }

    /**
     * Retrieves the largest accepted length in characters, or 0 if there's no limit.
     */
    public int ceiling() {
        return ceiling;
    }

    /**
     * Checks whether text of the given length is too long to parse.
     */
    public boolean exceeds(final int length) {
        return ceiling != 0 && length > ceiling;
    }

    private final int ceiling;
}
