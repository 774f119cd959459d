// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util;

import org.jetbrains.annotations.NotNull;

/**
 * Lets {@link mathtree.util.condition.Unwind} cross methods that don't declare it.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable without the compiler knowing its type is checked.
     * <p>
     * Declared to return an error so that call sites can write {@code throw SneakyThrow.doThrow(t)} and keep the
     * compiler's reachability analysis happy; it never actually returns.
     */
    public static @NotNull AssertionError doThrow(final @NotNull Throwable throwable) {
        throw SneakyThrow.<RuntimeException>rethrow(throwable);
    }

    // The cast to E is erased, and E is inferred as RuntimeException at the only call site.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull AssertionError rethrow(final @NotNull Throwable throwable) throws E {
        throw (E) throwable;
    }
}
