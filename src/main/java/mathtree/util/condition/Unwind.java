// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable carrying control from a handler back to a {@link Restart}.
 * <p>
 * Neither an {@link Exception} nor an {@link Error}: it must pass through ordinary catch blocks untouched, and
 * code should never catch it except to forward it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to restart " + target.name(), null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
