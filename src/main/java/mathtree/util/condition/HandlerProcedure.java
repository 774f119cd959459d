// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The code run by a {@link Handler} for every condition signaled while it is installed.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Processes the given condition.
     * <p>
     * Returning normally declines the condition and lets older handlers see it. Unwinding to a restart, with
     * {@link Restart#unwindTo()}, handles it; the resulting {@link Unwind} travels undeclared.
     */
    void handle(@NotNull SignaledCondition condition);
}
