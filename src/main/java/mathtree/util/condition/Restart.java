// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition;

import mathtree.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A point the stack can be unwound to.
 * <p>
 * Restarts are created only by {@link ConditionContext#withRestart(String, RestartCallback)}, and are listed,
 * newest first, by {@link ConditionContext#restarts()}.
 */
public final class Restart {
    Restart(final @NotNull String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        owner = context;
        context.firstRestart = this;
    }

    /**
     * Retrieves the user-readable name of this restart.
     */
    public @NotNull String name() {
        return name;
    }

    /**
     * Transfers control to this restart. Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void unlink() {
        assert owner == ConditionContext.localContext() : "Restart unlinked on a foreign thread";
        assert owner.firstRestart == this : "Restarts unlinked out of order";
        owner.firstRestart = next;
    }

    final @Nullable Restart next;
    private final @NotNull String name;
    private final @NotNull ConditionContext owner;
}
