// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An installed condition handler, meant for try-with-resources.
 * <p>
 * Handlers are consulted newest first.
 */
public final class Handler implements AutoCloseable {
    /**
     * Installs a handler running the given procedure in the calling thread's {@link ConditionContext}.
     */
    public Handler(final @NotNull HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        owner = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing; silences warnings about an unreferenced try-with-resources variable.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Uninstalls the handler.
     */
    @Override
    public void close() {
        assert owner == ConditionContext.localContext() : "Handler closed on a foreign thread";
        assert owner.firstHandler == this : "Handlers closed out of order";
        owner.firstHandler = next;
    }

    void handle(final @NotNull SignaledCondition condition) {
        procedure.handle(condition);
    }

    final @Nullable Handler next;
    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext owner;
}
