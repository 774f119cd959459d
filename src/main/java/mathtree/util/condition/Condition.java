// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type of everything that can be signaled through {@link ConditionContext}.
 * <p>
 * Handlers run <em>before</em> the stack is unwound, so a handler can inspect the restarts established below it,
 * or simply record the condition and let the signaling code continue.
 */
public abstract class Condition {
    /**
     * Initializes a condition with the given one-line message.
     */
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Retrieves the one-line message.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Retrieves a possibly multi-line message with all the details the condition carries.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + ": " + message;
    }

    private final @NotNull String message;
}
