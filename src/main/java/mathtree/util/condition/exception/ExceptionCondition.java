// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition.exception;

import java.io.PrintWriter;
import java.io.StringWriter;
import mathtree.util.condition.Condition;
import org.jetbrains.annotations.NotNull;

abstract class ExceptionCondition<E extends Exception> extends Condition {
    ExceptionCondition(final @NotNull E exception) {
        this(String.valueOf(exception.getMessage()), exception);
    }

    ExceptionCondition(final @NotNull String message, final @NotNull E exception) {
        super(message);
        this.exception = exception;
    }

    /**
     * Retrieves the wrapped exception.
     */
    public final @NotNull E exception() {
        return exception;
    }

    @Override
    public @NotNull String detailedMessage() {
        final var writer = new StringWriter();
        try (final var printWriter = new PrintWriter(writer)) {
            exception.printStackTrace(printWriter);
        }
        return writer.toString();
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + ": " + exception;
    }

    private final @NotNull E exception;
}
