// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a fatal condition reached the end of the handler chain without any handler unwinding.
 * <p>
 * Code that reads markup or files is expected to run under a handler that unwinds on fatal conditions, as the
 * command line front end does; reaching this means it didn't, so this is an {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
    }
}
