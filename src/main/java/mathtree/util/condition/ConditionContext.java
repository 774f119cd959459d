// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import mathtree.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The per-thread registry of installed handlers and established restarts.
 * <p>
 * Instances are never exposed; the static methods act on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals a non-fatal condition.
     * <p>
     * Handlers run newest first. If all of them return normally, so does this method; the signaling code then
     * carries on. A handler may instead unwind to a restart, in which case {@link Unwind} propagates from here.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().deliver(new SignaledCondition(condition, false));
    }

    /**
     * Signals a fatal condition.
     * <p>
     * Like {@link #signal(Condition)}, except that if every handler returns normally, {@link UnhandledErrorError}
     * is thrown. The return type lets call sites write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().deliver(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs {@code callback} with a restart named {@code restartName} established around it.
     *
     * @return The callback's result, or {@code null} if a handler unwound to the restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the restarts established in the calling thread, newest first.
     */
    public static @NotNull Iterable<@NotNull Restart> restarts() {
        final var first = localContext().firstRestart;
        return () -> new RestartIterator(first);
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void deliver(final @NotNull SignaledCondition condition) {
        // A handler that signals must only be seen by handlers older than itself.
        final var start = (currentHandler == null) ? firstHandler : currentHandler.next;
        for (var handler = start; handler != null; handler = handler.next) {
            final var saved = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = saved;
            }
        }
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);

    private static final class RestartIterator implements Iterator<@NotNull Restart> {
        private RestartIterator(final @Nullable Restart first) {
            current = first;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NotNull Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
