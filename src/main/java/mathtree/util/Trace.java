// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable description of what the current thread is doing, meant for try-with-resources.
 * <p>
 * The parser opens a trace for every markup element it descends into, so that a diagnostic printed by a condition
 * handler can tell the user where in the document it occurred.
 */
public final class Trace implements AutoCloseable {
    /**
     * Opens a trace whose message is computed only if somebody asks for it.
     */
    public Trace(final Supplier<String> supplier) {
        final var context = frames.get();
        next = context.top;
        this.supplier = supplier;
        owner = context;
        context.top = this;
    }

    /**
     * Opens a trace with a fixed message.
     */
    public Trace(final String message) {
        this(() -> message);
        this.message = message;
    }

    /**
     * Returns the calling thread's open trace messages, innermost first.
     */
    public static Iterable<String> activeTraces() {
        return () -> new Frames(frames.get().top);
    }

    /**
     * Does nothing; silences warnings about an unreferenced try-with-resources variable.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert owner == frames.get() : "Trace closed on a foreign thread";
        assert owner.top == this : "Traces closed out of order";
        owner.top = next;
    }

    private String message() {
        var result = message;
        if (result == null) {
            result = supplier.get();
            message = result;
        }
        return result;
    }

    @SuppressWarnings("nullness:type.argument")
    private static final ThreadLocal<Stack> frames = ThreadLocal.withInitial(Stack::new);

    private final @Nullable Trace next;
    private final Supplier<String> supplier;
    private final Stack owner;
    private @Nullable String message = null;

    private static final class Stack {
        private @Nullable Trace top = null;
    }

    private static final class Frames implements Iterator<String> {
        private Frames(final @Nullable Trace top) {
            current = top;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NonNull String next() {
            final var frame = current;
            if (frame == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = frame.next;
            return frame.message();
        }

        private @Nullable Trace current;
    }
}
