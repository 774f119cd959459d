// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cli;

import mathtree.util.Trace;
import mathtree.util.condition.Condition;
import mathtree.util.condition.ConditionContext;
import mathtree.util.condition.HandlerProcedure;
import mathtree.util.condition.SignaledCondition;

/**
 * Reports every condition on standard error. Fatal conditions additionally unwind to the newest restart, since
 * nobody is there to pick one.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        try (final var streams = Streams.acquire()) {
            if (!condition.isFatal()) {
                showCondition(streams, condition.condition(), "Warning: a condition");
                return;
            }
            showCondition(streams, condition.condition(), "A fatal condition");
        }
        final var restarts = ConditionContext.restarts().iterator();
        if (restarts.hasNext()) {
            restarts.next().unwindTo();
        }
    }

    private static void showCondition(final Streams streams, final Condition condition, final String prefix) {
        final var err = streams.err();
        err.println(prefix + " of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static final FallbackHandler instance = new FallbackHandler();
}
