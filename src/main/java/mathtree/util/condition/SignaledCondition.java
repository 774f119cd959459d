// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * What a {@link HandlerProcedure} receives: the condition plus how it was signaled.
 * <p>
 * Everything the parser reports arrives here non-fatal; only failures to read input or to configure the XML
 * parser are fatal.
 *
 * @param condition The condition being signaled.
 * @param isFatal   {@code true} iff it was signaled with {@link ConditionContext#error(Condition)}.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
}
