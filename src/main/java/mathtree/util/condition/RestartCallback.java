// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition;

/**
 * The body run under {@link ConditionContext#withRestart(String, RestartCallback)}.
 * <p>
 * Receives the restart it runs under, so that handlers it installs can unwind straight back to it.
 */
@FunctionalInterface
public interface RestartCallback<T> {
    @SuppressWarnings("RedundantThrows")
    T call(Restart restart) throws Unwind;
}
