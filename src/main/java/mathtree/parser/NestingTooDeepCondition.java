// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.parser;

import mathtree.util.condition.Condition;

/**
 * A condition type indicating that markup elements were nested deeper than the parser descends, so the innermost
 * ones were replaced with a placeholder.
 * <p>
 * Signaled at most once per parse, for the first element past the limit.
 */
public final class NestingTooDeepCondition extends Condition {
    NestingTooDeepCondition(final String tagName, final int maxDepth) {
        super("Expression nested more than " + maxDepth + " levels deep at XML tag <" + tagName + ">");
        this.tagName = tagName;
    }

    public String tagName() {
        return tagName;
    }

    private final String tagName;
}
