// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.parser;

import mathtree.util.condition.Condition;

/**
 * A condition type indicating that a markup element was unknown, or lacked children it requires, so parts of the
 * document are missing from the result.
 * <p>
 * Signaled at most once per parse, for the first such element.
 */
public final class UnknownTagCondition extends Condition {
    UnknownTagCondition(final String tagName) {
        super("Parts of the document will not be loaded correctly! Found unknown or incomplete XML tag <"
            + tagName + ">");
        this.tagName = tagName;
    }

    /**
     * Retrieves the name of the element that produced nothing.
     */
    public String tagName() {
        return tagName;
    }

    private final String tagName;
}
