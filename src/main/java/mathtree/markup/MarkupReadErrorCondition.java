// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.markup;

import mathtree.util.condition.Condition;

/**
 * A condition type indicating that markup text was not well-formed and produced no tree.
 */
public final class MarkupReadErrorCondition extends Condition {
    MarkupReadErrorCondition(final String message) {
        super(message);
    }
}
