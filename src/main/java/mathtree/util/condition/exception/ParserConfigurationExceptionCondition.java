// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition.exception;

import javax.xml.parsers.ParserConfigurationException;
import org.jetbrains.annotations.NotNull;

/**
 * A condition type indicating that the JAXP document builder could not be configured the way markup reading
 * requires.
 */
public final class ParserConfigurationExceptionCondition extends ExceptionCondition<ParserConfigurationException> {
    /**
     * Initializes a new {@code ParserConfigurationExceptionCondition} wrapping the given
     * {@link ParserConfigurationException}.
     */
    public ParserConfigurationExceptionCondition(final @NotNull ParserConfigurationException exception) {
        super(exception);
    }
}
