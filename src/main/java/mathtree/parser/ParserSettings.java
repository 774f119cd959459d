// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.parser;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Properties;
import mathtree.util.condition.ConditionContext;

/**
 * The configuration values the parser consumes.
 *
 * @param displayedDigits the longest number shown in full; never less than {@value #MIN_DISPLAYED_DIGITS}.
 * @param lengthLimit     the ceiling on the length of parsed markup text.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
public record ParserSettings(int displayedDigits, LengthLimit lengthLimit) {
    /**
     * Initializes the settings, raising {@code displayedDigits} to {@value #MIN_DISPLAYED_DIGITS} if it's smaller.
     */
    public ParserSettings {
        displayedDigits = Math.max(MIN_DISPLAYED_DIGITS, displayedDigits);
    }

    /**
     * Returns the settings used when nothing is configured.
     */
    public static ParserSettings defaults() {
        return new ParserSettings(DEFAULT_DISPLAYED_DIGITS, LengthLimit.SHORT);
    }

    /**
     * Reads the settings from the keys {@value #DISPLAYED_DIGITS_KEY} and {@value #SHOW_LENGTH_KEY}. Absent keys
     * take their defaults.
     * <p>
     * For every value that isn't a number, or is a tier that doesn't exist, a non-fatal
     * {@link InvalidSettingCondition} is signaled, and the default is used.
     */
    public static ParserSettings fromProperties(final Properties properties) {
        final var displayedDigits = readInt(properties, DISPLAYED_DIGITS_KEY, DEFAULT_DISPLAYED_DIGITS);
        final var tier = readInt(properties, SHOW_LENGTH_KEY, 0);
        var lengthLimit = LengthLimit.fromTier(tier);
        if (lengthLimit == null) {
            ConditionContext.signal(new InvalidSettingCondition(SHOW_LENGTH_KEY, Integer.toString(tier)));
            lengthLimit = LengthLimit.SHORT;
        }
        return new ParserSettings(displayedDigits, lengthLimit);
    }

    private static int readInt(final Properties properties, final String key, final int defaultValue) {
        final var value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (final NumberFormatException e) {
            ConditionContext.signal(new InvalidSettingCondition(key, value));
            return defaultValue;
        }
    }

    public static final String DISPLAYED_DIGITS_KEY = "displayedDigits";
    public static final String SHOW_LENGTH_KEY = "showLength";
    public static final int DEFAULT_DISPLAYED_DIGITS = 100;
    public static final int MIN_DISPLAYED_DIGITS = 10;
}
