// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.parser;

import mathtree.util.condition.Condition;

/**
 * A condition type indicating that a configuration value couldn't be understood, so the default is used instead.
 */
public final class InvalidSettingCondition extends Condition {
    InvalidSettingCondition(final String key, final String value) {
        super("Invalid value for setting " + key + ": \"" + value + "\", using the default");
        this.key = key;
    }

    /**
     * Retrieves the name of the offending setting.
     */
    public String key() {
        return key;
    }

    private final String key;
}
