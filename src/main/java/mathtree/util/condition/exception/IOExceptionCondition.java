// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.util.condition.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A condition type indicating that a file the program needed couldn't be read. Fatal for the markup and
 * settings files, non-fatal for images.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    public IOExceptionCondition(final Path path, final IOException exception) {
        super("Cannot read " + path + ": " + exception.getMessage(), exception);
        this.path = path;
    }

    /**
     * Retrieves the file that couldn't be read.
     */
    public Path path() {
        return path;
    }

    private final Path path;
}
