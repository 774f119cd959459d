// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.parser;

import mathtree.cell.Asset;
import mathtree.util.annotation.Nullable;

/**
 * Looks up the images a document refers to by file name.
 */
@FunctionalInterface
public interface AssetResolver {
    /**
     * Resolves the named image.
     *
     * @return the image, or {@code null} if it isn't available.
     */
    @Nullable Asset resolve(String fileName);

    /**
     * Returns a resolver that never finds anything, for parsing without access to images.
     */
    static AssetResolver none() {
        return fileName -> null;
    }
}
