// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cli;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import mathtree.cell.Asset;
import mathtree.parser.AssetResolver;
import mathtree.util.Trace;
import mathtree.util.annotation.Nullable;
import mathtree.util.condition.ConditionContext;
import mathtree.util.condition.exception.IOExceptionCondition;

/**
 * Resolves images as files relative to the directory of the document being parsed.
 * <p>
 * An image that can't be read, isn't in a format the JDK decodes, or whose name points outside the document's
 * directory is reported with a non-fatal {@link IOExceptionCondition} and left unresolved.
 */
public final class FileAssetResolver implements AssetResolver {
    public FileAssetResolver(final Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public @Nullable Asset resolve(final String fileName) {
        final Path path;
        try {
            path = directory.resolve(fileName).normalize();
        } catch (final InvalidPathException e) {
            ConditionContext.signal(new IOExceptionCondition(directory, new IOException(e.getMessage(), e)));
            return null;
        }
        if (!path.startsWith(directory)) {
            ConditionContext.signal(new IOExceptionCondition(
                path,
                new IOException("Image lies outside the document directory " + directory)));
            return null;
        }
        try (final var trace = new Trace(() -> "Loading image " + path)) {
            trace.use();
            try {
                final var data = Files.readAllBytes(path);
                final var image = ImageIO.read(new ByteArrayInputStream(data));
                if (image == null) {
                    throw new IOException("Unrecognized image format: " + path);
                }
                return new Asset(fileName, data, image.getWidth(), image.getHeight());
            } catch (final IOException e) {
                ConditionContext.signal(new IOExceptionCondition(path, e));
                return null;
            }
        }
    }

    private final Path directory;
}
