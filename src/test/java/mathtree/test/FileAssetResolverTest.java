// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.test;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import mathtree.cli.FileAssetResolver;
import mathtree.util.condition.exception.IOExceptionCondition;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class FileAssetResolverTest {
    @TempDir
    Path root;

    private Path documents;

    @BeforeEach
    void writeImages() throws IOException {
        documents = Files.createDirectory(root.resolve("documents"));
        writePng(documents.resolve("plot.png"), 30, 20);
        Files.createDirectory(documents.resolve("images"));
        writePng(documents.resolve("images").resolve("frame.png"), 4, 5);
        writePng(root.resolve("secret.png"), 1, 1);
    }

    @Test
    void imagesNextToTheDocumentResolve() {
        try (final var recorder = new ConditionRecorder()) {
            final var resolver = new FileAssetResolver(documents);
            final var plot = resolver.resolve("plot.png");
            assertThat(plot).isNotNull();
            assertThat(plot.width()).isEqualTo(30);
            assertThat(plot.height()).isEqualTo(20);
            assertThat(plot.name()).isEqualTo("plot.png");
            final var frame = resolver.resolve("images/../images/frame.png");
            assertThat(frame).isNotNull();
            assertThat(frame.height()).isEqualTo(5);
            assertThat(recorder.conditions()).isEmpty();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"../secret.png", "images/../../secret.png"})
    void namesLeavingTheDirectoryAreRejected(final String fileName) {
        try (final var recorder = new ConditionRecorder()) {
            assertThat(new FileAssetResolver(documents).resolve(fileName)).isNull();
            final var conditions = recorder.conditionsOfType(IOExceptionCondition.class);
            assertThat(conditions).hasSize(1);
            assertThat(conditions.get(0).path()).isEqualTo(root.resolve("secret.png").toAbsolutePath().normalize());
        }
    }

    @Test
    void absoluteNamesAreRejected() {
        final var secret = root.resolve("secret.png").toAbsolutePath().toString();
        try (final var recorder = new ConditionRecorder()) {
            assertThat(new FileAssetResolver(documents).resolve(secret)).isNull();
            assertThat(recorder.conditionsOfType(IOExceptionCondition.class)).hasSize(1);
        }
    }

    @Test
    void unreadableImagesAreReported() throws IOException {
        Files.writeString(documents.resolve("broken.png"), "not an image");
        try (final var recorder = new ConditionRecorder()) {
            final var resolver = new FileAssetResolver(documents);
            assertThat(resolver.resolve("missing.png")).isNull();
            assertThat(resolver.resolve("broken.png")).isNull();
            assertThat(recorder.conditionsOfType(IOExceptionCondition.class)).hasSize(2);
        }
    }

    private static void writePng(final Path path, final int width, final int height) throws IOException {
        final var image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        assertThat(ImageIO.write(image, "png", path.toFile())).isTrue();
    }
}
