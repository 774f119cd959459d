// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import mathtree.cell.Chain;
import mathtree.cell.Node;
import mathtree.markup.MarkupReader;
import mathtree.parser.MathParser;
import mathtree.parser.ParserSettings;
import mathtree.util.Trace;
import mathtree.util.annotation.Nullable;
import mathtree.util.condition.ConditionContext;
import mathtree.util.condition.Handler;
import mathtree.util.condition.exception.IOExceptionCondition;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        if (args.length < 1 || args.length > 2) {
            try (final var streams = Streams.acquire()) {
                streams.err().println("Expected arguments: <markup file> [settings file]");
                return ExitCode.USAGE;
            }
        }
        final var markupPath = Path.of(args[0]);
        final var settingsPath = (args.length == 2) ? Path.of(args[1]) : null;

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart(
                "abort-process",
                restart -> convert(markupPath, settingsPath));
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static ExitCode convert(final Path markupPath, final @Nullable Path settingsPath) {
        final var settings = (settingsPath != null) ? loadSettings(settingsPath) : ParserSettings.defaults();
        final var markup = readFile(markupPath);
        final var parent = markupPath.toAbsolutePath().getParent();
        final var directory = (parent != null) ? parent : Path.of("");
        final var parser = new MathParser(settings, new FileAssetResolver(directory));
        final @Nullable Node result;
        if (isWorksheet(markup)) {
            final var root = MarkupReader.read(markup);
            if (root == null) {
                return ExitCode.ERROR;
            }
            result = parser.parseDocument(root);
        } else {
            result = parser.parseLine(markup);
        }
        try (final var streams = Streams.acquire()) {
            streams.out().println(Chain.toString(result));
        }
        return ExitCode.SUCCESS;
    }

    private static boolean isWorksheet(final String markup) {
        return markup.contains("<" + WORKSHEET_ROOT);
    }

    private static ParserSettings loadSettings(final Path path) {
        try (final var trace = new Trace(() -> "Loading settings from " + path)) {
            trace.use();
            final var properties = new Properties();
            try (final var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(path, e));
            }
            return ParserSettings.fromProperties(properties);
        }
    }

    private static String readFile(final Path path) {
        try (final var trace = new Trace(() -> "Reading markup from " + path)) {
            trace.use();
            try {
                return Files.readString(path, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(path, e));
            }
        }
    }

    private static final String WORKSHEET_ROOT = "wxMaximaDocument";

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
