// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import strictml.ast.Document;
import strictml.ast.Serializer;
import strictml.ast.TreePrinter;
import strictml.parser.HtmlParser;
import strictml.util.Trace;
import strictml.util.annotation.Nullable;
import strictml.util.condition.ConditionContext;
import strictml.util.condition.Handler;
import strictml.util.condition.exception.IOExceptionCondition;

/**
 * The entry point of the {@code strictml} command.
 * <pre>
 * strictml [--tree | --html] &lt;file&gt;...
 * </pre>
 * Each file is read as UTF-8 and parsed. With {@code --tree}, the default, its tree is printed as an outline; with
 * {@code --html}, it is serialized back to HTML. Files that fail to parse are reported on standard error and skipped.
 */
public final class Main {
    private Main() {
    }

    @SuppressWarnings("UseOfSystemOutOrSystemErr")
    public static void main(final String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the command with the given arguments and streams, returning the process exit code: 0 if every file was
     * parsed, 1 if any failed, 64 on a usage error.
     */
    public static int run(final String[] args, final PrintStream out, final PrintStream err) {
        return runImpl(args, out, err).value;
    }

    private static ExitCode runImpl(final String[] args, final PrintStream out, final PrintStream err) {
        final var invocation = Invocation.parse(args);
        if (invocation == null) {
            err.println("Usage: strictml [--tree | --html] <file>...");
            return ExitCode.USAGE;
        }

        try (final var handler = new Handler(new FallbackHandler(err))) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                var allParsed = true;
                for (final var path : invocation.paths()) {
                    allParsed &= processFile(path, invocation.format(), out);
                }
                return allParsed ? ExitCode.SUCCESS : ExitCode.ERROR;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static boolean processFile(final Path path, final OutputFormat format, final PrintStream out) {
        final var processed = ConditionContext.withRestart("skip-file", restart -> {
            try (final var trace = new Trace(() -> "Processing " + path)) {
                trace.use();
                final var document = HtmlParser.parse(readFile(path));
                out.print(format.render(document));
                return Boolean.TRUE;
            }
        });
        return processed != null;
    }

    private static String readFile(final Path path) {
        try (final var trace = new Trace(() -> "Reading " + path)) {
            trace.use();
            try {
                return Files.readString(path, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    private enum OutputFormat {
        TREE {
            @Override
            String render(final Document document) {
                return TreePrinter.print(document);
            }
        },
        HTML {
            @Override
            String render(final Document document) {
                return Serializer.serialize(document) + '\n';
            }
        };

        abstract String render(Document document);
    }

    private record Invocation(OutputFormat format, List<Path> paths) {
        private static @Nullable Invocation parse(final String[] args) {
            var format = OutputFormat.TREE;
            final var paths = new ArrayList<Path>();
            var optionsEnded = false;
            for (final var arg : args) {
                if (!optionsEnded && arg.startsWith("--")) {
                    switch (arg) {
                        case "--tree" -> format = OutputFormat.TREE;
                        case "--html" -> format = OutputFormat.HTML;
                        case "--" -> optionsEnded = true;
                        default -> {
                            return null;
                        }
                    }
                } else {
                    paths.add(Path.of(arg));
                }
            }
            return paths.isEmpty() ? null : new Invocation(format, List.copyOf(paths));
        }
    }

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
