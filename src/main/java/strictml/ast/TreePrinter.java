// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.ast;

import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import strictml.util.UnreachableCodeReachedError;

/**
 * Renders a document as an indented outline, one node per line, for humans to read.
 * <p>
 * For example, {@code <p id="x">Hi</p>} becomes:
 * <pre>
 * Element p [id="x"]
 *   Text "Hi"
 * </pre>
 */
public final class TreePrinter {
    private TreePrinter() {
    }

    /**
     * Returns the outline of the given document. Every line, the last one included, ends with a line feed.
     */
    @CheckReturnValue
    public static String print(final Document document) {
        final var printer = new TreePrinter();
        printer.printNodes(document.nodes(), 0);
        return printer.builder.toString();
    }

    private void printNodes(final List<Node> nodes, final int depth) {
        for (final var node : nodes) {
            printNode(node, depth);
        }
    }

    private void printNode(final Node node, final int depth) {
        builder.append(indentation.repeat(depth));
        if (node instanceof final Node.Element element) {
            builder.append("Element ").append(element.name());
            if (!element.attributes().isEmpty()) {
                builder.append(" [");
                var first = true;
                for (final var attribute : element.attributes()) {
                    if (!first) {
                        builder.append(", ");
                    }
                    first = false;
                    builder.append(attribute.name());
                    if (!attribute.isBoolean()) {
                        builder.append('=');
                        appendQuoted(attribute.value());
                    }
                }
                builder.append(']');
            }
            builder.append('\n');
            printNodes(element.children(), depth + 1);
            return;
        }
        if (node instanceof final Node.Text text) {
            builder.append("Text ");
            appendQuoted(text.text());
        } else if (node instanceof final Node.Foreign foreign) {
            builder.append("Foreign ");
            appendQuoted(foreign.text());
        } else if (node instanceof final Node.Comment comment) {
            builder.append("Comment ");
            appendQuoted(comment.text());
        } else if (node instanceof final Node.Doctype doctype) {
            builder.append("Doctype ");
            appendQuoted(doctype.text());
        } else {
            throw new UnreachableCodeReachedError();
        }
        builder.append('\n');
    }

    private void appendQuoted(final String string) {
        builder.append('"');
        final var length = string.length();
        for (int i = 0; i < length; i += 1) {
            final var ch = string.charAt(i);
            switch (ch) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                case '\f' -> builder.append("\\f");
                default -> builder.append(ch);
            }
        }
        builder.append('"');
    }

    private static final String indentation = "  ";

    private final StringBuilder builder = new StringBuilder();
}
