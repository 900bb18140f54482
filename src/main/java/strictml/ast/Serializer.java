// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.ast;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import strictml.util.UnreachableCodeReachedError;

/**
 * The tree-to-HTML serializer.
 * <p>
 * Spans are written back verbatim, since the parser never decodes them. Parsing the output of this serializer yields
 * a document equal to the serialized one, as long as the document could have come out of the parser in the first
 * place.
 */
public final class Serializer {
    private Serializer(final Appendable output) {
        this.output = output;
    }

    /**
     * Serializes the document to a string.
     */
    @CheckReturnValue
    public static String serialize(final Document document) {
        final var builder = new StringBuilder();
        try {
            serialize(builder, document);
        } catch (final IOException e) {
            // StringBuilder never throws.
            throw new UncheckedIOException(e);
        }
        return builder.toString();
    }

    /**
     * Serializes the document, appending the output to {@code output}.
     * <p>
     * Any {@link IOException}s thrown by the output are allowed to propagate.
     */
    public static void serialize(final Appendable output, final Document document) throws IOException {
        final var serializer = new Serializer(output);
        serializer.serializeNodes(document.nodes());
    }

    private void serializeNodes(final List<Node> nodes) throws IOException {
        for (final var node : nodes) {
            serializeNode(node);
        }
    }

    private void serializeNode(final Node node) throws IOException {
        if (node instanceof final Node.Element element) {
            serializeElement(element);
        } else if (node instanceof final Node.Text text) {
            output.append(text.text());
        } else if (node instanceof final Node.Foreign foreign) {
            output.append(foreign.text());
        } else if (node instanceof final Node.Comment comment) {
            output.append("<!--").append(comment.text()).append("-->");
        } else if (node instanceof final Node.Doctype doctype) {
            output.append("<!DOCTYPE");
            if (!doctype.text().isEmpty()) {
                output.append(' ').append(doctype.text());
            }
            output.append('>');
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void serializeElement(final Node.Element element) throws IOException {
        output.append('<').append(element.name());
        for (final var attribute : element.attributes()) {
            serializeAttribute(attribute);
        }
        output.append('>');
        if (ElementNames.isVoid(element.name())) {
            return;
        }
        serializeNodes(element.children());
        output.append("</").append(element.name()).append('>');
    }

    private void serializeAttribute(final Attribute attribute) throws IOException {
        output.append(' ').append(attribute.name());
        if (attribute.isBoolean()) {
            return;
        }
        final var value = attribute.value();
        // The parser never produces a value with both kinds of quotes, only hand-built trees can have one.
        final var quote = (value.indexOf('"') < 0) ? '"' : '\'';
        output.append('=').append(quote);
        if (value.indexOf(quote) < 0) {
            output.append(value);
        } else {
            output.append(value.replace("'", "&#39;"));
        }
        output.append(quote);
    }

    private final Appendable output;
}
