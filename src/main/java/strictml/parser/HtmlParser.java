// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import strictml.ast.Attribute;
import strictml.ast.Attributes;
import strictml.ast.Document;
import strictml.ast.ElementNames;
import strictml.ast.Node;
import strictml.util.Ascii;
import strictml.util.Trace;
import strictml.util.UnreachableCodeReachedError;
import strictml.util.condition.ConditionContext;
import strictml.util.condition.Handler;
import strictml.util.condition.UnhandledErrorError;

/**
 * The HTML parser: a recursive descent parser over a subset of HTML syntax, with no error recovery.
 * <p>
 * The grammar, informally:
 * <pre>
 * document   = strictNode* ;
 * strictNode = doctype | comment | element ;
 * node       = strictNode | text ;
 * doctype    = "&lt;!DOCTYPE" ANYTHING "&gt;" ;
 * comment    = "&lt;!--" TEXT "--&gt;" ;
 * element    = "&lt;" NAME attribute* "/"? "&gt;"                              (void elements)
 *            | "&lt;" NAME attribute* "&gt;" FOREIGN "&lt;/" NAME "&gt;"             (foreign elements)
 *            | "&lt;" NAME attribute* "&gt;" node* "&lt;/" NAME "&gt;" ;
 * attribute  = KEY ( "=" ( QUOTED_VALUE | UNQUOTED_VALUE ) )? ;
 * </pre>
 * Tag names are matched ignoring ASCII case; attribute names are compared case-sensitively.
 * <p>
 * A parser instance handles a single source string and is used by a single thread. The static entry points create
 * one per call, so they may be called concurrently.
 */
public final class HtmlParser {
    private HtmlParser(final String source, final int maxDepth) {
        cursor = new Cursor(source);
        this.maxDepth = maxDepth;
    }

    /**
     * Parses the given source into a document, allowing elements to nest up to {@link #defaultMaxDepth} deep.
     *
     * @see #parse(String, int)
     */
    public static Document parse(final String source) {
        return parse(source, defaultMaxDepth);
    }

    /**
     * Parses the given source into a document.
     * <p>
     * If the source is malformed, a fatal {@link ParseErrorCondition} describing the first error is signaled. The
     * caller is expected to have established a handler that unwinds; use {@link #tryParse(String, int)} to get the
     * error as a value instead.
     *
     * @param maxDepth How deep elements may nest before the parse fails. Must be between 1 and
     *                 {@link #maxSupportedDepth}, since each level of nesting takes stack space.
     */
    public static Document parse(final String source, final int maxDepth) {
        if (maxDepth <= 0 || maxDepth > maxSupportedDepth) {
            throw new IllegalArgumentException(
                "Maximum nesting depth must be between 1 and " + maxSupportedDepth + ", got " + maxDepth);
        }
        try (final var trace = new Trace(() -> "Parsing an HTML document of " + source.length() + " characters")) {
            trace.use();
            return new HtmlParser(source, maxDepth).document();
        }
    }

    /**
     * Parses the given source, returning either the document or the first error, allowing elements to nest up to
     * {@link #defaultMaxDepth} deep.
     *
     * @see #tryParse(String, int)
     */
    public static ParseResult tryParse(final String source) {
        return tryParse(source, defaultMaxDepth);
    }

    /**
     * Parses the given source, returning either the document or the first error.
     * <p>
     * The parse runs under a handler that turns the {@link ParseErrorCondition} into a {@link ParseResult.Failed}.
     * Conditions of other types are left to the caller's handlers.
     */
    public static ParseResult tryParse(final String source, final int maxDepth) {
        final var error = new AtomicReference<ParseError>();
        final var document = ConditionContext.withRestart("abandon-parse", restart -> {
            try (final var handler = new Handler(condition -> {
                if (condition instanceof final ParseErrorCondition parseErrorCondition) {
                    error.set(parseErrorCondition.error());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                return parse(source, maxDepth);
            }
        });
        if (document != null) {
            return new ParseResult.Parsed(document);
        }
        final var parseError = error.get();
        if (parseError == null) {
            throw new UnreachableCodeReachedError("Parse abandoned without a parse error");
        }
        return new ParseResult.Failed(parseError);
    }

    private Document document() {
        final var nodes = new ArrayList<Node>();
        while (true) {
            cursor.skipWhitespace();
            if (cursor.isAtEnd()) {
                break;
            }
            nodes.add(strictNode());
        }
        return new Document(nodes);
    }

    private Node strictNode() {
        cursor.skipWhitespace();
        cursor.expect('<', "start of a node");
        final var next = cursor.peek(1);
        if (next == Cursor.endOfInput) {
            throw cursor.signalError("Expected something after start of node");
        }
        if (next != '!') {
            return element();
        }
        if (cursor.peek(2) == '-') {
            return comment();
        }
        if (!Ascii.regionEqualsIgnoreCase(cursor.source(), cursor.offset() + 2, "DOCTYPE")) {
            throw cursor.signalError("Expected doctype declaration or comment");
        }
        return doctypeDeclaration();
    }

    private Node node() {
        if (!cursor.currentIs('<')) {
            return text();
        }
        return strictNode();
    }

    private Node.Element element() {
        currentDepth += 1;
        try {
            if (currentDepth > maxDepth) {
                throw cursor.signalError("Element nesting limit reached, try to limit nesting");
            }

            cursor.advance();
            final var name = alphanumeric();
            cursor.skipWhitespace();

            final var attributes = new ArrayList<Attribute>();
            while (!cursor.currentIs('>') && !cursor.currentIs('/')) {
                final var attribute = attribute();
                if (Attributes.contains(attributes, attribute.name())) {
                    throw cursor.signalError("Element has two attributes with the same name");
                }
                attributes.add(attribute);
                cursor.skipWhitespace();
            }

            if (ElementNames.isVoid(name)) {
                if (cursor.currentIs('/')) {
                    cursor.advance();
                }
                cursor.expect('>', "end of opening tag");
                cursor.advance();
                return new Node.Element(name, attributes, List.of());
            }

            // Only void elements may self-close, so a '/' here fails.
            cursor.expect('>', "end of opening tag");
            cursor.advance();

            final var children = new ArrayList<Node>();
            if (ElementNames.isForeign(name)) {
                children.add(foreignText(name));
            } else {
                while (!cursor.nextMatches("</")) {
                    if (cursor.isAtEnd() || cursor.peek(1) == Cursor.endOfInput) {
                        throw cursor.signalError("Expected matching closing tag for " + name);
                    }
                    children.add(node());
                }
            }

            cursor.advanceBy(2);
            final var closingName = alphanumeric();
            if (!Ascii.equalsIgnoreCase(closingName, name)) {
                throw cursor.signalError(
                    "Mismatched closing tag: Expected '" + name + "', found '" + closingName + "'");
            }
            cursor.skipWhitespace();
            cursor.expect('>', "end of closing tag");
            cursor.advance();

            return new Node.Element(name, attributes, children);
        } finally {
            currentDepth -= 1;
        }
    }

    private Attribute attribute() {
        final var nameStart = cursor.offset();
        while (!isAttributeNameTerminator(cursor.current())) {
            cursor.advance();
        }
        if (cursor.offset() == nameStart) {
            throw cursor.signalError("Expected attribute name");
        }
        final var name = cursor.sliceFrom(nameStart);
        if (Cursor.isControl(cursor.current())) {
            throw signalUnexpectedControlCharacter();
        }

        cursor.skipWhitespace();
        if (cursor.isAtEnd()) {
            throw cursor.signalError("Expected something after attribute name");
        }
        if (!cursor.currentIs('=')) {
            return new Attribute(name, "");
        }

        cursor.advance();
        final var first = cursor.current();
        if (first == Cursor.endOfInput) {
            throw cursor.signalError("Expected attribute value after =");
        }
        if (first == '"' || first == '\'') {
            final var quote = (char) first;
            cursor.advance();
            final var valueStart = cursor.offset();
            while (!cursor.isAtEnd() && !Cursor.isControl(cursor.current()) && !cursor.currentIs(quote)) {
                cursor.advance();
            }
            cursor.expect(quote, "value-ending quote");
            final var value = cursor.sliceFrom(valueStart);
            cursor.advance();
            return new Attribute(name, value);
        }
        final var valueStart = cursor.offset();
        while (!isUnquotedValueTerminator(cursor.current())) {
            cursor.advance();
        }
        return new Attribute(name, cursor.sliceFrom(valueStart));
    }

    private Node.Text text() {
        final var start = cursor.offset();
        while (!cursor.isAtEnd() && !cursor.currentIs('<') && !Cursor.isControl(cursor.current())) {
            cursor.advance();
        }
        if (cursor.offset() == start && Cursor.isControl(cursor.current())) {
            throw signalUnexpectedControlCharacter();
        }
        return new Node.Text(cursor.sliceFrom(start));
    }

    private Node.Foreign foreignText(final String elementName) {
        final var start = cursor.offset();
        final var source = cursor.source();
        while (!cursor.isAtEnd()) {
            if (cursor.nextMatches("</")
                && Ascii.regionEqualsIgnoreCase(source, cursor.offset() + 2, elementName)) {
                break;
            }
            cursor.advance();
        }
        if (cursor.isAtEnd()) {
            throw cursor.signalError("Expected closing tag </" + elementName + ">");
        }
        return new Node.Foreign(cursor.sliceFrom(start));
    }

    private Node.Comment comment() {
        // Skip "<!-", then require the second '-'.
        cursor.advanceBy(3);
        cursor.expect('-', "second - in comment declaration");
        cursor.advance();

        if (cursor.currentIs('>') || cursor.currentIs('-')) {
            throw cursor.signalError("Comments may not start with '>' or '->'");
        }

        final var start = cursor.offset();
        while (!cursor.isAtEnd()) {
            if (cursor.nextMatches("--")) {
                if (cursor.peek(2) == '>') {
                    break;
                }
                throw cursor.signalError("Comments may not contain '--'");
            }
            if (Cursor.isControl(cursor.current())) {
                throw signalUnexpectedControlCharacter();
            }
            cursor.advance();
        }
        if (cursor.isAtEnd()) {
            throw cursor.signalError("Expected comment tag closer '-->'");
        }
        final var text = cursor.sliceFrom(start);
        cursor.advanceBy(3);
        return new Node.Comment(text);
    }

    private Node.Doctype doctypeDeclaration() {
        // Skip "<!DOCTYPE", already matched by the caller.
        cursor.advanceBy(9);
        cursor.skipWhitespace();

        // The declaration's content is not interpreted.
        final var start = cursor.offset();
        while (!cursor.isAtEnd() && !cursor.currentIs('>')) {
            cursor.advance();
        }
        if (cursor.isAtEnd()) {
            throw cursor.signalError("Expected DOCTYPE tag closer '>'");
        }
        final var text = cursor.sliceFrom(start);
        cursor.advance();
        return new Node.Doctype(text);
    }

    private String alphanumeric() {
        if (!Cursor.isAlphanumeric(cursor.current())) {
            throw cursor.signalError("Expected alphanumeric, found '" + cursor.describeCurrent() + "'");
        }
        final var start = cursor.offset();
        while (Cursor.isAlphanumeric(cursor.current())) {
            cursor.advance();
        }
        return cursor.sliceFrom(start);
    }

    private UnhandledErrorError signalUnexpectedControlCharacter() {
        throw cursor.signalError("Unexpected control character " + cursor.describeCurrent());
    }

    private static boolean isAttributeNameTerminator(final int ch) {
        return switch (ch) {
            case Cursor.endOfInput, '"', '\'', '>', '/', '=' -> true;
            default -> Cursor.isWhitespace(ch) || Cursor.isControl(ch);
        };
    }

    private static boolean isUnquotedValueTerminator(final int ch) {
        return switch (ch) {
            case Cursor.endOfInput, '"', '\'', '=', '>', '<', '`' -> true;
            default -> Cursor.isWhitespace(ch) || Cursor.isControl(ch);
        };
    }

    /**
     * The nesting depth allowed by the entry points that do not take one.
     */
    public static final int defaultMaxDepth = 512;

    /**
     * The largest nesting depth callers may ask for. Deeper recursion risks overflowing the stack of a thread with the
     * default stack size.
     */
    public static final int maxSupportedDepth = 1024;

    private final Cursor cursor;
    private final int maxDepth;
    private int currentDepth = 0;
}
