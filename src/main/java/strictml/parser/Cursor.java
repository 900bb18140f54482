// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.parser;

import java.util.Arrays;
import strictml.util.condition.ConditionContext;
import strictml.util.condition.UnhandledErrorError;

/**
 * A position in the source text, with lookahead and character classification.
 * <p>
 * The cursor only ever moves forward. It has no idea what it is scanning; all grammar decisions are made by
 * {@link HtmlParser}.
 * <p>
 * Characters are UTF-16 code units. Every character the grammar looks at is ASCII, and no code unit of a non-ASCII
 * character is in the ASCII range, so spans cut at ASCII delimiters never split a character.
 */
final class Cursor {
    Cursor(final String source) {
        this.source = source;
    }

    /**
     * Returns {@code true} iff there are no more characters.
     */
    boolean isAtEnd() {
        return position >= source.length();
    }

    /**
     * Returns the current character, or {@link #endOfInput} if there are no more.
     */
    int current() {
        return peek(0);
    }

    /**
     * Returns the character {@code distance} positions after the current one, or {@link #endOfInput} if that is past
     * the end.
     */
    int peek(final int distance) {
        final var index = position + distance;
        return (index < source.length()) ? source.charAt(index) : endOfInput;
    }

    /**
     * Returns {@code true} iff the current character is {@code ch}.
     */
    boolean currentIs(final char ch) {
        return current() == ch;
    }

    /**
     * Returns {@code true} iff the remaining input starts with {@code literal}.
     */
    boolean nextMatches(final String literal) {
        return source.startsWith(literal, position);
    }

    void advance() {
        position += 1;
    }

    void advanceBy(final int count) {
        position += count;
    }

    int offset() {
        return position;
    }

    String source() {
        return source;
    }

    /**
     * Returns the text from {@code start} up to, but not including, the current position.
     */
    String sliceFrom(final int start) {
        return source.substring(start, position);
    }

    void skipWhitespace() {
        while (isWhitespace(current())) {
            advance();
        }
    }

    /**
     * Signals a parse error unless the current character is {@code expected}. Does not advance.
     *
     * @param what What the expected character means at this point, such as {@code "end of opening tag"}.
     */
    void expect(final char expected, final String what) {
        if (!currentIs(expected)) {
            throw signalError("Expected " + what + " '" + expected + "', found '" + describeCurrent() + "'");
        }
    }

    /**
     * Describes the current character for error messages: the character itself, {@code [document end]}, or
     * {@code [control character 0xNN]} for characters that would not print.
     */
    String describeCurrent() {
        final var ch = current();
        if (ch == endOfInput) {
            return "[document end]";
        }
        if (isControl(ch)) {
            return String.format("[control character 0x%02x]", ch);
        }
        return new String(Character.toChars(source.codePointAt(position)));
    }

    /**
     * Signals a fatal {@link ParseErrorCondition} located at the current position.
     * <p>
     * Never returns normally. The declared return type lets call sites write {@code throw cursor.signalError(...)}.
     */
    UnhandledErrorError signalError(final String message) {
        throw ConditionContext.error(new ParseErrorCondition(ParseError.at(source, position, message)));
    }

    static boolean isWhitespace(final int ch) {
        return CharClass.of(ch) == CharClass.WHITESPACE;
    }

    static boolean isControl(final int ch) {
        return CharClass.of(ch) == CharClass.CONTROL;
    }

    static boolean isAlphanumeric(final int ch) {
        return CharClass.of(ch) == CharClass.ALPHANUMERIC;
    }

    /**
     * The value returned by {@link #current()} and {@link #peek(int)} past the end of input. Never equal to a
     * {@code char}.
     */
    static final int endOfInput = -1;

    private final String source;
    private int position = 0;

    private enum CharClass {
        OTHER,
        WHITESPACE,
        CONTROL,
        ALPHANUMERIC,
        END;

        private static CharClass of(final int ch) {
            if (ch == endOfInput) {
                return END;
            }
            return (ch < asciiClasses.length) ? asciiClasses[ch] : OTHER;
        }

        private static final CharClass[] asciiClasses;

        static {
            final var classes = new CharClass[128];
            Arrays.fill(classes, OTHER);
            Arrays.fill(classes, 0x00, 0x20, CONTROL);
            classes[0x7F] = CONTROL;
            classes[' '] = WHITESPACE;
            classes['\n'] = WHITESPACE;
            classes['\r'] = WHITESPACE;
            classes['\t'] = WHITESPACE;
            classes['\f'] = WHITESPACE;
            Arrays.fill(classes, '0', '9' + 1, ALPHANUMERIC);
            Arrays.fill(classes, 'A', 'Z' + 1, ALPHANUMERIC);
            Arrays.fill(classes, 'a', 'z' + 1, ALPHANUMERIC);
            asciiClasses = classes;
        }
    }
}
