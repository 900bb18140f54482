// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.parser;

/**
 * A description of why parsing failed, and where.
 * <p>
 * Offsets and columns count UTF-16 code units, as {@link String} indices do, not bytes of any encoding. They match
 * UTF-8 byte counts only while the text before the error is ASCII: in {@code "<p>\u00e9\n\u00e9<q></p>"} the
 * error is at column 8, where a byte-based column would be 9.
 *
 * @param message  The user-readable reason, without location information.
 * @param offset   The index in the source, in UTF-16 code units, where the failing rule gave up.
 * @param position The line and column corresponding to {@code offset}.
 */
public record ParseError(String message, int offset, SourcePosition position) {
    /**
     * Creates a parse error at the given offset of the given source, computing its line and column.
     */
    public static ParseError at(final String source, final int offset, final String message) {
        return new ParseError(message, offset, SourcePosition.of(source, offset));
    }

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    /**
     * Returns the error in the form {@code [line:column] message}.
     */
    @Override
    public String toString() {
        return "[" + position + "] " + message;
    }
}
