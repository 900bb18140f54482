// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.parser;

/**
 * A human-readable position in the source text.
 *
 * @param line   The 1-based line number.
 * @param column The 1-based column within the line, counted in UTF-16 code units.
 */
public record SourcePosition(int line, int column) {
    /**
     * Returns the position of the character at {@code offset} in {@code source}.
     * <p>
     * Lines are separated by line feeds only; a carriage return counts as an ordinary character.
     */
    public static SourcePosition of(final String source, final int offset) {
        if (offset < 0 || offset > source.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside of source of length " + source.length());
        }
        var line = 1;
        var lastLineFeed = -1;
        for (int i = 0; i < offset; i += 1) {
            if (source.charAt(i) == '\n') {
                line += 1;
                lastLineFeed = i;
            }
        }
        return new SourcePosition(line, offset - lastLineFeed);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
