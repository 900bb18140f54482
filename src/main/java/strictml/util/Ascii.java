// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.util;

/**
 * ASCII-only case-insensitive comparisons.
 * <p>
 * HTML folds case only in the ASCII range. {@link String#equalsIgnoreCase(String)} folds more than that, for example
 * it considers U+017F LATIN SMALL LETTER LONG S equal to {@code s}, so it cannot be used for tag names.
 */
public final class Ascii {
    private Ascii() {
    }

    /**
     * Returns the lowercase equivalent of {@code ch} if it is an ASCII uppercase letter, or {@code ch} unchanged.
     */
    public static char toLowerCase(final char ch) {
        return (ch >= 'A' && ch <= 'Z') ? (char) (ch + ('a' - 'A')) : ch;
    }

    /**
     * Returns {@code true} iff the two strings are equal once ASCII letters are folded to lowercase.
     */
    public static boolean equalsIgnoreCase(final String a, final String b) {
        return a.length() == b.length() && regionEqualsIgnoreCase(a, 0, b);
    }

    /**
     * Returns {@code true} iff {@code string} contains {@code expected} at {@code offset}, ignoring ASCII case.
     * <p>
     * A region extending past the end of {@code string} never matches.
     */
    public static boolean regionEqualsIgnoreCase(final String string, final int offset, final String expected) {
        final var length = expected.length();
        if (offset < 0 || offset > string.length() - length) {
            return false;
        }
        for (int i = 0; i < length; i += 1) {
            if (toLowerCase(string.charAt(offset + i)) != toLowerCase(expected.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
