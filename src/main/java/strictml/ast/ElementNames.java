// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.ast;

import java.util.List;
import strictml.util.Ascii;

/**
 * The fixed element categories that change how an element is parsed and serialized.
 * <p>
 * Membership is tested ignoring ASCII case, so {@code BR} is as void as {@code br}.
 */
public final class ElementNames {
    private ElementNames() {
    }

    /**
     * Returns {@code true} iff {@code name} names a void element: one that never has children nor a closing tag.
     */
    public static boolean isVoid(final String name) {
        return containsIgnoreCase(voidElements, name);
    }

    /**
     * Returns {@code true} iff {@code name} names a foreign element, whose body is kept as raw text up to the matching
     * closing tag instead of being parsed as HTML.
     */
    public static boolean isForeign(final String name) {
        return containsIgnoreCase(foreignElements, name);
    }

    private static boolean containsIgnoreCase(final List<String> names, final String name) {
        for (final var candidate : names) {
            if (Ascii.equalsIgnoreCase(candidate, name)) {
                return true;
            }
        }
        return false;
    }

    private static final List<String> voidElements = List.of(
        "area", "base", "br", "col", "command", "embed", "hr", "img",
        "input", "keygen", "link", "meta", "param", "source", "track", "wbr"
    );
    private static final List<String> foreignElements = List.of("script", "style", "title", "textarea", "svg", "math");
}
