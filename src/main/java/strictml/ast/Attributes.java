// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.ast;

import java.util.List;
import strictml.util.annotation.Nullable;

/**
 * Operations on lists of attributes.
 */
public final class Attributes {
    private Attributes() {
    }

    /**
     * Returns the attribute with the given name, or {@code null} if no such attribute is present.
     * <p>
     * Names are compared case-sensitively: {@code href} and {@code HREF} are different attributes.
     */
    public static @Nullable Attribute get(final List<Attribute> attributes, final String name) {
        for (final var attribute : attributes) {
            if (name.equals(attribute.name())) {
                return attribute;
            }
        }
        return null;
    }

    /**
     * Returns {@code true} iff an attribute with the given name is present, compared case-sensitively.
     */
    public static boolean contains(final List<Attribute> attributes, final String name) {
        return get(attributes, name) != null;
    }
}
