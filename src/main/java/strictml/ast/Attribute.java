// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.ast;

/**
 * An element attribute.
 * <p>
 * Boolean attributes, written without {@code =}, have an empty value. An attribute written as {@code name=""} is
 * indistinguishable from one.
 *
 * @param name  The attribute name, case preserved.
 * @param value The attribute value, without quotes.
 */
public record Attribute(String name, String value) {
    /**
     * Returns {@code true} iff the value is empty, as it is for attributes written without a value.
     */
    public boolean isBoolean() {
        return value.isEmpty();
    }
}
