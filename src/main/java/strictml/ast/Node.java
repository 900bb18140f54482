// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.ast;

import java.util.List;
import strictml.util.annotation.Nullable;

/**
 * The base interface for syntax tree nodes.
 * <p>
 * Nodes are immutable. Every string they hold is a span of the parsed source, exactly as written: nothing is decoded,
 * unescaped or normalized.
 */
public sealed interface Node {
    /**
     * A {@code <!DOCTYPE ...>} declaration.
     *
     * @param text Everything between the keyword and the closing {@code >}, minus the leading whitespace.
     */
    record Doctype(String text) implements Node {
    }

    /**
     * A {@code <!--...-->} comment.
     *
     * @param text The comment body, without delimiters. Never contains {@code --}.
     */
    record Comment(String text) implements Node {
    }

    /**
     * A run of character data between tags. Never contains {@code <} nor control characters.
     */
    record Text(String text) implements Node {
    }

    /**
     * The raw body of a foreign element, such as the source code inside {@code <script>}.
     */
    record Foreign(String text) implements Node {
    }

    /**
     * An element, with its attributes and children.
     * <p>
     * Void elements have no children. Foreign elements have exactly one child, a {@link Foreign} node.
     *
     * @param name       The tag name as written in the opening tag, case preserved.
     * @param attributes The attributes in source order; no two have the same name.
     * @param children   The child nodes in source order.
     */
    record Element(String name, List<Attribute> attributes, List<Node> children) implements Node {
        public Element {
            attributes = List.copyOf(attributes);
            children = List.copyOf(children);
        }

        /**
         * Returns the attribute with exactly the given name, or {@code null} if this element has none.
         */
        public @Nullable Attribute attribute(final String name) {
            return Attributes.get(attributes, name);
        }
    }
}
