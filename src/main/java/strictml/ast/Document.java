// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.ast;

import java.util.List;

/**
 * A parsed HTML document: the top-level nodes, in source order.
 * <p>
 * A document may be empty. Top-level nodes are never {@link Node.Text} nor {@link Node.Foreign}.
 */
public record Document(List<Node> nodes) {
    public Document {
        nodes = List.copyOf(nodes);
    }
}
