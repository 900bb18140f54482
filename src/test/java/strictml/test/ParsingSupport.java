// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.test;

import java.util.List;
import java.util.Objects;
import strictml.ast.Attribute;
import strictml.ast.Document;
import strictml.ast.Node;
import strictml.parser.HtmlParser;
import strictml.parser.ParseError;
import static org.assertj.core.api.Assertions.assertThat;

final class ParsingSupport {
    private ParsingSupport() {
    }

    static Document parseSuccessfully(final String source) {
        final var result = HtmlParser.tryParse(source);
        assertThat(result.errorOrNull()).as("parse error for %s", source).isNull();
        return Objects.requireNonNull(result.documentOrNull());
    }

    static ParseError parseFailing(final String source) {
        final var result = HtmlParser.tryParse(source);
        assertThat(result.documentOrNull()).as("document for %s", source).isNull();
        return Objects.requireNonNull(result.errorOrNull());
    }

    static Node.Element element(final String name, final List<Attribute> attributes, final Node... children) {
        return new Node.Element(name, attributes, List.of(children));
    }

    static Node.Element element(final String name, final Node... children) {
        return new Node.Element(name, List.of(), List.of(children));
    }

    static Document document(final Node... nodes) {
        return new Document(List.of(nodes));
    }
}
