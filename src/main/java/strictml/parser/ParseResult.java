// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.parser;

import strictml.ast.Document;
import strictml.util.annotation.Nullable;

/**
 * The outcome of {@link HtmlParser#tryParse(String)}: either a whole document or the first error, never both.
 */
public sealed interface ParseResult {
    /**
     * Returns the parsed document, or {@code null} if parsing failed.
     */
    @Nullable Document documentOrNull();

    /**
     * Returns the error, or {@code null} if parsing succeeded.
     */
    @Nullable ParseError errorOrNull();

    /**
     * Parsing succeeded.
     */
    record Parsed(Document document) implements ParseResult {
        @Override
        public Document documentOrNull() {
            return document;
        }

        @Override
        public @Nullable ParseError errorOrNull() {
            return null;
        }
    }

    /**
     * Parsing failed.
     */
    record Failed(ParseError error) implements ParseResult {
        @Override
        public @Nullable Document documentOrNull() {
            return null;
        }

        @Override
        public ParseError errorOrNull() {
            return error;
        }
    }
}
