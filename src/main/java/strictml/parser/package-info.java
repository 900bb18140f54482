// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The strict HTML parser.
 * <p>
 * {@link strictml.parser.HtmlParser} turns a complete in-memory HTML string into a {@link strictml.ast.Document}, or
 * reports the first syntax error with its line and column. There is no error recovery: malformed input is rejected,
 * never repaired.
 */
@NonNullByDefault
package strictml.parser;

import strictml.util.annotation.NonNullByDefault;
