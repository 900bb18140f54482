// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The immutable syntax tree produced by {@link strictml.parser.HtmlParser}, and ways to turn it back into text.
 */
@NonNullByDefault
package strictml.ast;

import strictml.util.annotation.NonNullByDefault;
