// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The command line front end: parses HTML files and prints their trees.
 */
@NonNullByDefault
package strictml.cli;

import strictml.util.annotation.NonNullByDefault;
