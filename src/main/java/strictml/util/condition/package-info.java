// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A small condition and restart system in the spirit of Common Lisp's.
 * <p>
 * Failures are signaled as {@link strictml.util.condition.Condition}s. Handlers see them before anything unwinds, and
 * pick where to resume by unwinding to a {@link strictml.util.condition.Restart}.
 */
@NonNullByDefault
package strictml.util.condition;

import strictml.util.annotation.NonNullByDefault;
