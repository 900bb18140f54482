// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when control flow arrives somewhere the code's own invariants say it cannot.
 * <p>
 * This is always a bug in strictml itself, hence an {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
