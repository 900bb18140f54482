// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type of everything that can be signaled.
 * <p>
 * A condition describes something that happened, with no commitment to what happens next: handlers run while the
 * signaling frame is still on the stack, and decide whether and where to unwind.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Returns the one-line, user-readable description of this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Returns the full user-readable description of this condition, possibly spanning several lines.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
