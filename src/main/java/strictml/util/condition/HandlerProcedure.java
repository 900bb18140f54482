// Copyright © 2021  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The code run by a {@link Handler} for each signaled condition.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Reacts to the given condition.
     * <p>
     * Returning normally declines the condition and lets older handlers see it. Handling it means leaving
     * non-locally, usually with {@link Restart#unwindTo()}, which throws {@link Unwind} without declaring it.
     */
    void handle(@NotNull Condition condition);
}
