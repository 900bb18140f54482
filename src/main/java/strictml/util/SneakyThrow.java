// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.util;

import org.jetbrains.annotations.NotNull;

/**
 * Throwing checked throwables without declaring them.
 * <p>
 * Only used for {@link strictml.util.condition.Unwind}, which is a {@link Throwable} that nearly every method in the
 * parser could throw, so declaring it everywhere would be pure noise.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} as if it were unchecked.
     * <p>
     * Never returns normally. The declared return type lets call sites write {@code throw SneakyThrow.doThrow(t)}, so
     * that the compiler knows the statement does not complete.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast vanishes at run time, while the compiler infers E as RuntimeException at
    // the call in doThrow.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
