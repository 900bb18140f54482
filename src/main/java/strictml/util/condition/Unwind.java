// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable that carries control from {@link Restart#unwindTo()} back to the restart's establishing frame.
 * <p>
 * Public only so that methods can declare {@code throws Unwind}. Never catch it yourself, except to carry it across
 * a boundary that would otherwise swallow it.
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}: it is not a failure, just a non-local transfer of control.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    // Unwinds are never serialized.
    private final transient @NotNull Restart target;
}
