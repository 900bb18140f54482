// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import strictml.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The per-thread registry of active handlers and restarts.
 * <p>
 * Instances are never exposed: the static methods operate on the calling thread's context. Nothing is shared between
 * threads, so independent threads may signal and handle conditions concurrently.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Offers the condition to the active handlers, newest first.
     * <p>
     * A handler may unwind to a restart, in which case this method throws {@link Unwind} without declaring it. If
     * every handler declines, throws {@link UnhandledErrorError}. Never returns normally; the declared return type
     * exists so that call sites can write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().signal(condition);
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs {@code callback} with a new restart named {@code restartName} established around it.
     *
     * @return The value returned by {@code callback}, or {@code null} if something unwound to the restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the calling thread's active restarts, newest first.
     */
    public static @NotNull Iterable<@NotNull Restart> restarts() {
        return localContext().new RestartIterable();
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final @NotNull Condition condition) {
        for (var handler = findFirstHandler(); handler != null; handler = handler.next) {
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler findFirstHandler() {
        // A condition signaled from inside a handler only reaches handlers older than that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);

    private final class RestartIterable implements Iterable<@NotNull Restart> {
        @Override
        public @NotNull Iterator<@NotNull Restart> iterator() {
            return new RestartIterator(firstRestart);
        }
    }

    private static final class RestartIterator implements Iterator<@NotNull Restart> {
        private RestartIterator(final @Nullable Restart firstRestart) {
            current = firstRestart;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NotNull Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
