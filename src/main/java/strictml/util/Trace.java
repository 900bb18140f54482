// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import strictml.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable description of the operation in progress, established with try-with-resources.
 * <p>
 * Traces form a per-thread chain, newest first. They are what gets printed when a fatal condition reaches the
 * command line front end, so they should say what the program was doing ("Parsing index.html"), not how.
 * <p>
 * A trace belongs to the thread that created it and must be closed by that thread.
 */
public final class Trace implements AutoCloseable {
    /**
     * Establishes a trace whose message is computed on first use, if ever.
     */
    public Trace(final MessageSupplier supplier) {
        final var context = localContext();
        next = context.firstTrace;
        this.supplier = supplier;
        ownerContext = context;
        context.firstTrace = this;
    }

    /**
     * Returns the messages of the calling thread's active traces, most recently established first.
     */
    public static Iterable<String> activeTraces() {
        return IterableImpl.instance;
    }

    /**
     * Does nothing. Call it in the try-with-resources body to keep the compiler from flagging the trace as unused.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Removes this trace from the calling thread's chain.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.firstTrace == this : "Trace chain corrupt";
        ownerContext.firstTrace = next;
    }

    private String message() {
        var result = message;
        if (result == null) {
            result = supplier.get();
            message = result;
        }
        return result;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never yields null.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    private final MessageSupplier supplier;
    private @Nullable String message = null;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace firstTrace = null;
    }

    private static final class IterableImpl implements Iterable<String> {
        @Override
        public @NonNull Iterator<String> iterator() {
            return new IteratorImpl(localContext().firstTrace);
        }

        private static final IterableImpl instance = new IterableImpl();
    }

    private static final class IteratorImpl implements Iterator<String> {
        private IteratorImpl(final @Nullable Trace firstTrace) {
            current = firstTrace;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public String next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = result.next;
            return result.message();
        }

        private @Nullable Trace current;
    }
}
