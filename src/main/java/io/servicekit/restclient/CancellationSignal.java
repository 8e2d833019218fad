package io.servicekit.restclient;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Caller-owned flag that aborts asynchronous calls. A call checks the signal before every attempt and at every retry
 * boundary, and a cancellation arriving while an attempt or a backoff pause is pending aborts that wait immediately.
 * One signal may be shared by several calls, for example all outbound calls made on behalf of one inbound request.
 */
public final class CancellationSignal {

    private static final Logger LOGGER = Logger.getLogger(CancellationSignal.class.getName());
    private static final Registration NO_REGISTRATION = () -> {
    };
    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(true);
    }

    /**
     * @return a signal that is never cancelled.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    /**
     * Returns a signal that cancels itself once {@code deadline} has elapsed, for callers working within a deadline
     * budget of their own.
     */
    public static CancellationSignal after(Duration deadline) {
        Objects.requireNonNull(deadline, "deadline");
        CancellationSignal signal = create();
        if (deadline.isZero() || deadline.isNegative()) {
            signal.cancel();
            return signal;
        }
        CompletableFuture.delayedExecutor(deadline.toNanos(), TimeUnit.NANOSECONDS).execute(signal::cancel);
        return signal;
    }

    /**
     * Cancels the signal and notifies registered calls.
     *
     * @return {@code true} if this invocation cancelled the signal, {@code false} if it was already cancelled.
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationSignal.none() cannot be cancelled");
        }
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "[rest-client] cancellation listener failed", ex);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers {@code listener} to run on cancellation; it runs immediately if the signal is already cancelled.
     * A listener registered concurrently with {@link #cancel()} may run twice, so it must be idempotent.
     *
     * @return handle removing the listener again.
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        if (!cancellable) {
            return NO_REGISTRATION;
        }
        listeners.add(listener);
        if (cancelled.get()) {
            listeners.remove(listener);
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
