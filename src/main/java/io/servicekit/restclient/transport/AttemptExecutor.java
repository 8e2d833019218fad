package io.servicekit.restclient.transport;

import io.servicekit.restclient.request.RequestSpec;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * The two things a retry loop waits for: an attempt and a backoff pause. The loop itself is written once against this
 * interface; the variant decides whether waiting blocks the calling thread or suspends the call.
 *
 * <p>Futures returned by a {@link #blocking blocking} executor are already complete when the method returns, so a loop
 * composed over them runs entirely on the calling thread. Futures returned by a {@link #suspending suspending}
 * executor complete later on the HTTP client's or the delay scheduler's threads, and no thread is held meanwhile.</p>
 *
 * <p>A future completes exceptionally only when the wait was cancelled or interrupted.</p>
 */
public interface AttemptExecutor {

    CompletableFuture<AttemptOutcome> attempt(RequestSpec<?> spec, Duration timeout);

    CompletableFuture<Void> pause(Duration wait);

    static AttemptExecutor blocking(Transport transport) {
        Objects.requireNonNull(transport, "transport");
        return new AttemptExecutor() {
            @Override
            public CompletableFuture<AttemptOutcome> attempt(RequestSpec<?> spec, Duration timeout) {
                try {
                    return CompletableFuture.completedFuture(transport.execute(spec, timeout));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return CompletableFuture.failedFuture(ex);
                }
            }

            @Override
            public CompletableFuture<Void> pause(Duration wait) {
                if (wait.isZero() || wait.isNegative()) {
                    return CompletableFuture.completedFuture(null);
                }
                try {
                    Thread.sleep(wait.toMillis(), wait.toNanosPart() % 1_000_000);
                    return CompletableFuture.completedFuture(null);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return CompletableFuture.failedFuture(ex);
                }
            }
        };
    }

    static AttemptExecutor suspending(AsyncTransport transport) {
        return suspending(transport, ForkJoinPool.commonPool());
    }

    /**
     * @param delayExecutor executor that continues the call once a backoff pause has elapsed.
     */
    static AttemptExecutor suspending(AsyncTransport transport, Executor delayExecutor) {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(delayExecutor, "delayExecutor");
        return new AttemptExecutor() {
            @Override
            public CompletableFuture<AttemptOutcome> attempt(RequestSpec<?> spec, Duration timeout) {
                return transport.executeAsync(spec, timeout);
            }

            @Override
            public CompletableFuture<Void> pause(Duration wait) {
                if (wait.isZero() || wait.isNegative()) {
                    return CompletableFuture.completedFuture(null);
                }
                CompletableFuture<Void> elapsed = new CompletableFuture<>();
                Executor timer = CompletableFuture.delayedExecutor(wait.toNanos(), TimeUnit.NANOSECONDS, delayExecutor);
                timer.execute(() -> elapsed.complete(null));
                return elapsed;
            }
        };
    }
}
