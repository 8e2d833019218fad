package io.servicekit.restclient.transport;

import io.servicekit.restclient.request.RequestSpec;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking transport. The returned future completes with the same classification as {@link Transport}; it only
 * completes exceptionally when it was cancelled. Cancelling it aborts the exchange.
 */
@FunctionalInterface
public interface AsyncTransport {

    CompletableFuture<AttemptOutcome> executeAsync(RequestSpec<?> spec, Duration timeout);
}
