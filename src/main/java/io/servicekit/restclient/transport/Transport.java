package io.servicekit.restclient.transport;

import io.servicekit.restclient.request.RequestSpec;

import java.time.Duration;

/**
 * Blocking transport: performs one physical HTTP exchange on the calling thread.
 */
@FunctionalInterface
public interface Transport {

    /**
     * Sends {@code spec} once and waits for the complete response.
     *
     * @return {@link AttemptOutcome.Success} for 2xx answers, {@link AttemptOutcome.HttpError} for any other status,
     *     {@link AttemptOutcome.TransportFailure} when no response arrived within {@code timeout}.
     * @throws InterruptedException when the calling thread is interrupted while waiting.
     */
    AttemptOutcome execute(RequestSpec<?> spec, Duration timeout) throws InterruptedException;
}
