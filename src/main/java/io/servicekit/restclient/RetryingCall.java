package io.servicekit.restclient;

import io.servicekit.restclient.internal.HttpErrorDecoder;
import io.servicekit.restclient.request.RequestSpec;
import io.servicekit.restclient.retry.RetryDecision;
import io.servicekit.restclient.retry.RetryPolicy;
import io.servicekit.restclient.schema.SchemaBinder;
import io.servicekit.restclient.transport.AttemptExecutor;
import io.servicekit.restclient.transport.AttemptOutcome;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

/**
 * One call's retry loop: attempt, classify, back off, attempt again, and finally bind or fail. Attempts of a call are
 * strictly sequential; attempt {@code n + 1} starts only after the outcome of attempt {@code n} has been classified
 * and the backoff pause has elapsed.
 *
 * <p>The loop is shared by {@link RestClient} and {@link AsyncRestClient}; only the {@link AttemptExecutor} differs.
 * The terminal error always reflects the last attempt's real outcome.</p>
 */
final class RetryingCall<T> {

    private static final Logger LOGGER = Logger.getLogger(RetryingCall.class.getName());

    private final RequestSpec<T> spec;
    private final AttemptExecutor executor;
    private final RetryPolicy policy;
    private final SchemaBinder binder;
    private final Duration timeout;
    private final CancellationSignal signal;
    private final CompletableFuture<BoundResponse<T>> result = new CompletableFuture<>();

    private volatile CompletableFuture<?> pending;

    RetryingCall(RequestSpec<T> spec, AttemptExecutor executor, RetryPolicy policy, SchemaBinder binder,
                 Duration timeout, CancellationSignal signal) {
        this.spec = spec;
        this.executor = executor;
        this.policy = policy;
        this.binder = binder;
        this.timeout = timeout;
        this.signal = signal == null ? CancellationSignal.none() : signal;
    }

    /**
     * Starts the first attempt. With a blocking executor the returned future is already complete.
     */
    CompletableFuture<BoundResponse<T>> start() {
        CancellationSignal.Registration registration = signal.onCancel(this::abortPending);
        result.whenComplete((value, error) -> {
            registration.close();
            if (result.isCancelled()) {
                abortPending();
            }
        });
        attempt(0);
        return result;
    }

    private void attempt(int index) {
        if (result.isDone()) {
            return;
        }
        if (signal.isCancelled()) {
            fail(cancelled(null));
            return;
        }

        LOGGER.fine(() -> String.format(Locale.ROOT, "[rest-client] %s %s attempt %d",
            spec.method(), spec.uri(), index + 1));
        CompletableFuture<AttemptOutcome> inFlight;
        try {
            inFlight = executor.attempt(spec, timeout);
        } catch (RuntimeException ex) {
            fail(ex);
            return;
        }
        pending = inFlight;
        if (signal.isCancelled() || result.isCancelled()) {
            inFlight.cancel(true);
        }
        inFlight.whenComplete((outcome, error) -> onOutcome(index, outcome, error));
    }

    private void onOutcome(int index, AttemptOutcome outcome, Throwable error) {
        if (error != null) {
            failFromInterruption(error);
            return;
        }

        if (outcome.kind() == AttemptOutcome.Kind.SUCCESS) {
            complete((AttemptOutcome.Success) outcome, index + 1);
            return;
        }

        RetryDecision decision = policy.decide(outcome, index);
        if (!decision.retry()) {
            RestClientException terminal = terminalError(outcome, index + 1);
            LOGGER.warning(() -> "[rest-client] " + terminal.getMessage());
            fail(terminal);
            return;
        }

        if (signal.isCancelled()) {
            fail(cancelled(null));
            return;
        }

        LOGGER.info(() -> String.format(Locale.ROOT, "[rest-client] %s %s attempt %d failed (%s); retrying in %d ms",
            spec.method(), spec.uri(), index + 1, describe(outcome), decision.delay().toMillis()));
        CompletableFuture<Void> delay = executor.pause(decision.delay());
        pending = delay;
        if (signal.isCancelled() || result.isCancelled()) {
            delay.cancel(true);
        }
        delay.whenComplete((ignored, pauseError) -> {
            if (pauseError != null) {
                failFromInterruption(pauseError);
                return;
            }
            attempt(index + 1);
        });
    }

    private void complete(AttemptOutcome.Success success, int attempts) {
        try {
            T value = binder.bind(success.body(), spec.responseShape());
            result.complete(new BoundResponse<>(success.status(), success.headers(), value, attempts));
        } catch (ValidationException ex) {
            LOGGER.warning(() -> String.format(Locale.ROOT, "[rest-client] %s %s returned an unexpected body: %s",
                spec.method(), spec.uri(), ex.getMessage()));
            fail(ex);
        } catch (RuntimeException ex) {
            fail(ex);
        }
    }

    private RestClientException terminalError(AttemptOutcome outcome, int attempts) {
        String method = spec.method().name();
        if (outcome.kind() == AttemptOutcome.Kind.HTTP_ERROR) {
            AttemptOutcome.HttpError httpError = (AttemptOutcome.HttpError) outcome;
            String detail = HttpErrorDecoder.detail(httpError.body(), httpError.contentType());
            return new HttpStatusException(method, spec.uri(), httpError.status(), httpError.body(), detail, attempts);
        }
        AttemptOutcome.TransportFailure failure = (AttemptOutcome.TransportFailure) outcome;
        if (failure.failure() == AttemptOutcome.FailureKind.TIMEOUT) {
            return new RequestTimeoutException(method, spec.uri(), failure.cause(), attempts);
        }
        return new NetworkException(method, spec.uri(), failure.cause(), attempts);
    }

    private void failFromInterruption(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CancellationException || cause instanceof InterruptedException || signal.isCancelled()) {
            fail(cancelled(cause));
            return;
        }
        fail(cause);
    }

    private RequestCancelledException cancelled(Throwable cause) {
        LOGGER.fine(() -> "[rest-client] " + spec + " cancelled");
        return new RequestCancelledException(spec.method().name(), spec.uri(), cause);
    }

    private void fail(Throwable error) {
        result.completeExceptionally(error);
    }

    private void abortPending() {
        CompletableFuture<?> current = pending;
        if (current != null) {
            current.cancel(true);
        }
    }

    private static String describe(AttemptOutcome outcome) {
        if (outcome.kind() == AttemptOutcome.Kind.TRANSPORT_FAILURE) {
            AttemptOutcome.TransportFailure failure = (AttemptOutcome.TransportFailure) outcome;
            return failure.failure().name().toLowerCase(Locale.ROOT) + ": " + failure.cause().getMessage();
        }
        return "status " + outcome.status();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
