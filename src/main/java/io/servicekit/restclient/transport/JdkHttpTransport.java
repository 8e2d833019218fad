package io.servicekit.restclient.transport;

import io.servicekit.restclient.request.RequestSpec;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

/**
 * {@link Transport} and {@link AsyncTransport} backed by the JDK {@link HttpClient}, which also owns the connection
 * pool shared by all calls of a client.
 */
public final class JdkHttpTransport implements Transport, AsyncTransport {

    private static final Logger LOGGER = Logger.getLogger(JdkHttpTransport.class.getName());

    private final HttpClient httpClient;

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public AttemptOutcome execute(RequestSpec<?> spec, Duration timeout) throws InterruptedException {
        HttpRequest request = toHttpRequest(spec, timeout);
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            return classify(spec, response);
        } catch (IOException ex) {
            return failure(spec, ex);
        }
    }

    @Override
    public CompletableFuture<AttemptOutcome> executeAsync(RequestSpec<?> spec, Duration timeout) {
        HttpRequest request = toHttpRequest(spec, timeout);
        CompletableFuture<HttpResponse<byte[]>> exchange =
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        CompletableFuture<AttemptOutcome> outcome = exchange.handle((response, error) -> {
            if (error == null) {
                return classify(spec, response);
            }
            Throwable cause = unwrap(error);
            if (cause instanceof IOException) {
                return failure(spec, (IOException) cause);
            }
            if (cause instanceof CancellationException) {
                throw (CancellationException) cause;
            }
            throw new CompletionException(cause);
        });
        outcome.whenComplete((value, error) -> {
            if (error != null) {
                exchange.cancel(true);
            }
        });
        return outcome;
    }

    /**
     * Converts the immutable {@link RequestSpec} into a fresh JDK request. Called once per attempt.
     */
    static HttpRequest toHttpRequest(RequestSpec<?> spec, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(spec.uri());
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }
        byte[] body = spec.body();
        builder.method(spec.method().name(), body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(body));
        spec.headers().forEach(builder::header);
        return builder.build();
    }

    private static AttemptOutcome classify(RequestSpec<?> spec, HttpResponse<byte[]> response) {
        LOGGER.fine(() -> String.format(Locale.ROOT, "[rest-client] %s %s -> %d",
            spec.method(), spec.uri(), response.statusCode()));
        return AttemptOutcome.fromResponse(response.statusCode(), response.headers().map(), response.body());
    }

    private static AttemptOutcome failure(RequestSpec<?> spec, IOException ex) {
        boolean timedOut = ex instanceof HttpTimeoutException;
        LOGGER.fine(() -> String.format(Locale.ROOT, "[rest-client] %s %s failed: %s",
            spec.method(), spec.uri(), timedOut ? "timeout" : ex.toString()));
        return timedOut ? AttemptOutcome.timeout(ex) : AttemptOutcome.network(ex);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
