package io.servicekit.restclient;

import io.servicekit.restclient.request.HttpMethod;
import io.servicekit.restclient.request.RequestBuilder;
import io.servicekit.restclient.request.RequestOptions;
import io.servicekit.restclient.request.RequestSpec;
import io.servicekit.restclient.retry.RetryPolicy;
import io.servicekit.restclient.schema.SchemaBinder;
import io.servicekit.restclient.schema.Shape;
import io.servicekit.restclient.transport.AsyncTransport;
import io.servicekit.restclient.transport.AttemptExecutor;
import io.servicekit.restclient.transport.JdkHttpTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * <p>
 * Non-blocking counterpart of {@link RestClient}. Calls return immediately with a {@link CompletableFuture}; no thread
 * is held while a request is in flight or while a retry waits out its backoff, so many calls can progress
 * concurrently over the JDK client's shared connection pool.
 * </p>
 *
 * <p>
 * Retry, binding and error semantics are identical to {@link RestClient}: futures complete exceptionally with the same
 * {@link RestClientException} subclasses the blocking client throws. A call is aborted when its
 * {@link CancellationSignal} fires, completing with {@link RequestCancelledException}, or when the returned future is
 * cancelled. In both cases the pending attempt or backoff is aborted and no further attempt is made.
 * </p>
 *
 * <pre>{@code
 * CancellationSignal deadline = CancellationSignal.after(Duration.ofSeconds(2));
 * client.get("/users/7", RequestOptions.none(), USER, deadline)
 *     .thenAccept(response -> render(response.value()));
 * }</pre>
 */
public final class AsyncRestClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(AsyncRestClient.class.getName());

    private final ClientConfig config;
    private final RequestBuilder requestBuilder;
    private final RetryPolicy retryPolicy;
    private final SchemaBinder binder = new SchemaBinder();
    private final AttemptExecutor executor;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();

    public AsyncRestClient(ClientConfig config) {
        this(config, null);
    }

    /**
     * Constructs a client sending its requests through {@code transport} instead of the JDK HTTP client.
     */
    public AsyncRestClient(ClientConfig config, AsyncTransport transport) {
        this.config = Objects.requireNonNull(config, "config");
        this.requestBuilder = new RequestBuilder(config.getBaseUrl(), config.getDefaultHeaders(),
            config.getCredentials());
        this.retryPolicy = config.retryPolicy();
        this.executor = AttemptExecutor.suspending(transport == null
            ? new JdkHttpTransport(config.getHttpClient())
            : transport);
    }

    public <T> CompletableFuture<BoundResponse<T>> get(String path, Shape<T> responseShape) {
        return execute(HttpMethod.GET, path, RequestOptions.none(), responseShape, CancellationSignal.none());
    }

    public <T> CompletableFuture<BoundResponse<T>> get(String path, RequestOptions options, Shape<T> responseShape) {
        return execute(HttpMethod.GET, path, options, responseShape, CancellationSignal.none());
    }

    public <T> CompletableFuture<BoundResponse<T>> get(String path, RequestOptions options, Shape<T> responseShape,
                                                       CancellationSignal signal) {
        return execute(HttpMethod.GET, path, options, responseShape, signal);
    }

    public <T> CompletableFuture<BoundResponse<T>> post(String path, Shape<T> responseShape) {
        return execute(HttpMethod.POST, path, RequestOptions.none(), responseShape, CancellationSignal.none());
    }

    public <T> CompletableFuture<BoundResponse<T>> post(String path, RequestOptions options, Shape<T> responseShape) {
        return execute(HttpMethod.POST, path, options, responseShape, CancellationSignal.none());
    }

    public <T> CompletableFuture<BoundResponse<T>> post(String path, RequestOptions options, Shape<T> responseShape,
                                                        CancellationSignal signal) {
        return execute(HttpMethod.POST, path, options, responseShape, signal);
    }

    public <T> CompletableFuture<BoundResponse<T>> put(String path, Shape<T> responseShape) {
        return execute(HttpMethod.PUT, path, RequestOptions.none(), responseShape, CancellationSignal.none());
    }

    public <T> CompletableFuture<BoundResponse<T>> put(String path, RequestOptions options, Shape<T> responseShape) {
        return execute(HttpMethod.PUT, path, options, responseShape, CancellationSignal.none());
    }

    public <T> CompletableFuture<BoundResponse<T>> put(String path, RequestOptions options, Shape<T> responseShape,
                                                       CancellationSignal signal) {
        return execute(HttpMethod.PUT, path, options, responseShape, signal);
    }

    public <T> CompletableFuture<BoundResponse<T>> patch(String path, Shape<T> responseShape) {
        return execute(HttpMethod.PATCH, path, RequestOptions.none(), responseShape, CancellationSignal.none());
    }

    public <T> CompletableFuture<BoundResponse<T>> patch(String path, RequestOptions options, Shape<T> responseShape) {
        return execute(HttpMethod.PATCH, path, options, responseShape, CancellationSignal.none());
    }

    public <T> CompletableFuture<BoundResponse<T>> patch(String path, RequestOptions options, Shape<T> responseShape,
                                                         CancellationSignal signal) {
        return execute(HttpMethod.PATCH, path, options, responseShape, signal);
    }

    public <T> CompletableFuture<BoundResponse<T>> delete(String path, Shape<T> responseShape) {
        return execute(HttpMethod.DELETE, path, RequestOptions.none(), responseShape, CancellationSignal.none());
    }

    public <T> CompletableFuture<BoundResponse<T>> delete(String path, RequestOptions options, Shape<T> responseShape) {
        return execute(HttpMethod.DELETE, path, options, responseShape, CancellationSignal.none());
    }

    public <T> CompletableFuture<BoundResponse<T>> delete(String path, RequestOptions options, Shape<T> responseShape,
                                                          CancellationSignal signal) {
        return execute(HttpMethod.DELETE, path, options, responseShape, signal);
    }

    /**
     * Starts a call with retries and binding. Errors detected before any request is sent, such as an
     * {@link EncodingException}, are reported through the returned future as well.
     *
     * @throws IllegalArgumentException when {@code path} leaves the base URL's origin.
     * @throws IllegalStateException when the client has been closed.
     */
    public <T> CompletableFuture<BoundResponse<T>> execute(HttpMethod method, String path, RequestOptions options,
                                                           Shape<T> responseShape, CancellationSignal signal) {
        ensureOpen();
        RequestSpec<T> spec;
        try {
            spec = requestBuilder.build(method, path, options, responseShape);
        } catch (RestClientException ex) {
            return CompletableFuture.failedFuture(ex);
        }

        CompletableFuture<BoundResponse<T>> call = new RetryingCall<>(spec, executor, retryPolicy, binder,
            config.getTimeout(), signal).start();
        inFlight.add(call);
        call.whenComplete((value, error) -> inFlight.remove(call));
        if (closed.get()) {
            // close() may have snapshotted inFlight before this call was added
            call.cancel(true);
        }
        return call;
    }

    public ClientConfig config() {
        return config;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the client: later calls fail with {@link IllegalStateException} and calls still in flight are cancelled.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<CompletableFuture<?>> pending = new ArrayList<>(inFlight);
        if (!pending.isEmpty()) {
            LOGGER.info(() -> String.format(Locale.ROOT, "[rest-client] closing client for %s, cancelling %d call(s)",
                config.getBaseUrl(), pending.size()));
        }
        for (CompletableFuture<?> call : pending) {
            call.cancel(true);
        }
        inFlight.clear();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("client for " + config.getBaseUrl() + " is closed");
        }
    }
}
