package io.servicekit.restclient;

import io.servicekit.restclient.request.HttpMethod;
import io.servicekit.restclient.request.RequestBuilder;
import io.servicekit.restclient.request.RequestOptions;
import io.servicekit.restclient.request.RequestSpec;
import io.servicekit.restclient.retry.RetryPolicy;
import io.servicekit.restclient.schema.SchemaBinder;
import io.servicekit.restclient.schema.Shape;
import io.servicekit.restclient.transport.AttemptExecutor;
import io.servicekit.restclient.transport.JdkHttpTransport;
import io.servicekit.restclient.transport.Transport;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <p>
 * Blocking client for one remote HTTP API. Every call runs on the calling thread from the first attempt to the last,
 * including backoff pauses, and either returns the bound response or throws a {@link RestClientException}.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Requests go to {@link ClientConfig#getBaseUrl()} plus the call's path; paths cannot leave that origin.</li>
 *   <li>Network failures, timeouts, 429 and 5xx answers are retried with capped exponential backoff, at most
 *       {@link ClientConfig#getMaxRetries()} times. Other errors surface after a single attempt.</li>
 *   <li>Response bodies are bound against the caller's {@link Shape}; mismatches raise {@link ValidationException}.</li>
 *   <li>Instances are thread-safe and meant to be shared: create one per remote API, inject it where needed, and
 *       {@link #close()} it on shutdown.</li>
 * </ul>
 *
 * <pre>{@code
 * try (RestClient users = new RestClient(config)) {
 *     User user = users.get("/users/7", USER).value();
 * }
 * }</pre>
 */
public final class RestClient implements AutoCloseable {

    private final ClientConfig config;
    private final RequestBuilder requestBuilder;
    private final RetryPolicy retryPolicy;
    private final SchemaBinder binder = new SchemaBinder();
    private final AttemptExecutor executor;
    private final AtomicBoolean closed = new AtomicBoolean();

    public RestClient(ClientConfig config) {
        this(config, null);
    }

    /**
     * Constructs a client sending its requests through {@code transport} instead of the JDK HTTP client.
     */
    public RestClient(ClientConfig config, Transport transport) {
        this.config = Objects.requireNonNull(config, "config");
        this.requestBuilder = new RequestBuilder(config.getBaseUrl(), config.getDefaultHeaders(),
            config.getCredentials());
        this.retryPolicy = config.retryPolicy();
        this.executor = AttemptExecutor.blocking(transport == null
            ? new JdkHttpTransport(config.getHttpClient())
            : transport);
    }

    public <T> BoundResponse<T> get(String path, Shape<T> responseShape) throws RestClientException {
        return execute(HttpMethod.GET, path, RequestOptions.none(), responseShape);
    }

    public <T> BoundResponse<T> get(String path, RequestOptions options, Shape<T> responseShape)
        throws RestClientException {
        return execute(HttpMethod.GET, path, options, responseShape);
    }

    public <T> BoundResponse<T> post(String path, Shape<T> responseShape) throws RestClientException {
        return execute(HttpMethod.POST, path, RequestOptions.none(), responseShape);
    }

    public <T> BoundResponse<T> post(String path, RequestOptions options, Shape<T> responseShape)
        throws RestClientException {
        return execute(HttpMethod.POST, path, options, responseShape);
    }

    public <T> BoundResponse<T> put(String path, Shape<T> responseShape) throws RestClientException {
        return execute(HttpMethod.PUT, path, RequestOptions.none(), responseShape);
    }

    public <T> BoundResponse<T> put(String path, RequestOptions options, Shape<T> responseShape)
        throws RestClientException {
        return execute(HttpMethod.PUT, path, options, responseShape);
    }

    public <T> BoundResponse<T> patch(String path, Shape<T> responseShape) throws RestClientException {
        return execute(HttpMethod.PATCH, path, RequestOptions.none(), responseShape);
    }

    public <T> BoundResponse<T> patch(String path, RequestOptions options, Shape<T> responseShape)
        throws RestClientException {
        return execute(HttpMethod.PATCH, path, options, responseShape);
    }

    public <T> BoundResponse<T> delete(String path, Shape<T> responseShape) throws RestClientException {
        return execute(HttpMethod.DELETE, path, RequestOptions.none(), responseShape);
    }

    public <T> BoundResponse<T> delete(String path, RequestOptions options, Shape<T> responseShape)
        throws RestClientException {
        return execute(HttpMethod.DELETE, path, options, responseShape);
    }

    /**
     * Performs a call with retries and binds its response.
     *
     * @throws EncodingException when the body cannot be encoded; no request is sent.
     * @throws NetworkException when the last permitted attempt could not connect or was reset.
     * @throws RequestTimeoutException when the last permitted attempt timed out.
     * @throws HttpStatusException when the service answered with a non-2xx status that was not retried further.
     * @throws ValidationException when the 2xx body does not match {@code responseShape}.
     * @throws RequestCancelledException when the calling thread was interrupted.
     * @throws IllegalArgumentException when {@code path} leaves the base URL's origin.
     * @throws IllegalStateException when the client has been closed.
     */
    public <T> BoundResponse<T> execute(HttpMethod method, String path, RequestOptions options,
                                        Shape<T> responseShape) throws RestClientException {
        ensureOpen();
        RequestSpec<T> spec = requestBuilder.build(method, path, options, responseShape);
        CompletableFuture<BoundResponse<T>> call = new RetryingCall<>(spec, executor, retryPolicy, binder,
            config.getTimeout(), CancellationSignal.none()).start();
        return await(call, spec);
    }

    public ClientConfig config() {
        return config;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes the client; later calls fail with {@link IllegalStateException}. The JDK HTTP client releases its pooled
     * connections once it becomes unreachable, so nothing else needs disposal.
     */
    @Override
    public void close() {
        closed.set(true);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("client for " + config.getBaseUrl() + " is closed");
        }
    }

    private static <T> BoundResponse<T> await(CompletableFuture<BoundResponse<T>> call, RequestSpec<T> spec)
        throws RestClientException {
        try {
            return call.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(spec.method().name(), spec.uri(), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RestClientException) {
                throw (RestClientException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RestClientException("unexpected failure: " + cause, spec.method().name(), spec.uri(), cause);
        }
    }
}
