package io.servicekit.restclient;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.servicekit.restclient.auth.Credentials;
import io.servicekit.restclient.request.HttpMethod;
import io.servicekit.restclient.request.RequestOptions;
import io.servicekit.restclient.schema.BoundObject;
import io.servicekit.restclient.schema.ObjectShape;
import io.servicekit.restclient.schema.Shape;
import io.servicekit.restclient.schema.Shapes;
import io.servicekit.restclient.transport.AttemptOutcome;
import io.servicekit.restclient.transport.Transport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RestClientTest {

    private static final ObjectShape WIDGET = Shapes.object()
        .required("id", Shapes.integer())
        .required("name", Shapes.string());

    private HttpServer server;
    private URI baseUri;
    private final DelegatingHandler widgetsHandler = new DelegatingHandler();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/api/widgets", exchange -> {
            requests.add(Recorded.of(exchange));
            widgetsHandler.handle(exchange);
        });
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void bindsSuccessfulGetOnFirstAttempt() throws Exception {
        widgetsHandler.delegate = exchange -> respond(exchange, 200, "{\"id\": 7, \"name\": \"widget\", \"extra\": 1}");

        try (RestClient client = new RestClient(config(3))) {
            BoundResponse<BoundObject> response = client.get("/widgets/7", WIDGET);

            assertEquals(200, response.status());
            assertEquals(1, response.attempts());
            assertEquals(7L, response.value().getLong("id"));
            assertEquals("widget", response.value().getString("name"));
            assertEquals(Optional.of("application/json"), response.header("content-type"));
        }

        Recorded request = requests.get(0);
        assertEquals("GET", request.method);
        assertEquals("/api/widgets/7", request.path);
        assertEquals("application/json", request.header("Accept"));
        assertEquals("orders", request.header("X-Service"));
    }

    @Test
    void exhaustsRetriesOnPersistentServerErrors() {
        widgetsHandler.delegate = exchange -> respond(exchange, 503, "{\"message\": \"maintenance\"}");

        try (RestClient client = new RestClient(config(2))) {
            HttpStatusException ex = assertThrows(HttpStatusException.class, () -> client.get("/widgets/7", WIDGET));

            assertEquals(503, ex.getStatusCode());
            assertEquals(3, ex.getAttempts());
            assertEquals("maintenance", ex.getDetail());
            assertEquals("GET", ex.getMethod());
        }
        assertEquals(3, requests.size());
    }

    @Test
    void doesNotRetryClientErrors() {
        widgetsHandler.delegate = exchange -> respond(exchange, 404, "{\"detail\": \"widget 9 not found\"}");

        try (RestClient client = new RestClient(config(3))) {
            HttpStatusException ex = assertThrows(HttpStatusException.class, () -> client.get("/widgets/9", WIDGET));

            assertEquals(404, ex.getStatusCode());
            assertEquals(1, ex.getAttempts());
            assertEquals("widget 9 not found", ex.getDetail());
            assertTrue(ex.getBodyAsString().contains("not found"));
        }
        assertEquals(1, requests.size());
    }

    @Test
    void retriedPostSendsIdenticalIdempotencyKey() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        widgetsHandler.delegate = exchange -> {
            if (calls.incrementAndGet() == 1) {
                respond(exchange, 503, "");
            } else {
                respond(exchange, 201, "{\"id\": 11, \"name\": \"gear\"}");
            }
        };

        RequestOptions options = RequestOptions.builder()
            .header("Idempotency-Key", "key-123")
            .body(Map.of("name", "gear"))
            .build();
        try (RestClient client = new RestClient(config(3))) {
            BoundResponse<BoundObject> response = client.post("/widgets", options, WIDGET);
            assertEquals(201, response.status());
            assertEquals(2, response.attempts());
            assertEquals(11L, response.value().getLong("id"));
        }

        assertEquals(2, requests.size());
        for (Recorded request : requests) {
            assertEquals("POST", request.method);
            assertEquals("key-123", request.header("Idempotency-Key"));
            assertEquals("{\"name\":\"gear\"}", request.body);
            assertEquals("application/json", request.header("Content-Type"));
        }
    }

    @Test
    void doesNotRetryValidationFailures() {
        widgetsHandler.delegate = exchange -> respond(exchange, 200, "{\"id\": \"seven\", \"name\": \"widget\"}");

        try (RestClient client = new RestClient(config(3))) {
            ValidationException ex = assertThrows(ValidationException.class, () -> client.get("/widgets/7", WIDGET));
            assertEquals("id", ex.getFieldPath());
        }
        assertEquals(1, requests.size());
    }

    @Test
    void bindsListsIntoDomainTypes() throws Exception {
        widgetsHandler.delegate = exchange -> respond(exchange, 200,
            "[{\"id\": 1, \"name\": \"a\"}, {\"id\": 2, \"name\": \"b\"}]");
        Shape<List<Widget>> widgets = Shapes.list(WIDGET.map(o -> new Widget(o.getLong("id"), o.getString("name"))));

        try (RestClient client = new RestClient(config(0))) {
            List<Widget> value = client.get("/widgets",
                RequestOptions.builder().query("page", "1").build(), widgets).value();
            assertEquals(List.of(new Widget(1, "a"), new Widget(2, "b")), value);
        }
        assertEquals("page=1", requests.get(0).query);
    }

    @Test
    void deleteWithNoContent() throws Exception {
        widgetsHandler.delegate = exchange -> {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        };

        try (RestClient client = new RestClient(config(0))) {
            BoundResponse<Void> response = client.delete("/widgets/3", Shapes.none());
            assertEquals(204, response.status());
            assertNull(response.value());
        }
        assertEquals("DELETE", requests.get(0).method);
    }

    @Test
    void sendsCredentialsOnEveryAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        widgetsHandler.delegate = exchange -> respond(exchange, calls.incrementAndGet() < 3 ? 500 : 200,
            "{\"id\": 1, \"name\": \"a\"}");

        ClientConfig config = ClientConfig.builder()
            .baseUrl(baseUri + "/api")
            .credentials(Credentials.bearer("secret-token"))
            .backoffBase(Duration.ofMillis(1))
            .backoffCap(Duration.ofMillis(5))
            .build();
        try (RestClient client = new RestClient(config)) {
            assertEquals(3, client.get("/widgets/1", WIDGET).attempts());
        }
        assertEquals(3, requests.size());
        requests.forEach(request -> assertEquals("Bearer secret-token", request.header("Authorization")));
    }

    @Test
    void unreachableServerPreservesLastNetworkCause() {
        server.stop(0);
        server = null;

        try (RestClient client = new RestClient(config(2))) {
            NetworkException ex = assertThrows(NetworkException.class, () -> client.get("/widgets/1", WIDGET));
            assertEquals(3, ex.getAttempts());
            assertNotNull(ex.getCause());
        }
    }

    @Test
    void lastAttemptOutcomeDeterminesError() {
        AtomicInteger calls = new AtomicInteger();
        List<AttemptOutcome> script = List.of(
            AttemptOutcome.fromResponse(503, Map.of(), new byte[0]),
            AttemptOutcome.network(new ConnectException("refused on attempt 2")));

        try (RestClient client = new RestClient(config(1), (spec, timeout) -> script.get(calls.getAndIncrement()))) {
            NetworkException ex = assertThrows(NetworkException.class, () -> client.get("/widgets/1", WIDGET));
            assertEquals("refused on attempt 2", ex.getCause().getMessage());
            assertEquals(2, ex.getAttempts());
        }
        assertEquals(2, calls.get());
    }

    @Test
    void doesNotFollowRedirectsToAnotherOrigin() throws Exception {
        HttpServer other = HttpServer.create(new InetSocketAddress(0), 0);
        AtomicInteger otherCalls = new AtomicInteger();
        other.createContext("/", exchange -> {
            otherCalls.incrementAndGet();
            respond(exchange, 200, "{\"id\": 1, \"name\": \"elsewhere\"}");
        });
        other.start();
        try {
            String target = "http://127.0.0.1:" + other.getAddress().getPort() + "/collect";
            widgetsHandler.delegate = exchange -> {
                exchange.getResponseHeaders().add("Location", target);
                respond(exchange, 302, "");
            };

            ClientConfig config = ClientConfig.builder()
                .baseUrl(baseUri + "/api")
                .credentials(Credentials.bearer("secret-token"))
                .maxRetries(2)
                .backoffBase(Duration.ofMillis(1))
                .backoffCap(Duration.ofMillis(5))
                .build();
            try (RestClient client = new RestClient(config)) {
                HttpStatusException ex = assertThrows(HttpStatusException.class,
                    () -> client.get("/widgets/1", WIDGET));
                assertEquals(302, ex.getStatusCode());
                assertEquals(1, ex.getAttempts());
            }
            assertEquals(0, otherCalls.get());
            assertEquals(1, requests.size());
        } finally {
            other.stop(0);
        }
    }

    @Test
    void exhaustsRetriesOnTimeouts() {
        AtomicInteger calls = new AtomicInteger();
        Transport timingOut = (spec, timeout) -> {
            calls.incrementAndGet();
            return AttemptOutcome.timeout(new HttpTimeoutException("request timed out"));
        };

        try (RestClient client = new RestClient(config(2), timingOut)) {
            RequestTimeoutException ex = assertThrows(RequestTimeoutException.class,
                () -> client.get("/widgets/1", WIDGET));
            assertEquals(3, ex.getAttempts());
            assertTrue(ex.getCause() instanceof HttpTimeoutException);
            assertEquals("GET", ex.getMethod());
        }
        assertEquals(3, calls.get());
    }

    @Test
    void slowServerSurfacesAsTimeoutAfterRetries() {
        widgetsHandler.delegate = exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "{\"id\": 1, \"name\": \"late\"}");
        };

        ClientConfig config = ClientConfig.builder()
            .baseUrl(baseUri + "/api")
            .timeout(Duration.ofMillis(200))
            .maxRetries(1)
            .backoffBase(Duration.ofMillis(1))
            .backoffCap(Duration.ofMillis(5))
            .build();
        try (RestClient client = new RestClient(config)) {
            RequestTimeoutException ex = assertThrows(RequestTimeoutException.class,
                () -> client.get("/widgets/1", WIDGET));
            assertEquals(2, ex.getAttempts());
            assertTrue(ex.getCause() instanceof HttpTimeoutException);
        }
    }

    @Test
    void encodingErrorsSendNothing() {
        try (RestClient client = new RestClient(config(3))) {
            assertThrows(EncodingException.class,
                () -> client.post("/widgets", RequestOptions.body(new Object()), WIDGET));
        }
        assertTrue(requests.isEmpty());
    }

    @Test
    void rejectsPathsOutsideBaseOrigin() {
        try (RestClient client = new RestClient(config(3))) {
            assertThrows(IllegalArgumentException.class, () -> client.get("http://elsewhere.test/x", WIDGET));
        }
    }

    @Test
    void closedClientRejectsCalls() {
        RestClient client = new RestClient(config(0));
        client.close();
        assertTrue(client.isClosed());
        assertThrows(IllegalStateException.class, () -> client.execute(HttpMethod.GET, "/widgets", null, WIDGET));
    }

    private ClientConfig config(int maxRetries) {
        return ClientConfig.builder()
            .baseUrl(baseUri + "/api")
            .defaultHeader("X-Service", "orders")
            .timeout(Duration.ofSeconds(5))
            .maxRetries(maxRetries)
            .backoffBase(Duration.ofMillis(1))
            .backoffCap(Duration.ofMillis(5))
            .build();
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private record Widget(long id, String name) {
    }

    private static final class Recorded {
        private final String method;
        private final String path;
        private final String query;
        private final Map<String, List<String>> headers;
        private final String body;

        private Recorded(String method, String path, String query, Map<String, List<String>> headers, String body) {
            this.method = method;
            this.path = path;
            this.query = query;
            this.headers = headers;
            this.body = body;
        }

        static Recorded of(HttpExchange exchange) throws IOException {
            return new Recorded(
                exchange.getRequestMethod(),
                exchange.getRequestURI().getPath(),
                exchange.getRequestURI().getRawQuery(),
                Map.copyOf(exchange.getRequestHeaders()),
                new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        }

        String header(String name) {
            for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(name)) {
                    return entry.getValue().get(0);
                }
            }
            return null;
        }
    }

    private static final class DelegatingHandler implements HttpHandler {
        private volatile HttpHandler delegate;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            HttpHandler current = delegate;
            if (current == null) {
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
                return;
            }
            current.handle(exchange);
        }
    }
}
