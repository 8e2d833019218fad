package io.servicekit.restclient.transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one transport attempt: a 2xx response, a non-2xx response, or a failure before any response arrived.
 * The transport never interprets bodies; this value only carries what came over the wire.
 */
public interface AttemptOutcome {

    enum Kind {
        SUCCESS,
        HTTP_ERROR,
        TRANSPORT_FAILURE
    }

    enum FailureKind {
        NETWORK,
        TIMEOUT
    }

    Kind kind();

    /**
     * @return HTTP status, or {@code -1} for a transport failure.
     */
    int status();

    static AttemptOutcome fromResponse(int status, Map<String, List<String>> headers, byte[] body) {
        if (status >= 200 && status <= 299) {
            return new Success(status, headers, body);
        }
        return new HttpError(status, headers, body);
    }

    static AttemptOutcome network(IOException cause) {
        return new TransportFailure(FailureKind.NETWORK, cause);
    }

    static AttemptOutcome timeout(IOException cause) {
        return new TransportFailure(FailureKind.TIMEOUT, cause);
    }

    record Success(int status, Map<String, List<String>> headers, byte[] body) implements AttemptOutcome {
        public Success {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
            body = body == null ? new byte[0] : body;
        }

        @Override
        public Kind kind() {
            return Kind.SUCCESS;
        }

        @Override
        public String toString() {
            return "Success[status=" + status + ", bytes=" + body.length + "]";
        }
    }

    record HttpError(int status, Map<String, List<String>> headers, byte[] body) implements AttemptOutcome {
        public HttpError {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
            body = body == null ? new byte[0] : body;
        }

        @Override
        public Kind kind() {
            return Kind.HTTP_ERROR;
        }

        public String contentType() {
            for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
                if ("content-type".equalsIgnoreCase(entry.getKey()) && !entry.getValue().isEmpty()) {
                    return entry.getValue().get(0);
                }
            }
            return null;
        }

        @Override
        public String toString() {
            return "HttpError[status=" + status + ", body=" + new String(body, StandardCharsets.UTF_8) + "]";
        }
    }

    record TransportFailure(FailureKind failure, IOException cause) implements AttemptOutcome {
        public TransportFailure {
            Objects.requireNonNull(failure, "failure");
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public Kind kind() {
            return Kind.TRANSPORT_FAILURE;
        }

        @Override
        public int status() {
            return -1;
        }
    }
}
