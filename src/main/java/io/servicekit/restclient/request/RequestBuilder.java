package io.servicekit.restclient.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.servicekit.restclient.EncodingException;
import io.servicekit.restclient.RestClientException;
import io.servicekit.restclient.auth.Credentials;
import io.servicekit.restclient.internal.Json;
import io.servicekit.restclient.schema.Shape;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Assembles {@link RequestSpec}s from connection-level settings and call-site options.
 *
 * <ul>
 *   <li>The URI is the base URL followed by the path and the URL-encoded query. Paths carrying their own scheme or
 *       authority, or resolving to another origin, are rejected.</li>
 *   <li>Headers are merged case-insensitively: defaults, then JSON content negotiation headers, then credentials, then
 *       call-site headers. The call site wins on conflict.</li>
 *   <li>The body is encoded for the final {@code Content-Type}, JSON unless the caller chose another type.</li>
 * </ul>
 */
public final class RequestBuilder {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String ACCEPT = "Accept";
    public static final String APPLICATION_JSON = "application/json";
    public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host",
        "upgrade");

    private final String baseUrl;
    private final URI baseUri;
    private final Map<String, String> defaultHeaders;
    private final Credentials credentials;
    private final ObjectMapper mapper;

    public RequestBuilder(String baseUrl, Map<String, String> defaultHeaders, Credentials credentials) {
        this(baseUrl, defaultHeaders, credentials, Json.mapper());
    }

    public RequestBuilder(String baseUrl, Map<String, String> defaultHeaders, Credentials credentials,
                          ObjectMapper mapper) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.baseUri = URI.create(this.baseUrl);
        if (baseUri.getScheme() == null || baseUri.getHost() == null) {
            throw new IllegalArgumentException("base URL must include scheme and host: " + baseUrl);
        }
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (defaultHeaders != null) {
            defaultHeaders.forEach((name, value) -> headers.put(checkHeaderName(name), value));
        }
        this.defaultHeaders = headers;
        this.credentials = credentials;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Builds the {@link RequestSpec} of one call.
     *
     * @throws IllegalArgumentException when the path escapes the base URL's origin or a header may not be set.
     * @throws EncodingException when the body cannot be encoded for the chosen content type.
     * @throws RestClientException when the credentials cannot produce their headers.
     */
    public <T> RequestSpec<T> build(HttpMethod method, String path, RequestOptions options, Shape<T> responseShape)
        throws RestClientException {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(responseShape, "responseShape");
        RequestOptions call = options == null ? RequestOptions.none() : options;

        URI uri = resolve(path, call.getQuery());

        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(defaultHeaders);
        headers.putIfAbsent(ACCEPT, APPLICATION_JSON);
        if (credentials != null) {
            Map<String, String> authHeaders = credentials.headers();
            if (authHeaders != null) {
                authHeaders.forEach((name, value) -> headers.put(checkHeaderName(name), value));
            }
        }
        call.getHeaders().forEach((name, value) -> headers.put(checkHeaderName(name), value));

        byte[] body = null;
        if (call.getBody() != null) {
            headers.putIfAbsent(CONTENT_TYPE, APPLICATION_JSON);
            body = encode(call.getBody(), headers.get(CONTENT_TYPE));
        }

        return new RequestSpec<>(method, uri, headers, body, responseShape);
    }

    /**
     * Resolves {@code path} and {@code query} against the base URL.
     */
    public URI resolve(String path, Map<String, String> query) {
        String relative = path == null ? "" : path.trim();
        if (relative.startsWith("//") || SCHEME.matcher(relative).find()) {
            throw new IllegalArgumentException("path must be relative to the base URL: " + path);
        }
        if (!relative.isEmpty() && !relative.startsWith("/") && !relative.startsWith("?")) {
            relative = "/" + relative;
        }

        StringBuilder url = new StringBuilder(baseUrl).append(relative);
        if (query != null && !query.isEmpty()) {
            char separator = relative.indexOf('?') >= 0 ? '&' : '?';
            for (Map.Entry<String, String> entry : query.entrySet()) {
                url.append(separator)
                    .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
                separator = '&';
            }
        }

        URI uri;
        try {
            uri = URI.create(url.toString()).normalize();
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("invalid request path: " + path, ex);
        }
        if (!sameOrigin(baseUri, uri)) {
            throw new IllegalArgumentException("path escapes the base URL origin: " + path);
        }
        return uri;
    }

    private byte[] encode(Object body, String contentType) throws EncodingException {
        String mediaType = mediaType(contentType);
        if (body instanceof byte[]) {
            return ((byte[]) body).clone();
        }
        if (isJson(mediaType)) {
            if (body instanceof String) {
                return ((String) body).getBytes(charset(contentType));
            }
            try {
                return mapper.writeValueAsBytes(body);
            } catch (JsonProcessingException ex) {
                throw new EncodingException("cannot encode " + body.getClass().getName() + " as JSON: "
                    + ex.getOriginalMessage(), ex);
            }
        }
        if (body instanceof String) {
            return ((String) body).getBytes(charset(contentType));
        }
        if (FORM_URLENCODED.equals(mediaType) && body instanceof Map) {
            return formEncode((Map<?, ?>) body, charset(contentType));
        }
        throw new EncodingException("cannot encode " + body.getClass().getName() + " as " + mediaType
            + "; supply a byte[] or String body");
    }

    private static byte[] formEncode(Map<?, ?> fields, Charset charset) throws EncodingException {
        StringBuilder form = new StringBuilder();
        for (Map.Entry<?, ?> entry : fields.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new EncodingException("form fields cannot have null names or values");
            }
            if (form.length() > 0) {
                form.append('&');
            }
            form.append(URLEncoder.encode(entry.getKey().toString(), charset))
                .append('=')
                .append(URLEncoder.encode(entry.getValue().toString(), charset));
        }
        return form.toString().getBytes(charset);
    }

    private static boolean isJson(String mediaType) {
        return APPLICATION_JSON.equals(mediaType) || mediaType.endsWith("+json");
    }

    private static String mediaType(String contentType) {
        if (contentType == null) {
            return APPLICATION_JSON;
        }
        int semicolon = contentType.indexOf(';');
        String type = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return type.trim().toLowerCase(Locale.ROOT);
    }

    private static Charset charset(String contentType) throws EncodingException {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String parameter : contentType.split(";")) {
            String trimmed = parameter.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
                    throw new EncodingException("unsupported charset " + name, ex);
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static boolean sameOrigin(URI base, URI candidate) {
        if (candidate.getScheme() == null || candidate.getHost() == null) {
            return false;
        }
        return base.getScheme().equalsIgnoreCase(candidate.getScheme())
            && base.getHost().equalsIgnoreCase(candidate.getHost())
            && effectivePort(base) == effectivePort(candidate);
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private static String checkHeaderName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("header name must be non-empty");
        }
        if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("header " + name + " is managed by the transport");
        }
        return name;
    }
}
