package io.servicekit.restclient.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Extracts a human readable message from error payloads. Services built on common frameworks report errors as
 * {@code {"detail": ...}}, {@code {"message": ...}} or {@code {"error": ...}}; anything else yields {@code null}.
 */
public final class HttpErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();
    private static final List<String> MESSAGE_FIELDS = List.of("detail", "message", "error");
    private static final int MAX_TEXT_DETAIL = 512;

    private HttpErrorDecoder() {
    }

    public static String detail(byte[] body, String contentType) {
        if (body == null || body.length == 0) {
            return null;
        }

        try {
            JsonNode node = MAPPER.readTree(body);
            if (node == null || !node.isObject()) {
                return null;
            }
            for (String field : MESSAGE_FIELDS) {
                JsonNode value = node.get(field);
                if (value == null || value.isNull()) {
                    continue;
                }
                return value.isTextual() ? value.asText() : value.toString();
            }
            return null;
        } catch (IOException ex) {
            if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("text/")) {
                String text = new String(body, StandardCharsets.UTF_8).trim();
                return text.length() > MAX_TEXT_DETAIL ? text.substring(0, MAX_TEXT_DETAIL) : text;
            }
            return null;
        }
    }
}
