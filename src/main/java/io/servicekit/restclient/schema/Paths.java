package io.servicekit.restclient.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Helpers for building field paths and describing JSON nodes in validation errors.
 */
final class Paths {

    static final String ROOT = "$";

    private Paths() {
    }

    static String field(String parent, String name) {
        if (parent == null || ROOT.equals(parent)) {
            return name;
        }
        return parent + "." + name;
    }

    static String index(String parent, int index) {
        if (parent == null || ROOT.equals(parent)) {
            return "[" + index + "]";
        }
        return parent + "[" + index + "]";
    }

    static String typeOf(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "missing";
        }
        if (node.isNull()) {
            return "null";
        }
        if (node.isTextual()) {
            return "string";
        }
        if (node.isIntegralNumber()) {
            return "integer";
        }
        if (node.isNumber()) {
            return "number";
        }
        if (node.isBoolean()) {
            return "boolean";
        }
        if (node.isObject()) {
            return "object";
        }
        if (node.isArray()) {
            return "array";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
