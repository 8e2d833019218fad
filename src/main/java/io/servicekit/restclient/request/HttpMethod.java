package io.servicekit.restclient.request;

/**
 * HTTP methods supported by the client facades.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}
