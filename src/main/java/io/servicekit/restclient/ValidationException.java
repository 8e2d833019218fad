package io.servicekit.restclient;

/**
 * Raised when a response body does not match the declared shape. Never retried: sending the request again will not
 * change the payload's structure.
 */
public final class ValidationException extends RestClientException {

    private static final long serialVersionUID = 1L;

    private final String fieldPath;
    private final String expected;
    private final String actual;

    public ValidationException(String fieldPath, String expected, String actual) {
        this(fieldPath, expected, actual, null);
    }

    public ValidationException(String fieldPath, String expected, String actual, Throwable cause) {
        super("response field " + fieldPath + ": expected " + expected + " but was " + actual, cause);
        this.fieldPath = fieldPath;
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * @return location of the first mismatch, for example {@code owner.id} or {@code items[2].name};
     *     {@code $} denotes the document root.
     */
    public String getFieldPath() {
        return fieldPath;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
