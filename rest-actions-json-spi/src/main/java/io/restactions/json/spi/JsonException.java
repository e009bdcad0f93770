package io.restactions.json.spi;

/**
 * Base exception for JSON serialization, parsing and conversion errors.
 *
 * <p>Conversion failures may carry the JSON path of the offending value
 * (for example {@code customer.address[0].city}); parse failures do not.
 */
public class JsonException extends Exception {

    private final String path;

    public JsonException(String message) {
        this(message, null, null);
    }

    public JsonException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public JsonException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * JSON path of the value that failed conversion, or null if unknown.
     */
    public String path() {
        return path;
    }
}
