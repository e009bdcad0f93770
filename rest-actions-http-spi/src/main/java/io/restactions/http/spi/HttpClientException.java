package io.restactions.http.spi;

/**
 * Exception thrown when an HTTP exchange fails below the HTTP layer
 * (connection refused, DNS failure, broken pipe, interruption).
 * Wraps underlying implementation-specific exceptions.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message) {
        super(message);
    }

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }

    public HttpClientException(Throwable cause) {
        super(cause);
    }
}
