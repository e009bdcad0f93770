package io.restactions.http.spi;

import java.util.Optional;

/**
 * Represents a fully read HTTP response from an {@link HttpClientAdapter}
 * or {@link AsyncHttpClientAdapter}.
 *
 * <p>The exchange is already closed when a response is handed out; nothing
 * needs to be released by the caller.
 */
public interface HttpClientResponse {

    /**
     * Returns the HTTP status code.
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * Returns the first value for the specified header name.
     * @param name the header name (case-insensitive)
     * @return the header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * Returns the response body.
     * @return the body bytes, or null if the response carried no entity
     */
    byte[] body();
}
