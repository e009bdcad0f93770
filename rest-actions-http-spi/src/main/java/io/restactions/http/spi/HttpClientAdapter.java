package io.restactions.http.spi;

/**
 * Blocking abstraction for HTTP client implementations.
 *
 * <p>This interface lets the REST action engine work with different HTTP client
 * libraries (JDK HttpClient, Apache HttpClient, OkHttp, etc.) without a direct
 * dependency on any of them. The calling thread blocks until the response has been
 * read completely or the exchange fails.
 *
 * <p>Implementations should be thread-safe and reusable. Every call is an independent
 * exchange whose connection-level resources are released before the method returns.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://example.com")).build();
 * HttpClientResponse response = adapter.send(request);
 * }</pre>
 *
 * @see AsyncHttpClientAdapter
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and returns the response with body as byte array.
     *
     * <p>HTTP error statuses are returned as regular responses; only failures below
     * the HTTP layer raise an exception.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with body as bytes
     * @throws HttpClientException if the request fails
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;
}
