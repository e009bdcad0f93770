package io.restactions.http.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counterpart of {@link HttpClientAdapter}.
 *
 * <p>The returned future completes with the fully read response, or exceptionally with
 * an {@link HttpClientException} (possibly an {@link HttpTimeoutException}). Cancelling
 * the future abandons the exchange; implementations release the underlying connection
 * on every completion path.
 */
public interface AsyncHttpClientAdapter {

    /**
     * Sends an HTTP request asynchronously.
     *
     * @param request the HTTP request to send
     * @return a future of the response
     */
    CompletableFuture<HttpClientResponse> sendAsync(HttpClientRequest request);
}
