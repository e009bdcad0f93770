package io.restactions.core;

import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking counterpart of {@link RequestExecutor}.
 *
 * <p>The returned future completes with every HTTP response, error statuses included, and
 * completes exceptionally with an {@link io.restactions.http.spi.HttpClientException}
 * (possibly wrapped in a {@link java.util.concurrent.CompletionException}) on transport failure.
 * Cancelling it should abort the underlying exchange.
 */
@FunctionalInterface
public interface AsyncRequestExecutor {

    CompletableFuture<RawResponse> execute(ApiRequest request);

    /**
     * @see RequestExecutor#urlOf(ApiRequest)
     */
    default String urlOf(ApiRequest request) {
        return request.path();
    }
}
