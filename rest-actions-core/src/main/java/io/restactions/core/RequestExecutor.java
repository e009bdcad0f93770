package io.restactions.core;

import io.restactions.http.spi.HttpClientException;

/**
 * Blocking transport capability used by {@link ResourceHandle}.
 *
 * <p>Implementations must attach credentials, send JSON and return every HTTP response,
 * including error statuses. Only failures below the HTTP layer are thrown.
 */
@FunctionalInterface
public interface RequestExecutor {

    RawResponse execute(ApiRequest request) throws HttpClientException;

    /**
     * URL reported on transport failures; the request path unless the executor knows the
     * absolute address.
     */
    default String urlOf(ApiRequest request) {
        return request.path();
    }
}
