package io.restactions.client;

import io.restactions.core.ApiRequest;
import io.restactions.core.AsyncRequestExecutor;
import io.restactions.core.RawResponse;
import io.restactions.http.spi.AsyncHttpClientAdapter;
import io.restactions.http.spi.HttpClientException;
import io.restactions.http.spi.HttpClientRequest;
import io.restactions.http.spi.HttpClientResponse;
import io.restactions.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link AsyncRequestExecutor} over an {@link AsyncHttpClientAdapter}.
 *
 * <p>Cancelling a returned future cancels the adapter's exchange.
 */
public final class AsyncHttpRequestExecutor implements AsyncRequestExecutor {
    private static final Logger log = LoggerFactory.getLogger(AsyncHttpRequestExecutor.class);

    private final ClientConfig config;
    private final AsyncHttpClientAdapter http;
    private final JsonCodec codec;

    public AsyncHttpRequestExecutor(ClientConfig config, AsyncHttpClientAdapter http, JsonCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public CompletableFuture<RawResponse> execute(ApiRequest request) {
        URI uri = HttpRequests.uriOf(config, request);
        HttpClientRequest httpRequest;
        try {
            httpRequest = HttpRequests.toHttpRequest(config, codec, request, uri);
        } catch (HttpClientException e) {
            return CompletableFuture.failedFuture(e);
        }

        long start = System.nanoTime();
        CompletableFuture<HttpClientResponse> exchange = http.sendAsync(httpRequest);
        CompletableFuture<RawResponse> result = exchange.handle((response, failure) -> {
            long elapsed = HttpRequestExecutor.elapsedMillis(start);
            if (failure == null) {
                log.debug("{} {} -> {} ({} ms)", request.verb(), uri, response.statusCode(), elapsed);
                return HttpRequests.toRawResponse(response, uri);
            }
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause() : failure;
            if (!(cause instanceof CancellationException)) {
                log.warn("{} {} failed after {} ms: {}", request.verb(), uri, elapsed, cause.getMessage());
            }
            throw failure instanceof CompletionException ce ? ce : new CompletionException(cause);
        });
        result.whenComplete((r, t) -> {
            if (t instanceof CancellationException) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    @Override
    public String urlOf(ApiRequest request) {
        return HttpRequests.uriOf(config, request).toString();
    }
}
