package io.restactions.client;

import io.restactions.core.ApiRequest;
import io.restactions.core.RawResponse;
import io.restactions.core.RequestExecutor;
import io.restactions.http.spi.HttpClientAdapter;
import io.restactions.http.spi.HttpClientException;
import io.restactions.http.spi.HttpClientResponse;
import io.restactions.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;

/**
 * {@link RequestExecutor} over a blocking {@link HttpClientAdapter}.
 */
public final class HttpRequestExecutor implements RequestExecutor {
    private static final Logger log = LoggerFactory.getLogger(HttpRequestExecutor.class);

    private final ClientConfig config;
    private final HttpClientAdapter http;
    private final JsonCodec codec;

    public HttpRequestExecutor(ClientConfig config, HttpClientAdapter http, JsonCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public RawResponse execute(ApiRequest request) throws HttpClientException {
        URI uri = HttpRequests.uriOf(config, request);
        long start = System.nanoTime();
        try {
            HttpClientResponse response = http.send(HttpRequests.toHttpRequest(config, codec, request, uri));
            log.debug("{} {} -> {} ({} ms)", request.verb(), uri, response.statusCode(), elapsedMillis(start));
            return HttpRequests.toRawResponse(response, uri);
        } catch (HttpClientException e) {
            log.warn("{} {} failed after {} ms: {}", request.verb(), uri, elapsedMillis(start), e.getMessage());
            throw e;
        }
    }

    @Override
    public String urlOf(ApiRequest request) {
        return HttpRequests.uriOf(config, request).toString();
    }

    static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
