package io.restactions.client;

import io.restactions.core.ApiRequest;
import io.restactions.core.RawResponse;
import io.restactions.core.Urls;
import io.restactions.http.spi.HttpClientException;
import io.restactions.http.spi.HttpClientRequest;
import io.restactions.http.spi.HttpClientResponse;
import io.restactions.json.spi.JsonCodec;
import io.restactions.json.spi.JsonException;

import java.net.URI;

/**
 * Translation between core requests and transport requests.
 */
final class HttpRequests {
    static final String JSON = "application/json";

    private HttpRequests() {}

    static URI uriOf(ClientConfig config, ApiRequest request) {
        return Urls.withQuery(Urls.resolve(config.baseUrl(), request.path()), request.query());
    }

    static HttpClientRequest toHttpRequest(ClientConfig config, JsonCodec codec, ApiRequest request, URI uri)
            throws HttpClientException {
        HttpClientRequest.Builder builder = HttpClientRequest.builder(uri, request.verb().name())
                .headers(config.headers())
                .header("Authorization", "Bearer " + config.apiKey())
                .header("Accept", JSON)
                .timeout(config.timeout());
        if (request.body() != null) {
            try {
                builder.header("Content-Type", JSON).body(codec.writeBytes(request.body()));
            } catch (JsonException e) {
                throw new HttpClientException("Failed to encode request body for " + uri, e);
            }
        }
        return builder.build();
    }

    static RawResponse toRawResponse(HttpClientResponse response, URI uri) {
        return new RawResponse(response.statusCode(), response.body(), uri.toString());
    }
}
