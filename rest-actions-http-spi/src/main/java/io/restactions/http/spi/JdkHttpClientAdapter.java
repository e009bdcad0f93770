package io.restactions.http.spi;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link HttpClientAdapter} and {@link AsyncHttpClientAdapter} implementation using the JDK 11+ HttpClient.
 * This is the default implementation when no other HTTP client library is configured.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter, AsyncHttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new adapter with a default HttpClient.
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient());
    }

    /**
     * Creates a new adapter with the specified HttpClient.
     * @param httpClient the HttpClient to use
     * @return a new JdkHttpClientAdapter
     */
    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try {
            HttpRequest jdkRequest = toJdkRequest(request);
            HttpResponse<byte[]> response = httpClient.send(jdkRequest, HttpResponse.BodyHandlers.ofByteArray());
            return new ByteArrayResponse(response);
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException("Request interrupted", e);
        } catch (Exception e) {
            throw new HttpClientException(e);
        }
    }

    @Override
    public CompletableFuture<HttpClientResponse> sendAsync(HttpClientRequest request) {
        HttpRequest jdkRequest;
        try {
            jdkRequest = toJdkRequest(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new HttpClientException(e));
        }
        CompletableFuture<HttpResponse<byte[]>> exchange =
                httpClient.sendAsync(jdkRequest, HttpResponse.BodyHandlers.ofByteArray());
        CompletableFuture<HttpClientResponse> result = new CompletableFuture<>();
        exchange.whenComplete((response, failure) -> {
            if (failure != null) {
                result.completeExceptionally(translate(failure));
            } else {
                result.complete(new ByteArrayResponse(response));
            }
        });
        result.whenComplete((ignored, failure) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    private static HttpClientException translate(Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        if (cause instanceof java.net.http.HttpTimeoutException) {
            return new HttpTimeoutException(cause);
        }
        if (cause instanceof HttpClientException e) {
            return e;
        }
        return new HttpClientException(cause);
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());

        HttpRequest.BodyPublisher bodyPublisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        builder.method(request.method(), bodyPublisher);
        request.headers().forEach(builder::header);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        return builder.build();
    }

    private static final class ByteArrayResponse implements HttpClientResponse {
        private final HttpResponse<byte[]> response;

        ByteArrayResponse(HttpResponse<byte[]> response) {
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public byte[] body() {
            return response.body();
        }
    }
}
