package io.restactions.http.spi;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using Apache HttpClient 5.
 *
 * <p>Requires {@code org.apache.httpcomponents.client5:httpclient5} on the classpath.
 * The response handler form of {@code execute} releases the connection before returning.
 * Wrap in {@link BlockingToAsyncHttpAdapter} for asynchronous use.
 */
public final class ApacheHttpClientAdapter implements HttpClientAdapter {

    private final CloseableHttpClient httpClient;

    public ApacheHttpClientAdapter(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static ApacheHttpClientAdapter create() {
        return new ApacheHttpClientAdapter(HttpClients.createDefault());
    }

    public static ApacheHttpClientAdapter create(CloseableHttpClient httpClient) {
        return new ApacheHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try {
            HttpUriRequestBase apacheRequest = toApacheRequest(request);
            return httpClient.execute(apacheRequest, response -> {
                byte[] body = response.getEntity() != null
                        ? EntityUtils.toByteArray(response.getEntity())
                        : null;
                return new ByteArrayResponse(response.getCode(), response.getHeaders(), body);
            });
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (Exception e) {
            throw new HttpClientException(e);
        }
    }

    private static HttpUriRequestBase toApacheRequest(HttpClientRequest request) {
        HttpUriRequestBase apacheRequest = new HttpUriRequestBase(request.method(), request.uri());

        if (request.body() != null) {
            String contentType = request.header("Content-Type");
            ContentType type = contentType != null ? ContentType.parse(contentType) : ContentType.APPLICATION_JSON;
            apacheRequest.setEntity(new ByteArrayEntity(request.body(), type));
        }

        request.headers().forEach(apacheRequest::setHeader);

        if (request.timeout() != null) {
            long millis = request.timeout().toMillis();
            RequestConfig config = RequestConfig.custom()
                    .setResponseTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .setConnectionRequestTimeout(Timeout.of(millis, TimeUnit.MILLISECONDS))
                    .build();
            apacheRequest.setConfig(config);
        }

        return apacheRequest;
    }

    private static final class ByteArrayResponse implements HttpClientResponse {
        private final int statusCode;
        private final Header[] headers;
        private final byte[] body;

        ByteArrayResponse(int statusCode, Header[] headers, byte[] body) {
            this.statusCode = statusCode;
            this.headers = headers;
            this.body = body;
        }

        @Override public int statusCode() { return statusCode; }

        @Override
        public Optional<String> header(String name) {
            for (Header h : headers) {
                if (h.getName().equalsIgnoreCase(name)) {
                    return Optional.ofNullable(h.getValue());
                }
            }
            return Optional.empty();
        }

        @Override public byte[] body() { return body; }
    }
}
