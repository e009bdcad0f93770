package io.restactions.http.spi;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} and {@link AsyncHttpClientAdapter} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter, AsyncHttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        Call call = newCall(request);
        try (Response response = call.execute()) {
            return new ByteArrayResponse(response);
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(e);
        } catch (InterruptedIOException e) {
            if (isCallTimeout(e)) throw new HttpTimeoutException(e);
            throw new HttpClientException(e);
        } catch (IOException e) {
            throw new HttpClientException(e);
        }
    }

    @Override
    public CompletableFuture<HttpClientResponse> sendAsync(HttpClientRequest request) {
        Call call;
        try {
            call = newCall(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new HttpClientException(e));
        }
        CompletableFuture<HttpClientResponse> result = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call c, IOException e) {
                if (e instanceof SocketTimeoutException || isCallTimeout(e)) {
                    result.completeExceptionally(new HttpTimeoutException(e));
                } else {
                    result.completeExceptionally(new HttpClientException(e));
                }
            }

            @Override
            public void onResponse(Call c, Response response) {
                try (response) {
                    result.complete(new ByteArrayResponse(response));
                } catch (IOException e) {
                    result.completeExceptionally(new HttpClientException(e));
                }
            }
        });
        result.whenComplete((ignored, failure) -> {
            if (result.isCancelled()) {
                call.cancel();
            }
        });
        return result;
    }

    private Call newCall(HttpClientRequest request) {
        return clientWithTimeout(request).newCall(toOkHttpRequest(request));
    }

    private static boolean isCallTimeout(IOException e) {
        return e instanceof InterruptedIOException && "timeout".equals(e.getMessage());
    }

    private OkHttpClient clientWithTimeout(HttpClientRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .writeTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString());

        request.headers().forEach(builder::header);

        RequestBody body = null;
        if (request.body() != null) {
            String contentType = request.header("Content-Type");
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            body = RequestBody.create(request.body(), mediaType);
        }

        String method = request.method();
        switch (method) {
            case "GET" -> builder.get();
            case "DELETE" -> { if (body != null) builder.delete(body); else builder.delete(); }
            case "POST" -> builder.post(body != null ? body : RequestBody.create(new byte[0], null));
            case "PATCH" -> builder.patch(body != null ? body : RequestBody.create(new byte[0], null));
            default -> builder.method(method, body);
        }

        return builder.build();
    }

    private static final class ByteArrayResponse implements HttpClientResponse {
        private final int statusCode;
        private final okhttp3.Headers headers;
        private final byte[] body;

        ByteArrayResponse(Response response) throws IOException {
            this.statusCode = response.code();
            this.headers = response.headers();
            ResponseBody responseBody = response.body();
            this.body = responseBody != null ? responseBody.bytes() : null;
        }

        @Override public int statusCode() { return statusCode; }
        @Override public Optional<String> header(String name) { return Optional.ofNullable(headers.get(name)); }
        @Override public byte[] body() { return body; }
    }
}
