package io.restactions.http.spi;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Adapter that wraps a blocking {@link HttpClientAdapter} to provide the {@link AsyncHttpClientAdapter} interface.
 *
 * <p>Every exchange runs on the provided {@link Executor}. Cancelling the returned future
 * does not interrupt an exchange that is already running; the blocking adapter still
 * releases its connection when that exchange ends.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter blocking = ApacheHttpClientAdapter.create();
 * AsyncHttpClientAdapter async = new BlockingToAsyncHttpAdapter(blocking, Executors.newCachedThreadPool());
 * }</pre>
 */
public final class BlockingToAsyncHttpAdapter implements AsyncHttpClientAdapter {

    private final HttpClientAdapter delegate;
    private final Executor executor;

    /**
     * Creates an async adapter for the given blocking adapter.
     *
     * @param delegate the blocking adapter to wrap
     * @param executor executor to run blocking exchanges on
     */
    public BlockingToAsyncHttpAdapter(HttpClientAdapter delegate, Executor executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<HttpClientResponse> sendAsync(HttpClientRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return delegate.send(request);
            } catch (HttpClientException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Returns the underlying blocking adapter.
     */
    public HttpClientAdapter delegate() {
        return delegate;
    }
}
