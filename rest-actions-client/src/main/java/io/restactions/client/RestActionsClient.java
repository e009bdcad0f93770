package io.restactions.client;

import io.restactions.core.ActionRegistry;
import io.restactions.core.AsyncRequestExecutor;
import io.restactions.core.AsyncResourceHandle;
import io.restactions.core.RequestExecutor;
import io.restactions.core.ResourceHandle;
import io.restactions.core.RestActionException;
import io.restactions.http.spi.AsyncHttpClientAdapter;
import io.restactions.http.spi.BlockingToAsyncHttpAdapter;
import io.restactions.http.spi.HttpClientAdapter;
import io.restactions.http.spi.JdkHttpClientAdapter;
import io.restactions.json.spi.JsonCodec;
import io.restactions.json.spi.JsonCodecs;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Entry point: holds the configuration, the JSON codec and one executor for the configured
 * {@link ExecutionMode}, and hands out resource handles bound to them.
 *
 * <pre>{@code
 * RestActionsClient client = RestActionsClient.builder()
 *         .config(ClientConfig.fromEnvironment())
 *         .build();
 * ResourceHandle<Company> company = client.resource("company",
 *         ActionRegistry.builder(Company.class).get("company").update("company").build());
 * }</pre>
 */
public final class RestActionsClient {

    private final ClientConfig config;
    private final JsonCodec codec;
    private final RequestExecutor executor;
    private final AsyncRequestExecutor asyncExecutor;

    private RestActionsClient(ClientConfig config, JsonCodec codec, RequestExecutor executor, AsyncRequestExecutor asyncExecutor) {
        this.config = config;
        this.codec = codec;
        this.executor = executor;
        this.asyncExecutor = asyncExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ClientConfig config() {
        return config;
    }

    public ExecutionMode mode() {
        return config.mode();
    }

    public JsonCodec codec() {
        return codec;
    }

    /**
     * The blocking executor.
     *
     * @throws RestActionException.Configuration if the client was built for {@link ExecutionMode#ASYNC}
     */
    public RequestExecutor requestExecutor() {
        if (executor == null) {
            throw RestActionException.configuration("Client is in " + config.mode() + " mode; use asyncResource(...)");
        }
        return executor;
    }

    /**
     * The async executor.
     *
     * @throws RestActionException.Configuration if the client was built for {@link ExecutionMode#BLOCKING}
     */
    public AsyncRequestExecutor asyncRequestExecutor() {
        if (asyncExecutor == null) {
            throw RestActionException.configuration("Client is in " + config.mode() + " mode; use resource(...)");
        }
        return asyncExecutor;
    }

    public <E> ResourceHandle<E> resource(String endpoint, ActionRegistry<E> registry) {
        return ResourceFactory.build(this, endpoint, requestExecutor(), registry);
    }

    public <E> AsyncResourceHandle<E> asyncResource(String endpoint, ActionRegistry<E> registry) {
        return ResourceFactory.buildAsync(this, endpoint, asyncRequestExecutor(), registry);
    }

    @Override
    public String toString() {
        return "RestActionsClient{" + config + "}";
    }

    public static final class Builder {
        private ClientConfig config;
        private JsonCodec codec;
        private HttpClientAdapter httpClient;
        private AsyncHttpClientAdapter asyncHttpClient;
        private Executor blockingExecutor;

        private Builder() {}

        public Builder config(ClientConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder codec(JsonCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        /**
         * Transport for blocking mode. In async mode it is used as well when no async transport
         * is set, running on {@link #blockingExecutor(Executor)} unless it is already async capable.
         */
        public Builder httpClient(HttpClientAdapter httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
            return this;
        }

        public Builder asyncHttpClient(AsyncHttpClientAdapter asyncHttpClient) {
            this.asyncHttpClient = Objects.requireNonNull(asyncHttpClient, "asyncHttpClient");
            return this;
        }

        /**
         * Executor that runs a blocking-only transport in async mode. Defaults to the common pool.
         */
        public Builder blockingExecutor(Executor executor) {
            this.blockingExecutor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public RestActionsClient build() {
            if (config == null) {
                throw RestActionException.configuration("Client configuration is required");
            }
            JsonCodec resolvedCodec = codec == null ? JsonCodecs.load() : codec;
            if (config.mode() == ExecutionMode.BLOCKING) {
                HttpClientAdapter http = httpClient == null ? JdkHttpClientAdapter.create() : httpClient;
                return new RestActionsClient(config, resolvedCodec,
                        new HttpRequestExecutor(config, http, resolvedCodec), null);
            }
            return new RestActionsClient(config, resolvedCodec, null,
                    new AsyncHttpRequestExecutor(config, resolveAsync(), resolvedCodec));
        }

        private AsyncHttpClientAdapter resolveAsync() {
            if (asyncHttpClient != null) {
                return asyncHttpClient;
            }
            if (httpClient == null) {
                return JdkHttpClientAdapter.create();
            }
            if (httpClient instanceof AsyncHttpClientAdapter capable) {
                return capable;
            }
            return new BlockingToAsyncHttpAdapter(httpClient,
                    blockingExecutor == null ? ForkJoinPool.commonPool() : blockingExecutor);
        }
    }
}
