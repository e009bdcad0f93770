package io.restactions.client;

import io.restactions.core.ActionRegistry;
import io.restactions.core.AsyncRequestExecutor;
import io.restactions.core.AsyncResourceHandle;
import io.restactions.core.RequestExecutor;
import io.restactions.core.ResourceHandle;

import java.util.Objects;

/**
 * Binds an endpoint and an {@link ActionRegistry} to a client's executor.
 *
 * <p>Construction only: no I/O happens here. Registry well-formedness is enforced when the
 * registry is built.
 */
public final class ResourceFactory {
    private ResourceFactory() {}

    public static <E> ResourceHandle<E> build(RestActionsClient client, String endpoint,
                                              RequestExecutor executor, ActionRegistry<E> registry) {
        Objects.requireNonNull(client, "client");
        return new ResourceHandle<>(endpoint, registry, executor, client.codec());
    }

    public static <E> AsyncResourceHandle<E> buildAsync(RestActionsClient client, String endpoint,
                                                        AsyncRequestExecutor executor, ActionRegistry<E> registry) {
        Objects.requireNonNull(client, "client");
        return new AsyncResourceHandle<>(endpoint, registry, executor, client.codec());
    }
}
