package io.restactions.core;

import io.restactions.json.spi.JsonCodec;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking operations on one REST resource.
 *
 * <p>Same contract as {@link ResourceHandle}; only the wait for the response is
 * asynchronous. Futures complete normally with an {@link ActionResult} for every classified
 * outcome. Cancelling a returned future cancels the underlying exchange.
 *
 * @param <E> the entity type returned by get, create, update and list
 */
public final class AsyncResourceHandle<E> {

    private final AsyncRequestExecutor executor;
    private final ActionDispatcher<E> dispatcher;

    public AsyncResourceHandle(String endpoint, ActionRegistry<E> registry, AsyncRequestExecutor executor, JsonCodec codec) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.dispatcher = new ActionDispatcher<>(endpoint, registry, codec);
    }

    public String endpoint() {
        return dispatcher.endpoint();
    }

    public ActionRegistry<E> registry() {
        return dispatcher.registry();
    }

    public CompletableFuture<ActionResult<E>> get(String id) {
        return dispatcher.runAsync(executor, ActionKey.GET, id, null, null, dispatcher.entity());
    }

    public CompletableFuture<ActionResult<E>> create(Object payload) {
        return dispatcher.runAsync(executor, ActionKey.CREATE, null, payload, null, dispatcher.entity());
    }

    public CompletableFuture<ActionResult<E>> update(String id, Object payload) {
        return dispatcher.runAsync(executor, ActionKey.UPDATE, id, payload, null, dispatcher.entity());
    }

    public CompletableFuture<ActionResult<Boolean>> delete(String id) {
        return dispatcher.runAsync(executor, ActionKey.DELETE, id, null, null, dispatcher.delete());
    }

    public CompletableFuture<ActionResult<List<E>>> list() {
        return list(Map.of());
    }

    public CompletableFuture<ActionResult<List<E>>> list(Map<String, String> query) {
        return dispatcher.runAsync(executor, ActionKey.LIST, null, null, query, dispatcher.list());
    }

    public CompletableFuture<ActionResult<Object>> performSubaction(String id, String subaction) {
        return performSubaction(id, subaction, null);
    }

    public CompletableFuture<ActionResult<Object>> performSubaction(String id, String subaction, Object payload) {
        return run(dispatcher.subactionKey(subaction), id, payload);
    }

    public <R> CompletableFuture<ActionResult<R>> performSubaction(String id, String subaction, Object payload, Class<R> type) {
        return run(dispatcher.subactionKey(subaction, type), id, payload)
                .thenApply(result -> result.map(type::cast));
    }

    private CompletableFuture<ActionResult<Object>> run(ActionResult<ActionKey> key, String id, Object payload) {
        if (key instanceof ActionResult.Failure<ActionKey> f) {
            return CompletableFuture.completedFuture(f.cast());
        }
        return dispatcher.runAsync(executor, key.orThrow(), id, payload, null, dispatcher.subaction());
    }
}
