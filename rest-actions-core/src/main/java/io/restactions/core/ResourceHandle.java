package io.restactions.core;

import io.restactions.json.spi.JsonCodec;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Blocking operations on one REST resource.
 *
 * <p>Each method runs on the calling thread and returns an {@link ActionResult}; classified
 * failures are never thrown. Actions missing from the registry fail without touching the
 * executor. Instances hold no per-call state and may be shared between threads.
 *
 * @param <E> the entity type returned by get, create, update and list
 */
public final class ResourceHandle<E> {

    private final RequestExecutor executor;
    private final ActionDispatcher<E> dispatcher;

    public ResourceHandle(String endpoint, ActionRegistry<E> registry, RequestExecutor executor, JsonCodec codec) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.dispatcher = new ActionDispatcher<>(endpoint, registry, codec);
    }

    public String endpoint() {
        return dispatcher.endpoint();
    }

    public ActionRegistry<E> registry() {
        return dispatcher.registry();
    }

    /** {@code GET endpoint/id}. */
    public ActionResult<E> get(String id) {
        return dispatcher.run(executor, ActionKey.GET, id, null, null, dispatcher.entity());
    }

    /** {@code POST endpoint}; null top-level fields of {@code payload} are not sent. */
    public ActionResult<E> create(Object payload) {
        return dispatcher.run(executor, ActionKey.CREATE, null, payload, null, dispatcher.entity());
    }

    /** {@code PATCH endpoint/id}; the body is prepared as for {@link #create(Object)}. */
    public ActionResult<E> update(String id, Object payload) {
        return dispatcher.run(executor, ActionKey.UPDATE, id, payload, null, dispatcher.entity());
    }

    /**
     * {@code DELETE endpoint/id}. Succeeds with true for 200 and 204, false for any other
     * status below 400.
     */
    public ActionResult<Boolean> delete(String id) {
        return dispatcher.run(executor, ActionKey.DELETE, id, null, null, dispatcher.delete());
    }

    public ActionResult<List<E>> list() {
        return list(Map.of());
    }

    /**
     * {@code GET endpoint?query}. Elements keep the response order.
     */
    public ActionResult<List<E>> list(Map<String, String> query) {
        return dispatcher.run(executor, ActionKey.LIST, null, null, query, dispatcher.list());
    }

    public ActionResult<Object> performSubaction(String id, String subaction) {
        return performSubaction(id, subaction, null);
    }

    /**
     * Runs {@code endpoint/id/suffix}. No body is sent when {@code payload} is null.
     */
    public ActionResult<Object> performSubaction(String id, String subaction, Object payload) {
        return dispatcher.subactionKey(subaction)
                .flatMap(key -> dispatcher.run(executor, key, id, payload, null, dispatcher.subaction()));
    }

    /**
     * Typed variant; fails with a configuration error when the subaction's shape does not
     * produce {@code type}.
     */
    public <R> ActionResult<R> performSubaction(String id, String subaction, Object payload, Class<R> type) {
        return dispatcher.subactionKey(subaction, type)
                .flatMap(key -> dispatcher.run(executor, key, id, payload, null, dispatcher.subaction()))
                .map(type::cast);
    }
}
