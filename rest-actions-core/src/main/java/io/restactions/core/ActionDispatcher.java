package io.restactions.core;

import io.restactions.http.spi.HttpClientException;
import io.restactions.json.spi.JsonCodec;
import io.restactions.json.spi.JsonException;
import io.restactions.json.spi.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * The dispatch algorithm shared by every resource and both execution modes.
 *
 * <p>A call is planned (allowed check, verb, path, body), handed to an executor and
 * completed (classify statuses of 400 and above, then parse, unwrap and validate). Planning
 * failures never reach the executor. Every failure carries the action key and endpoint.
 *
 * @param <E> the resource's entity type
 */
public final class ActionDispatcher<E> {

    /**
     * A request ready to execute together with the config that will interpret its response.
     */
    public record Plan(ActionKey key, ActionConfig<?> config, ApiRequest request) {}

    /**
     * Turns a non-failing response into the action's result.
     */
    @FunctionalInterface
    public interface Completion<R> {
        ActionResult<R> complete(ActionConfig<?> config, RawResponse response);
    }

    private final String endpoint;
    private final ActionRegistry<E> registry;
    private final JsonCodec codec;
    private final ErrorClassifier classifier;
    private final PayloadPreparer preparer;

    public ActionDispatcher(String endpoint, ActionRegistry<E> registry, JsonCodec codec) {
        Objects.requireNonNull(endpoint, "endpoint");
        this.endpoint = Urls.join(endpoint);
        if (this.endpoint.isEmpty()) {
            throw RestActionException.configuration("Resource endpoint must not be empty");
        }
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.classifier = new ErrorClassifier(codec);
        this.preparer = new PayloadPreparer(codec);
    }

    public String endpoint() {
        return endpoint;
    }

    public ActionRegistry<E> registry() {
        return registry;
    }

    // ===== Skeleton =====

    public <R> ActionResult<R> run(RequestExecutor executor, ActionKey key, String id, Object payload,
                                   Map<String, String> query, Completion<R> completion) {
        ActionResult<Plan> planned = plan(key, id, payload, query);
        if (planned instanceof ActionResult.Failure<Plan> f) {
            return f.cast();
        }
        Plan plan = planned.orThrow();
        RawResponse response;
        try {
            response = executor.execute(plan.request());
        } catch (HttpClientException e) {
            return transportFailure(plan, executor.urlOf(plan.request()), e);
        }
        return complete(plan, response, completion);
    }

    public <R> CompletableFuture<ActionResult<R>> runAsync(AsyncRequestExecutor executor, ActionKey key, String id,
                                                           Object payload, Map<String, String> query,
                                                           Completion<R> completion) {
        ActionResult<Plan> planned = plan(key, id, payload, query);
        if (planned instanceof ActionResult.Failure<Plan> f) {
            return CompletableFuture.completedFuture(f.cast());
        }
        Plan plan = planned.orThrow();
        CompletableFuture<RawResponse> exchange = executor.execute(plan.request());
        CompletableFuture<ActionResult<R>> result = exchange.handle((response, failure) -> {
            if (failure == null) {
                return complete(plan, response, completion);
            }
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause() : failure;
            if (cause instanceof HttpClientException transport) {
                return transportFailure(plan, executor.urlOf(plan.request()), transport);
            }
            throw failure instanceof CompletionException ce ? ce : new CompletionException(cause);
        });
        result.whenComplete((r, t) -> {
            if (t instanceof CancellationException) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    /**
     * Checks the action is configured and builds its request.
     */
    public ActionResult<Plan> plan(ActionKey key, String id, Object payload, Map<String, String> query) {
        ActionConfig<?> config = registry.find(key).orElse(null);
        if (config == null) {
            String what = key.isSubaction()
                    ? "The subaction '" + key.subaction() + "'"
                    : "The action '" + key + "'";
            return configurationFailure(key, what + " is not allowed for " + endpoint);
        }

        String path;
        switch (key.kind()) {
            case CREATE:
            case LIST:
                path = endpoint;
                break;
            case PERFORM:
                if (id == null || id.isBlank()) {
                    return configurationFailure(key, "The subaction '" + key.subaction() + "' on " + endpoint + " requires a resource id");
                }
                path = Urls.join(endpoint, Urls.segment(id), config.endpointSuffix());
                break;
            default:
                if (id == null || id.isBlank()) {
                    return configurationFailure(key, "The action '" + key + "' on " + endpoint + " requires a resource id");
                }
                path = Urls.join(endpoint, Urls.segment(id));
        }

        JsonNode body = null;
        if (key.kind() == ActionKind.CREATE || key.kind() == ActionKind.UPDATE || key.kind() == ActionKind.PERFORM) {
            if (payload == null && key.kind() != ActionKind.PERFORM) {
                return configurationFailure(key, "The action '" + key + "' on " + endpoint + " requires a payload");
            }
            ActionResult<JsonNode> prepared = preparer.prepare(payload);
            if (prepared instanceof ActionResult.Failure<JsonNode> f) {
                return ActionResult.failure(f.error().withContext(key, endpoint));
            }
            body = prepared.orThrow();
        }

        Map<String, String> params = key.kind() == ActionKind.LIST ? query : null;
        return ActionResult.success(new Plan(key, config, new ApiRequest(config.verb(), path, body, params)));
    }

    /**
     * Interprets a response: statuses of 400 and above are classified before anything else.
     */
    public <R> ActionResult<R> complete(Plan plan, RawResponse response, Completion<R> completion) {
        ActionResult<R> result = ErrorClassifier.isFailure(response.statusCode())
                ? ActionResult.failure(classifier.classify(response.statusCode(), response.bodyText(), response.url()))
                : completion.complete(plan.config(), response);
        return result.mapError(e -> (e.url() == null ? e.withUrl(response.url()) : e).withContext(plan.key(), endpoint));
    }

    public <R> ActionResult<R> transportFailure(Plan plan, String url, HttpClientException failure) {
        return ActionResult.failure(classifier.transportFailure(url, failure)
                .withContext(plan.key(), endpoint));
    }

    /**
     * Key for a caller-supplied subaction name. A null or blank name is never configured.
     */
    public ActionResult<ActionKey> subactionKey(String name) {
        if (name == null || name.isBlank()) {
            return configurationFailure(null, "The subaction '" + (name == null ? "" : name)
                    + "' is not allowed for " + endpoint);
        }
        return ActionResult.success(ActionKey.perform(name));
    }

    /**
     * As {@link #subactionKey(String)}, and fails when the configured shape does not produce
     * {@code type}. Unconfigured names are left to {@link #plan}.
     */
    public ActionResult<ActionKey> subactionKey(String name, Class<?> type) {
        return subactionKey(name).flatMap(key -> registry.find(key)
                .filter(config -> !type.isAssignableFrom(config.shape().type()))
                .<ActionResult<ActionKey>>map(config -> configurationFailure(key, "The subaction '"
                        + key.subaction() + "' on " + endpoint + " produces "
                        + config.shape().type().getName() + ", not " + type.getName()))
                .orElseGet(() -> ActionResult.success(key)));
    }

    // ===== Completions =====

    /**
     * Single entity for get, create and update.
     */
    public Completion<E> entity() {
        return (config, response) -> completeValue(entityConfig(config), response);
    }

    public Completion<List<E>> list() {
        return (config, response) -> completeList(entityConfig(config), response);
    }

    /**
     * True for 200 and 204. Other non-failing statuses yield false; the body is not read.
     */
    public Completion<Boolean> delete() {
        return (config, response) -> ActionResult.success(response.statusCode() == 200 || response.statusCode() == 204);
    }

    public Completion<Object> subaction() {
        return (config, response) -> completeValue(config, response).map(v -> v);
    }

    <T> ActionResult<T> completeValue(ActionConfig<T> config, RawResponse response) {
        return parse(response).flatMap(body -> ResponseUnwrapper.unwrapAndValidate(body, config, endpoint));
    }

    <T> ActionResult<List<T>> completeList(ActionConfig<T> config, RawResponse response) {
        return parse(response)
                .flatMap(body -> ResponseUnwrapper.unwrap(body, config, endpoint))
                .flatMap(items -> validateEach(items, config.shape()));
    }

    private static <T> ActionResult<List<T>> validateEach(JsonNode items, ResultShape<T> shape) {
        if (items == null || !items.isArray()) {
            String raw = items == null ? "null" : items.toString();
            return ActionResult.failure(ClassifiedError.responseParse("expected an array of "
                    + shape.type().getSimpleName() + " but found " + describe(items), raw, null));
        }
        List<T> out = new ArrayList<>(items.size());
        int index = 0;
        for (Iterator<JsonNode> it = items.elements(); it.hasNext(); index++) {
            JsonNode item = it.next();
            try {
                out.add(shape.validate(item));
            } catch (ShapeViolationException e) {
                return ActionResult.failure(ResponseUnwrapper.shapeFailure(item, shape, e.under("[" + index + "]")));
            }
        }
        return ActionResult.success(Collections.unmodifiableList(out));
    }

    private ActionResult<JsonNode> parse(RawResponse response) {
        if (!response.hasBody()) {
            return ActionResult.success(codec.nullNode());
        }
        try {
            return ActionResult.success(codec.readTree(response.body()));
        } catch (JsonException e) {
            return ActionResult.failure(ClassifiedError.responseParse("body is not valid JSON",
                    response.bodyText(), e).withStatus(response.statusCode()));
        }
    }

    private ActionConfig<E> entityConfig(ActionConfig<?> config) {
        return registry.entityAction(config.key())
                .orElseThrow(() -> new IllegalStateException("not an entity action: " + config.key()));
    }

    private <T> ActionResult<T> configurationFailure(ActionKey key, String message) {
        return ActionResult.failure(ClassifiedError.configuration(message).withContext(key, endpoint));
    }

    private static String describe(JsonNode node) {
        return node == null ? "nothing" : node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
