package io.restactions.core;

import io.restactions.json.spi.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Extracts an action's payload from a response body and validates it into the action's shape.
 *
 * <p>A configured unwrap key must be present even on 2xx responses; its absence is an
 * {@link ErrorKind#HTTP} error. Shape violations are {@link ErrorKind#RESPONSE_PARSE}
 * errors carrying the offending value as raw body. Never performs I/O.
 */
public final class ResponseUnwrapper {

    private static final String[] DIAGNOSTIC_FIELDS = {"message", "errors", "error"};

    private ResponseUnwrapper() {}

    public static <T> ActionResult<T> unwrapAndValidate(JsonNode body, ActionConfig<T> config, String endpoint) {
        return unwrap(body, config, endpoint).flatMap(candidate -> validate(candidate, config.shape()));
    }

    /**
     * Returns the value under the config's unwrap key, or the whole body when none is set.
     */
    public static ActionResult<JsonNode> unwrap(JsonNode body, ActionConfig<?> config, String endpoint) {
        String key = config.unwrapKey();
        if (key == null) {
            return ActionResult.success(body);
        }
        if (body != null && body.isObject() && body.has(key)) {
            return ActionResult.success(body.get(key));
        }
        return ActionResult.failure(missingKey(body, key, config.key(), endpoint));
    }

    /**
     * Validates a candidate value into {@code shape}.
     */
    public static <T> ActionResult<T> validate(JsonNode candidate, ResultShape<T> shape) {
        try {
            return ActionResult.success(shape.validate(candidate));
        } catch (ShapeViolationException e) {
            return ActionResult.failure(shapeFailure(candidate, shape, e));
        }
    }

    static ClassifiedError shapeFailure(JsonNode candidate, ResultShape<?> shape, ShapeViolationException e) {
        String raw = candidate == null ? "null" : candidate.toString();
        return ClassifiedError.responseParse(
                "value does not match " + shape.type().getSimpleName(), raw, e);
    }

    private static ClassifiedError missingKey(JsonNode body, String key, ActionKey action, String endpoint) {
        StringBuilder message = new StringBuilder("Response key '").append(key)
                .append("' not found in response for action '").append(action)
                .append("' on ").append(endpoint);
        if (body != null && body.isObject()) {
            for (String field : DIAGNOSTIC_FIELDS) {
                JsonNode value = body.get(field);
                if (value != null && !value.isNull()) {
                    message.append(" - API ").append(field).append(": ").append(ErrorClassifier.text(value));
                    break;
                }
            }
            List<String> available = new ArrayList<>();
            for (Iterator<String> it = body.fieldNames(); it.hasNext(); ) {
                available.add(it.next());
            }
            if (!available.isEmpty()) {
                message.append(" (available keys: ").append(String.join(", ", available)).append(')');
            }
        }
        return new ClassifiedError(ErrorKind.HTTP, message.toString(), null,
                body == null ? null : body.toString(), null, action.toString(), endpoint, null);
    }
}
