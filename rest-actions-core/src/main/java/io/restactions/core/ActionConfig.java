package io.restactions.core;

import java.util.Objects;

/**
 * Immutable description of one configured action.
 *
 * <p>{@code unwrapKey} names the response field holding the payload; when null the whole
 * body is the candidate. {@code endpointSuffix} only applies to subactions and defaults to
 * the subaction name. {@code verb} defaults to {@link ActionKey#defaultVerb()}.
 *
 * @param <T> type produced by the result shape
 */
public record ActionConfig<T>(
        ActionKey key,
        ResultShape<T> shape,
        String unwrapKey,
        String endpointSuffix,
        HttpVerb verb
) {
    public ActionConfig {
        Objects.requireNonNull(key, "key");
        if (shape == null) {
            throw RestActionException.configuration("The action '" + key
                    + "' must declare a result shape or use ResultShape.unvalidated()");
        }
        if (unwrapKey != null && unwrapKey.isBlank()) {
            throw RestActionException.configuration("The action '" + key + "' has a blank unwrap key");
        }
        if (key.isSubaction()) {
            endpointSuffix = endpointSuffix == null ? key.subaction() : trimSlashes(endpointSuffix);
            if (endpointSuffix.isEmpty()) {
                throw RestActionException.configuration("The subaction '" + key.subaction() + "' has an empty endpoint suffix");
            }
        } else if (endpointSuffix != null) {
            throw RestActionException.configuration("The action '" + key + "' cannot declare an endpoint suffix");
        }
        verb = verb == null ? key.defaultVerb() : verb;
    }

    public static <T> ActionConfig<T> of(ActionKey key, ResultShape<T> shape) {
        return new ActionConfig<>(key, shape, null, null, null);
    }

    public static <T> ActionConfig<T> subaction(String name, ResultShape<T> shape) {
        return of(ActionKey.perform(name), shape);
    }

    public ActionConfig<T> withUnwrapKey(String unwrapKey) {
        return new ActionConfig<>(key, shape, unwrapKey, endpointSuffix, verb);
    }

    public ActionConfig<T> withEndpointSuffix(String endpointSuffix) {
        return new ActionConfig<>(key, shape, unwrapKey, endpointSuffix, verb);
    }

    public ActionConfig<T> withVerb(HttpVerb verb) {
        return new ActionConfig<>(key, shape, unwrapKey, endpointSuffix, verb);
    }

    private static String trimSlashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '/') start++;
        while (end > start && s.charAt(end - 1) == '/') end--;
        return s.substring(start, end);
    }
}
