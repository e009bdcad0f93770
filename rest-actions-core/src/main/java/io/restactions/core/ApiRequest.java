package io.restactions.core;

import io.restactions.json.spi.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A request ready for a {@link RequestExecutor}.
 *
 * @param verb  HTTP method
 * @param path  path relative to the client's base URL, without leading slash
 * @param body  JSON body, or null to send none
 * @param query query parameters, never null; null keys and values are dropped
 */
public record ApiRequest(HttpVerb verb, String path, JsonNode body, Map<String, String> query) {
    public ApiRequest {
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(path, "path");
        query = query == null ? Map.of() : present(query);
    }

    public static ApiRequest of(HttpVerb verb, String path) {
        return new ApiRequest(verb, path, null, Map.of());
    }

    public Optional<JsonNode> bodyNode() {
        return Optional.ofNullable(body);
    }

    private static Map<String, String> present(Map<String, String> query) {
        Map<String, String> copy = new LinkedHashMap<>();
        query.forEach((name, value) -> {
            if (name != null && value != null) {
                copy.put(name, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
