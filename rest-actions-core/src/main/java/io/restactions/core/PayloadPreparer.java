package io.restactions.core;

import io.restactions.json.spi.JsonCodec;
import io.restactions.json.spi.JsonException;
import io.restactions.json.spi.JsonNode;
import io.restactions.json.spi.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts caller payloads into request bodies.
 *
 * <p>Top-level null fields are omitted. Nested nulls are sent as is, except
 * {@code customer.dv} which the upstream API rejects when null.
 */
public final class PayloadPreparer {

    private final JsonCodec codec;

    public PayloadPreparer(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * @param payload POJO, record, {@code Map} or {@link JsonNode}; may be null
     * @return the body to send, or a success holding null when {@code payload} is null
     */
    public ActionResult<JsonNode> prepare(Object payload) {
        if (payload == null) {
            return ActionResult.success(null);
        }
        JsonNode tree;
        try {
            tree = codec.valueToTree(payload);
        } catch (JsonException e) {
            String where = e.path() == null ? "" : " at " + e.path();
            return ActionResult.failure(new ClassifiedError(ErrorKind.CONFIGURATION,
                    "Payload of type " + payload.getClass().getName() + " cannot be serialized" + where + ": " + e.getMessage(),
                    null, null, null, null, null, e));
        }
        if (tree instanceof ObjectNode object) {
            stripNullFields(object);
            ObjectNode customer = object.getObject("customer");
            if (customer != null) {
                JsonNode dv = customer.get("dv");
                if (dv != null && dv.isNull()) {
                    customer.remove("dv");
                }
            }
        }
        return ActionResult.success(tree);
    }

    private static void stripNullFields(ObjectNode object) {
        List<String> nullFields = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = object.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            if (field.getValue() == null || field.getValue().isNull()) {
                nullFields.add(field.getKey());
            }
        }
        nullFields.forEach(object::remove);
    }
}
