package io.restactions.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import io.restactions.json.spi.JsonCodec;
import io.restactions.json.spi.JsonException;
import io.restactions.json.spi.JsonNode;
import io.restactions.json.spi.ObjectNode;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 *
 * <p>The default mapper ignores unknown response fields, so result types only need to
 * declare the fields they use. It is otherwise strict: {@code null} for primitives, floats
 * into integer properties, numbers or booleans into string properties, and trailing content
 * after the root value are all rejected.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the mapper configuration used by {@link #JacksonJsonCodec()}.
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = JsonMapper.builder()
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return mapper;
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(unwrapIfNode(value));
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(unwrapIfNode(value));
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to string", e);
        }
    }

    @Override
    public JsonNode readTree(byte[] data) throws JsonException {
        try {
            com.fasterxml.jackson.databind.JsonNode node = mapper.readTree(data);
            return JacksonJsonNode.wrap(node == null ? mapper.nullNode() : node, mapper);
        } catch (Exception e) {
            throw new JsonException("Failed to parse bytes to tree", e);
        }
    }

    @Override
    public JsonNode readTree(String json) throws JsonException {
        try {
            com.fasterxml.jackson.databind.JsonNode node = mapper.readTree(json);
            return JacksonJsonNode.wrap(node == null ? mapper.nullNode() : node, mapper);
        } catch (Exception e) {
            throw new JsonException("Failed to parse string to tree", e);
        }
    }

    @Override
    public JsonNode valueToTree(Object value) throws JsonException {
        if (value instanceof JacksonJsonNode node) {
            return JacksonJsonNode.wrap(node.delegate.deepCopy(), mapper);
        }
        try {
            com.fasterxml.jackson.databind.JsonNode node = mapper.valueToTree(value);
            return JacksonJsonNode.wrap(node == null ? mapper.nullNode() : node, mapper);
        } catch (IllegalArgumentException e) {
            throw new JsonException("Failed to convert " + describe(value) + " to tree", pathOf(e.getCause()), e);
        }
    }

    @Override
    public JsonNode nullNode() {
        return JacksonJsonNode.wrap(mapper.nullNode(), mapper);
    }

    @Override
    public ObjectNode createObjectNode() {
        return new JacksonObjectNode(mapper.createObjectNode(), mapper);
    }

    private static Object unwrapIfNode(Object value) {
        if (value instanceof JacksonJsonNode node) {
            return node.delegate;
        }
        return value;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }

    /**
     * Renders the reference chain of a mapping failure as {@code a.b[0].c}.
     */
    static String pathOf(Throwable failure) {
        if (!(failure instanceof JsonMappingException mapping)) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : mapping.getPath()) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) sb.append('.');
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
