package io.restactions.json.spi;

import java.util.Iterator;
import java.util.Map;

/**
 * Abstraction for a JSON tree node. Represents any JSON value (object, array, string, number, boolean, null).
 * Implementations should provide access to node content and structure without exposing
 * the underlying JSON library.
 */
public interface JsonNode {

    /**
     * Returns the node type.
     */
    JsonNodeType getNodeType();

    /**
     * Returns true if this is an object node.
     */
    default boolean isObject() {
        return getNodeType() == JsonNodeType.OBJECT;
    }

    /**
     * Returns true if this is an array node.
     */
    default boolean isArray() {
        return getNodeType() == JsonNodeType.ARRAY;
    }

    /**
     * Returns true if this is a text node.
     */
    default boolean isTextual() {
        return getNodeType() == JsonNodeType.STRING;
    }

    /**
     * Returns true if this is a null node.
     */
    default boolean isNull() {
        return getNodeType() == JsonNodeType.NULL;
    }

    /**
     * Gets a field by name from an object node.
     * Returns null if this is not an object or the field doesn't exist.
     */
    JsonNode get(String fieldName);

    /**
     * Gets an element by index from an array node.
     * Returns null if this is not an array or index is out of bounds.
     */
    JsonNode get(int index);

    /**
     * Returns true if this node has a field with the given name.
     * A field explicitly set to JSON {@code null} counts as present.
     */
    boolean has(String fieldName);

    /**
     * Returns the size of this node.
     * For objects: number of fields
     * For arrays: number of elements
     * For others: 0
     */
    int size();

    /**
     * Returns the text value of this node.
     * For text nodes: the string value
     * For other scalar types: string representation
     * For containers: empty string
     */
    String asText();

    /**
     * Returns an iterator over the field names (for object nodes).
     */
    Iterator<String> fieldNames();

    /**
     * Returns an iterator over the field entries (for object nodes).
     */
    Iterator<Map.Entry<String, JsonNode>> fields();

    /**
     * Returns an iterator over the elements (for array nodes).
     */
    Iterator<JsonNode> elements();

    /**
     * Converts this node to a Java object of the specified type.
     * @throws JsonException if conversion fails; {@link JsonException#path()} points at the offending value
     */
    <T> T toObject(Class<T> type) throws JsonException;

    /**
     * Returns the compact JSON text of this node.
     */
    @Override
    String toString();
}
