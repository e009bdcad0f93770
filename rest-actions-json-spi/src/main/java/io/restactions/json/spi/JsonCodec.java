package io.restactions.json.spi;

/**
 * Minimal JSON codec interface providing serialization, parsing and tree conversion.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Request payloads enter the engine through {@link #valueToTree(Object)} so that
 * absent fields can be pruned before the body is written. Response bodies are parsed
 * with {@link #readTree(byte[])} and converted to typed results with
 * {@link JsonNode#toObject(Class)}.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object (or a {@link JsonNode}) to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object (or a {@link JsonNode}) to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Tree model =====

    /**
     * Parses JSON bytes into a tree.
     * @param data JSON bytes
     * @return the root node
     * @throws JsonException if the data is not valid JSON
     */
    JsonNode readTree(byte[] data) throws JsonException;

    /**
     * Parses a JSON string into a tree.
     * @param json JSON string
     * @return the root node
     * @throws JsonException if the string is not valid JSON
     */
    JsonNode readTree(String json) throws JsonException;

    /**
     * Converts an arbitrary object into a freshly allocated, mutable tree.
     * Passing a {@link JsonNode} returns a deep copy of it.
     * @param value the object to convert
     * @return the tree representation
     * @throws JsonException if the object cannot be represented as JSON
     */
    JsonNode valueToTree(Object value) throws JsonException;

    /**
     * Returns the JSON {@code null} node.
     */
    JsonNode nullNode();

    /**
     * Creates a new empty object node.
     */
    ObjectNode createObjectNode();
}
