package io.restactions.json.spi;

/**
 * Mutable JSON object node.
 * Used to prune and adjust request payloads before they are written.
 */
public interface ObjectNode extends JsonNode {

    /**
     * Sets a string field.
     */
    ObjectNode put(String fieldName, String value);

    /**
     * Removes a field.
     */
    ObjectNode remove(String fieldName);

    /**
     * Returns the child object under {@code fieldName} as a mutable node,
     * or null if the field is absent or not an object.
     */
    ObjectNode getObject(String fieldName);
}
