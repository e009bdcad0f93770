package io.restactions.json.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.restactions.json.spi.ObjectNode;

/**
 * Jackson implementation of ObjectNode.
 */
final class JacksonObjectNode extends JacksonJsonNode implements ObjectNode {
    private final com.fasterxml.jackson.databind.node.ObjectNode objectDelegate;

    JacksonObjectNode(com.fasterxml.jackson.databind.node.ObjectNode delegate, ObjectMapper mapper) {
        super(delegate, mapper);
        this.objectDelegate = delegate;
    }

    @Override
    public ObjectNode put(String fieldName, String value) {
        objectDelegate.put(fieldName, value);
        return this;
    }

    @Override
    public ObjectNode remove(String fieldName) {
        objectDelegate.remove(fieldName);
        return this;
    }

    @Override
    public ObjectNode getObject(String fieldName) {
        com.fasterxml.jackson.databind.JsonNode child = objectDelegate.get(fieldName);
        if (child instanceof com.fasterxml.jackson.databind.node.ObjectNode on) {
            return new JacksonObjectNode(on, mapper);
        }
        return null;
    }
}
