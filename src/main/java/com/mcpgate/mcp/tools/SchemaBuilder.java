package com.mcpgate.mcp.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Small fluent builder for the JSON-Schema-like {@code inputSchema} objects that tools advertise.
 */
public class SchemaBuilder {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final ObjectNode schemaNode = objectMapper.createObjectNode();
    private final ObjectNode propertiesNode = objectMapper.createObjectNode();
    private final ArrayNode requiredNode = objectMapper.createArrayNode();

    private SchemaBuilder() {
        schemaNode.put("type", "object");
    }

    public static SchemaBuilder object() {
        return new SchemaBuilder();
    }

    public SchemaBuilder string(String name, String description, boolean required) {
        return property(name, "string", description, required);
    }

    public SchemaBuilder string(String name, String description, String defaultValue) {
        property(name, "string", description, false);
        ((ObjectNode) propertiesNode.get(name)).put("default", defaultValue);
        return this;
    }

    public SchemaBuilder integer(String name, String description, boolean required) {
        return property(name, "integer", description, required);
    }

    public SchemaBuilder integer(String name, String description, long defaultValue) {
        property(name, "integer", description, false);
        ((ObjectNode) propertiesNode.get(name)).put("default", defaultValue);
        return this;
    }

    public SchemaBuilder bool(String name, String description, boolean defaultValue) {
        property(name, "boolean", description, false);
        ((ObjectNode) propertiesNode.get(name)).put("default", defaultValue);
        return this;
    }

    public SchemaBuilder object(String name, String description, boolean required) {
        return property(name, "object", description, required);
    }

    public SchemaBuilder array(String name, String description, boolean required) {
        return property(name, "array", description, required);
    }

    private SchemaBuilder property(String name, String type, String description, boolean required) {
        ObjectNode propertyNode = propertiesNode.putObject(name);
        propertyNode.put("type", type);
        propertyNode.put("description", description);
        if (required) {
            requiredNode.add(name);
        }
        return this;
    }

    public ObjectNode build() {
        ObjectNode built = schemaNode.deepCopy();
        built.set("properties", propertiesNode.deepCopy());
        built.set("required", requiredNode.deepCopy());
        return built;
    }
}
