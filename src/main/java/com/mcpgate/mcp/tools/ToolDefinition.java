package com.mcpgate.mcp.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Descriptive metadata for a tool as returned by {@code tools/list}.
 * The input schema is advertised to clients but not enforced; handlers validate their own arguments.
 */
public record ToolDefinition(String name, String description, ObjectNode inputSchema) {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? SchemaBuilder.object().build() : inputSchema;
    }

    public ObjectNode toJson() {
        ObjectNode toolNode = objectMapper.createObjectNode();
        toolNode.put("name", name);
        toolNode.put("description", description);
        toolNode.set("inputSchema", inputSchema.deepCopy());
        return toolNode;
    }
}
