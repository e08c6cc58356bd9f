package com.mcpgate.mcp.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of a tool call. Tool failures are data: an error result still travels back as a
 * normal {@code tools/call} result with {@code isError} set.
 */
public record ToolResult(String text, boolean isError) {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static ToolResult text(String text) {
        return new ToolResult(text, false);
    }

    public static ToolResult error(String text) {
        return new ToolResult(text, true);
    }

    public ObjectNode toJson() {
        ObjectNode resultNode = objectMapper.createObjectNode();
        ArrayNode contentNode = resultNode.putArray("content");
        ObjectNode textContent = contentNode.addObject();
        textContent.put("type", "text");
        textContent.put("text", text);
        if (isError) {
            resultNode.put("isError", true);
        }
        return resultNode;
    }
}
