package com.mcpgate.mcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.mcpgate.mcp.security.ClientSession;

/**
 * Executes one tool. Implementations should turn their own failures into
 * {@link ToolResult#error(String)}; anything thrown is converted by the caller.
 */
@FunctionalInterface
public interface ToolHandler {
    ToolResult handle(JsonNode arguments, ClientSession session) throws Exception;
}
