package com.mcpgate.mcp.tools;

import java.util.List;

/**
 * A source of tools merged into the {@link ToolRegistry}.
 */
public interface ToolProvider {

    /**
     * @return short provider name used in configuration and logs
     */
    String getName();

    List<ToolDefinition> getToolDefinitions();

    /**
     * @return the handler for the named tool, or null if this provider does not have it
     */
    ToolHandler getHandler(String toolName);
}
