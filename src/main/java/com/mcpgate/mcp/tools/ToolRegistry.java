package com.mcpgate.mcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mcpgate.mcp.config.ResourceManager;
import com.mcpgate.mcp.security.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Name to definition and handler mapping assembled from tool providers at startup.
 * Read-only once the server is running.
 */
public class ToolRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Map<String, RegisteredTool> tools = new LinkedHashMap<>();

    private record RegisteredTool(ToolDefinition definition, ToolHandler handler) {
    }

    public ToolRegistry() {
    }

    public ToolRegistry(List<? extends ToolProvider> toolProviders) {
        toolProviders.forEach(this::register);
    }

    /**
     * Adds every tool of a provider. A later registration of the same name replaces the earlier one.
     */
    public final synchronized void register(ToolProvider toolProvider) {
        for (ToolDefinition definition : toolProvider.getToolDefinitions()) {
            ToolHandler handler = toolProvider.getHandler(definition.name());
            if (handler == null) {
                logger.warn("Provider {} advertises tool {} without a handler, skipping", toolProvider.getName(), definition.name());
                continue;
            }
            register(definition, handler);
        }
        logger.info("Registered tool provider {} ({} tools)", toolProvider.getName(), toolProvider.getToolDefinitions().size());
    }

    public synchronized void register(ToolDefinition definition, ToolHandler handler) {
        RegisteredTool previous = tools.put(definition.name(), new RegisteredTool(definition, Objects.requireNonNull(handler)));
        if (previous != null) {
            logger.warn("Tool {} registered twice, the later registration wins", definition.name());
        }
    }

    public synchronized boolean hasTool(String toolName) {
        return tools.containsKey(toolName);
    }

    public synchronized List<ToolDefinition> getToolDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        tools.values().forEach(tool -> definitions.add(tool.definition()));
        return definitions;
    }

    /**
     * @return the {@code tools/list} result
     */
    public ObjectNode listTools() {
        ObjectNode resultNode = objectMapper.createObjectNode();
        ArrayNode toolsNode = resultNode.putArray("tools");
        for (ToolDefinition definition : getToolDefinitions()) {
            toolsNode.add(definition.toJson());
        }
        return resultNode;
    }

    /**
     * Runs a tool on the calling thread.
     * An unknown name is answered with an error result rather than an exception.
     *
     * @throws Exception whatever the handler throws
     */
    public ToolResult callTool(String toolName, JsonNode arguments, ClientSession session) throws Exception {
        ToolHandler handler;
        synchronized (this) {
            RegisteredTool tool = toolName == null ? null : tools.get(toolName);
            handler = tool == null ? null : tool.handler();
        }
        if (handler == null) {
            return ToolResult.error(ResourceManager.getErrorMessage("tool.unknown", String.valueOf(toolName)));
        }

        JsonNode toolArguments = arguments == null || arguments.isMissingNode() || arguments.isNull()
                ? objectMapper.createObjectNode() : arguments;
        ToolResult toolResult = handler.handle(toolArguments, session);
        if (toolResult == null) {
            return ToolResult.error(ResourceManager.getErrorMessage("tool.internal.error", "tool returned no result"));
        }
        return toolResult;
    }

    public synchronized int size() {
        return tools.size();
    }
}
