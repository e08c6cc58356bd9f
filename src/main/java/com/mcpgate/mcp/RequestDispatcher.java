package com.mcpgate.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mcpgate.mcp.config.CliUtils;
import com.mcpgate.mcp.config.ResourceManager;
import com.mcpgate.mcp.security.ClientSession;
import com.mcpgate.mcp.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/**
 * Answers one parsed JSON-RPC request for a session.
 * Admission (rate limit, authentication) has already happened in {@link ConnectionHandler};
 * this class only knows about MCP methods.
 */
public class RequestDispatcher {
    public static final String DEFAULT_PROTOCOL_VERSION = "2025-06-18";
    public static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of(
            "2025-06-18", "2025-03-26", "2024-11-05");
    static final String UNKNOWN_TOOL = "unknown";

    private static final Logger logger = LoggerFactory.getLogger(RequestDispatcher.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final ServerContext serverContext;

    public RequestDispatcher(ServerContext serverContext) {
        this.serverContext = serverContext;
    }

    /**
     * Processes an MCP request and returns the response to write.
     *
     * @param requestNode the parsed request line
     * @param clientSession the session of the calling connection
     * @return the JSON-RPC response, or null for notifications (requests without id)
     */
    public JsonNode handleRequest(JsonNode requestNode, ClientSession clientSession) {
        if (requestNode == null || !requestNode.isObject()) {
            return JsonRpc.createErrorResponse(JsonRpc.INVALID_REQUEST,
                    ResourceManager.getErrorMessage("protocol.invalid.request",
                            ResourceManager.getErrorMessage("protocol.not.object")), null);
        }

        boolean isNotification = JsonRpc.isNotification(requestNode);
        JsonNode requestId = isNotification ? null : requestNode.get("id");
        JsonNode methodNode = requestNode.get("method");
        if (methodNode == null || !methodNode.isTextual()) {
            if (isNotification) {
                logger.debug("Dropping notification without a method");
                return null;
            }
            return JsonRpc.createErrorResponse(JsonRpc.INVALID_REQUEST,
                    ResourceManager.getErrorMessage("protocol.invalid.request",
                            ResourceManager.getErrorMessage("protocol.missing.method")), requestId);
        }

        String requestMethod = methodNode.asText();
        JsonNode requestParams = requestNode.path("params");
        logger.debug("Handling request: method={}, id={}, isNotification={}", requestMethod, requestId, isNotification);

        try {
            JsonNode resultNode = executeMethod(requestMethod, requestParams, clientSession);
            return isNotification ? null : JsonRpc.createSuccessResponse(resultNode, requestId);
        } catch (MethodNotFoundException e) {
            if (isNotification) {
                logger.debug("Ignoring unknown notification {}", requestMethod);
                return null;
            }
            return JsonRpc.createErrorResponse(JsonRpc.METHOD_NOT_FOUND, e.getMessage(), requestId);
        } catch (Exception e) {
            logger.error("Error handling request {}", requestMethod, e);
            serverContext.metricsCollector().recordRequest(metricsKey(requestMethod, requestParams), 0, false);
            if (isNotification) {
                return null;
            }
            return JsonRpc.createErrorResponse(JsonRpc.INTERNAL_ERROR,
                    ResourceManager.getErrorMessage("protocol.internal.error", String.valueOf(e.getMessage())), requestId);
        }
    }

    private JsonNode executeMethod(String requestMethod, JsonNode requestParams, ClientSession clientSession)
            throws Exception {
        return switch (requestMethod) {
            case "initialize" -> handleInitialize(requestParams, clientSession);
            case "notifications/initialized" -> handleNotificationInitialized(clientSession);
            case "tools/list" -> serverContext.toolRegistry().listTools();
            case "tools/call" -> handleCallTool(requestParams, clientSession);
            case "resources/list" -> emptyList("resources");
            case "prompts/list" -> emptyList("prompts");
            case "ping" -> objectMapper.createObjectNode();
            default -> throw new MethodNotFoundException(
                    ResourceManager.getErrorMessage("protocol.method.not.found", requestMethod));
        };
    }

    private JsonNode handleInitialize(JsonNode requestParams, ClientSession clientSession) {
        JsonNode clientInfo = requestParams.path("clientInfo");
        if (clientInfo.isObject()) {
            String clientName = clientInfo.path("name").asText("");
            String clientVersion = clientInfo.path("version").asText("");
            if (!clientName.isEmpty()) {
                clientSession.setUserAgent(clientVersion.isEmpty() ? clientName : clientName + "/" + clientVersion);
            }
        }

        String protocolVersion = negotiateProtocolVersion(requestParams.path("protocolVersion").asText(null));
        logger.info("Client {} initialized (protocol {}, agent {})", clientSession.getClientId(), protocolVersion,
                clientSession.getUserAgent());

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.put("protocolVersion", protocolVersion);
        ObjectNode capabilitiesNode = resultNode.putObject("capabilities");
        capabilitiesNode.putObject("tools");
        ObjectNode serverInfo = resultNode.putObject("serverInfo");
        serverInfo.put("name", serverContext.configParams().serverName());
        serverInfo.put("version", CliUtils.SERVER_VERSION);
        return resultNode;
    }

    /**
     * Echoes the client's version when supported, otherwise offers the newest version this server speaks.
     */
    static String negotiateProtocolVersion(String clientProtocolVersion) {
        if (clientProtocolVersion != null && SUPPORTED_PROTOCOL_VERSIONS.contains(clientProtocolVersion)) {
            return clientProtocolVersion;
        }
        if (clientProtocolVersion != null) {
            logger.debug("Client requested unsupported protocol version {}, offering {}",
                    clientProtocolVersion, DEFAULT_PROTOCOL_VERSION);
        }
        return DEFAULT_PROTOCOL_VERSION;
    }

    private JsonNode handleNotificationInitialized(ClientSession clientSession) {
        logger.debug("Client {} sent notifications/initialized", clientSession.getClientId());
        return objectMapper.createObjectNode();
    }

    /**
     * Runs a tool with the configured timeout and records the outcome under the tool name.
     */
    JsonNode handleCallTool(JsonNode requestParams, ClientSession clientSession) {
        JsonNode nameNode = requestParams.path("name");
        String toolName = nameNode.isTextual() && !nameNode.asText().isEmpty() ? nameNode.asText() : UNKNOWN_TOOL;
        JsonNode toolArguments = requestParams.path("arguments");

        long startNanos = System.nanoTime();
        ToolResult toolResult = executeTool(toolName, toolArguments, clientSession);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        serverContext.metricsCollector().recordRequest(toolName, elapsedMs, !toolResult.isError());
        logger.debug("Tool {} finished in {}ms (error={})", toolName, elapsedMs, toolResult.isError());
        return toolResult.toJson();
    }

    private ToolResult executeTool(String toolName, JsonNode toolArguments, ClientSession clientSession) {
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        Callable<ToolResult> toolCall = () -> {
            if (callerContext != null) {
                MDC.setContextMap(callerContext);
            }
            try {
                return serverContext.toolRegistry().callTool(toolName, toolArguments, clientSession);
            } finally {
                MDC.clear();
            }
        };

        Future<ToolResult> toolFuture = serverContext.toolExecutor().submit(toolCall);
        long timeoutSeconds = serverContext.configParams().requestTimeoutSeconds();
        try {
            return toolFuture.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            toolFuture.cancel(true);
            logger.warn("Tool {} timed out after {}s", toolName, timeoutSeconds);
            return ToolResult.error(ResourceManager.getErrorMessage("tool.timeout", String.valueOf(timeoutSeconds)));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.warn("Tool {} failed", toolName, cause);
            String causeMessage = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return ToolResult.error(ResourceManager.getErrorMessage("tool.internal.error", causeMessage));
        } catch (InterruptedException e) {
            toolFuture.cancel(true);
            Thread.currentThread().interrupt();
            return ToolResult.error(ResourceManager.getErrorMessage("tool.interrupted"));
        }
    }

    private static JsonNode emptyList(String fieldName) {
        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.putArray(fieldName);
        return resultNode;
    }

    private static String metricsKey(String requestMethod, JsonNode requestParams) {
        if ("tools/call".equals(requestMethod)) {
            JsonNode nameNode = requestParams.path("name");
            return nameNode.isTextual() && !nameNode.asText().isEmpty() ? nameNode.asText() : UNKNOWN_TOOL;
        }
        return requestMethod;
    }

    private static class MethodNotFoundException extends Exception {
        MethodNotFoundException(String message) {
            super(message);
        }
    }
}
