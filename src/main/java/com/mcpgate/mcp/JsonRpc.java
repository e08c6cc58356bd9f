package com.mcpgate.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON-RPC 2.0 envelope builders and the error codes used on the wire.
 */
public final class JsonRpc {
    public static final String VERSION = "2.0";

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int RATE_LIMIT_EXCEEDED = -32000;
    public static final int AUTHENTICATION_FAILED = -32001;

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonRpc() {
    }

    /**
     * A request without an {@code id} member is a notification and never gets a response.
     * An explicit {@code "id": null} still counts as a request, and so does anything that is not
     * a JSON object, since it cannot be told apart from a broken request.
     */
    public static boolean isNotification(JsonNode requestNode) {
        return requestNode != null && requestNode.isObject() && !requestNode.has("id");
    }

    public static ObjectNode createSuccessResponse(JsonNode resultNode, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", VERSION);
        setRespId(requestId, responseNode);
        responseNode.set("result", resultNode == null ? objectMapper.createObjectNode() : resultNode);
        return responseNode;
    }

    public static ObjectNode createErrorResponse(int code, String message, JsonNode requestId) {
        return createErrorResponse(code, message, null, requestId);
    }

    public static ObjectNode createErrorResponse(int code, String message, JsonNode errorData, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", VERSION);
        setRespId(requestId, responseNode);

        ObjectNode errorNode = responseNode.putObject("error");
        errorNode.put("code", code);
        errorNode.put("message", message);
        if (errorData != null) {
            errorNode.set("data", errorData);
        }
        return responseNode;
    }

    /**
     * Copies the request id exactly (string, number, null or anything else the client sent).
     */
    private static void setRespId(JsonNode requestId, ObjectNode responseNode) {
        responseNode.set("id", requestId == null ? NullNode.getInstance() : requestId.deepCopy());
    }
}
