package com.mcpgate.mcp.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mcpgate.mcp.security.ClientSession;
import com.mcpgate.mcp.tools.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Redis tools. Commands are sent as {@code {command, args}} to the database_ws
 * {@code /redis/command} endpoint, which answers with {@code {result}}.
 */
public class RedisTools implements ToolProvider {
    private static final Logger logger = LoggerFactory.getLogger(RedisTools.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    static final String COMMAND_ENDPOINT = "/redis/command";

    private final DatabaseServiceClient serviceClient;
    private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();
    private final List<ToolDefinition> definitions;

    public RedisTools(DatabaseServiceClient serviceClient) {
        this.serviceClient = serviceClient;

        handlers.put("redis_health", this::redisHealth);
        handlers.put("redis_keys", this::redisKeys);
        handlers.put("redis_get", this::redisGet);
        handlers.put("redis_set", this::redisSet);
        handlers.put("redis_delete", this::redisDelete);
        handlers.put("redis_scan", this::redisScan);

        definitions = List.of(
                new ToolDefinition("redis_health", "Check Redis service health",
                        SchemaBuilder.object().build()),
                new ToolDefinition("redis_keys", "List Redis keys matching a pattern",
                        SchemaBuilder.object()
                                .string("pattern", "Key pattern", "*")
                                .integer("limit", "Maximum number of keys to show", 100)
                                .build()),
                new ToolDefinition("redis_get", "Get the value of a Redis key",
                        SchemaBuilder.object().string("key", "Key to read", true).build()),
                new ToolDefinition("redis_set", "Set the value of a Redis key",
                        SchemaBuilder.object()
                                .string("key", "Key to set", true)
                                .string("value", "Value to store", true)
                                .integer("expire", "Expiration in seconds (optional)", false)
                                .build()),
                new ToolDefinition("redis_delete", "Delete a Redis key",
                        SchemaBuilder.object().string("key", "Key to delete", true).build()),
                new ToolDefinition("redis_scan", "Incrementally scan Redis keys matching a pattern",
                        SchemaBuilder.object()
                                .string("pattern", "Key pattern", "*")
                                .integer("count", "SCAN COUNT hint", 10)
                                .integer("limit", "Maximum number of keys to show", 100)
                                .build()));
    }

    @Override
    public String getName() {
        return "redis";
    }

    @Override
    public List<ToolDefinition> getToolDefinitions() {
        return definitions;
    }

    @Override
    public ToolHandler getHandler(String toolName) {
        return handlers.get(toolName);
    }

    ToolResult redisHealth(JsonNode arguments, ClientSession session) {
        JsonNode healthNode;
        try {
            healthNode = serviceClient.get("/admin/health");
        } catch (DatabaseServiceException e) {
            return failure("Redis Health Check Failed", e);
        }
        String healthText = "Redis Health Check:\n\n" +
                "Status: " + healthNode.path("status").asText("Unknown") + "\n" +
                "Version: " + healthNode.path("version").asText("Unknown") + "\n" +
                "Uptime: " + healthNode.path("uptime").asText("Unknown") + "\n" +
                "Connected Clients: " + healthNode.path("connected_clients").asText("Unknown") + "\n" +
                "Used Memory: " + healthNode.path("used_memory").asText("Unknown") + "\n" +
                "Total Keys: " + healthNode.path("total_keys").asText("Unknown");
        return ToolResult.text(healthText);
    }

    ToolResult redisKeys(JsonNode arguments, ClientSession session) {
        String pattern = arguments.path("pattern").asText("*");
        int limit = arguments.path("limit").asInt(100);

        JsonNode keysNode;
        try {
            keysNode = execute("KEYS", pattern).path("result");
        } catch (DatabaseServiceException e) {
            return failure("Failed to list keys", e);
        }

        StringBuilder keysText = new StringBuilder("Redis Keys (pattern: ").append(pattern).append("):\n\n");
        keysText.append("Found ").append(keysNode.size()).append(" keys:\n\n");
        for (int i = 0; i < Math.min(limit, keysNode.size()); i++) {
            keysText.append("- ").append(keysNode.get(i).asText()).append('\n');
        }
        if (keysNode.size() > limit) {
            keysText.append("\n... and ").append(keysNode.size() - limit).append(" more keys");
        }
        return ToolResult.text(keysText.toString());
    }

    ToolResult redisGet(JsonNode arguments, ClientSession session) {
        String key = requiredKey(arguments);
        if (key == null) {
            return ToolResult.error("Error: 'key' is required");
        }

        JsonNode valueNode;
        try {
            valueNode = execute("GET", key).path("result");
        } catch (DatabaseServiceException e) {
            return failure("Failed to get key '" + key + "'", e);
        }
        if (valueNode.isMissingNode() || valueNode.isNull()) {
            return ToolResult.error("Key '" + key + "' not found in Redis");
        }

        String value = valueNode.isValueNode() ? valueNode.asText() : valueNode.toString();
        String valueText = "Redis Key: " + key + "\n\n" +
                "Value:\n" + value + "\n\n" +
                "Type: " + valueNode.getNodeType().name().toLowerCase(Locale.ROOT) + "\n" +
                "Length: " + value.length() + " characters";
        return ToolResult.text(valueText);
    }

    ToolResult redisSet(JsonNode arguments, ClientSession session) {
        String key = requiredKey(arguments);
        JsonNode valueNode = arguments.path("value");
        if (key == null || valueNode.isMissingNode() || valueNode.isNull()) {
            return ToolResult.error("Error: 'key' and 'value' are required");
        }
        long expire = arguments.path("expire").asLong(0);

        ObjectNode commandNode = command("SET", key, valueNode.asText());
        if (expire > 0) {
            ((ArrayNode) commandNode.get("args")).add("EX").add(expire);
        }

        JsonNode responseNode;
        try {
            responseNode = serviceClient.post(COMMAND_ENDPOINT, commandNode);
        } catch (DatabaseServiceException e) {
            return failure("Failed to set key '" + key + "'", e);
        }

        StringBuilder setText = new StringBuilder("Redis Key Set Successfully:\n\n");
        setText.append("Key: ").append(key).append('\n');
        setText.append("Value: ").append(valueNode.asText()).append('\n');
        if (expire > 0) {
            setText.append("Expiration: ").append(expire).append(" seconds\n");
        }
        setText.append("Result: ").append(responseNode.path("result").asText("OK"));
        return ToolResult.text(setText.toString());
    }

    ToolResult redisDelete(JsonNode arguments, ClientSession session) {
        String key = requiredKey(arguments);
        if (key == null) {
            return ToolResult.error("Error: 'key' is required");
        }

        long deletedCount;
        try {
            deletedCount = execute("DEL", key).path("result").asLong(0);
        } catch (DatabaseServiceException e) {
            return failure("Failed to delete key '" + key + "'", e);
        }
        if (deletedCount == 0) {
            return ToolResult.error("Key '" + key + "' not found in Redis");
        }
        return ToolResult.text("Redis Key Deleted Successfully:\n\nKey: " + key + "\nKeys deleted: " + deletedCount);
    }

    ToolResult redisScan(JsonNode arguments, ClientSession session) {
        String pattern = arguments.path("pattern").asText("*");
        int count = arguments.path("count").asInt(10);
        int limit = arguments.path("limit").asInt(100);

        ObjectNode commandNode = objectMapper.createObjectNode();
        commandNode.put("command", "SCAN");
        commandNode.putArray("args").add(0).add("MATCH").add(pattern).add("COUNT").add(count);

        JsonNode scanNode;
        try {
            scanNode = serviceClient.post(COMMAND_ENDPOINT, commandNode).path("result");
        } catch (DatabaseServiceException e) {
            return failure("Failed to scan keys", e);
        }

        String cursor = "0";
        JsonNode keysNode = objectMapper.createArrayNode();
        if (scanNode.isArray() && scanNode.size() >= 2) {
            cursor = scanNode.get(0).asText();
            keysNode = scanNode.get(1);
        }

        StringBuilder scanText = new StringBuilder("Redis Key Scan Results:\n\n");
        scanText.append("Pattern: ").append(pattern).append('\n');
        scanText.append("Cursor: ").append(cursor).append('\n');
        int shown = Math.min(limit, keysNode.size());
        scanText.append("Keys found: ").append(shown).append("\n\n");
        if (shown == 0) {
            scanText.append("No keys found matching the pattern");
        } else {
            scanText.append("Keys:\n");
            for (int i = 0; i < shown; i++) {
                scanText.append("- ").append(keysNode.get(i).asText()).append('\n');
            }
        }
        return ToolResult.text(scanText.toString());
    }

    private JsonNode execute(String command, String... commandArgs) throws DatabaseServiceException {
        return serviceClient.post(COMMAND_ENDPOINT, command(command, commandArgs));
    }

    private static ObjectNode command(String command, String... commandArgs) {
        ObjectNode commandNode = objectMapper.createObjectNode();
        commandNode.put("command", command);
        ArrayNode argsNode = commandNode.putArray("args");
        for (String commandArg : commandArgs) {
            argsNode.add(commandArg);
        }
        return commandNode;
    }

    private static String requiredKey(JsonNode arguments) {
        JsonNode keyNode = arguments.path("key");
        if (keyNode.isMissingNode() || keyNode.isNull() || keyNode.asText().isEmpty()) {
            return null;
        }
        return keyNode.asText();
    }

    private static ToolResult failure(String action, DatabaseServiceException e) {
        logger.warn("{}: {}", action, e.getMessage());
        return ToolResult.error(action + ":\n" + e.getMessage());
    }
}
