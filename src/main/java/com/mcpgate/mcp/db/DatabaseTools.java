package com.mcpgate.mcp.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mcpgate.mcp.security.ClientSession;
import com.mcpgate.mcp.tools.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * SQL and CRUD tools proxied to the database_ws service.
 * Every downstream failure is turned into an error result.
 */
public class DatabaseTools implements ToolProvider {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseTools.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final DatabaseServiceClient serviceClient;
    private final Clock clock;
    private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();
    private final List<ToolDefinition> definitions = new ArrayList<>();

    public DatabaseTools(DatabaseServiceClient serviceClient) {
        this(serviceClient, Clock.systemDefaultZone());
    }

    public DatabaseTools(DatabaseServiceClient serviceClient, Clock clock) {
        this.serviceClient = serviceClient;
        this.clock = clock;

        addTool(new ToolDefinition("database_health", "Check database service health and connection",
                SchemaBuilder.object().build()), this::databaseHealth);
        addTool(new ToolDefinition("list_databases", "List all available databases",
                SchemaBuilder.object().build()), this::listDatabases);
        addTool(new ToolDefinition("list_schemas", "List all schemas in the database",
                SchemaBuilder.object().build()), this::listSchemas);
        addTool(new ToolDefinition("list_tables", "List all tables in the database or a specific schema",
                SchemaBuilder.object()
                        .string("schema_name", "Schema to list tables from (optional)", false)
                        .build()), this::listTables);
        addTool(new ToolDefinition("execute_sql", "Execute a read-only SQL query",
                SchemaBuilder.object()
                        .string("sql", "SQL query to execute", true)
                        .object("parameters", "Query parameters", false)
                        .build()), this::executeSql);
        addTool(new ToolDefinition("execute_write_sql", "Execute a SQL write operation (INSERT, UPDATE, DELETE)",
                SchemaBuilder.object()
                        .string("sql", "SQL statement to execute", true)
                        .object("parameters", "Statement parameters", false)
                        .build()), this::executeWriteSql);
        addTool(new ToolDefinition("read_records", "Read records from a table with paging",
                SchemaBuilder.object()
                        .string("schema_name", "Schema name", true)
                        .string("table_name", "Table name", true)
                        .integer("limit", "Maximum number of records", 100)
                        .integer("offset", "Number of records to skip", 0)
                        .string("order_by", "Column to order by (optional)", false)
                        .build()), this::readRecords);
        addTool(new ToolDefinition("read_record", "Read a specific record by ID",
                recordSchema(false)), this::readRecord);
        addTool(new ToolDefinition("create_record", "Create a new record in a table",
                SchemaBuilder.object()
                        .string("schema_name", "Schema name", true)
                        .string("table_name", "Table name", true)
                        .object("data", "Column values for the new record", true)
                        .build()), this::createRecord);
        addTool(new ToolDefinition("update_record", "Update an existing record",
                recordSchema(true)), this::updateRecord);
        addTool(new ToolDefinition("delete_record", "Delete a record from a table",
                recordSchema(false)), this::deleteRecord);
    }

    private void addTool(ToolDefinition definition, ToolHandler handler) {
        definitions.add(definition);
        handlers.put(definition.name(), handler);
    }

    private static ObjectNode recordSchema(boolean withData) {
        SchemaBuilder schemaBuilder = SchemaBuilder.object()
                .string("schema_name", "Schema name", true)
                .string("table_name", "Table name", true)
                .string("record_id", "Record ID", true);
        if (withData) {
            schemaBuilder.object("data", "Column values to update", true);
        }
        return schemaBuilder.build();
    }

    @Override
    public String getName() {
        return "database";
    }

    @Override
    public List<ToolDefinition> getToolDefinitions() {
        return List.copyOf(definitions);
    }

    @Override
    public ToolHandler getHandler(String toolName) {
        return handlers.get(toolName);
    }

    ToolResult databaseHealth(JsonNode arguments, ClientSession session) {
        JsonNode healthNode;
        try {
            healthNode = serviceClient.get("/admin/health");
        } catch (DatabaseServiceException e) {
            return failure("Database Health Check Failed", e);
        }
        String healthText = "Database Service Health Check:\n" +
                "- Service Status: " + healthNode.path("status").asText("unknown") + "\n" +
                "- Database Connection: " + healthNode.path("database").asText("unknown") + "\n" +
                "- Timestamp: " + Instant.now(clock);
        return ToolResult.text(healthText);
    }

    ToolResult listDatabases(JsonNode arguments, ClientSession session) {
        try {
            JsonNode responseNode = serviceClient.get("/admin/databases");
            return ToolResult.text(formatNameList("Available Databases", responseNode.path("databases")));
        } catch (DatabaseServiceException e) {
            return failure("Failed to list databases", e);
        }
    }

    ToolResult listSchemas(JsonNode arguments, ClientSession session) {
        try {
            JsonNode responseNode = serviceClient.get("/admin/schemas");
            return ToolResult.text(formatNameList("Available Schemas", responseNode.path("schemas")));
        } catch (DatabaseServiceException e) {
            return failure("Failed to list schemas", e);
        }
    }

    ToolResult listTables(JsonNode arguments, ClientSession session) {
        String schemaName = optionalText(arguments, "schema_name");
        if (isDotSegment(schemaName)) {
            return invalidName(schemaName);
        }
        String endpoint = schemaName == null ? "/admin/tables" : "/admin/tables/" + DatabaseServiceClient.pathSegment(schemaName);
        try {
            JsonNode responseNode = serviceClient.get(endpoint);
            String title = schemaName == null ? "Available Tables" : "Available Tables in schema '" + schemaName + "'";
            return ToolResult.text(formatNameList(title, responseNode.path("tables")));
        } catch (DatabaseServiceException e) {
            return failure("Failed to list tables", e);
        }
    }

    ToolResult executeSql(JsonNode arguments, ClientSession session) {
        String sql = optionalText(arguments, "sql");
        if (sql == null) {
            return ToolResult.error("Error: SQL query is required");
        }

        JsonNode responseNode;
        try {
            responseNode = serviceClient.post("/crud/raw-sql", sqlRequest(sql, arguments));
        } catch (DatabaseServiceException e) {
            return failure("SQL execution failed", e);
        }
        if (!responseNode.path("success").asBoolean(true)) {
            return ToolResult.error("SQL execution failed: " + responseNode.path("message").asText());
        }

        JsonNode dataNode = responseNode.path("data");
        int rowCount = responseNode.path("row_count").asInt(dataNode.size());
        StringBuilder resultText = new StringBuilder("SQL Query Executed Successfully\n\n");
        resultText.append("Results (").append(rowCount).append(" rows):\n");
        resultText.append("Query: ").append(sql).append("\n\n");
        if (dataNode.isArray() && dataNode.size() > 0) {
            resultText.append(formatMarkdownTable(dataNode));
        } else {
            resultText.append("Query executed successfully (no data returned)\n");
        }
        return ToolResult.text(resultText.toString());
    }

    ToolResult executeWriteSql(JsonNode arguments, ClientSession session) {
        String sql = optionalText(arguments, "sql");
        if (sql == null) {
            return ToolResult.error("Error: SQL query is required");
        }

        JsonNode responseNode;
        try {
            responseNode = serviceClient.post("/crud/raw-sql/write", sqlRequest(sql, arguments));
        } catch (DatabaseServiceException e) {
            return failure("SQL write execution failed", e);
        }
        if (!responseNode.path("success").asBoolean(true)) {
            return ToolResult.error("SQL write execution failed: " + responseNode.path("message").asText());
        }

        String resultText = "SQL Write Operation Executed Successfully\n\n" +
                "Query: " + sql + "\n" +
                "Affected Rows: " + responseNode.path("affected_rows").asLong(0) + "\n" +
                "Message: " + responseNode.path("message").asText("");
        return ToolResult.text(resultText);
    }

    ToolResult readRecords(JsonNode arguments, ClientSession session) {
        String schemaName = optionalText(arguments, "schema_name");
        String tableName = optionalText(arguments, "table_name");
        if (schemaName == null || tableName == null) {
            return ToolResult.error("Error: Schema name and table name are required");
        }
        if (isDotSegment(schemaName) || isDotSegment(tableName)) {
            return invalidName(isDotSegment(schemaName) ? schemaName : tableName);
        }
        int limit = arguments.path("limit").asInt(100);
        int offset = arguments.path("offset").asInt(0);
        String orderBy = optionalText(arguments, "order_by");

        StringBuilder endpoint = new StringBuilder(tableEndpoint(schemaName, tableName))
                .append("?limit=").append(limit).append("&offset=").append(offset);
        if (orderBy != null) {
            endpoint.append("&order_by=").append(DatabaseServiceClient.queryValue(orderBy));
        }

        JsonNode responseNode;
        try {
            responseNode = serviceClient.get(endpoint.toString());
        } catch (DatabaseServiceException e) {
            return failure("Failed to read records", e);
        }

        JsonNode recordsNode = responseNode.path("records");
        StringBuilder resultText = new StringBuilder("Records from ").append(schemaName).append('.').append(tableName)
                .append("\n\n");
        resultText.append("Showing ").append(responseNode.path("count").asInt(recordsNode.size()))
                .append(" of ").append(responseNode.path("total_count").asInt(recordsNode.size()))
                .append(" records (limit: ").append(limit).append(", offset: ").append(offset).append(")\n\n");
        if (recordsNode.isArray() && recordsNode.size() > 0) {
            resultText.append(formatMarkdownTable(recordsNode));
        } else {
            resultText.append("No records found\n");
        }
        return ToolResult.text(resultText.toString());
    }

    ToolResult readRecord(JsonNode arguments, ClientSession session) {
        RecordKey recordKey = RecordKey.from(arguments);
        if (recordKey == null) {
            return ToolResult.error("Error: Schema name, table name, and record ID are required");
        }
        if (recordKey.hasDotSegment()) {
            return invalidName(recordKey.qualifiedTable() + "/" + recordKey.recordId());
        }

        JsonNode responseNode;
        try {
            responseNode = serviceClient.get(recordKey.endpoint());
        } catch (DatabaseServiceException e) {
            if (e.getStatusCode() == 404) {
                return ToolResult.error("Record not found: ID " + recordKey.recordId() + " in " + recordKey.qualifiedTable());
            }
            return failure("Failed to read record", e);
        }

        StringBuilder resultText = new StringBuilder("Record ").append(recordKey.recordId()).append(" from ")
                .append(recordKey.qualifiedTable()).append("\n\n");
        JsonNode recordNode = responseNode.path("data");
        if (recordNode.isObject() && recordNode.size() > 0) {
            appendFields(resultText, recordNode, "");
        } else {
            resultText.append("Record not found\n");
        }
        return ToolResult.text(resultText.toString());
    }

    ToolResult createRecord(JsonNode arguments, ClientSession session) {
        String schemaName = optionalText(arguments, "schema_name");
        String tableName = optionalText(arguments, "table_name");
        if (schemaName == null || tableName == null) {
            return ToolResult.error("Error: Schema name and table name are required");
        }
        if (isDotSegment(schemaName) || isDotSegment(tableName)) {
            return invalidName(isDotSegment(schemaName) ? schemaName : tableName);
        }
        JsonNode dataNode = arguments.path("data");
        if (!dataNode.isObject() || dataNode.size() == 0) {
            return ToolResult.error("Error: Record data is required");
        }

        ObjectNode requestNode = objectMapper.createObjectNode();
        requestNode.set("data", dataNode);
        JsonNode responseNode;
        try {
            responseNode = serviceClient.post(tableEndpoint(schemaName, tableName), requestNode);
        } catch (DatabaseServiceException e) {
            return failure("Failed to create record", e);
        }

        StringBuilder resultText = new StringBuilder("Record created successfully in ").append(schemaName).append('.')
                .append(tableName).append("\n\n");
        resultText.append("Record ID: ").append(responseNode.path("id").asText("unknown")).append('\n');
        resultText.append("Created Data:\n");
        appendFields(resultText, responseNode.path("data"), "  ");
        return ToolResult.text(resultText.toString());
    }

    ToolResult updateRecord(JsonNode arguments, ClientSession session) {
        RecordKey recordKey = RecordKey.from(arguments);
        if (recordKey == null) {
            return ToolResult.error("Error: Schema name, table name, and record ID are required");
        }
        if (recordKey.hasDotSegment()) {
            return invalidName(recordKey.qualifiedTable() + "/" + recordKey.recordId());
        }
        JsonNode dataNode = arguments.path("data");
        if (!dataNode.isObject() || dataNode.size() == 0) {
            return ToolResult.error("Error: Update data is required");
        }

        ObjectNode requestNode = objectMapper.createObjectNode();
        requestNode.set("data", dataNode);
        JsonNode responseNode;
        try {
            responseNode = serviceClient.put(recordKey.endpoint(), requestNode);
        } catch (DatabaseServiceException e) {
            return failure("Failed to update record", e);
        }

        StringBuilder resultText = new StringBuilder("Record ").append(recordKey.recordId())
                .append(" updated successfully in ").append(recordKey.qualifiedTable()).append("\n\n");
        resultText.append("Updated Data:\n");
        appendFields(resultText, responseNode.path("data"), "  ");
        return ToolResult.text(resultText.toString());
    }

    ToolResult deleteRecord(JsonNode arguments, ClientSession session) {
        RecordKey recordKey = RecordKey.from(arguments);
        if (recordKey == null) {
            return ToolResult.error("Error: Schema name, table name, and record ID are required");
        }
        if (recordKey.hasDotSegment()) {
            return invalidName(recordKey.qualifiedTable() + "/" + recordKey.recordId());
        }
        try {
            serviceClient.delete(recordKey.endpoint());
        } catch (DatabaseServiceException e) {
            return failure("Failed to delete record", e);
        }
        String resultText = "Record " + recordKey.recordId() + " deleted successfully from " + recordKey.qualifiedTable() +
                "\n\nRecord ID: " + recordKey.recordId() + "\nTable: " + recordKey.qualifiedTable();
        return ToolResult.text(resultText);
    }

    /**
     * Schema, table and record id of a single-record operation.
     */
    private record RecordKey(String schemaName, String tableName, String recordId) {
        static RecordKey from(JsonNode arguments) {
            String schemaName = optionalText(arguments, "schema_name");
            String tableName = optionalText(arguments, "table_name");
            String recordId = optionalText(arguments, "record_id");
            if (schemaName == null || tableName == null || recordId == null) {
                return null;
            }
            return new RecordKey(schemaName, tableName, recordId);
        }

        String endpoint() {
            return tableEndpoint(schemaName, tableName) + "/" + DatabaseServiceClient.pathSegment(recordId);
        }

        boolean hasDotSegment() {
            return isDotSegment(schemaName) || isDotSegment(tableName) || isDotSegment(recordId);
        }

        String qualifiedTable() {
            return schemaName + "." + tableName;
        }
    }

    /**
     * "." and ".." survive URL encoding and would change the endpoint path.
     */
    private static boolean isDotSegment(String name) {
        return ".".equals(name) || "..".equals(name);
    }

    private static ToolResult invalidName(String name) {
        return ToolResult.error("Error: Invalid name '" + name + "'");
    }

    private static String tableEndpoint(String schemaName, String tableName) {
        return "/crud/" + DatabaseServiceClient.pathSegment(schemaName) + "/" + DatabaseServiceClient.pathSegment(tableName);
    }

    private static ObjectNode sqlRequest(String sql, JsonNode arguments) {
        ObjectNode requestNode = objectMapper.createObjectNode();
        requestNode.put("sql", sql);
        JsonNode parametersNode = arguments.path("parameters");
        requestNode.set("parameters", parametersNode.isMissingNode() || parametersNode.isNull()
                ? objectMapper.createObjectNode() : parametersNode);
        return requestNode;
    }

    private static String optionalText(JsonNode arguments, String fieldName) {
        JsonNode valueNode = arguments.path(fieldName);
        if (valueNode.isMissingNode() || valueNode.isNull()) {
            return null;
        }
        String value = valueNode.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static ToolResult failure(String action, DatabaseServiceException e) {
        logger.warn("{}: {}", action, e.getMessage());
        return ToolResult.error(action + ":\n" + e.getMessage());
    }

    private static String formatNameList(String title, JsonNode namesNode) {
        StringBuilder listText = new StringBuilder(title).append(" (").append(namesNode.size()).append("):\n\n");
        for (JsonNode nameNode : namesNode) {
            listText.append("- ").append(displayName(nameNode)).append('\n');
        }
        return listText.toString();
    }

    private static String displayName(JsonNode nameNode) {
        if (nameNode.isObject()) {
            for (String field : new String[]{"name", "table_name", "schema_name"}) {
                if (nameNode.hasNonNull(field)) {
                    return nameNode.get(field).asText();
                }
            }
            return nameNode.toString();
        }
        return nameNode.asText();
    }

    private static void appendFields(StringBuilder target, JsonNode objectNode, String indent) {
        Iterator<Map.Entry<String, JsonNode>> fieldIterator = objectNode.fields();
        while (fieldIterator.hasNext()) {
            Map.Entry<String, JsonNode> field = fieldIterator.next();
            target.append(indent).append("**").append(field.getKey()).append("**: ").append(cellText(field.getValue()))
                    .append('\n');
        }
    }

    /**
     * Renders an array of row objects as a markdown table, columns taken from the first row.
     */
    static String formatMarkdownTable(JsonNode rowsNode) {
        List<String> columnNames = new ArrayList<>();
        rowsNode.get(0).fieldNames().forEachRemaining(columnNames::add);

        StringBuilder tableText = new StringBuilder("| ").append(String.join(" | ", columnNames)).append(" |\n");
        tableText.append('|').append(String.join("|", Collections.nCopies(columnNames.size(), "---"))).append("|\n");
        for (JsonNode rowNode : rowsNode) {
            tableText.append('|');
            for (String columnName : columnNames) {
                tableText.append(' ').append(cellText(rowNode.path(columnName))).append(" |");
            }
            tableText.append('\n');
        }
        return tableText.toString();
    }

    private static String cellText(JsonNode valueNode) {
        if (valueNode.isMissingNode()) {
            return "";
        }
        if (valueNode.isNull()) {
            return "NULL";
        }
        String text = valueNode.isValueNode() ? valueNode.asText() : valueNode.toString();
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
