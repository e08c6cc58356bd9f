package com.mcpgate.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mcpgate.mcp.config.ConfigParams;
import com.mcpgate.mcp.metrics.MetricsCollector;
import com.mcpgate.mcp.security.*;
import com.mcpgate.mcp.tools.SchemaBuilder;
import com.mcpgate.mcp.tools.ToolDefinition;
import com.mcpgate.mcp.tools.ToolRegistry;
import com.mcpgate.mcp.tools.ToolResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RequestDispatcherTest {
    @Mock
    private MetricsCollector mockMetrics;

    private ExecutorService toolExecutor;
    private ToolRegistry toolRegistry;
    private RequestDispatcher requestDispatcher;
    private ClientSession session;

    @BeforeEach
    void setUp() {
        ConfigParams configParams = ConfigParams.defaultConfig().withLimits(10, 60, 1);
        toolExecutor = Executors.newCachedThreadPool();
        toolRegistry = new ToolRegistry();
        toolRegistry.register(new ToolDefinition("shout", "Upper-cases text",
                        SchemaBuilder.object().string("text", "Text", true).build()),
                (args, s) -> ToolResult.text(args.path("text").asText().toUpperCase()));
        toolRegistry.register(new ToolDefinition("slow", "Sleeps", SchemaBuilder.object().build()),
                (args, s) -> {
                    Thread.sleep(5000);
                    return ToolResult.text("late");
                });
        toolRegistry.register(new ToolDefinition("broken", "Throws", SchemaBuilder.object().build()),
                (args, s) -> {
                    throw new IllegalStateException("kaput");
                });

        ServerContext serverContext = new ServerContext(configParams,
                new RateLimiter(100, Duration.ofSeconds(60)),
                new IpFilter(Set.of(), 5, BanPolicy.permanent()),
                new Authenticator(false, null),
                new SessionManager(),
                mockMetrics,
                toolRegistry,
                toolExecutor);
        requestDispatcher = new RequestDispatcher(serverContext);
        session = new ClientSession("127.0.0.1", Instant.now());
    }

    @AfterEach
    void tearDown() {
        toolExecutor.shutdownNow();
    }

    @Test
    void testInitialize() {
        ObjectNode request = TestUtils.request(1, "initialize");
        ObjectNode params = request.putObject("params");
        params.put("protocolVersion", "2024-11-05");
        params.putObject("clientInfo").put("name", "inspector").put("version", "0.9");

        JsonNode response = requestDispatcher.handleRequest(request, session);

        JsonNode result = response.get("result");
        assertEquals(1, response.get("id").asInt());
        assertEquals("2024-11-05", result.get("protocolVersion").asText());
        assertTrue(result.get("capabilities").has("tools"));
        assertEquals("mcpgate", result.get("serverInfo").get("name").asText());
        assertEquals("inspector/0.9", session.getUserAgent());
    }

    @Test
    void testNegotiateProtocolVersion() {
        assertEquals(RequestDispatcher.DEFAULT_PROTOCOL_VERSION, RequestDispatcher.negotiateProtocolVersion(null));
        assertEquals(RequestDispatcher.DEFAULT_PROTOCOL_VERSION, RequestDispatcher.negotiateProtocolVersion("1999-01-01"));
        assertEquals("2025-03-26", RequestDispatcher.negotiateProtocolVersion("2025-03-26"));
    }

    @Test
    void testToolsList() {
        JsonNode response = requestDispatcher.handleRequest(TestUtils.request(2, "tools/list"), session);
        assertThat(response.get("result").get("tools")).extracting(tool -> tool.get("name").asText())
                .containsExactly("shout", "slow", "broken");
    }

    @Test
    void testEmptyListsAndPing() {
        assertEquals(0, requestDispatcher.handleRequest(TestUtils.request(3, "resources/list"), session)
                .get("result").get("resources").size());
        assertEquals(0, requestDispatcher.handleRequest(TestUtils.request(4, "prompts/list"), session)
                .get("result").get("prompts").size());
        assertTrue(requestDispatcher.handleRequest(TestUtils.request(5, "ping"), session).get("result").isEmpty());
    }

    @Test
    void testToolCallRecordsSuccess() {
        JsonNode response = requestDispatcher.handleRequest(
                TestUtils.toolCall(6, "shout", TestUtils.MAPPER.createObjectNode().put("text", "hi")), session);

        assertEquals("HI", TestUtils.resultText(response));
        assertFalse(response.get("result").has("isError"));
        verify(mockMetrics).recordRequest(eq("shout"), anyLong(), eq(true));
    }

    @Test
    @DisplayName("Unknown tools return an error result and count as failures")
    void testUnknownTool() {
        JsonNode response = requestDispatcher.handleRequest(TestUtils.toolCall(7, "nope", null), session);

        assertTrue(response.get("result").get("isError").asBoolean());
        assertEquals("Unknown tool: nope", TestUtils.resultText(response));
        verify(mockMetrics).recordRequest(eq("nope"), anyLong(), eq(false));
    }

    @Test
    void testMissingToolName() {
        requestDispatcher.handleRequest(TestUtils.request(8, "tools/call"), session);
        verify(mockMetrics).recordRequest(eq(RequestDispatcher.UNKNOWN_TOOL), anyLong(), eq(false));
    }

    @Test
    void testToolExceptionBecomesErrorResult() {
        JsonNode response = requestDispatcher.handleRequest(TestUtils.toolCall(9, "broken", null), session);

        assertFalse(response.has("error"));
        assertEquals("Internal error: kaput", TestUtils.resultText(response));
        verify(mockMetrics).recordRequest(eq("broken"), anyLong(), eq(false));
    }

    @Test
    @DisplayName("Tools running past the request timeout are abandoned")
    void testToolTimeout() {
        JsonNode response = requestDispatcher.handleRequest(TestUtils.toolCall(10, "slow", null), session);

        assertTrue(response.get("result").get("isError").asBoolean());
        assertEquals("Tool execution timed out after 1s", TestUtils.resultText(response));
    }

    @Test
    void testUnknownMethod() {
        JsonNode response = requestDispatcher.handleRequest(TestUtils.request(11, "no/such"), session);
        assertEquals(JsonRpc.METHOD_NOT_FOUND, response.get("error").get("code").asInt());
        assertEquals(11, response.get("id").asInt());
    }

    @Test
    @DisplayName("Notifications never produce a response, even for unknown methods")
    void testNotifications() {
        assertNull(requestDispatcher.handleRequest(TestUtils.notification("notifications/initialized"), session));
        assertNull(requestDispatcher.handleRequest(TestUtils.notification("no/such"), session));

        ObjectNode toolNotification = TestUtils.notification("tools/call");
        toolNotification.putObject("params").put("name", "shout");
        assertNull(requestDispatcher.handleRequest(toolNotification, session));
    }

    @Test
    void testInvalidRequests() throws Exception {
        JsonNode notObject = requestDispatcher.handleRequest(TestUtils.MAPPER.readTree("[1]"), session);
        assertEquals(JsonRpc.INVALID_REQUEST, notObject.get("error").get("code").asInt());
        assertTrue(notObject.get("id").isNull());

        JsonNode noMethod = requestDispatcher.handleRequest(TestUtils.MAPPER.readTree("{\"id\":\"x\",\"method\":5}"), session);
        assertEquals(JsonRpc.INVALID_REQUEST, noMethod.get("error").get("code").asInt());
        assertEquals("x", noMethod.get("id").asText());
        verifyNoInteractions(mockMetrics);
    }
}
