package com.mcpgate.mcp.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mcpgate.mcp.TestUtils;
import com.mcpgate.mcp.TestUtils.MutableClock;
import com.mcpgate.mcp.metrics.MetricsCollector;
import com.mcpgate.mcp.security.ClientSession;
import com.mcpgate.mcp.security.SessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.mcpgate.mcp.tools.AdminTools.HealthStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AdminToolsTest {
    private MutableClock clock;
    private MetricsCollector metricsCollector;
    private SessionManager sessionManager;
    private AdminTools adminTools;
    private ClientSession session;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        metricsCollector = new MetricsCollector(100, clock);
        sessionManager = new SessionManager(clock);
        adminTools = new AdminTools(metricsCollector, sessionManager, 10, clock);
        session = sessionManager.createSession("192.0.2.10");
        sessionManager.updateSession(session.getClientId());
    }

    @Test
    void testDefinitions() {
        assertEquals("admin", adminTools.getName());
        assertThat(adminTools.getToolDefinitions()).extracting(ToolDefinition::name)
                .containsExactly("echo", "get_system_info", "get_metrics", "health_check");
        adminTools.getToolDefinitions().forEach(definition -> assertNotNull(adminTools.getHandler(definition.name())));
        assertNull(adminTools.getHandler("missing"));
    }

    @Test
    @DisplayName("echo includes the message, timestamp and client details")
    void testEcho() {
        ObjectNode arguments = TestUtils.MAPPER.createObjectNode().put("message", "hi");

        ToolResult toolResult = adminTools.echo(arguments, session);

        assertFalse(toolResult.isError());
        assertThat(toolResult.text())
                .contains("Message: hi")
                .contains("Timestamp: 2024-01-01T00:00:00Z")
                .contains("Client IP: 192.0.2.10")
                .contains("Request Count: 1");
    }

    @Test
    void testEchoRequiresMessage() {
        assertTrue(adminTools.echo(TestUtils.MAPPER.createObjectNode(), session).isError());
    }

    @Test
    void testSystemInfo() {
        session.setUserAgent("test-client/1.0");
        ToolResult toolResult = adminTools.getSystemInfo(TestUtils.MAPPER.createObjectNode(), session);
        assertThat(toolResult.text())
                .contains("System Information:")
                .contains("- Processors: ")
                .contains("- Active Sessions: 1")
                .contains("- Your IP: 192.0.2.10")
                .contains("- User Agent: test-client/1.0");
    }

    @Test
    void testMetricsDashboard() {
        assertThat(adminTools.getMetrics(TestUtils.MAPPER.createObjectNode(), session).text())
                .contains("No tool calls recorded yet");

        metricsCollector.recordRequest("echo", 12, true);
        metricsCollector.recordRequest("echo", 8, false);

        String dashboard = adminTools.getMetrics(TestUtils.MAPPER.createObjectNode(), session).text();
        assertThat(dashboard)
                .contains("- Total Requests: 2")
                .contains("- Errors: 1")
                .contains("- echo:")
                .contains("Min/Max: 8ms / 12ms")
                .contains("[FAILED] echo: 8ms");
    }

    @Test
    void testHealthCheckConnections() {
        for (int i = 0; i < 8; i++) {
            metricsCollector.recordConnectionChange(1);
        }
        assertThat(adminTools.healthCheck(TestUtils.MAPPER.createObjectNode(), session).text())
                .contains("- connections: WARNING (8/10)");

        metricsCollector.recordConnectionChange(2);
        String healthText = adminTools.healthCheck(TestUtils.MAPPER.createObjectNode(), session).text();
        assertThat(healthText)
                .contains("- connections: CRITICAL (10/10)")
                .contains("Overall Status: CRITICAL");
    }

    @Test
    void testHealthCheckErrorRate() {
        for (int i = 0; i < 9; i++) {
            metricsCollector.recordRequest("echo", 1, true);
        }
        metricsCollector.recordRequest("echo", 1, false);
        assertThat(adminTools.healthCheck(TestUtils.MAPPER.createObjectNode(), session).text())
                .contains("- error_rate: CRITICAL (10.0%)");
    }

    @Test
    void testGrade() {
        assertEquals(HEALTHY, AdminTools.grade(79.9, 80, 95));
        assertEquals(WARNING, AdminTools.grade(80, 80, 95));
        assertEquals(CRITICAL, AdminTools.grade(95, 80, 95));
    }
}
