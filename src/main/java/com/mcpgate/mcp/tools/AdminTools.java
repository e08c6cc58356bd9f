package com.mcpgate.mcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mcpgate.mcp.metrics.MetricsCollector;
import com.mcpgate.mcp.security.ClientSession;
import com.mcpgate.mcp.security.SessionManager;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Administrative tools available on every server: echo, system information, metrics and health.
 */
public class AdminTools implements ToolProvider {
    static final double MEMORY_WARNING_PERCENT = 80;
    static final double MEMORY_CRITICAL_PERCENT = 95;
    static final double DISK_WARNING_PERCENT = 85;
    static final double DISK_CRITICAL_PERCENT = 95;
    static final double CONNECTION_WARNING_RATIO = 0.8;
    static final double ERROR_RATE_WARNING = 0.05;
    static final double ERROR_RATE_CRITICAL = 0.10;

    private final MetricsCollector metricsCollector;
    private final SessionManager sessionManager;
    private final int maxConnections;
    private final Clock clock;
    private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();
    private final List<ToolDefinition> definitions;

    public AdminTools(MetricsCollector metricsCollector, SessionManager sessionManager, int maxConnections) {
        this(metricsCollector, sessionManager, maxConnections, Clock.systemDefaultZone());
    }

    public AdminTools(MetricsCollector metricsCollector, SessionManager sessionManager, int maxConnections, Clock clock) {
        this.metricsCollector = metricsCollector;
        this.sessionManager = sessionManager;
        this.maxConnections = maxConnections;
        this.clock = clock;

        handlers.put("echo", this::echo);
        handlers.put("get_system_info", this::getSystemInfo);
        handlers.put("get_metrics", this::getMetrics);
        handlers.put("health_check", this::healthCheck);

        definitions = List.of(
                new ToolDefinition("echo", "Echo a message with client metadata and timestamps",
                        SchemaBuilder.object().string("message", "Message to echo", true).build()),
                new ToolDefinition("get_system_info", "Get comprehensive system information and server status",
                        SchemaBuilder.object().build()),
                new ToolDefinition("get_metrics", "Get server performance metrics and statistics",
                        SchemaBuilder.object().build()),
                new ToolDefinition("health_check", "Perform a comprehensive health check of the server",
                        SchemaBuilder.object().build()));
    }

    @Override
    public String getName() {
        return "admin";
    }

    @Override
    public List<ToolDefinition> getToolDefinitions() {
        return definitions;
    }

    @Override
    public ToolHandler getHandler(String toolName) {
        return handlers.get(toolName);
    }

    ToolResult echo(JsonNode arguments, ClientSession session) {
        JsonNode messageNode = arguments.path("message");
        if (messageNode.isMissingNode() || messageNode.isNull()) {
            return ToolResult.error("Error: 'message' is required");
        }

        String responseText = "Echo Response:\n" +
                "Message: " + messageNode.asText() + "\n" +
                "Timestamp: " + Instant.now(clock) + "\n" +
                "Client IP: " + session.getIpAddress() + "\n" +
                "Request Count: " + session.getRequestCount();
        return ToolResult.text(responseText);
    }

    ToolResult getSystemInfo(JsonNode arguments, ClientSession session) {
        Runtime runtime = Runtime.getRuntime();
        long usedMemory = runtime.totalMemory() - runtime.freeMemory();
        File root = new File(File.separator);

        StringBuilder infoText = new StringBuilder("System Information:\n\n");
        infoText.append("Hardware:\n");
        infoText.append("- Platform: ").append(System.getProperty("os.name")).append(' ')
                .append(System.getProperty("os.version")).append('\n');
        infoText.append("- Architecture: ").append(System.getProperty("os.arch")).append('\n');
        infoText.append("- Processors: ").append(runtime.availableProcessors()).append('\n');
        infoText.append("- System Load Average: ")
                .append(String.format(Locale.ROOT, "%.2f", ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage()))
                .append('\n');
        infoText.append("- JVM Memory: ").append(toMegabytes(usedMemory)).append("MB used / ")
                .append(toMegabytes(runtime.maxMemory())).append("MB max\n");
        infoText.append("- Disk: ").append(toGigabytes(root.getTotalSpace() - root.getUsableSpace())).append("GB used / ")
                .append(toGigabytes(root.getTotalSpace())).append("GB total\n\n");

        infoText.append("Software:\n");
        infoText.append("- Java: ").append(System.getProperty("java.version")).append(" (")
                .append(System.getProperty("java.vendor")).append(")\n");
        infoText.append("- Process ID: ").append(ProcessHandle.current().pid()).append('\n');
        infoText.append("- Working Directory: ").append(System.getProperty("user.dir")).append("\n\n");

        infoText.append("Server Status:\n");
        infoText.append("- Current Time: ").append(Instant.now(clock)).append('\n');
        infoText.append("- Active Connections: ").append(metricsCollector.getActiveConnections()).append('\n');
        infoText.append("- Active Sessions: ").append(sessionManager.size()).append('\n');
        infoText.append("- Total Requests: ").append(metricsCollector.getRequestCount()).append('\n');
        infoText.append("- Uptime: ").append(metricsCollector.getSummary().path("server_info").path("uptime_formatted").asText())
                .append("\n\n");

        infoText.append("Client Info:\n");
        infoText.append("- Your IP: ").append(session.getIpAddress()).append('\n');
        infoText.append("- Client ID: ").append(session.getClientId()).append('\n');
        infoText.append("- Connected: ").append(session.getConnectedAt()).append('\n');
        infoText.append("- Requests Made: ").append(session.getRequestCount()).append('\n');
        infoText.append("- Authenticated: ").append(session.isAuthenticated());
        if (session.getUserAgent() != null) {
            infoText.append("\n- User Agent: ").append(session.getUserAgent());
        }
        return ToolResult.text(infoText.toString());
    }

    ToolResult getMetrics(JsonNode arguments, ClientSession session) {
        ObjectNode summary = metricsCollector.getSummary();
        JsonNode serverInfo = summary.path("server_info");
        JsonNode requestMetrics = summary.path("request_metrics");
        JsonNode currentSystem = summary.path("system_metrics").path("current");

        StringBuilder metricsText = new StringBuilder("Server Metrics Dashboard:\n\n");
        metricsText.append("Server Info:\n");
        metricsText.append("- Start Time: ").append(serverInfo.path("start_time").asText()).append('\n');
        metricsText.append("- Uptime: ").append(serverInfo.path("uptime_formatted").asText()).append('\n');
        metricsText.append("- Platform: ").append(serverInfo.path("platform").asText()).append('\n');
        metricsText.append("- Java: ").append(serverInfo.path("java_version").asText()).append("\n\n");

        metricsText.append("System Metrics:\n");
        metricsText.append("- CPU: ").append(currentSystem.path("cpu_percent").asDouble()).append("%\n");
        metricsText.append("- Memory: ").append(currentSystem.path("memory_percent").asDouble()).append("% (")
                .append(currentSystem.path("memory_used_gb").asDouble()).append("GB / ")
                .append(currentSystem.path("memory_total_gb").asDouble()).append("GB)\n");
        metricsText.append("- Disk: ").append(currentSystem.path("disk_percent").asDouble()).append("% (")
                .append(currentSystem.path("disk_used_gb").asDouble()).append("GB / ")
                .append(currentSystem.path("disk_total_gb").asDouble()).append("GB)\n\n");

        metricsText.append("Request Metrics:\n");
        metricsText.append("- Total Requests: ").append(requestMetrics.path("total_requests").asLong()).append('\n');
        metricsText.append("- Errors: ").append(requestMetrics.path("error_count").asLong()).append('\n');
        metricsText.append("- Success Rate: ").append(requestMetrics.path("success_rate_percent").asDouble()).append("%\n");
        metricsText.append("- Average Response: ").append(requestMetrics.path("average_response_time_ms").asDouble()).append("ms\n");
        metricsText.append("- Active Connections: ").append(requestMetrics.path("active_connections").asInt()).append("\n\n");

        metricsText.append("Tool Performance:");
        Iterator<Map.Entry<String, JsonNode>> toolIterator = summary.path("tool_metrics").fields();
        if (!toolIterator.hasNext()) {
            metricsText.append("\n- No tool calls recorded yet");
        }
        while (toolIterator.hasNext()) {
            Map.Entry<String, JsonNode> toolEntry = toolIterator.next();
            JsonNode toolMetrics = toolEntry.getValue();
            metricsText.append("\n- ").append(toolEntry.getKey()).append(":\n");
            metricsText.append("  - Calls: ").append(toolMetrics.path("count").asLong()).append('\n');
            metricsText.append("  - Success Rate: ").append(toolMetrics.path("success_rate").asDouble()).append("%\n");
            metricsText.append("  - Avg Response: ").append(toolMetrics.path("avg_response_time_ms").asDouble()).append("ms\n");
            metricsText.append("  - Min/Max: ").append(toolMetrics.path("min_response_time_ms").asLong()).append("ms / ")
                    .append(toolMetrics.path("max_response_time_ms").asLong()).append("ms");
        }

        JsonNode recentRequests = requestMetrics.path("recent_requests");
        if (recentRequests.size() > 0) {
            metricsText.append("\n\nRecent Requests:");
            for (int i = Math.max(0, recentRequests.size() - 5); i < recentRequests.size(); i++) {
                JsonNode recent = recentRequests.get(i);
                metricsText.append('\n').append(recent.path("success").asBoolean() ? "[OK] " : "[FAILED] ")
                        .append(recent.path("tool").asText()).append(": ")
                        .append(recent.path("response_time_ms").asLong()).append("ms");
            }
        }
        return ToolResult.text(metricsText.toString());
    }

    ToolResult healthCheck(JsonNode arguments, ClientSession session) {
        Map<String, HealthCheck> checks = new LinkedHashMap<>();

        Runtime runtime = Runtime.getRuntime();
        double memoryPercent = percent(runtime.totalMemory() - runtime.freeMemory(), runtime.maxMemory());
        checks.put("memory", new HealthCheck(grade(memoryPercent, MEMORY_WARNING_PERCENT, MEMORY_CRITICAL_PERCENT),
                formatPercent(memoryPercent)));

        File root = new File(File.separator);
        double diskPercent = percent(root.getTotalSpace() - root.getUsableSpace(), root.getTotalSpace());
        checks.put("disk", new HealthCheck(grade(diskPercent, DISK_WARNING_PERCENT, DISK_CRITICAL_PERCENT),
                formatPercent(diskPercent)));

        int activeConnections = metricsCollector.getActiveConnections();
        HealthStatus connectionStatus = activeConnections >= maxConnections ? HealthStatus.CRITICAL
                : activeConnections >= maxConnections * CONNECTION_WARNING_RATIO ? HealthStatus.WARNING
                : HealthStatus.HEALTHY;
        checks.put("connections", new HealthCheck(connectionStatus, activeConnections + "/" + maxConnections));

        double errorRate = metricsCollector.getErrorRate();
        checks.put("error_rate", new HealthCheck(grade(errorRate, ERROR_RATE_WARNING, ERROR_RATE_CRITICAL),
                formatPercent(errorRate * 100)));

        HealthStatus overall = HealthStatus.HEALTHY;
        for (HealthCheck healthCheck : checks.values()) {
            if (healthCheck.status().ordinal() > overall.ordinal()) {
                overall = healthCheck.status();
            }
        }

        StringBuilder healthText = new StringBuilder("Health Check Results:\n\n");
        healthText.append("Overall Status: ").append(overall.name()).append('\n');
        healthText.append("Timestamp: ").append(Instant.now(clock)).append("\n\n");
        healthText.append("Detailed Checks:");
        checks.forEach((name, healthCheck) -> healthText.append("\n- ").append(name).append(": ")
                .append(healthCheck.status().name()).append(" (").append(healthCheck.value()).append(')'));
        return ToolResult.text(healthText.toString());
    }

    enum HealthStatus {
        HEALTHY, WARNING, CRITICAL
    }

    record HealthCheck(HealthStatus status, String value) {
    }

    static HealthStatus grade(double value, double warningThreshold, double criticalThreshold) {
        if (value >= criticalThreshold) {
            return HealthStatus.CRITICAL;
        }
        if (value >= warningThreshold) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }

    private static double percent(long part, long total) {
        return total <= 0 ? 0.0 : part * 100.0 / total;
    }

    private static String formatPercent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }

    private static long toMegabytes(long bytes) {
        return bytes / (1024 * 1024);
    }

    private static long toGigabytes(long bytes) {
        return bytes / (1024L * 1024 * 1024);
    }
}
