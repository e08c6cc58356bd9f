package com.mcpgate.mcp.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

/**
 * Server-wide counters, a bounded request history and per-tool statistics.
 * Derived values (success rates, averages, uptime) are computed on read.
 */
public class MetricsCollector {
    public static final int DEFAULT_MAX_HISTORY = 1000;
    private static final int RECENT_REQUESTS = 10;
    private static final int MAX_SYSTEM_HISTORY = 100;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;
    private final int maxHistory;
    private final Supplier<SystemSnapshot> systemProbe;

    private Instant startTime;
    private long requestCount;
    private long errorCount;
    private int activeConnections;
    private final Deque<RequestRecord> requestHistory = new ArrayDeque<>();
    private final Map<String, ToolStats> toolStats = new TreeMap<>();
    private final Deque<SystemSnapshot> systemHistory = new ArrayDeque<>();

    public MetricsCollector() {
        this(DEFAULT_MAX_HISTORY, Clock.systemUTC());
    }

    public MetricsCollector(int maxHistory, Clock clock) {
        this(maxHistory, clock, () -> SystemSnapshot.capture(clock.instant()));
    }

    public MetricsCollector(int maxHistory, Clock clock, Supplier<SystemSnapshot> systemProbe) {
        if (maxHistory <= 0) {
            throw new IllegalArgumentException("maxHistory must be positive: " + maxHistory);
        }
        this.maxHistory = maxHistory;
        this.clock = clock;
        this.systemProbe = Objects.requireNonNull(systemProbe, "systemProbe");
        this.startTime = clock.instant();
    }

    /**
     * Records one completed request or tool call.
     *
     * @param toolName tool or method name the request is accounted to
     * @param responseTimeMs elapsed handling time
     * @param success false for error results and protocol errors
     */
    public synchronized void recordRequest(String toolName, long responseTimeMs, boolean success) {
        requestCount++;
        if (!success) {
            errorCount++;
        }
        requestHistory.addLast(new RequestRecord(toolName, responseTimeMs, success, clock.instant()));
        while (requestHistory.size() > maxHistory) {
            requestHistory.pollFirst();
        }
        toolStats.computeIfAbsent(toolName, k -> new ToolStats()).record(responseTimeMs, success);
    }

    public synchronized void recordConnectionChange(int delta) {
        activeConnections = Math.max(0, activeConnections + delta);
    }

    public synchronized long getRequestCount() {
        return requestCount;
    }

    public synchronized long getErrorCount() {
        return errorCount;
    }

    public synchronized int getActiveConnections() {
        return activeConnections;
    }

    public synchronized List<RequestRecord> getRequestHistory() {
        return List.copyOf(requestHistory);
    }

    public synchronized double getSuccessRate() {
        return requestCount == 0 ? 0.0 : round2((requestCount - errorCount) * 100.0 / requestCount);
    }

    /**
     * @return error rate as a fraction between 0 and 1
     */
    public synchronized double getErrorRate() {
        return (double) errorCount / Math.max(requestCount, 1);
    }

    public synchronized double getAverageResponseTimeMs() {
        if (requestHistory.isEmpty()) {
            return 0.0;
        }
        long total = 0;
        for (RequestRecord requestRecord : requestHistory) {
            total += requestRecord.responseTimeMs();
        }
        return round2((double) total / requestHistory.size());
    }

    /**
     * Takes a host snapshot and keeps it in the bounded system history.
     */
    public synchronized SystemSnapshot collectSystemMetrics() {
        SystemSnapshot snapshot = systemProbe.get();
        systemHistory.addLast(snapshot);
        while (systemHistory.size() > MAX_SYSTEM_HISTORY) {
            systemHistory.pollFirst();
        }
        return snapshot;
    }

    public synchronized List<SystemSnapshot> getSystemHistory() {
        return List.copyOf(systemHistory);
    }

    public synchronized Duration getUptime() {
        return Duration.between(startTime, clock.instant());
    }

    /**
     * @return a snapshot of the statistics for one tool, or null if it was never called
     */
    public synchronized ToolStats getToolMetrics(String toolName) {
        ToolStats stats = toolStats.get(toolName);
        return stats == null ? null : stats.copy();
    }

    public synchronized Map<String, ToolStats> getAllToolMetrics() {
        Map<String, ToolStats> snapshot = new TreeMap<>();
        toolStats.forEach((name, stats) -> snapshot.put(name, stats.copy()));
        return snapshot;
    }

    /**
     * Builds the full metrics summary: server info, a fresh system snapshot with the recent
     * system history, request metrics with the most recent requests, and per-tool metrics.
     */
    public synchronized ObjectNode getSummary() {
        ObjectNode summary = objectMapper.createObjectNode();
        Duration uptime = getUptime();
        SystemSnapshot currentSystem = collectSystemMetrics();

        ObjectNode serverInfo = summary.putObject("server_info");
        serverInfo.put("start_time", startTime.toString());
        serverInfo.put("uptime_seconds", uptime.toSeconds());
        serverInfo.put("uptime_formatted", formatDuration(uptime));
        serverInfo.put("platform", System.getProperty("os.name"));
        serverInfo.put("java_version", System.getProperty("java.version"));

        ObjectNode systemMetrics = summary.putObject("system_metrics");
        putSnapshot(systemMetrics.putObject("current"), currentSystem);
        ArrayNode systemHistoryNode = systemMetrics.putArray("history");
        List<SystemSnapshot> snapshots = new ArrayList<>(systemHistory);
        for (SystemSnapshot snapshot : snapshots.subList(Math.max(0, snapshots.size() - RECENT_REQUESTS), snapshots.size())) {
            putSnapshot(systemHistoryNode.addObject(), snapshot);
        }

        ObjectNode requestMetrics = summary.putObject("request_metrics");
        requestMetrics.put("total_requests", requestCount);
        requestMetrics.put("error_count", errorCount);
        requestMetrics.put("success_rate_percent", getSuccessRate());
        requestMetrics.put("active_connections", activeConnections);
        requestMetrics.put("average_response_time_ms", getAverageResponseTimeMs());
        ArrayNode recentRequests = requestMetrics.putArray("recent_requests");
        List<RequestRecord> history = new ArrayList<>(requestHistory);
        for (RequestRecord requestRecord : history.subList(Math.max(0, history.size() - RECENT_REQUESTS), history.size())) {
            ObjectNode recent = recentRequests.addObject();
            recent.put("tool", requestRecord.toolName());
            recent.put("response_time_ms", requestRecord.responseTimeMs());
            recent.put("success", requestRecord.success());
            recent.put("timestamp", requestRecord.timestamp().toString());
        }

        ObjectNode toolMetrics = summary.putObject("tool_metrics");
        toolStats.forEach((name, stats) -> {
            ObjectNode toolNode = toolMetrics.putObject(name);
            toolNode.put("count", stats.getCount());
            toolNode.put("errors", stats.getErrors());
            toolNode.put("success_rate", stats.getSuccessRate());
            toolNode.put("avg_response_time_ms", stats.getAverageTimeMs());
            toolNode.put("min_response_time_ms", stats.getMinTimeMs());
            toolNode.put("max_response_time_ms", stats.getMaxTimeMs());
        });
        return summary;
    }

    /**
     * Clears every counter and restarts the uptime clock.
     */
    public synchronized void reset() {
        requestCount = 0;
        errorCount = 0;
        activeConnections = 0;
        requestHistory.clear();
        toolStats.clear();
        systemHistory.clear();
        startTime = clock.instant();
    }

    private static void putSnapshot(ObjectNode snapshotNode, SystemSnapshot snapshot) {
        snapshotNode.put("cpu_percent", snapshot.cpuPercent());
        snapshotNode.put("memory_percent", snapshot.memoryPercent());
        snapshotNode.put("memory_used_gb", snapshot.memoryUsedGb());
        snapshotNode.put("memory_total_gb", snapshot.memoryTotalGb());
        snapshotNode.put("disk_percent", snapshot.diskPercent());
        snapshotNode.put("disk_used_gb", snapshot.diskUsedGb());
        snapshotNode.put("disk_total_gb", snapshot.diskTotalGb());
        snapshotNode.put("timestamp", snapshot.timestamp().toString());
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long days = seconds / 86400;
        String time = String.format(Locale.ROOT, "%d:%02d:%02d", (seconds % 86400) / 3600, (seconds % 3600) / 60, seconds % 60);
        return days > 0 ? days + (days == 1 ? " day, " : " days, ") + time : time;
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
