package com.mcpgate.mcp.metrics;

import java.time.Instant;

/**
 * One recorded request in the metrics history.
 */
public record RequestRecord(String toolName, long responseTimeMs, boolean success, Instant timestamp) {
}
