package com.mcpgate.mcp.metrics;

/**
 * Running per-tool counters. Not thread safe; guarded by {@link MetricsCollector}.
 */
public class ToolStats {
    private long count;
    private long errors;
    private long totalTimeMs;
    private long minTimeMs = Long.MAX_VALUE;
    private long maxTimeMs;

    void record(long responseTimeMs, boolean success) {
        count++;
        if (!success) {
            errors++;
        }
        totalTimeMs += responseTimeMs;
        minTimeMs = Math.min(minTimeMs, responseTimeMs);
        maxTimeMs = Math.max(maxTimeMs, responseTimeMs);
    }

    ToolStats copy() {
        ToolStats copy = new ToolStats();
        copy.count = count;
        copy.errors = errors;
        copy.totalTimeMs = totalTimeMs;
        copy.minTimeMs = minTimeMs;
        copy.maxTimeMs = maxTimeMs;
        return copy;
    }

    public long getCount() {
        return count;
    }

    public long getErrors() {
        return errors;
    }

    public double getSuccessRate() {
        return count == 0 ? 0.0 : MetricsCollector.round2((count - errors) * 100.0 / count);
    }

    public double getAverageTimeMs() {
        return count == 0 ? 0.0 : MetricsCollector.round2((double) totalTimeMs / count);
    }

    public long getMinTimeMs() {
        return count == 0 ? 0 : minTimeMs;
    }

    public long getMaxTimeMs() {
        return maxTimeMs;
    }
}
