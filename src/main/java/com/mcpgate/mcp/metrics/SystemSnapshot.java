package com.mcpgate.mcp.metrics;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.time.Instant;

/**
 * Host CPU, memory and disk usage at one point in time.
 * Memory falls back to the JVM heap when the platform bean does not expose physical memory.
 */
public record SystemSnapshot(
        double cpuPercent,
        double memoryPercent,
        double memoryUsedGb,
        double memoryTotalGb,
        double diskPercent,
        double diskUsedGb,
        double diskTotalGb,
        Instant timestamp) {

    private static final double GIGABYTE = 1024.0 * 1024.0 * 1024.0;

    public static SystemSnapshot capture(Instant timestamp) {
        OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
        double cpuPercent = 0.0;
        long memoryUsed;
        long memoryTotal;
        if (osBean instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean platformBean = (com.sun.management.OperatingSystemMXBean) osBean;
            double cpuLoad = platformBean.getCpuLoad();
            cpuPercent = cpuLoad < 0 ? 0.0 : cpuLoad * 100.0;
            memoryTotal = platformBean.getTotalMemorySize();
            memoryUsed = memoryTotal - platformBean.getFreeMemorySize();
        } else {
            Runtime runtime = Runtime.getRuntime();
            memoryTotal = runtime.maxMemory();
            memoryUsed = runtime.totalMemory() - runtime.freeMemory();
        }

        File root = new File(File.separator);
        long diskTotal = root.getTotalSpace();
        long diskUsed = diskTotal - root.getUsableSpace();

        return new SystemSnapshot(
                MetricsCollector.round2(cpuPercent),
                percent(memoryUsed, memoryTotal),
                MetricsCollector.round2(memoryUsed / GIGABYTE),
                MetricsCollector.round2(memoryTotal / GIGABYTE),
                percent(diskUsed, diskTotal),
                MetricsCollector.round2(diskUsed / GIGABYTE),
                MetricsCollector.round2(diskTotal / GIGABYTE),
                timestamp);
    }

    private static double percent(long part, long total) {
        return total <= 0 ? 0.0 : MetricsCollector.round2(part * 100.0 / total);
    }
}
