package com.mcpgate.mcp;

import com.mcpgate.mcp.config.ConfigParams;
import com.mcpgate.mcp.metrics.MetricsCollector;
import com.mcpgate.mcp.security.Authenticator;
import com.mcpgate.mcp.security.IpFilter;
import com.mcpgate.mcp.security.RateLimiter;
import com.mcpgate.mcp.security.SessionManager;
import com.mcpgate.mcp.tools.ToolRegistry;

import java.util.concurrent.ExecutorService;

/**
 * Shared services handed to every connection. Each service is thread safe;
 * one instance exists per {@link ProtocolServer}.
 */
public record ServerContext(
        ConfigParams configParams,
        RateLimiter rateLimiter,
        IpFilter ipFilter,
        Authenticator authenticator,
        SessionManager sessionManager,
        MetricsCollector metricsCollector,
        ToolRegistry toolRegistry,
        ExecutorService toolExecutor) {
}
