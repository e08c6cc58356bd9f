package com.mcpgate.mcp.security;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Server-side state for one connected client.
 * Mutated by the owning connection thread; read by the session sweep and by tools.
 */
public class ClientSession {
    private final String clientId;
    private final String ipAddress;
    private final Instant connectedAt;
    private final AtomicLong requestCount = new AtomicLong();
    private volatile Instant lastActivity;
    private volatile boolean authenticated;
    private volatile String userAgent;

    public ClientSession(String ipAddress, Instant connectedAt) {
        this(UUID.randomUUID().toString(), ipAddress, connectedAt);
    }

    public ClientSession(String clientId, String ipAddress, Instant connectedAt) {
        this.clientId = clientId;
        this.ipAddress = ipAddress;
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
    }

    /**
     * Marks an accepted request.
     */
    void recordActivity(Instant now) {
        lastActivity = now;
        requestCount.incrementAndGet();
    }

    public String getClientId() {
        return clientId;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public void setAuthenticated(boolean authenticated) {
        this.authenticated = authenticated;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    @Override
    public String toString() {
        return "ClientSession[clientId=" + clientId + ", ip=" + ipAddress + ", requests=" + requestCount.get()
                + ", authenticated=" + authenticated + "]";
    }
}
