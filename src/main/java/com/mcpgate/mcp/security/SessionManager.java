package com.mcpgate.mcp.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live client sessions keyed by client id.
 * The expiry sweep only drops registry entries; it never touches sockets.
 */
public class SessionManager {
    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionManager() {
        this(Clock.systemUTC());
    }

    public SessionManager(Clock clock) {
        this.clock = clock;
    }

    public ClientSession createSession(String ipAddress) {
        ClientSession session = new ClientSession(ipAddress, clock.instant());
        sessions.put(session.getClientId(), session);
        logger.debug("Session {} created for {}", session.getClientId(), ipAddress);
        return session;
    }

    public ClientSession getSession(String clientId) {
        return sessions.get(clientId);
    }

    /**
     * Bumps last activity and the request count of a session.
     *
     * @return false if the session is no longer registered
     */
    public boolean updateSession(String clientId) {
        ClientSession session = sessions.get(clientId);
        if (session == null) {
            return false;
        }
        session.recordActivity(clock.instant());
        return true;
    }

    public ClientSession removeSession(String clientId) {
        ClientSession removed = sessions.remove(clientId);
        if (removed != null) {
            logger.debug("Session {} removed", clientId);
        }
        return removed;
    }

    /**
     * Removes every session whose last activity is older than {@code maxAge}.
     *
     * @return the number of sessions removed
     */
    public int cleanupExpiredSessions(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (ClientSession session : sessions.values()) {
            if (session.getLastActivity().isBefore(cutoff) && sessions.remove(session.getClientId(), session)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Cleaned up {} expired sessions", removed);
        }
        return removed;
    }

    public Collection<ClientSession> getSessions() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
