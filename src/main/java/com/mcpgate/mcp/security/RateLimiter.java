package com.mcpgate.mcp.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Sliding window request limiter keyed by client (normally the source IP).
 * Each key keeps the timestamps of its accepted requests; entries older than the
 * window are evicted before every count, so the window moves continuously.
 */
public class RateLimiter {
    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<Instant>> requestLog = new HashMap<>();

    public RateLimiter(int maxRequests, Duration window) {
        this(maxRequests, window, Clock.systemUTC());
    }

    public RateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Records a request for the key if it still has room in the current window.
     *
     * @param clientKey the client being limited
     * @return true if the request is allowed, false if the limit has been reached
     */
    public synchronized boolean isAllowed(String clientKey) {
        Instant now = clock.instant();
        Deque<Instant> timestamps = requestLog.computeIfAbsent(clientKey, k -> new ArrayDeque<>());
        evictExpired(timestamps, now);

        if (timestamps.size() < maxRequests) {
            timestamps.addLast(now);
            return true;
        }
        return false;
    }

    /**
     * @return how many more requests the key may make in the current window
     */
    public synchronized int getRemainingRequests(String clientKey) {
        Deque<Instant> timestamps = requestLog.get(clientKey);
        if (timestamps == null) {
            return maxRequests;
        }
        evictExpired(timestamps, clock.instant());
        if (timestamps.isEmpty()) {
            requestLog.remove(clientKey);
            return maxRequests;
        }
        return Math.max(0, maxRequests - timestamps.size());
    }

    /**
     * Time until the oldest request in the window expires, zero if the key has room.
     */
    public synchronized Duration getRetryAfter(String clientKey) {
        Deque<Instant> timestamps = requestLog.get(clientKey);
        Instant now = clock.instant();
        if (timestamps == null) {
            return Duration.ZERO;
        }
        evictExpired(timestamps, now);
        if (timestamps.size() < maxRequests) {
            return Duration.ZERO;
        }
        Duration retryAfter = Duration.between(now, timestamps.peekFirst().plus(window));
        return retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    }

    /**
     * Drops keys with no requests left in the current window.
     *
     * @return number of keys removed
     */
    public synchronized int pruneExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Deque<Instant>> iterator = requestLog.values().iterator();
        while (iterator.hasNext()) {
            Deque<Instant> timestamps = iterator.next();
            evictExpired(timestamps, now);
            if (timestamps.isEmpty()) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    synchronized int trackedKeys() {
        return requestLog.size();
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    private void evictExpired(Deque<Instant> timestamps, Instant now) {
        Instant cutoff = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }
}
