package com.mcpgate.mcp.security;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides how long an IP stays locked out after too many failed authentications.
 */
public interface BanPolicy {

    /**
     * @param bannedAt when the ban was imposed
     * @param now the current time
     * @return true while the ban is still in force
     */
    boolean isActive(Instant bannedAt, Instant now);

    /**
     * Bans that last for the lifetime of the process.
     */
    static BanPolicy permanent() {
        return (bannedAt, now) -> true;
    }

    /**
     * Bans that are lifted once {@code duration} has elapsed.
     */
    static BanPolicy ofDuration(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Ban duration must be positive: " + duration);
        }
        return (bannedAt, now) -> now.isBefore(bannedAt.plus(duration));
    }

    /**
     * Maps a nullable duration to a policy, null meaning permanent.
     */
    static BanPolicy fromDuration(Duration duration) {
        return duration == null ? permanent() : ofDuration(duration);
    }
}
