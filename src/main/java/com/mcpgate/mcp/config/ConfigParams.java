package com.mcpgate.mcp.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable startup configuration for the protocol server.
 * Produced by {@link CliUtils#loadConfiguration(String[])} and validated on construction,
 * so an instance that exists is always usable.
 *
 * @param host bind address
 * @param port listen port, 0 picks an ephemeral port
 * @param sslCert PEM certificate chain path, or null for plain TCP
 * @param sslKey PEM (PKCS#8) private key path, or null for plain TCP
 * @param sslClientAuth one of none, want, need
 * @param authEnabled whether clients must present the auth token
 * @param authToken shared secret, required when auth is enabled
 * @param rateLimitRequests requests allowed per window per IP
 * @param rateLimitWindowSeconds sliding window length
 * @param maxConnections maximum concurrent connections
 * @param idleTimeoutSeconds per-read idle timeout
 * @param requestTimeoutSeconds tool execution timeout
 * @param allowedIps exact addresses or CIDR blocks; empty allows everyone
 * @param maxFailedAttempts failed authentications before an IP is locked out
 * @param banDurationSeconds lockout length, 0 for the lifetime of the process
 * @param sessionMaxAgeHours idle age after which the sweep removes a session
 * @param sessionCleanupIntervalSeconds period of the session sweep
 * @param maxLineBytes largest accepted request line
 * @param serverName name reported in {@code serverInfo}
 * @param toolProviders enabled tool providers
 * @param databaseServiceUrl base URL of the database_ws service
 * @param databaseServiceTimeoutSeconds HTTP timeout for database_ws calls
 * @param fileRoot sandbox root for file tools
 * @param maxFileSize default read limit for file tools
 */
public record ConfigParams(
        String host,
        int port,
        String sslCert,
        String sslKey,
        String sslClientAuth,
        boolean authEnabled,
        String authToken,
        int rateLimitRequests,
        int rateLimitWindowSeconds,
        int maxConnections,
        int idleTimeoutSeconds,
        int requestTimeoutSeconds,
        Set<String> allowedIps,
        int maxFailedAttempts,
        long banDurationSeconds,
        int sessionMaxAgeHours,
        int sessionCleanupIntervalSeconds,
        int maxLineBytes,
        String serverName,
        List<String> toolProviders,
        String databaseServiceUrl,
        int databaseServiceTimeoutSeconds,
        Path fileRoot,
        long maxFileSize) {

    /** Largest idle timeout whose millisecond value still fits a socket timeout. */
    public static final int MAX_IDLE_TIMEOUT_SECONDS = Integer.MAX_VALUE / 1000;

    public static final List<String> KNOWN_TOOL_PROVIDERS = List.of("admin", "files", "database", "redis");

    public ConfigParams {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.host.required"));
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.port.range", String.valueOf(port)));
        }
        requirePositive("RATE_LIMIT_REQUESTS", rateLimitRequests);
        requirePositive("RATE_LIMIT_WINDOW", rateLimitWindowSeconds);
        requirePositive("MAX_CONNECTIONS", maxConnections);
        requirePositive("IDLE_TIMEOUT", idleTimeoutSeconds);
        if (idleTimeoutSeconds > MAX_IDLE_TIMEOUT_SECONDS) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage(
                    "config.at.most", "IDLE_TIMEOUT", String.valueOf(idleTimeoutSeconds), String.valueOf(MAX_IDLE_TIMEOUT_SECONDS)));
        }
        requirePositive("REQUEST_TIMEOUT", requestTimeoutSeconds);
        requirePositive("MAX_FAILED_ATTEMPTS", maxFailedAttempts);
        requirePositive("SESSION_MAX_AGE", sessionMaxAgeHours);
        requirePositive("SESSION_CLEANUP_INTERVAL", sessionCleanupIntervalSeconds);
        requirePositive("MAX_LINE_BYTES", maxLineBytes);
        requirePositive("DATABASE_SERVICE_TIMEOUT", databaseServiceTimeoutSeconds);
        requirePositive("MAX_FILE_SIZE", maxFileSize);
        if (banDurationSeconds < 0) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage(
                    "config.not.negative", "BAN_DURATION", String.valueOf(banDurationSeconds)));
        }

        sslCert = blankToNull(sslCert);
        sslKey = blankToNull(sslKey);
        authToken = blankToNull(authToken);
        if (authEnabled && authToken == null) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.auth.token.required"));
        }
        if (sslCert != null && sslKey == null) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.ssl.key.required"));
        }
        if (sslKey != null && sslCert == null) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.ssl.cert.required"));
        }

        sslClientAuth = sslClientAuth == null ? "none" : sslClientAuth.trim().toLowerCase(Locale.ROOT);
        if (!List.of("none", "want", "need").contains(sslClientAuth)) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.ssl.client.auth", sslClientAuth));
        }

        toolProviders = toolProviders == null ? List.of() : List.copyOf(toolProviders);
        for (String toolProvider : toolProviders) {
            if (!KNOWN_TOOL_PROVIDERS.contains(toolProvider)) {
                throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.tool.provider.unknown", toolProvider));
            }
        }

        allowedIps = allowedIps == null ? Set.of() : Set.copyOf(allowedIps);
        serverName = serverName == null || serverName.isBlank() ? CliUtils.SERVER_NAME : serverName;
        fileRoot = fileRoot == null ? Path.of("").toAbsolutePath() : fileRoot.toAbsolutePath().normalize();
    }

    /**
     * Configuration with every default and authentication disabled.
     * Handy for tests and for embedding the server.
     */
    public static ConfigParams defaultConfig() {
        return customConfig("127.0.0.1", 0, false, null);
    }

    /**
     * Default configuration with the given bind address and authentication settings.
     */
    public static ConfigParams customConfig(String host, int port, boolean authEnabled, String authToken) {
        return new ConfigParams(host, port, null, null, "none", authEnabled, authToken,
                100, 60, 50, 600, 300, Set.of(), 5, 0, 24, 300, 1024 * 1024,
                CliUtils.SERVER_NAME, List.of("admin", "files"), "http://localhost:8000", 30,
                null, 1024 * 1024);
    }

    public boolean isTlsEnabled() {
        return sslCert != null && sslKey != null;
    }

    public Duration idleTimeout() {
        return Duration.ofSeconds(idleTimeoutSeconds);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public Duration rateLimitWindow() {
        return Duration.ofSeconds(rateLimitWindowSeconds);
    }

    public Duration sessionMaxAge() {
        return Duration.ofHours(sessionMaxAgeHours);
    }

    /**
     * @return null when bans are permanent
     */
    public Duration banDuration() {
        return banDurationSeconds == 0 ? null : Duration.ofSeconds(banDurationSeconds);
    }

    /**
     * Copy of this configuration with different rate limit settings.
     */
    public ConfigParams withRateLimit(int requests, int windowSeconds) {
        return new ConfigParams(host, port, sslCert, sslKey, sslClientAuth, authEnabled, authToken,
                requests, windowSeconds, maxConnections, idleTimeoutSeconds, requestTimeoutSeconds,
                allowedIps, maxFailedAttempts, banDurationSeconds, sessionMaxAgeHours,
                sessionCleanupIntervalSeconds, maxLineBytes, serverName, toolProviders,
                databaseServiceUrl, databaseServiceTimeoutSeconds, fileRoot, maxFileSize);
    }

    /**
     * Copy of this configuration with different connection limits and timeouts.
     */
    public ConfigParams withLimits(int connections, int idleSeconds, int requestSeconds) {
        return new ConfigParams(host, port, sslCert, sslKey, sslClientAuth, authEnabled, authToken,
                rateLimitRequests, rateLimitWindowSeconds, connections, idleSeconds, requestSeconds,
                allowedIps, maxFailedAttempts, banDurationSeconds, sessionMaxAgeHours,
                sessionCleanupIntervalSeconds, maxLineBytes, serverName, toolProviders,
                databaseServiceUrl, databaseServiceTimeoutSeconds, fileRoot, maxFileSize);
    }

    /**
     * Copy of this configuration with a different allow-list.
     */
    public ConfigParams withAllowedIps(Set<String> ips) {
        return new ConfigParams(host, port, sslCert, sslKey, sslClientAuth, authEnabled, authToken,
                rateLimitRequests, rateLimitWindowSeconds, maxConnections, idleTimeoutSeconds,
                requestTimeoutSeconds, ips, maxFailedAttempts, banDurationSeconds, sessionMaxAgeHours,
                sessionCleanupIntervalSeconds, maxLineBytes, serverName, toolProviders,
                databaseServiceUrl, databaseServiceTimeoutSeconds, fileRoot, maxFileSize);
    }

    /**
     * Copy of this configuration with different lockout settings.
     */
    public ConfigParams withLockout(int failedAttempts, long banSeconds) {
        return new ConfigParams(host, port, sslCert, sslKey, sslClientAuth, authEnabled, authToken,
                rateLimitRequests, rateLimitWindowSeconds, maxConnections, idleTimeoutSeconds,
                requestTimeoutSeconds, allowedIps, failedAttempts, banSeconds, sessionMaxAgeHours,
                sessionCleanupIntervalSeconds, maxLineBytes, serverName, toolProviders,
                databaseServiceUrl, databaseServiceTimeoutSeconds, fileRoot, maxFileSize);
    }

    /**
     * Copy of this configuration serving TLS with the given PEM files.
     */
    public ConfigParams withTls(String certFile, String keyFile, String clientAuth) {
        return new ConfigParams(host, port, certFile, keyFile, clientAuth, authEnabled, authToken,
                rateLimitRequests, rateLimitWindowSeconds, maxConnections, idleTimeoutSeconds,
                requestTimeoutSeconds, allowedIps, maxFailedAttempts, banDurationSeconds, sessionMaxAgeHours,
                sessionCleanupIntervalSeconds, maxLineBytes, serverName, toolProviders,
                databaseServiceUrl, databaseServiceTimeoutSeconds, fileRoot, maxFileSize);
    }

    /**
     * Copy of this configuration with a different set of tool providers and file root.
     */
    public ConfigParams withTools(List<String> providers, Path root) {
        return new ConfigParams(host, port, sslCert, sslKey, sslClientAuth, authEnabled, authToken,
                rateLimitRequests, rateLimitWindowSeconds, maxConnections, idleTimeoutSeconds,
                requestTimeoutSeconds, allowedIps, maxFailedAttempts, banDurationSeconds, sessionMaxAgeHours,
                sessionCleanupIntervalSeconds, maxLineBytes, serverName, providers,
                databaseServiceUrl, databaseServiceTimeoutSeconds, root, maxFileSize);
    }

    @Override
    public String toString() {
        // authToken deliberately omitted
        return "ConfigParams[host=" + host + ", port=" + port + ", tls=" + isTlsEnabled()
                + ", authEnabled=" + authEnabled + ", rateLimit=" + rateLimitRequests + "/" + rateLimitWindowSeconds + "s"
                + ", maxConnections=" + maxConnections + ", idleTimeout=" + idleTimeoutSeconds + "s"
                + ", requestTimeout=" + requestTimeoutSeconds + "s, allowedIps=" + allowedIps
                + ", toolProviders=" + toolProviders + "]";
    }

    private static void requirePositive(String paramName, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage(
                    "config.positive", paramName, String.valueOf(value)));
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
