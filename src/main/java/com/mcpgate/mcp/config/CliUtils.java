package com.mcpgate.mcp.config;

import com.mcpgate.mcp.RequestDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Utility class for handling command line interface operations.
 * Provides argument parsing, help display, version information and configuration loading.
 */
public class CliUtils {
    private static final Logger logger = LoggerFactory.getLogger(CliUtils.class);
    public static final String SERVER_NAME = "mcpgate";
    public static final String SERVER_VERSION = "1.0.0";
    public static final String SERVER_DESCRIPTION = "Secure MCP tool server over line-delimited JSON-RPC";

    static final String ENV_PREFIX = "MCP_";
    static final String PROPERTY_PREFIX = "mcp.";

    /**
     * Maps short form arguments to their long form equivalents.
     *
     * @return Map of short form to long form argument names
     */
    static Map<String, String> getShortFormMapping() {
        Map<String, String> shortToLong = new HashMap<>();

        // Help and version
        shortToLong.put("h", "help");
        shortToLong.put("v", "version");

        // Listener
        shortToLong.put("c", "config_file");
        shortToLong.put("b", "host");
        shortToLong.put("p", "port");
        shortToLong.put("k", "ssl_cert");
        shortToLong.put("K", "ssl_key");

        // Security
        shortToLong.put("a", "auth_enabled");
        shortToLong.put("t", "auth_token");
        shortToLong.put("A", "allowed_ips");

        // Limits
        shortToLong.put("r", "rate_limit_requests");
        shortToLong.put("w", "rate_limit_window");
        shortToLong.put("C", "max_connections");
        shortToLong.put("i", "idle_timeout");
        shortToLong.put("T", "request_timeout");

        // Tools
        shortToLong.put("P", "tool_providers");
        shortToLong.put("d", "database_service_url");
        shortToLong.put("f", "file_root");

        return shortToLong;
    }

    /**
     * Parses command line arguments into a key-value map.
     * Supports both short form (-p) and long form (--port) arguments.
     * Handles both key=value and key value formats for both forms.
     * Converts keys to uppercase for consistent lookup.
     *
     * @param args Command line arguments array
     * @return Map of uppercase keys to values
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> argsMap = new HashMap<>();
        Map<String, String> shortToLong = getShortFormMapping();

        for (int i = 0; i < args.length; i++) {
            String currArg = args[i];
            String argKey = null;
            String argValue;

            if (currArg.startsWith("--")) {
                String argWithoutPrefix = currArg.substring(2);

                if (argWithoutPrefix.contains("=")) {
                    String[] argParts = argWithoutPrefix.split("=", 2);
                    argKey = argParts[0];
                    argValue = argParts[1];
                } else {
                    argKey = argWithoutPrefix;
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        argValue = args[i + 1];
                        i++;
                    } else {
                        argValue = "true"; // Flag without value
                    }
                }
            } else if (currArg.startsWith("-") && currArg.length() > 1) {
                String shortArg = currArg.substring(1);

                if (shortArg.contains("=")) {
                    String[] argParts = shortArg.split("=", 2);
                    argKey = shortToLong.get(argParts[0]);
                    argValue = argParts[1];
                } else {
                    argKey = shortToLong.get(shortArg);
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        argValue = args[i + 1];
                        i++;
                    } else {
                        argValue = "true";
                    }
                }
            } else {
                continue;
            }

            if (argKey != null) {
                argsMap.put(argKey.toUpperCase(Locale.ROOT), argValue);
            }
        }

        return argsMap;
    }

    /**
     * Checks for help and version arguments and handles them.
     *
     * @param args Command line arguments
     * @return true if help or version was displayed (caller should exit), false otherwise
     */
    public static boolean handleHelpAndVersion(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                displayHelp();
                return true;
            }
            if ("--version".equals(arg) || "-v".equals(arg)) {
                displayVersion();
                return true;
            }
        }
        return false;
    }

    static void displayHelp() {
        System.out.println(SERVER_NAME + " v" + SERVER_VERSION);
        System.out.println("Usage: java -jar mcpgate-" + SERVER_VERSION + ".jar [OPTIONS]");
        System.out.println();
        System.out.println("ARGUMENT FORMATS:");
        System.out.println("  -k=value  or  --key=value     (no spaces around =)");
        System.out.println("  -k value  or  --key value     (space-separated)");
        System.out.println("  -k        or  --key           (flags, defaults to true)");
        System.out.println();
        System.out.println("OPTIONS:");
        System.out.println("  -h, --help                          Show this help message and exit");
        System.out.println("  -v, --version                       Show version information and exit");
        System.out.println("  -c, --config_file=<path>            Load KEY=VALUE configuration from file");
        System.out.println("  -b, --host=<address>                Bind address (default: 0.0.0.0)");
        System.out.println("  -p, --port=<port>                   Listen port (default: 3001)");
        System.out.println("  -k, --ssl_cert=<path>               PEM certificate chain (enables TLS)");
        System.out.println("  -K, --ssl_key=<path>                PEM PKCS#8 private key");
        System.out.println("      --ssl_client_auth=<mode>        none, want or need (default: none)");
        System.out.println();
        System.out.println("SECURITY:");
        System.out.println("  -a, --auth_enabled=<true|false>     Require a token (default: true)");
        System.out.println("  -t, --auth_token=<token>            Shared secret (or MCP_AUTH_TOKEN)");
        System.out.println("  -A, --allowed_ips=<list>            Comma separated IPs or CIDR blocks");
        System.out.println("      --max_failed_attempts=<num>     Failed logins before lockout (default: 5)");
        System.out.println("      --ban_duration=<sec>            Lockout length, 0 = permanent (default: 0)");
        System.out.println();
        System.out.println("LIMITS:");
        System.out.println("  -r, --rate_limit_requests=<num>     Requests per window per IP (default: 100)");
        System.out.println("  -w, --rate_limit_window=<sec>       Window length (default: 60)");
        System.out.println("  -C, --max_connections=<num>         Concurrent connections (default: 50)");
        System.out.println("  -i, --idle_timeout=<sec>            Read idle timeout (default: 600)");
        System.out.println("  -T, --request_timeout=<sec>         Tool execution timeout (default: 300)");
        System.out.println("      --session_max_age=<hours>       Idle session expiry (default: 24)");
        System.out.println();
        System.out.println("TOOLS:");
        System.out.println("  -P, --tool_providers=<list>         admin,files,database,redis (default: admin,files)");
        System.out.println("  -d, --database_service_url=<url>    database_ws URL (default: http://localhost:8000)");
        System.out.println("  -f, --file_root=<path>              Sandbox for file tools (default: working dir)");
        System.out.println();
        System.out.println("Every option can also be set as environment variable MCP_<KEY> or");
        System.out.println("system property mcp.<key> (e.g. MCP_PORT, -Dmcp.rate.limit.requests=10).");
    }

    static void displayVersion() {
        System.out.println(SERVER_NAME + " v" + SERVER_VERSION);
        System.out.println(SERVER_DESCRIPTION);
        System.out.println("MCP Protocol Version: " + RequestDispatcher.DEFAULT_PROTOCOL_VERSION);
        System.out.println("Java Version: " + System.getProperty("java.version"));
        System.out.println("Java Vendor: " + System.getProperty("java.vendor"));
        System.out.println("\nFeatures:");
        System.out.println(" - Model Context Protocol (MCP) over line-delimited JSON-RPC");
        System.out.println(" - Plain TCP or TLS transport");
        System.out.println(" - Token authentication with failed-attempt lockout");
        System.out.println(" - Sliding window rate limiting and IP allow-lists");
        System.out.println(" - Pluggable tool providers");
    }

    /**
     * Loads configuration from command line arguments, config file, environment variables and system properties.
     * Uses priority order: CLI args (--port) > config file > environment variables (MCP_PORT) >
     * system properties (-Dmcp.port=) > hard coded defaults.
     *
     * @param args Command line arguments
     * @return Validated ConfigParams instance
     * @throws IOException if the config file cannot be read
     * @throws IllegalArgumentException if a value cannot be parsed or fails validation
     */
    public static ConfigParams loadConfiguration(String[] args) throws IOException {
        Map<String, String> cliArgs = parseArgs(args);

        Map<String, String> fileConfig = null;
        String configFile = getConfigValue("CONFIG_FILE", null, cliArgs, null);
        if (configFile != null) {
            try {
                fileConfig = loadConfigFile(configFile);
                logger.info("Configuration file loaded: {}", configFile);
            } catch (IOException e) {
                logger.error("Failed to load configuration file: {}", configFile, e);
                throw new IOException("Failed to load configuration file: " + configFile, e);
            }
        }

        String host = getConfigValue("HOST", "0.0.0.0", cliArgs, fileConfig);
        String port = getConfigValue("PORT", "3001", cliArgs, fileConfig);
        String sslCert = getConfigValue("SSL_CERT", null, cliArgs, fileConfig);
        String sslKey = getConfigValue("SSL_KEY", null, cliArgs, fileConfig);
        String sslClientAuth = getConfigValue("SSL_CLIENT_AUTH", "none", cliArgs, fileConfig);
        String authEnabled = getConfigValue("AUTH_ENABLED", "true", cliArgs, fileConfig);
        String authToken = getConfigValue("AUTH_TOKEN", null, cliArgs, fileConfig);
        String rateLimitRequests = getConfigValue("RATE_LIMIT_REQUESTS", "100", cliArgs, fileConfig);
        String rateLimitWindow = getConfigValue("RATE_LIMIT_WINDOW", "60", cliArgs, fileConfig);
        String maxConnections = getConfigValue("MAX_CONNECTIONS", "50", cliArgs, fileConfig);
        String idleTimeout = getConfigValue("IDLE_TIMEOUT", "600", cliArgs, fileConfig);
        String requestTimeout = getConfigValue("REQUEST_TIMEOUT", "300", cliArgs, fileConfig);
        String allowedIps = getConfigValue("ALLOWED_IPS", "", cliArgs, fileConfig);
        String maxFailedAttempts = getConfigValue("MAX_FAILED_ATTEMPTS", "5", cliArgs, fileConfig);
        String banDuration = getConfigValue("BAN_DURATION", "0", cliArgs, fileConfig);
        String sessionMaxAge = getConfigValue("SESSION_MAX_AGE", "24", cliArgs, fileConfig);
        String sessionCleanupInterval = getConfigValue("SESSION_CLEANUP_INTERVAL", "300", cliArgs, fileConfig);
        String maxLineBytes = getConfigValue("MAX_LINE_BYTES", "1048576", cliArgs, fileConfig);
        String serverName = getConfigValue("SERVER_NAME", SERVER_NAME, cliArgs, fileConfig);
        String toolProviders = getConfigValue("TOOL_PROVIDERS", "admin,files", cliArgs, fileConfig);
        String databaseServiceUrl = getConfigValue("DATABASE_SERVICE_URL", "http://localhost:8000", cliArgs, fileConfig);
        String databaseServiceTimeout = getConfigValue("DATABASE_SERVICE_TIMEOUT", "30", cliArgs, fileConfig);
        String fileRoot = getConfigValue("FILE_ROOT", null, cliArgs, fileConfig);
        String maxFileSize = getConfigValue("MAX_FILE_SIZE", "1048576", cliArgs, fileConfig);

        try {
            return new ConfigParams(host,
                    parseIntegerConfig("PORT", port),
                    sslCert, sslKey, sslClientAuth,
                    parseBooleanConfig("AUTH_ENABLED", authEnabled),
                    authToken,
                    parseIntegerConfig("RATE_LIMIT_REQUESTS", rateLimitRequests),
                    parseIntegerConfig("RATE_LIMIT_WINDOW", rateLimitWindow),
                    parseIntegerConfig("MAX_CONNECTIONS", maxConnections),
                    parseIntegerConfig("IDLE_TIMEOUT", idleTimeout),
                    parseIntegerConfig("REQUEST_TIMEOUT", requestTimeout),
                    new LinkedHashSet<>(parseListConfig(allowedIps)),
                    parseIntegerConfig("MAX_FAILED_ATTEMPTS", maxFailedAttempts),
                    parseIntegerConfig("BAN_DURATION", banDuration),
                    parseIntegerConfig("SESSION_MAX_AGE", sessionMaxAge),
                    parseIntegerConfig("SESSION_CLEANUP_INTERVAL", sessionCleanupInterval),
                    parseIntegerConfig("MAX_LINE_BYTES", maxLineBytes),
                    serverName,
                    parseListConfig(toolProviders.toLowerCase(Locale.ROOT)),
                    databaseServiceUrl,
                    parseIntegerConfig("DATABASE_SERVICE_TIMEOUT", databaseServiceTimeout),
                    fileRoot == null ? null : Path.of(fileRoot),
                    parseIntegerConfig("MAX_FILE_SIZE", maxFileSize));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.validation.failed", "configuration parameters", e.getMessage()), e);
        }
    }

    /**
     * Gets a configuration value using the priority order:
     * CLI args > config file > env vars > system properties > default.
     *
     * @param varName Config parameter name (uppercase, without the MCP_ prefix)
     * @param defaultValue Default value if not found in any source
     * @param cliArgs Parsed command line arguments
     * @param fileConfig Configuration from file (can be null if no config file)
     * @return The configuration value from the highest priority source
     */
    static String getConfigValue(String varName, String defaultValue, Map<String, String> cliArgs, Map<String, String> fileConfig) {
        String cliValue = cliArgs.get(varName);
        if (cliValue != null) {
            return cliValue;
        }

        if (fileConfig != null) {
            String fileValue = fileConfig.get(varName);
            if (fileValue == null) {
                fileValue = fileConfig.get(ENV_PREFIX + varName);
            }
            if (fileValue != null) {
                return fileValue;
            }
        }

        String envValue = System.getenv(ENV_PREFIX + varName);
        if (envValue != null) {
            return envValue;
        }

        String propValue = System.getProperty(PROPERTY_PREFIX + varName.toLowerCase(Locale.ROOT).replace('_', '.'));
        if (propValue != null) {
            return propValue;
        }

        return defaultValue;
    }

    /**
     * Loads configuration parameters from a file.
     * Each line should be in KEY=VALUE format. Lines starting with # are treated as comments.
     * Empty lines are ignored.
     *
     * @param configFilePath Path to the configuration file
     * @return Map of configuration key-value pairs
     * @throws IOException if the file cannot be read
     */
    public static Map<String, String> loadConfigFile(String configFilePath) throws IOException {
        Map<String, String> configMap = new HashMap<>();

        try (BufferedReader bufferedReader = Files.newBufferedReader(Path.of(configFilePath), StandardCharsets.UTF_8)) {
            String currLine;
            int lineNumber = 0;

            while ((currLine = bufferedReader.readLine()) != null) {
                lineNumber++;
                currLine = currLine.trim();

                if (currLine.isEmpty() || currLine.startsWith("#")) {
                    continue;
                }

                String[] lineParts = currLine.split("=", 2);
                if (lineParts.length != 2) {
                    logger.warn("Invalid config line {} in file {}: {}", lineNumber, configFilePath, currLine);
                    continue;
                }

                String paramKey = lineParts[0].trim().toUpperCase(Locale.ROOT);
                String paramValue = lineParts[1].trim();

                if (paramKey.isEmpty()) {
                    logger.warn("Key cannot be empty. Invalid config on line {} in file {}", lineNumber, configFilePath);
                    continue;
                }

                if (paramValue.length() >= 2 && ((paramValue.startsWith("\"") && paramValue.endsWith("\""))
                        || (paramValue.startsWith("'") && paramValue.endsWith("'")))) {
                    paramValue = paramValue.substring(1, paramValue.length() - 1);
                }

                configMap.put(paramKey, paramValue);
                logger.debug("Loaded config: {} = {}", paramKey, paramKey.contains("TOKEN") ? "***" : paramValue);
            }
        }

        logger.info("Loaded {} configuration parameters from file: {}", configMap.size(), configFilePath);
        return configMap;
    }

    /**
     * Splits a comma separated value, dropping blanks.
     */
    static List<String> parseListConfig(String value) {
        List<String> values = new ArrayList<>();
        if (value == null) {
            return values;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    private static int parseIntegerConfig(String paramName, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.parse.integer.failed", paramName, value), e);
        }
    }

    private static boolean parseBooleanConfig(String paramName, String value) {
        if (value == null) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.parse.boolean.failed", paramName, "null"));
        }

        String lowerValue = value.toLowerCase(Locale.ROOT).trim();
        if ("true".equals(lowerValue) || "false".equals(lowerValue)) {
            return Boolean.parseBoolean(lowerValue);
        }
        throw new IllegalArgumentException(
                ResourceManager.getErrorMessage("config.parse.boolean.failed", paramName, value));
    }
}
