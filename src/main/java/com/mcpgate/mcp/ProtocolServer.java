package com.mcpgate.mcp;

import com.mcpgate.mcp.config.CliUtils;
import com.mcpgate.mcp.config.ConfigParams;
import com.mcpgate.mcp.config.ResourceManager;
import com.mcpgate.mcp.db.DatabaseServiceClient;
import com.mcpgate.mcp.db.DatabaseTools;
import com.mcpgate.mcp.db.RedisTools;
import com.mcpgate.mcp.metrics.MetricsCollector;
import com.mcpgate.mcp.security.Authenticator;
import com.mcpgate.mcp.security.BanPolicy;
import com.mcpgate.mcp.security.IpFilter;
import com.mcpgate.mcp.security.RateLimiter;
import com.mcpgate.mcp.security.SessionManager;
import com.mcpgate.mcp.security.TlsContextFactory;
import com.mcpgate.mcp.tools.AdminTools;
import com.mcpgate.mcp.tools.FileTools;
import com.mcpgate.mcp.tools.ToolProvider;
import com.mcpgate.mcp.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLServerSocket;
import java.io.IOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MCP server speaking newline-delimited JSON-RPC 2.0 over TCP, optionally wrapped in TLS.
 * <p>
 * One accept thread hands each socket to a {@link ConnectionHandler} running on its own thread.
 * Tool calls run on a separate pool so a slow tool can be abandoned at the request timeout.
 * A background sweep removes sessions that have been idle longer than the configured maximum age
 * and prunes idle rate limit and failed-attempt entries.
 */
public class ProtocolServer {
    private static final Logger logger = LoggerFactory.getLogger(ProtocolServer.class);

    private final ServerContext serverContext;
    private final RequestDispatcher requestDispatcher;
    private final Semaphore connectionSlots;
    private final Set<ConnectionHandler> activeHandlers = ConcurrentHashMap.newKeySet();
    private final ExecutorService connectionExecutor;
    private final ScheduledExecutorService sessionSweeper;

    private volatile boolean running;
    private volatile ServerSocket serverSocket;
    private Thread acceptThread;

    public ProtocolServer(ConfigParams configParams) {
        this(configParams, List.of());
    }

    /**
     * Creates a server with the configured tool providers plus any extra ones supplied by the caller.
     *
     * @param configParams validated configuration
     * @param additionalProviders providers registered after the configured ones
     */
    public ProtocolServer(ConfigParams configParams, List<? extends ToolProvider> additionalProviders) {
        MetricsCollector metricsCollector = new MetricsCollector();
        SessionManager sessionManager = new SessionManager();
        ToolRegistry toolRegistry = createToolRegistry(configParams, metricsCollector, sessionManager);
        for (ToolProvider toolProvider : additionalProviders) {
            toolRegistry.register(toolProvider);
        }

        this.serverContext = new ServerContext(
                configParams,
                new RateLimiter(configParams.rateLimitRequests(), configParams.rateLimitWindow()),
                new IpFilter(configParams.allowedIps(), configParams.maxFailedAttempts(),
                        BanPolicy.fromDuration(configParams.banDuration())),
                new Authenticator(configParams.authEnabled(), configParams.authToken()),
                sessionManager,
                metricsCollector,
                toolRegistry,
                Executors.newCachedThreadPool(namedThreadFactory("mcp-tool", true)));
        this.requestDispatcher = new RequestDispatcher(serverContext);
        this.connectionSlots = new Semaphore(configParams.maxConnections());
        this.connectionExecutor = Executors.newCachedThreadPool(namedThreadFactory("mcp-conn", false));
        this.sessionSweeper = Executors.newSingleThreadScheduledExecutor(namedThreadFactory("mcp-session-sweep", true));
    }

    /**
     * Builds the registry for the providers named in the configuration.
     * The database and redis providers share one HTTP client for the database service.
     */
    static ToolRegistry createToolRegistry(ConfigParams configParams, MetricsCollector metricsCollector,
                                           SessionManager sessionManager) {
        List<ToolProvider> toolProviders = new ArrayList<>();
        DatabaseServiceClient serviceClient = null;
        for (String providerName : configParams.toolProviders()) {
            switch (providerName) {
                case "admin" -> toolProviders.add(new AdminTools(metricsCollector, sessionManager, configParams.maxConnections()));
                case "files" -> toolProviders.add(new FileTools(configParams.fileRoot(), configParams.maxFileSize()));
                case "database", "redis" -> {
                    if (serviceClient == null) {
                        serviceClient = new DatabaseServiceClient(configParams.databaseServiceUrl(),
                                Duration.ofSeconds(configParams.databaseServiceTimeoutSeconds()));
                    }
                    toolProviders.add("database".equals(providerName)
                            ? new DatabaseTools(serviceClient) : new RedisTools(serviceClient));
                }
                default -> throw new IllegalArgumentException(
                        ResourceManager.getErrorMessage("config.tool.provider.unknown", providerName));
            }
        }
        return new ToolRegistry(toolProviders);
    }

    /**
     * Binds the listening socket and starts accepting connections.
     * Returns once the socket is bound; {@link #getPort()} then reports the actual port.
     *
     * @throws IOException if the address cannot be bound or a TLS file cannot be read
     * @throws GeneralSecurityException if the TLS certificate or key is invalid
     */
    public synchronized void start() throws IOException, GeneralSecurityException {
        if (running) {
            throw new IllegalStateException("Server already started");
        }
        ConfigParams configParams = serverContext.configParams();
        logger.info("Starting {} with {}", configParams.serverName(), configParams);

        ServerSocket listener;
        if (configParams.isTlsEnabled()) {
            SSLContext sslContext = TlsContextFactory.createServerContext(Path.of(configParams.sslCert()), Path.of(configParams.sslKey()));
            SSLServerSocket sslServerSocket = (SSLServerSocket) sslContext.getServerSocketFactory().createServerSocket();
            TlsContextFactory.applyClientAuth(sslServerSocket, configParams.sslClientAuth());
            listener = sslServerSocket;
        } else {
            listener = new ServerSocket();
        }

        try {
            listener.setReuseAddress(true);
            listener.bind(new InetSocketAddress(configParams.host(), configParams.port()));
        } catch (BindException e) {
            closeQuietly(listener);
            throw new IOException(ResourceManager.getErrorMessage("startup.port.inuse", String.valueOf(configParams.port())), e);
        } catch (IOException e) {
            closeQuietly(listener);
            throw new IOException(ResourceManager.getErrorMessage("startup.bind.failed",
                    configParams.host(), String.valueOf(configParams.port()), e.getMessage()), e);
        }

        serverSocket = listener;
        running = true;

        long sweepInterval = configParams.sessionCleanupIntervalSeconds();
        sessionSweeper.scheduleAtFixedRate(this::sweepSessions, sweepInterval, sweepInterval, TimeUnit.SECONDS);

        acceptThread = new Thread(this::acceptConnections, "mcp-accept");
        acceptThread.start();

        logger.info("{} listening on {}:{} ({}, auth {}, {} tools)", configParams.serverName(), configParams.host(),
                getPort(), configParams.isTlsEnabled() ? "TLS" : "plain TCP",
                configParams.authEnabled() ? "enabled" : "disabled", serverContext.toolRegistry().size());
    }

    private void acceptConnections() {
        while (running) {
            Socket clientSocket;
            try {
                clientSocket = serverSocket.accept();
            } catch (SocketException e) {
                if (running) {
                    logger.error("Listening socket failed: {}", e.getMessage());
                }
                break;
            } catch (IOException e) {
                if (running) {
                    logger.warn("Failed to accept connection: {}", e.getMessage());
                }
                continue;
            }

            ConnectionHandler connectionHandler = new ConnectionHandler(clientSocket, serverContext, requestDispatcher,
                    connectionSlots, () -> running, activeHandlers::remove);
            activeHandlers.add(connectionHandler);
            try {
                connectionExecutor.execute(connectionHandler);
            } catch (RejectedExecutionException e) {
                logger.debug("Server stopping, dropping connection from {}", connectionHandler.getClientIp());
                activeHandlers.remove(connectionHandler);
                closeQuietly(clientSocket);
            }
        }
        logger.debug("Accept loop finished");
    }

    private void sweepSessions() {
        try {
            int removed = serverContext.sessionManager().cleanupExpiredSessions(serverContext.configParams().sessionMaxAge());
            if (removed > 0) {
                logger.info("Removed {} expired sessions", removed);
            }
            int idleClients = serverContext.rateLimiter().pruneExpired();
            int staleIps = serverContext.ipFilter().pruneStale(serverContext.configParams().sessionMaxAge());
            logger.debug("Pruned {} idle rate limit keys and {} stale failed-attempt entries", idleClients, staleIps);
        } catch (RuntimeException e) {
            logger.warn("Session sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Stops accepting new connections and lets connected clients finish.
     * Returns immediately; open connections end when their clients disconnect or go idle.
     */
    public void stop() {
        if (!stopAccepting()) {
            return;
        }
        Thread drainThread = new Thread(() -> {
            try {
                while (!connectionExecutor.awaitTermination(1, TimeUnit.MINUTES)) {
                    logger.debug("Waiting for {} connections to finish", activeHandlers.size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            serverContext.toolExecutor().shutdown();
            logger.info("All connections closed");
        }, "mcp-drain");
        drainThread.setDaemon(true);
        drainThread.start();
    }

    /**
     * Stops accepting, waits up to {@code gracePeriod} for connections to end, then closes the rest.
     */
    public void stop(Duration gracePeriod) {
        stopAccepting();
        try {
            if (!connectionExecutor.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.info("Closing {} remaining connections", activeHandlers.size());
                for (ConnectionHandler connectionHandler : activeHandlers) {
                    connectionHandler.close();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        connectionExecutor.shutdownNow();
        serverContext.toolExecutor().shutdownNow();
        logger.info("Server stopped");
    }

    /**
     * @return false if the server was not running
     */
    private synchronized boolean stopAccepting() {
        if (!running) {
            return false;
        }
        running = false;
        logger.info("Stopping {}...", serverContext.configParams().serverName());
        closeQuietly(serverSocket);
        sessionSweeper.shutdownNow();
        connectionExecutor.shutdown();
        return true;
    }

    public int getPort() {
        ServerSocket listener = serverSocket;
        return listener == null ? -1 : listener.getLocalPort();
    }

    public boolean isRunning() {
        return running;
    }

    public ServerContext getServerContext() {
        return serverContext;
    }

    int getActiveConnectionCount() {
        return activeHandlers.size();
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            logger.debug("Error closing {}: {}", closeable, e.getMessage());
        }
    }

    private static ThreadFactory namedThreadFactory(String prefix, boolean daemon) {
        AtomicInteger threadCounter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }

    public static void main(String[] args) {
        // Handle help and version arguments first
        if (CliUtils.handleHelpAndVersion(args)) {
            System.exit(0);
        }

        ConfigParams configParams;
        try {
            configParams = CliUtils.loadConfiguration(args);
        } catch (IOException | IllegalArgumentException e) {
            logger.error(ResourceManager.getErrorMessage("startup.config.error", e.getMessage()));
            System.exit(2);
            return;
        }

        ProtocolServer protocolServer = new ProtocolServer(configParams);
        try {
            protocolServer.start();
        } catch (IOException e) {
            logger.error(ResourceManager.getErrorMessage("startup.generic.error", e.getMessage()));
            System.exit(1);
            return;
        } catch (GeneralSecurityException e) {
            logger.error(ResourceManager.getErrorMessage("startup.config.error", e.getMessage()));
            System.exit(2);
            return;
        } catch (Exception e) {
            logger.error(ResourceManager.getErrorMessage("startup.unexpected.error", e.getMessage()), e);
            System.exit(3);
            return;
        }

        // Add shutdown hook for clean resource cleanup
        Runtime.getRuntime().addShutdownHook(new Thread(() -> protocolServer.stop(Duration.ofSeconds(10)), "mcp-shutdown"));
        logger.info("Press Ctrl+C to stop the server");
    }
}
