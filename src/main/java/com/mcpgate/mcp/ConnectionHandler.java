package com.mcpgate.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mcpgate.mcp.config.ResourceManager;
import com.mcpgate.mcp.security.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.*;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Semaphore;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Serves one client connection on its own thread.
 * <p>
 * Admission runs before anything is read: block list, allow-list, then a connection slot.
 * A refused connection is closed with no session and no response. Admitted connections then
 * read one JSON-RPC request per line, apply the rate limit and (when enabled) token
 * authentication per request, and answer strictly in arrival order.
 */
public class ConnectionHandler implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);
    private static final Logger securityLogger = LoggerFactory.getLogger("SECURITY." + ConnectionHandler.class.getName());
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    static final String MDC_CLIENT_IP = "clientIp";
    static final String MDC_CLIENT_ID = "clientId";

    public enum ConnectionState {
        NEW, ADMITTED, AUTHENTICATING, SERVING, CLOSING
    }

    private final Socket clientSocket;
    private final ServerContext serverContext;
    private final RequestDispatcher requestDispatcher;
    private final Semaphore connectionSlots;
    private final BooleanSupplier serverRunning;
    private final Consumer<ConnectionHandler> onClose;
    private final String clientIp;

    private volatile ConnectionState connectionState = ConnectionState.NEW;
    private volatile ClientSession clientSession;

    public ConnectionHandler(Socket clientSocket, ServerContext serverContext, RequestDispatcher requestDispatcher,
                             Semaphore connectionSlots, BooleanSupplier serverRunning,
                             Consumer<ConnectionHandler> onClose) {
        this.clientSocket = clientSocket;
        this.serverContext = serverContext;
        this.requestDispatcher = requestDispatcher;
        this.connectionSlots = connectionSlots;
        this.serverRunning = serverRunning;
        this.onClose = onClose;
        this.clientIp = clientSocket.getInetAddress().getHostAddress();
    }

    @Override
    public void run() {
        MDC.put(MDC_CLIENT_IP, clientIp);
        boolean slotAcquired = false;
        boolean connectionCounted = false;
        try {
            if (serverContext.ipFilter().isBlocked(clientIp)) {
                logSecurityEvent("BLOCKED_IP_REJECTED", "Connection from locked out IP " + clientIp);
                return;
            }
            if (!serverContext.ipFilter().isAllowed(clientIp)) {
                logSecurityEvent("IP_NOT_ALLOWED", "Connection from " + clientIp + " is not in the allow-list");
                return;
            }
            if (!connectionSlots.tryAcquire()) {
                logger.warn("Connection limit of {} reached, rejecting {}", serverContext.configParams().maxConnections(), clientIp);
                return;
            }
            slotAcquired = true;
            connectionState = ConnectionState.ADMITTED;

            clientSession = serverContext.sessionManager().createSession(clientIp);
            MDC.put(MDC_CLIENT_ID, clientSession.getClientId());
            serverContext.metricsCollector().recordConnectionChange(1);
            connectionCounted = true;
            logger.info("Client connected: {} ({})", clientIp, clientSession.getClientId());

            if (serverContext.authenticator().isAuthEnabled()) {
                connectionState = ConnectionState.AUTHENTICATING;
            } else {
                clientSession.setAuthenticated(true);
                connectionState = ConnectionState.SERVING;
            }

            clientSocket.setSoTimeout(Math.toIntExact(serverContext.configParams().idleTimeout().toMillis()));
            serveRequests();
        } catch (IOException e) {
            if (connectionState == ConnectionState.CLOSING || clientSocket.isClosed()) {
                logger.debug("Connection closed: {}", e.getMessage());
            } else {
                logger.warn("Connection error for {}: {}", clientIp, e.getMessage());
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error serving {}", clientIp, e);
        } finally {
            connectionState = ConnectionState.CLOSING;
            if (clientSession != null) {
                serverContext.sessionManager().removeSession(clientSession.getClientId());
            }
            if (connectionCounted) {
                serverContext.metricsCollector().recordConnectionChange(-1);
            }
            if (slotAcquired) {
                connectionSlots.release();
            }
            closeSocket();
            if (clientSession != null) {
                logger.info("Client disconnected: {} ({}, {} requests)", clientIp, clientSession.getClientId(),
                        clientSession.getRequestCount());
            }
            onClose.accept(this);
            MDC.clear();
        }
    }

    private void serveRequests() throws IOException {
        LineReader lineReader = new LineReader(clientSocket.getInputStream(), serverContext.configParams().maxLineBytes());
        Writer responseWriter = new BufferedWriter(new OutputStreamWriter(clientSocket.getOutputStream(), StandardCharsets.UTF_8));

        while (connectionState != ConnectionState.CLOSING && !clientSocket.isClosed()) {
            String requestLine;
            try {
                requestLine = lineReader.readLine();
            } catch (SocketTimeoutException e) {
                if (clientSocket.isClosed() || clientSocket.isInputShutdown() || !serverRunning.getAsBoolean()) {
                    break;
                }
                logger.debug("No data from {} for {}s, still waiting", clientIp, serverContext.configParams().idleTimeoutSeconds());
                continue;
            } catch (LineReader.LineTooLongException e) {
                logger.warn("Discarded oversized request line from {}", clientIp);
                writeResponse(responseWriter, JsonRpc.createErrorResponse(JsonRpc.INVALID_REQUEST,
                        ResourceManager.getErrorMessage("protocol.invalid.request",
                                ResourceManager.getErrorMessage("protocol.line.too.long",
                                        String.valueOf(serverContext.configParams().maxLineBytes()))), null));
                continue;
            }

            if (requestLine == null) {
                logger.debug("Client {} closed the connection", clientIp);
                break;
            }
            if (requestLine.isBlank()) {
                continue;
            }

            JsonNode responseNode = processLine(requestLine);
            if (responseNode != null) {
                writeResponse(responseWriter, responseNode);
            }
        }
    }

    /**
     * Runs one request line through parsing, the rate limit, authentication and dispatch.
     *
     * @return the response to write, or null when nothing is sent
     */
    JsonNode processLine(String requestLine) {
        logger.debug("Request: {}", requestLine);
        JsonNode requestNode;
        try {
            requestNode = objectMapper.readTree(requestLine);
        } catch (JsonProcessingException e) {
            logger.warn("Malformed JSON from {}: {}", clientIp, e.getOriginalMessage());
            return JsonRpc.createErrorResponse(JsonRpc.PARSE_ERROR,
                    ResourceManager.getErrorMessage("protocol.parse.error", e.getOriginalMessage()), null);
        }

        boolean isNotification = JsonRpc.isNotification(requestNode);
        JsonNode requestId = requestNode.isObject() ? requestNode.get("id") : null;

        try {
            if (!serverContext.rateLimiter().isAllowed(clientIp)) {
                logSecurityEvent("RATE_LIMIT_EXCEEDED", "Client " + clientIp + " exceeded "
                        + serverContext.rateLimiter().getMaxRequests() + " requests per "
                        + serverContext.rateLimiter().getWindow().toSeconds() + "s");
                return isNotification ? null : rateLimitedResponse(requestId);
            }

            if (connectionState == ConnectionState.AUTHENTICATING && requestNode.isObject()) {
                JsonNode authFailure = authenticate(requestNode, isNotification, requestId);
                if (connectionState != ConnectionState.SERVING) {
                    return authFailure;
                }
            }

            serverContext.sessionManager().updateSession(clientSession.getClientId());
            JsonNode responseNode = requestDispatcher.handleRequest(requestNode, clientSession);
            if (responseNode != null) {
                logger.debug("Response: {}", responseNode);
            }
            return responseNode;
        } catch (RuntimeException e) {
            logger.error("Unhandled error processing request from {}", clientIp, e);
            if (isNotification) {
                return null;
            }
            return JsonRpc.createErrorResponse(JsonRpc.INTERNAL_ERROR,
                    ResourceManager.getErrorMessage("protocol.internal.error", String.valueOf(e.getMessage())), requestId);
        }
    }

    /**
     * Checks the token carried by a request while the connection is unauthenticated.
     * On success the connection moves to SERVING; on failure the attempt is counted against the IP
     * and the connection is closed once the IP is locked out.
     *
     * @return the error response for a failed attempt, null when nothing should be sent
     */
    private JsonNode authenticate(JsonNode requestNode, boolean isNotification, JsonNode requestId) {
        String presentedToken = extractAuthToken(requestNode);
        if (presentedToken != null && serverContext.authenticator().verifyToken(presentedToken)) {
            clientSession.setAuthenticated(true);
            connectionState = ConnectionState.SERVING;
            logger.info("Client {} authenticated", clientSession.getClientId());
            return null;
        }

        if (isNotification && presentedToken == null) {
            logger.debug("Dropping unauthenticated notification from {}", clientIp);
            return null;
        }

        boolean lockedOut = serverContext.ipFilter().recordFailedAttempt(clientIp);
        logSecurityEvent("AUTH_FAILED", "Client " + clientIp + " presented " + (presentedToken == null ? "no" : "an invalid")
                + " token (" + serverContext.ipFilter().getFailedAttempts(clientIp) + " failed attempts)");
        if (lockedOut) {
            logSecurityEvent("IP_LOCKED_OUT", "Closing connection from " + clientIp);
            connectionState = ConnectionState.CLOSING;
        }
        if (isNotification) {
            return null;
        }
        String messageKey = presentedToken == null ? "auth.required" : "auth.invalid";
        return JsonRpc.createErrorResponse(JsonRpc.AUTHENTICATION_FAILED, ResourceManager.getErrorMessage(messageKey), requestId);
    }

    /**
     * The token may be sent as {@code params.authToken} or as a top-level {@code auth_token} member.
     */
    static String extractAuthToken(JsonNode requestNode) {
        JsonNode tokenNode = requestNode.path("params").path("authToken");
        if (!tokenNode.isTextual()) {
            tokenNode = requestNode.path("auth_token");
        }
        return tokenNode.isTextual() ? tokenNode.asText() : null;
    }

    private JsonNode rateLimitedResponse(JsonNode requestId) {
        ObjectNode errorData = objectMapper.createObjectNode();
        errorData.put("remaining", serverContext.rateLimiter().getRemainingRequests(clientIp));
        long retryAfterMillis = serverContext.rateLimiter().getRetryAfter(clientIp).toMillis();
        errorData.put("retryAfterSeconds", (retryAfterMillis + 999) / 1000);
        return JsonRpc.createErrorResponse(JsonRpc.RATE_LIMIT_EXCEEDED,
                ResourceManager.getErrorMessage("protocol.rate.limited"), errorData, requestId);
    }

    private void writeResponse(Writer responseWriter, JsonNode responseNode) throws IOException {
        responseWriter.write(objectMapper.writeValueAsString(responseNode));
        responseWriter.write('\n');
        responseWriter.flush();
    }

    /**
     * Closes the socket from another thread, ending the read loop.
     */
    public void close() {
        connectionState = ConnectionState.CLOSING;
        closeSocket();
    }

    private void closeSocket() {
        try {
            clientSocket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket for {}: {}", clientIp, e.getMessage());
        }
    }

    private void logSecurityEvent(String securityEvent, String eventDetails) {
        securityLogger.warn("SECURITY_EVENT: {} - {}", securityEvent, eventDetails);
    }

    public ConnectionState getConnectionState() {
        return connectionState;
    }

    public ClientSession getClientSession() {
        return clientSession;
    }

    public String getClientIp() {
        return clientIp;
    }
}
