package com.mcpgate.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mcpgate.mcp.config.ConfigParams;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManagerFactory;
import java.io.*;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.KeyStore;
import java.security.cert.CertificateFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Starts real servers on ephemeral ports and talks to them over sockets.
 */
class ProtocolServerIntegrationTest {
    private final List<ProtocolServer> startedServers = new ArrayList<>();
    private final List<McpTestClient> openClients = new ArrayList<>();

    @AfterEach
    void tearDown() {
        openClients.forEach(McpTestClient::close);
        startedServers.forEach(server -> server.stop(Duration.ofMillis(500)));
    }

    private ProtocolServer startServer(ConfigParams configParams) throws Exception {
        ProtocolServer protocolServer = new ProtocolServer(configParams);
        protocolServer.start();
        startedServers.add(protocolServer);
        return protocolServer;
    }

    private McpTestClient connect(ProtocolServer protocolServer) throws IOException {
        McpTestClient client = new McpTestClient(new Socket("127.0.0.1", protocolServer.getPort()));
        openClients.add(client);
        return client;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    /**
     * Line oriented JSON-RPC client over a plain or TLS socket.
     */
    static class McpTestClient implements Closeable {
        private final Socket socket;
        private final BufferedReader reader;
        private final Writer writer;

        McpTestClient(Socket socket) throws IOException {
            this.socket = socket;
            socket.setSoTimeout(5000);
            this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            this.writer = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
        }

        void sendLine(String line) throws IOException {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        }

        JsonNode call(JsonNode request) throws IOException {
            sendLine(request.toString());
            return readResponse();
        }

        JsonNode readResponse() throws IOException {
            String line = reader.readLine();
            assertNotNull(line, "server closed the connection");
            return TestUtils.MAPPER.readTree(line);
        }

        /**
         * @return true once the server has closed the connection (EOF or reset)
         */
        boolean isClosedByServer() {
            try {
                return reader.readLine() == null;
            } catch (SocketTimeoutException e) {
                return false;
            } catch (IOException e) {
                return true;
            }
        }

        @Override
        public void close() {
            try {
                socket.close();
            } catch (IOException e) {
                // already closed
            }
        }
    }

    @Test
    @Timeout(20)
    @DisplayName("initialize, tools/list and an echo call over one connection")
    void testBasicSession() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig());
        McpTestClient client = connect(protocolServer);

        ObjectNode initialize = TestUtils.request(1, "initialize");
        initialize.putObject("params").put("protocolVersion", "2025-06-18")
                .putObject("clientInfo").put("name", "it-client").put("version", "1");
        JsonNode initResponse = client.call(initialize);
        assertEquals("2025-06-18", initResponse.get("result").get("protocolVersion").asText());
        assertEquals("mcpgate", initResponse.get("result").get("serverInfo").get("name").asText());

        client.sendLine(TestUtils.notification("notifications/initialized").toString());

        JsonNode toolsResponse = client.call(TestUtils.request(2, "tools/list"));
        assertEquals(2, toolsResponse.get("id").asInt());
        assertThat(toolsResponse.get("result").get("tools")).extracting(tool -> tool.get("name").asText())
                .contains("echo", "get_system_info", "get_metrics", "health_check", "list_files", "read_file");

        JsonNode echoResponse = client.call(TestUtils.toolCall(3, "echo", TestUtils.MAPPER.createObjectNode().put("message", "hi")));
        assertThat(TestUtils.resultText(echoResponse)).contains("Message: hi").contains("Client IP: 127.0.0.1");

        assertEquals(1, protocolServer.getServerContext().metricsCollector().getToolMetrics("echo").getCount());
        assertEquals(1, protocolServer.getServerContext().metricsCollector().getActiveConnections());
        assertEquals(1, protocolServer.getServerContext().sessionManager().size());
    }

    @Test
    @Timeout(20)
    void testStringIdsAreEchoed() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig());
        McpTestClient client = connect(protocolServer);

        client.sendLine("{\"jsonrpc\":\"2.0\",\"id\":\"req-7\",\"method\":\"ping\"}");

        assertEquals("req-7", client.readResponse().get("id").asText());
    }

    @Test
    @Timeout(20)
    @DisplayName("Malformed JSON gets a parse error and the connection stays usable")
    void testMalformedJson() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig());
        McpTestClient client = connect(protocolServer);

        client.sendLine("{\"jsonrpc\": \"2.0\", \"id\": 1, \"method\":");
        JsonNode parseError = client.readResponse();
        assertEquals(JsonRpc.PARSE_ERROR, parseError.get("error").get("code").asInt());
        assertTrue(parseError.get("id").isNull());
        assertThat(parseError.get("error").get("message").asText()).startsWith("Parse error");

        client.sendLine("{\"id\":1,\"method\":\"ping\"} trailing");
        assertEquals(JsonRpc.PARSE_ERROR, client.readResponse().get("error").get("code").asInt());

        assertEquals(2, client.call(TestUtils.request(2, "ping")).get("id").asInt());
    }

    @Test
    @Timeout(20)
    void testNotificationsGetNoResponse() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig());
        McpTestClient client = connect(protocolServer);

        client.sendLine(TestUtils.notification("notifications/initialized").toString());
        client.sendLine(TestUtils.notification("no/such/method").toString());
        client.sendLine("");

        // the first line back must answer the ping
        assertEquals(42, client.call(TestUtils.request(42, "ping")).get("id").asInt());
    }

    @Test
    @Timeout(20)
    void testUnknownMethodAndInvalidRequest() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig());
        McpTestClient client = connect(protocolServer);

        assertEquals(JsonRpc.METHOD_NOT_FOUND, client.call(TestUtils.request(1, "bogus")).get("error").get("code").asInt());

        client.sendLine("[1,2,3]");
        assertEquals(JsonRpc.INVALID_REQUEST, client.readResponse().get("error").get("code").asInt());
    }

    @Test
    @Timeout(20)
    @DisplayName("Requests over the per-IP limit are answered with a rate limit error")
    void testRateLimit() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig().withRateLimit(3, 60));
        McpTestClient client = connect(protocolServer);

        for (int i = 1; i <= 3; i++) {
            assertTrue(client.call(TestUtils.request(i, "ping")).has("result"));
        }
        JsonNode limited = client.call(TestUtils.request(4, "ping"));

        JsonNode errorNode = limited.get("error");
        assertEquals(JsonRpc.RATE_LIMIT_EXCEEDED, errorNode.get("code").asInt());
        assertEquals("Rate limit exceeded", errorNode.get("message").asText());
        assertEquals(0, errorNode.get("data").get("remaining").asInt());
        assertThat(errorNode.get("data").get("retryAfterSeconds").asLong()).isBetween(1L, 60L);
        assertEquals(4, limited.get("id").asInt());

        // the limit is per IP, so a second connection is limited too
        McpTestClient second = connect(protocolServer);
        assertEquals(JsonRpc.RATE_LIMIT_EXCEEDED, second.call(TestUtils.request(5, "ping")).get("error").get("code").asInt());
    }

    @Test
    @Timeout(20)
    void testRateLimitedNotificationGetsNoResponse() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig().withRateLimit(1, 60));
        McpTestClient client = connect(protocolServer);

        assertTrue(client.call(TestUtils.request(1, "ping")).has("result"));
        client.sendLine(TestUtils.notification("ping").toString());

        // the next line back belongs to request 2, nothing was written for the notification
        JsonNode limited = client.call(TestUtils.request(2, "ping"));
        assertEquals(2, limited.get("id").asInt());
        assertEquals(JsonRpc.RATE_LIMIT_EXCEEDED, limited.get("error").get("code").asInt());
    }

    @Test
    @Timeout(20)
    @DisplayName("A read timeout on an idle connection does not close it")
    void testIdleTimeoutKeepsConnectionOpen() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig().withLimits(5, 1, 300));
        McpTestClient client = connect(protocolServer);
        assertTrue(client.call(TestUtils.request(1, "ping")).has("result"));

        Thread.sleep(2500);

        assertEquals(2, client.call(TestUtils.request(2, "ping")).get("id").asInt());
        assertEquals(1, protocolServer.getServerContext().sessionManager().size());
    }

    @Test
    @Timeout(20)
    void testAuthentication() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.customConfig("127.0.0.1", 0, true, "s3cret"));
        McpTestClient client = connect(protocolServer);

        JsonNode noToken = client.call(TestUtils.request(1, "tools/list"));
        assertEquals(JsonRpc.AUTHENTICATION_FAILED, noToken.get("error").get("code").asInt());
        assertEquals("Authentication required", noToken.get("error").get("message").asText());

        ObjectNode wrongToken = TestUtils.request(2, "tools/list");
        wrongToken.putObject("params").put("authToken", "nope");
        assertEquals("Invalid authentication token", client.call(wrongToken).get("error").get("message").asText());

        ObjectNode goodToken = TestUtils.request(3, "tools/list");
        goodToken.putObject("params").put("authToken", "s3cret");
        assertTrue(client.call(goodToken).get("result").has("tools"));

        // authenticated for the rest of the connection
        assertTrue(client.call(TestUtils.request(4, "ping")).has("result"));
        assertEquals(2, protocolServer.getServerContext().ipFilter().getFailedAttempts("127.0.0.1"));
    }

    @Test
    @Timeout(20)
    void testTopLevelAuthToken() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.customConfig("127.0.0.1", 0, true, "s3cret"));
        McpTestClient client = connect(protocolServer);

        ObjectNode request = TestUtils.request(1, "ping");
        request.put("auth_token", "s3cret");

        assertTrue(client.call(request).has("result"));
    }

    @Test
    @Timeout(20)
    @DisplayName("Repeated failed authentication locks the IP out")
    void testLockout() throws Exception {
        ProtocolServer protocolServer = startServer(
                ConfigParams.customConfig("127.0.0.1", 0, true, "s3cret").withLockout(2, 0));
        McpTestClient client = connect(protocolServer);

        ObjectNode wrongToken = TestUtils.request(1, "ping");
        wrongToken.putObject("params").put("authToken", "bad");
        assertEquals(JsonRpc.AUTHENTICATION_FAILED, client.call(wrongToken).get("error").get("code").asInt());
        wrongToken.put("id", 2);
        assertEquals(JsonRpc.AUTHENTICATION_FAILED, client.call(wrongToken).get("error").get("code").asInt());

        assertTrue(client.isClosedByServer());
        assertTrue(protocolServer.getServerContext().ipFilter().isBlocked("127.0.0.1"));

        McpTestClient retry = connect(protocolServer);
        assertTrue(retry.isClosedByServer());
    }

    @Test
    @Timeout(20)
    void testAllowListRejectsOtherAddresses() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig().withAllowedIps(Set.of("10.0.0.0/8")));
        McpTestClient client = connect(protocolServer);

        assertTrue(client.isClosedByServer());
        assertEquals(0, protocolServer.getServerContext().sessionManager().size());
    }

    @Test
    @Timeout(20)
    @DisplayName("Connections beyond the limit are closed until a slot frees up")
    void testMaxConnections() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig().withLimits(1, 600, 300));
        McpTestClient first = connect(protocolServer);
        assertTrue(first.call(TestUtils.request(1, "ping")).has("result"));

        McpTestClient second = connect(protocolServer);
        assertTrue(second.isClosedByServer());

        first.close();
        awaitCondition(() -> protocolServer.getServerContext().metricsCollector().getActiveConnections() == 0);
        awaitCondition(() -> protocolServer.getServerContext().sessionManager().size() == 0);

        McpTestClient third = connect(protocolServer);
        assertTrue(third.call(TestUtils.request(2, "ping")).has("result"));
    }

    @Test
    @Timeout(20)
    void testTlsConnection() throws Exception {
        String certFile = TestUtils.tlsFixture("server-cert.pem").toString();
        String keyFile = TestUtils.tlsFixture("server-key.pem").toString();
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig().withTls(certFile, keyFile, "none"));

        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        try (InputStream certStream = Files.newInputStream(TestUtils.tlsFixture("server-cert.pem"))) {
            trustStore.setCertificateEntry("server", CertificateFactory.getInstance("X.509").generateCertificate(certStream));
        }
        TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        trustManagerFactory.init(trustStore);
        SSLContext clientContext = SSLContext.getInstance("TLS");
        clientContext.init(null, trustManagerFactory.getTrustManagers(), null);

        SSLSocket sslSocket = (SSLSocket) clientContext.getSocketFactory().createSocket("127.0.0.1", protocolServer.getPort());
        sslSocket.startHandshake();
        McpTestClient client = new McpTestClient(sslSocket);
        openClients.add(client);

        assertEquals(1, client.call(TestUtils.request(1, "ping")).get("id").asInt());
    }

    @Test
    @Timeout(20)
    void testPortInUse() throws Exception {
        ProtocolServer first = startServer(ConfigParams.defaultConfig());
        ProtocolServer second = new ProtocolServer(ConfigParams.customConfig("127.0.0.1", first.getPort(), false, null));

        IOException e = assertThrows(IOException.class, second::start);
        assertThat(e.getMessage()).contains(String.valueOf(first.getPort()));
        assertFalse(second.isRunning());
    }

    @Test
    @Timeout(20)
    @DisplayName("Graceful stop closes the listener but lets open connections finish")
    void testGracefulStopDrainsConnections() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig());
        int port = protocolServer.getPort();
        McpTestClient client = connect(protocolServer);
        assertTrue(client.call(TestUtils.request(1, "ping")).has("result"));

        protocolServer.stop();

        assertFalse(protocolServer.isRunning());
        assertThrows(IOException.class, () -> {
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress("127.0.0.1", port), 1000);
            }
        });
        JsonNode echoResponse = client.call(TestUtils.toolCall(2, "echo", TestUtils.MAPPER.createObjectNode().put("message", "still here")));
        assertThat(TestUtils.resultText(echoResponse)).contains("Message: still here");

        client.close();
        awaitCondition(() -> protocolServer.getActiveConnectionCount() == 0);
        awaitCondition(() -> protocolServer.getServerContext().metricsCollector().getActiveConnections() == 0);
    }

    @Test
    @Timeout(20)
    void testStopRefusesNewConnections() throws Exception {
        ProtocolServer protocolServer = startServer(ConfigParams.defaultConfig());
        int port = protocolServer.getPort();
        McpTestClient client = connect(protocolServer);
        assertTrue(client.call(TestUtils.request(1, "ping")).has("result"));

        protocolServer.stop(Duration.ofMillis(200));

        assertFalse(protocolServer.isRunning());
        assertTrue(client.isClosedByServer());
        assertThrows(IOException.class, () -> {
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress("127.0.0.1", port), 1000);
            }
        });
    }
}
