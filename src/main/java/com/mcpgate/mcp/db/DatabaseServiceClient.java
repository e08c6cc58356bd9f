package com.mcpgate.mcp.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * JSON over HTTP client for the external database_ws service that the database and redis tools proxy to.
 */
public class DatabaseServiceClient {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseServiceClient.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public DatabaseServiceClient(String baseUrl, Duration requestTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(requestTimeout)
                .build();
    }

    public JsonNode get(String endpoint) throws DatabaseServiceException {
        return send("GET", endpoint, HttpRequest.BodyPublishers.noBody());
    }

    public JsonNode post(String endpoint, JsonNode body) throws DatabaseServiceException {
        return send("POST", endpoint, jsonBody(body));
    }

    public JsonNode put(String endpoint, JsonNode body) throws DatabaseServiceException {
        return send("PUT", endpoint, jsonBody(body));
    }

    public JsonNode delete(String endpoint) throws DatabaseServiceException {
        return send("DELETE", endpoint, HttpRequest.BodyPublishers.noBody());
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Encodes one path segment (schema, table, record id) for use in an endpoint.
     */
    public static String pathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Encodes a query parameter value.
     */
    public static String queryValue(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private JsonNode send(String method, String endpoint, HttpRequest.BodyPublisher bodyPublisher)
            throws DatabaseServiceException {
        URI requestUri = URI.create(baseUrl + endpoint);
        HttpRequest httpRequest = HttpRequest.newBuilder(requestUri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .method(method, bodyPublisher)
                .build();

        logger.debug("database_ws {} {}", method, requestUri);
        HttpResponse<String> httpResponse;
        try {
            httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new DatabaseServiceException("Request timeout after " + requestTimeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new DatabaseServiceException("Cannot connect to database service: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DatabaseServiceException("Request interrupted", e);
        }

        int statusCode = httpResponse.statusCode();
        String responseBody = httpResponse.body();
        if (statusCode == 503) {
            throw new DatabaseServiceException("Database service unavailable", statusCode);
        }
        if (statusCode < 200 || statusCode >= 300) {
            throw new DatabaseServiceException("HTTP " + statusCode + ": " + describeError(responseBody), statusCode);
        }

        if (responseBody == null || responseBody.isBlank()) {
            return objectMapper.createObjectNode();
        }
        JsonNode responseNode;
        try {
            responseNode = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new DatabaseServiceException("Invalid JSON from database service: " + e.getOriginalMessage(), statusCode, e);
        }
        JsonNode errorNode = responseNode.path("error");
        if (!errorNode.isMissingNode() && !errorNode.isNull()) {
            throw new DatabaseServiceException(errorNode.isTextual() ? errorNode.asText() : errorNode.toString(), statusCode);
        }
        return responseNode;
    }

    private static HttpRequest.BodyPublisher jsonBody(JsonNode body) throws DatabaseServiceException {
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new DatabaseServiceException("Cannot serialize request body", e);
        }
    }

    /**
     * Pulls a readable message out of an error body, preferring FastAPI style {@code detail}.
     */
    private static String describeError(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return "(empty response)";
        }
        try {
            JsonNode errorBody = objectMapper.readTree(responseBody);
            for (String field : new String[]{"detail", "error", "message"}) {
                JsonNode messageNode = errorBody.path(field);
                if (messageNode.isTextual()) {
                    return messageNode.asText();
                }
            }
        } catch (JsonProcessingException e) {
            logger.trace("Error body is not JSON", e);
        }
        return responseBody;
    }
}
