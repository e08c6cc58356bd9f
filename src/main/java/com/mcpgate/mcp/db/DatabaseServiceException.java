package com.mcpgate.mcp.db;

/**
 * Failure talking to the database_ws service: connection problems, timeouts,
 * non-success HTTP status or an error reported in the response body.
 */
public class DatabaseServiceException extends Exception {
    private final int statusCode;

    public DatabaseServiceException(String message) {
        this(message, -1, null);
    }

    public DatabaseServiceException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public DatabaseServiceException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public DatabaseServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
