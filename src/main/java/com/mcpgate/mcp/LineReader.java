package com.mcpgate.mcp;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads newline terminated UTF-8 lines from a socket stream.
 * <p>
 * Partial lines are kept in the reader across {@link java.net.SocketTimeoutException}s, so an
 * idle timeout in the middle of a slowly arriving line loses nothing. Lines longer than the limit
 * are discarded up to their newline and reported with {@link LineTooLongException}.
 */
public class LineReader {
    private final InputStream inputStream;
    private final int maxLineBytes;
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream();
    private final byte[] readBuffer = new byte[8192];
    private int readPosition;
    private int readLimit;
    private boolean discarding;

    public LineReader(InputStream inputStream, int maxLineBytes) {
        this.inputStream = inputStream;
        this.maxLineBytes = maxLineBytes;
    }

    /**
     * @return the next line without its terminator (a trailing CR is stripped too), or null at end of stream
     * @throws java.net.SocketTimeoutException when the read deadline passes; the reader stays usable
     * @throws LineTooLongException when a line exceeds the limit; the reader stays usable
     */
    public String readLine() throws IOException {
        while (true) {
            if (readPosition >= readLimit) {
                int bytesRead = inputStream.read(readBuffer);
                if (bytesRead < 0) {
                    // Unterminated data at end of stream is treated as a final line
                    if (lineBuffer.size() > 0 && !discarding) {
                        return takeLine();
                    }
                    lineBuffer.reset();
                    return null;
                }
                readPosition = 0;
                readLimit = bytesRead;
            }

            while (readPosition < readLimit) {
                byte nextByte = readBuffer[readPosition++];
                if (nextByte == '\n') {
                    if (discarding) {
                        discarding = false;
                        lineBuffer.reset();
                        throw new LineTooLongException(maxLineBytes);
                    }
                    return takeLine();
                }
                if (discarding) {
                    continue;
                }
                lineBuffer.write(nextByte);
                if (lineBuffer.size() > maxLineBytes) {
                    discarding = true;
                    lineBuffer.reset();
                }
            }
        }
    }

    private String takeLine() {
        byte[] lineBytes = lineBuffer.toByteArray();
        lineBuffer.reset();
        int length = lineBytes.length;
        if (length > 0 && lineBytes[length - 1] == '\r') {
            length--;
        }
        return new String(lineBytes, 0, length, StandardCharsets.UTF_8);
    }

    /**
     * Raised for a request line above the configured size.
     */
    public static class LineTooLongException extends IOException {
        public LineTooLongException(int maxLineBytes) {
            super("request line exceeds " + maxLineBytes + " bytes");
        }
    }
}
