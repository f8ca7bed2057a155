package respkv.resp;

import respkv.exception.ConnectionClosedException;
import respkv.exception.ProtocolException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import static respkv.config.Constants.DEFAULT_MAX_ARGUMENTS;
import static respkv.config.Constants.DEFAULT_MAX_BULK_LENGTH;

/**
 * Reads commands shaped as {@code *<n>\r\n($<len>\r\n<bytes>\r\n){n}} from a blocking stream.
 * <p>
 * There is no resynchronization: once a {@link ProtocolException} is thrown the stream position
 * is undefined and the caller must drop the connection.
 */
public class RespDecoder {
    private static final int MAX_HEADER_LENGTH = 32;

    private final int maxBulkLength;
    private final int maxArguments;

    public RespDecoder() {
        this(DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_ARGUMENTS);
    }

    public RespDecoder(int maxBulkLength, int maxArguments) {
        this.maxBulkLength = maxBulkLength;
        this.maxArguments = maxArguments;
    }

    /**
     * Blocks until one full command is available.
     *
     * @return the command elements in order; empty for {@code *0\r\n}
     * @throws ConnectionClosedException if the stream ends before the command is complete
     * @throws ProtocolException         if the bytes are not a flat array of bulk strings
     */
    public List<byte[]> decodeCommand(InputStream in) throws IOException {
        int count = readHeader(in, '*', "array length");
        if (count > maxArguments) {
            throw new ProtocolException("Too many arguments: " + count);
        }

        List<byte[]> elements = new ArrayList<>(Math.min(count, 64));
        for (int i = 0; i < count; i++) {
            elements.add(readBulkString(in));
        }
        return elements;
    }

    private byte[] readBulkString(InputStream in) throws IOException {
        int length = readHeader(in, '$', "bulk string length");
        if (length > maxBulkLength) {
            throw new ProtocolException("Bulk string length exceeds limit: " + length);
        }

        byte[] payload = in.readNBytes(length);
        if (payload.length < length) {
            throw new ConnectionClosedException("Stream closed inside bulk string");
        }
        int cr = in.read();
        int lf = in.read();
        if (cr == -1 || lf == -1) {
            throw new ConnectionClosedException("Stream closed inside bulk string");
        }
        if (cr != '\r' || lf != '\n') {
            throw new ProtocolException("Bulk string must end with CRLF");
        }
        return payload;
    }

    private int readHeader(InputStream in, char prefix, String what) throws IOException {
        byte[] line = readLine(in);
        if (line.length == 0 || line[0] != prefix) {
            throw new ProtocolException("Expected '" + prefix + "' but got "
                                        + (line.length == 0 ? "empty line" : "'" + (char) line[0] + "'"));
        }
        if (line.length == 1) {
            throw new ProtocolException("Invalid " + what + ": missing digits");
        }

        long value = 0;
        for (int i = 1; i < line.length; i++) {
            byte b = line[i];
            if (b < '0' || b > '9') {
                throw new ProtocolException("Invalid " + what + ": " + new String(line, 1, line.length - 1));
            }
            value = value * 10 + (b - '0');
            if (value > Integer.MAX_VALUE) {
                throw new ProtocolException("Invalid " + what + ": too large");
            }
        }
        return (int) value;
    }

    /**
     * Reads up to the next CRLF and returns the bytes before it.
     */
    private byte[] readLine(InputStream in) throws IOException {
        byte[] buffer = new byte[MAX_HEADER_LENGTH];
        int length = 0;
        while (true) {
            int b = in.read();
            if (b == -1) {
                throw new ConnectionClosedException(length == 0 ? "Stream closed" : "Stream closed inside header");
            }
            if (b == '\r') {
                int next = in.read();
                if (next == -1) {
                    throw new ConnectionClosedException("Stream closed inside header");
                }
                if (next != '\n') {
                    throw new ProtocolException("Header line must end with CRLF");
                }
                byte[] line = new byte[length];
                System.arraycopy(buffer, 0, line, 0, length);
                return line;
            }
            if (length == MAX_HEADER_LENGTH) {
                throw new ProtocolException("Header line too long");
            }
            buffer[length++] = (byte) b;
        }
    }
}
