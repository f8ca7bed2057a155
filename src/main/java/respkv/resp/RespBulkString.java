package respkv.resp;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Binary-safe bulk string. A {@code null} payload is the null bulk string {@code $-1\r\n}.
 */
public final class RespBulkString extends AbstractRespValue {
    private static final byte[] NULL_BULK_STRING = {'$', '-', '1', '\r', '\n'};
    public static final RespBulkString NULL = new RespBulkString((byte[]) null);

    private final byte[] value;

    public RespBulkString(byte[] value) {
        this.value = value;
    }

    public RespBulkString(String value) {
        this(value == null ? null : value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        if (value == null) {
            out.write(NULL_BULK_STRING);
            return;
        }
        SerializerUtils.writeHeader(out, '$', value.length);
        out.write(value);
        out.write(SerializerUtils.CRLF);
    }

    public byte[] value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (RespBulkString) obj;
        return Arrays.equals(this.value, that.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "RespBulkString[" +
               "value=" + (value == null ? "null" : new String(value, StandardCharsets.UTF_8)) + ']';
    }
}
