package respkv.resp;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Error reply. Every error leaves the server as {@code -ERR <message>\r\n}.
 */
public final class RespError extends AbstractRespValue {
    private static final String PREFIX = "ERR ";
    private final String message;

    public RespError(String message) {
        this.message = message == null ? "" : message.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        SerializerUtils.writeLine(out, '-', PREFIX + message);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (RespError) obj;
        return Objects.equals(this.message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message);
    }

    @Override
    public String toString() {
        return "RespError[message=" + message + ']';
    }
}
