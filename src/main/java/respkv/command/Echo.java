package respkv.command;

import respkv.resp.RespBulkString;
import respkv.resp.RespValue;

import java.util.Arrays;
import java.util.List;

public final class Echo extends AbstractCommand {
    public static final String CODE = "ECHO";
    private final byte[] message;

    public Echo(List<byte[]> tokens) {
        requireArity(tokens, 2, CODE);
        this.message = tokens.get(1);
    }

    @Override
    protected RespValue executeCommand() {
        return new RespBulkString(message);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (Echo) obj;
        return Arrays.equals(this.message, that.message);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(message);
    }

    @Override
    public String toString() {
        return "Echo[message=" + text(message) + ']';
    }
}
