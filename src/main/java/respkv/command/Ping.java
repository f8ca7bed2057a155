package respkv.command;

import respkv.resp.RespSimpleString;
import respkv.resp.RespValue;

import java.util.List;

import static respkv.config.Constants.PONG;

public final class Ping extends AbstractCommand {
    public static final String CODE = "PING";
    private static final RespSimpleString PONG_REPLY = new RespSimpleString(PONG);

    public Ping(List<byte[]> tokens) {
        requireArity(tokens, 1, CODE);
    }

    @Override
    protected RespValue executeCommand() {
        return PONG_REPLY;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || obj != null && obj.getClass() == this.getClass();
    }

    @Override
    public int hashCode() {
        return 1;
    }

    @Override
    public String toString() {
        return "Ping[]";
    }
}
