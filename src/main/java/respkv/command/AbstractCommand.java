package respkv.command;

import respkv.exception.InvalidArgumentException;
import respkv.exception.KvException;
import respkv.exception.UnknownCommandException;
import respkv.resp.RespError;
import respkv.resp.RespValue;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static respkv.config.Constants.NOT_AN_INTEGER_MESSAGE;
import static respkv.util.Logger.debug;

public abstract sealed class AbstractCommand implements Command
        permits Echo, Get, LLen, LPop, LPush, LRange, Ping, RPush, Set {

    protected abstract RespValue executeCommand();

    @Override
    public final RespValue execute() {
        try {
            return executeCommand();
        } catch (KvException e) {
            debug("Error handling command %s: %s", this, e.getMessage());
            return new RespError(e.getMessage());
        }
    }

    protected static void requireArity(List<byte[]> tokens, int expected, String code) {
        if (tokens.size() != expected) {
            throw UnknownCommandException.wrongArity(code.toLowerCase());
        }
    }

    protected static void requireMinArity(List<byte[]> tokens, int minimum, String code) {
        if (tokens.size() < minimum) {
            throw UnknownCommandException.wrongArity(code.toLowerCase());
        }
    }

    protected static long parseLong(byte[] token) {
        try {
            return Long.parseLong(new String(token, StandardCharsets.US_ASCII));
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException(NOT_AN_INTEGER_MESSAGE);
        }
    }

    protected static String text(byte[] token) {
        return new String(token, StandardCharsets.UTF_8);
    }
}
