package respkv.command;

import respkv.resp.RespInteger;
import respkv.resp.RespValue;
import respkv.store.KeyValueStore;

import java.util.Arrays;
import java.util.List;

public final class LLen extends AbstractCommand {
    public static final String CODE = "LLEN";
    private final byte[] key;
    private final KeyValueStore store;

    public LLen(List<byte[]> tokens, KeyValueStore store) {
        requireArity(tokens, 2, CODE);
        this.key = tokens.get(1);
        this.store = store;
    }

    @Override
    protected RespValue executeCommand() {
        return new RespInteger(store.llen(key));
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(key, ((LLen) o).key);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(key);
    }

    @Override
    public String toString() {
        return "LLen{key=" + text(key) + '}';
    }
}
