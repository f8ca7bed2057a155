package respkv.command;

import respkv.resp.RespBulkString;
import respkv.resp.RespValue;
import respkv.store.KeyValueStore;

import java.util.Arrays;
import java.util.List;

public final class LPop extends AbstractCommand {
    public static final String CODE = "LPOP";
    private final byte[] key;
    private final KeyValueStore store;

    public LPop(List<byte[]> tokens, KeyValueStore store) {
        requireArity(tokens, 2, CODE);
        this.key = tokens.get(1);
        this.store = store;
    }

    @Override
    protected RespValue executeCommand() {
        return store.lpop(key)
                .map(RespBulkString::new)
                .orElse(RespBulkString.NULL);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(key, ((LPop) o).key);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(key);
    }

    @Override
    public String toString() {
        return "LPop{key=" + text(key) + '}';
    }
}
