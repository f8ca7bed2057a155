package respkv.command;

import respkv.resp.RespBulkString;
import respkv.resp.RespValue;
import respkv.store.KeyValueStore;
import respkv.store.StoredValue;
import respkv.store.WrongTypeException;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public final class Get extends AbstractCommand {
    public static final String CODE = "GET";
    private final byte[] key;
    private final KeyValueStore store;

    public Get(List<byte[]> tokens, KeyValueStore store) {
        requireArity(tokens, 2, CODE);
        this.key = tokens.get(1);
        this.store = store;
    }

    @Override
    protected RespValue executeCommand() {
        Optional<StoredValue> stored = store.get(key);
        if (stored.isEmpty()) {
            return RespBulkString.NULL;
        }
        if (stored.get() instanceof StoredValue.Scalar scalar) {
            return new RespBulkString(scalar.bytes());
        }
        throw new WrongTypeException();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (Get) obj;
        return Arrays.equals(this.key, that.key);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(key);
    }

    @Override
    public String toString() {
        return "Get[key=" + text(key) + ']';
    }
}
