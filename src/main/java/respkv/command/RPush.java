package respkv.command;

import respkv.resp.RespInteger;
import respkv.resp.RespValue;
import respkv.store.KeyValueStore;

import java.util.Arrays;
import java.util.List;

/**
 * {@code RPUSH key value [value ...]}: appends the values to the tail and replies with the new length.
 */
public final class RPush extends AbstractCommand {
    public static final String CODE = "RPUSH";
    private final byte[] key;
    private final List<byte[]> values;
    private final KeyValueStore store;

    public RPush(List<byte[]> tokens, KeyValueStore store) {
        requireMinArity(tokens, 3, CODE);
        this.key = tokens.get(1);
        this.values = List.copyOf(tokens.subList(2, tokens.size()));
        this.store = store;
    }

    @Override
    protected RespValue executeCommand() {
        return new RespInteger(store.rpush(key, values));
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        RPush that = (RPush) o;
        return Arrays.equals(key, that.key) && Arrays.deepEquals(values.toArray(), that.values.toArray());
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(key) + Arrays.deepHashCode(values.toArray());
    }

    @Override
    public String toString() {
        return "RPush{" +
               "key=" + text(key) +
               ", values=" + values.size() +
               '}';
    }
}
