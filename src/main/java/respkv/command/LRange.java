package respkv.command;

import respkv.resp.RespArray;
import respkv.resp.RespValue;
import respkv.store.KeyValueStore;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class LRange extends AbstractCommand {
    public static final String CODE = "LRANGE";
    private final byte[] key;
    private final long start;
    private final long end;
    private final KeyValueStore store;

    public LRange(List<byte[]> tokens, KeyValueStore store) {
        requireArity(tokens, 4, CODE);
        this.key = tokens.get(1);
        this.start = parseLong(tokens.get(2));
        this.end = parseLong(tokens.get(3));
        this.store = store;
    }

    @Override
    protected RespValue executeCommand() {
        return RespArray.ofBulkStrings(store.lrange(key, start, end));
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        LRange lRange = (LRange) o;
        return start == lRange.start && end == lRange.end && Arrays.equals(key, lRange.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(key), start, end);
    }

    @Override
    public String toString() {
        return "LRange{" +
               "key=" + text(key) +
               ", start=" + start +
               ", end=" + end +
               '}';
    }
}
