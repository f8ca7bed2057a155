package respkv.command;

import respkv.exception.InvalidArgumentException;
import respkv.resp.RespSimpleString;
import respkv.resp.RespValue;
import respkv.store.KeyValueStore;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static respkv.config.Constants.EXPIRATION_TOKEN_CONTENT;
import static respkv.config.Constants.INVALID_EXPIRE_MESSAGE;
import static respkv.config.Constants.OK;

/**
 * {@code SET key value [PX milliseconds]}. Trailing tokens that are not a complete PX option are ignored.
 */
public final class Set extends AbstractCommand {
    public static final String CODE = "SET";
    private static final RespSimpleString OK_REPLY = new RespSimpleString(OK);
    // largest PX whose deadline still fits in a nanosecond long
    private static final long MAX_TTL_MILLIS = Long.MAX_VALUE / 1_000_000;

    private final byte[] key;
    private final byte[] value;
    private final Duration ttl;
    private final KeyValueStore store;

    public Set(List<byte[]> tokens, KeyValueStore store) {
        requireMinArity(tokens, 3, CODE);
        this.key = tokens.get(1);
        this.value = tokens.get(2);
        this.ttl = getTtl(tokens);
        this.store = store;
    }

    private static Duration getTtl(List<byte[]> tokens) {
        if (tokens.size() < 5 || !text(tokens.get(3)).equalsIgnoreCase(EXPIRATION_TOKEN_CONTENT)) {
            return null;
        }
        long millis = parseLong(tokens.get(4));
        if (millis <= 0 || millis > MAX_TTL_MILLIS) {
            throw new InvalidArgumentException(INVALID_EXPIRE_MESSAGE);
        }
        return Duration.ofMillis(millis);
    }

    @Override
    protected RespValue executeCommand() {
        store.set(key, value, ttl);
        return OK_REPLY;
    }

    public Duration ttl() {
        return ttl;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Set set = (Set) o;
        return Arrays.equals(key, set.key)
               && Arrays.equals(value, set.value)
               && Objects.equals(ttl, set.ttl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(key), Arrays.hashCode(value), ttl);
    }

    @Override
    public String toString() {
        return "Set{" +
               "key=" + text(key) +
               ", valueLength=" + value.length +
               ", ttl=" + ttl +
               '}';
    }
}
