package respkv.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static respkv.util.Logger.debug;

/**
 * Volatile key-value store holding scalar and list values with optional expiry.
 * <p>
 * Every operation touches exactly one key and runs under that key's lock, so operations on the
 * same key are linearized while different keys proceed independently. Expiry is lazy: an expired
 * entry is removed by the first operation that looks at it.
 */
public class KeyValueStore {
    private final ConcurrentMap<Key, Entry> data;
    private final KeyLockTable locks;
    private final Clock clock;

    public KeyValueStore() {
        this(Clock.SYSTEM);
    }

    public KeyValueStore(Clock clock) {
        this.data = new ConcurrentHashMap<>();
        this.locks = new KeyLockTable();
        this.clock = clock;
    }

    /**
     * Replaces whatever is stored under {@code key}. A {@code null} ttl means no expiry.
     */
    public void set(byte[] key, byte[] value, Duration ttl) {
        Key k = Key.of(key);
        OptionalLong expiresAt = ttl == null
                ? OptionalLong.empty()
                : OptionalLong.of(clock.nanoTime() + ttl.toNanos());
        locks.withLock(k, () -> data.put(k, new Entry(new StoredValue.Scalar(value.clone()), expiresAt)));
    }

    /**
     * Returns the live value under {@code key}. List values are returned as a detached copy.
     */
    public Optional<StoredValue> get(byte[] key) {
        Key k = Key.of(key);
        return locks.withLock(k, () -> {
            Entry entry = live(k);
            if (entry == null) {
                return Optional.empty();
            }
            StoredValue value = entry.value();
            if (value instanceof StoredValue.ListValue list) {
                return Optional.of(list.copy());
            }
            return Optional.of(value);
        });
    }

    public boolean exists(byte[] key) {
        Key k = Key.of(key);
        return locks.withLock(k, () -> live(k) != null);
    }

    public void delete(byte[] key) {
        Key k = Key.of(key);
        locks.withLock(k, () -> data.remove(k));
    }

    public int rpush(byte[] key, List<byte[]> items) {
        return push(key, items, false);
    }

    /**
     * Pushes each item to the head in the given order, so {@code [a, b, c]} ends up as {@code c, b, a}.
     */
    public int lpush(byte[] key, List<byte[]> items) {
        return push(key, items, true);
    }

    /**
     * Inclusive range with negative indexes counted from the tail.
     */
    public List<byte[]> lrange(byte[] key, long start, long end) {
        Key k = Key.of(key);
        return locks.withLock(k, () -> {
            StoredValue.ListValue list = existingList(k);
            if (list == null) {
                return List.of();
            }
            long length = list.size();
            long from = start < 0 ? Math.max(start + length, 0) : start;
            long to = Math.min(end < 0 ? end + length : end, length - 1);
            if (from > to) {
                return List.of();
            }
            return list.slice((int) from, (int) to);
        });
    }

    public long llen(byte[] key) {
        Key k = Key.of(key);
        return locks.withLock(k, () -> {
            StoredValue.ListValue list = existingList(k);
            return list == null ? 0L : list.size();
        });
    }

    public Optional<byte[]> lpop(byte[] key) {
        Key k = Key.of(key);
        return locks.withLock(k, () -> {
            StoredValue.ListValue list = existingList(k);
            if (list == null || list.isEmpty()) {
                return Optional.empty();
            }
            byte[] head = list.popHead();
            if (list.isEmpty()) {
                data.remove(k);
            }
            return Optional.of(head);
        });
    }

    /**
     * Number of entries held, including expired ones not yet evicted.
     */
    public int size() {
        return data.size();
    }

    int lockTableSize() {
        return locks.size();
    }

    private int push(byte[] key, List<byte[]> items, boolean head) {
        Key k = Key.of(key);
        return locks.withLock(k, () -> {
            StoredValue.ListValue list = existingList(k);
            if (items.isEmpty()) {
                return list == null ? 0 : list.size();
            }
            if (list == null) {
                list = new StoredValue.ListValue();
                data.put(k, Entry.persistent(list));
            }
            if (head) {
                list.pushHead(items);
            } else {
                list.pushTail(items);
            }
            return list.size();
        });
    }

    /**
     * Returns the entry for {@code key}, evicting it first if it has expired. Caller holds the key lock.
     */
    private Entry live(Key key) {
        Entry entry = data.get(key);
        if (entry != null && entry.isExpired(clock.nanoTime())) {
            debug("Evicting expired key '%s'", key);
            data.remove(key);
            return null;
        }
        return entry;
    }

    private StoredValue.ListValue existingList(Key key) {
        Entry entry = live(key);
        if (entry == null) {
            return null;
        }
        if (entry.value() instanceof StoredValue.ListValue list) {
            return list;
        }
        throw new WrongTypeException();
    }
}
