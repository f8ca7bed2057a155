package respkv.store;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key locks created on demand. The table lock only guards lookups and bookkeeping,
 * never the work done under a key lock.
 * <p>
 * Each key lock counts the threads holding or waiting for it and is dropped from the table
 * when that count reaches zero, so deleted keys do not leave locks behind.
 */
final class KeyLockTable {
    private final ReentrantLock tableLock = new ReentrantLock();
    private final Map<Key, KeyLock> locks = new HashMap<>();

    <T> T withLock(Key key, Supplier<T> action) {
        KeyLock keyLock = acquire(key);
        keyLock.lock.lock();
        try {
            return action.get();
        } finally {
            keyLock.lock.unlock();
            release(key, keyLock);
        }
    }

    int size() {
        tableLock.lock();
        try {
            return locks.size();
        } finally {
            tableLock.unlock();
        }
    }

    private KeyLock acquire(Key key) {
        tableLock.lock();
        try {
            KeyLock keyLock = locks.computeIfAbsent(key, k -> new KeyLock());
            keyLock.users++;
            return keyLock;
        } finally {
            tableLock.unlock();
        }
    }

    private void release(Key key, KeyLock keyLock) {
        tableLock.lock();
        try {
            if (--keyLock.users == 0) {
                locks.remove(key);
            }
        } finally {
            tableLock.unlock();
        }
    }

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by tableLock
        private int users;
    }
}
