package respkv.store;

import java.util.OptionalLong;

/**
 * A stored value plus its absolute expiry on the store's monotonic clock.
 */
record Entry(StoredValue value, OptionalLong expiresAt) {

    static Entry persistent(StoredValue value) {
        return new Entry(value, OptionalLong.empty());
    }

    boolean isExpired(long now) {
        return expiresAt.isPresent() && now - expiresAt.getAsLong() > 0;
    }
}
