package respkv.store;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Immutable, case-sensitive byte-string key.
 */
public final class Key {
    private final byte[] bytes;
    private final int hash;

    private Key(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    public static Key of(byte[] bytes) {
        return new Key(bytes.clone());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        return Arrays.equals(this.bytes, ((Key) obj).bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
