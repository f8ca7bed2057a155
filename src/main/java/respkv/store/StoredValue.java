package respkv.store;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Type-tagged value of an entry. The variant of an entry never changes while it lives.
 */
public sealed interface StoredValue permits StoredValue.Scalar, StoredValue.ListValue {

    record Scalar(byte[] bytes) implements StoredValue {

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Scalar other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Scalar[length=" + bytes.length + ']';
        }
    }

    /**
     * Mutable list; only touched while the owning key's lock is held.
     */
    final class ListValue implements StoredValue {
        private final Deque<byte[]> items;

        ListValue() {
            this.items = new ArrayDeque<>();
        }

        private ListValue(Collection<byte[]> items) {
            this.items = new ArrayDeque<>(items);
        }

        int size() {
            return items.size();
        }

        boolean isEmpty() {
            return items.isEmpty();
        }

        void pushTail(List<byte[]> values) {
            items.addAll(values);
        }

        void pushHead(List<byte[]> values) {
            for (byte[] value : values) {
                items.addFirst(value);
            }
        }

        byte[] popHead() {
            return items.pollFirst();
        }

        List<byte[]> slice(int from, int to) {
            List<byte[]> result = new ArrayList<>(to - from + 1);
            Iterator<byte[]> iterator = items.iterator();
            for (int i = 0; i <= to && iterator.hasNext(); i++) {
                byte[] item = iterator.next();
                if (i >= from) {
                    result.add(item);
                }
            }
            return result;
        }

        public List<byte[]> items() {
            return List.copyOf(items);
        }

        ListValue copy() {
            return new ListValue(items);
        }

        @Override
        public String toString() {
            return "ListValue[size=" + items.size() + ']';
        }
    }
}
