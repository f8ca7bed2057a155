package respkv.store;

/**
 * Monotonic time source for expiry. Never backed by wall-clock time.
 */
@FunctionalInterface
public interface Clock {
    Clock SYSTEM = System::nanoTime;

    long nanoTime();
}
