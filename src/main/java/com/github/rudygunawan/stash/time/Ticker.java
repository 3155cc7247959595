package com.github.rudygunawan.stash.time;

/**
 * A monotonic time source that returns the current time in nanoseconds.
 *
 * <p>Every time-bounded store stamps entries and checks expiry through a {@code Ticker}, so the
 * expiry math is immune to wall-clock adjustments. Tests can supply a ticker they advance by
 * hand instead of sleeping.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * // Default: System.nanoTime()
 * TimedCache<String, User> cache = TimedCache.withLifespan(Duration.ofMinutes(10));
 *
 * // Explicit ticker
 * Cached<String, User> cache = CacheBuilder.newBuilder()
 *     .ticker(Ticker.systemTicker())
 *     .expireAfterWrite(10, TimeUnit.MINUTES)
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     *
     * <p>Implementations must have the same properties as {@link System#nanoTime()}: values are
     * nanoseconds, never go backwards, and are unrelated to wall-clock time.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return a ticker that uses the system's nanosecond-precision clock
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
