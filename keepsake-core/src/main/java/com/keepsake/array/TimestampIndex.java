package com.keepsake.array;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable sequence of timestamps that share one time zone.
 */
public final class TimestampIndex {
    private static final Instant MIN = Instant.ofEpochSecond(0, Long.MIN_VALUE);
    private static final Instant MAX = Instant.ofEpochSecond(0, Long.MAX_VALUE);

    private final long[] epochNanos;
    private final ZoneId zone;

    /**
     * Create an index from epoch nanoseconds.
     *
     * @param epochNanos Nanoseconds since the epoch, one per entry
     * @param zone Time zone of every entry
     */
    public TimestampIndex(long[] epochNanos, ZoneId zone) {
        this.epochNanos = epochNanos.clone();
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * Create an index from zoned timestamps. All entries are converted to the
     * zone of the first; an empty list uses UTC.
     *
     * @param timestamps Timestamps in order
     * @return New index
     */
    public static TimestampIndex of(List<ZonedDateTime> timestamps) {
        ZoneId zone = timestamps.isEmpty() ? ZoneId.of("UTC") : timestamps.get(0).getZone();
        long[] nanos = new long[timestamps.size()];
        for (int i = 0; i < nanos.length; i++) {
            nanos[i] = toEpochNanos(timestamps.get(i).toInstant());
        }
        return new TimestampIndex(nanos, zone);
    }

    /**
     * Convert an instant to nanoseconds since the epoch. Only instants between
     * 1677-09-21T00:12:43.145224192Z and 2262-04-11T23:47:16.854775807Z fit in a long.
     *
     * @param instant The instant
     * @return Epoch nanoseconds
     * @throws IllegalArgumentException if the instant is outside the representable range
     */
    public static long toEpochNanos(Instant instant) {
        try {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Instant " + instant
                + " is outside the nanosecond range " + MIN + " to " + MAX, e);
        }
    }

    /**
     * Convert nanoseconds since the epoch to an instant.
     *
     * @param nanos Epoch nanoseconds
     * @return The instant
     */
    public static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
    }

    /**
     * Get the zone shared by every entry.
     *
     * @return Time zone
     */
    public ZoneId getZone() {
        return zone;
    }

    /**
     * Get the number of entries.
     *
     * @return Entry count
     */
    public int size() {
        return epochNanos.length;
    }

    /**
     * Get one entry.
     *
     * @param i Position
     * @return Timestamp in this index's zone
     */
    public ZonedDateTime get(int i) {
        return fromEpochNanos(epochNanos[i]).atZone(zone);
    }

    /**
     * Get every entry as epoch nanoseconds.
     *
     * @return Copy of the raw values
     */
    public long[] toEpochNanos() {
        return epochNanos.clone();
    }

    /**
     * Get every entry as a zoned timestamp.
     *
     * @return Unmodifiable list of timestamps
     */
    public List<ZonedDateTime> toList() {
        List<ZonedDateTime> result = new ArrayList<>(epochNanos.length);
        for (int i = 0; i < epochNanos.length; i++) {
            result.add(get(i));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TimestampIndex)) {
            return false;
        }
        TimestampIndex other = (TimestampIndex) obj;
        return zone.equals(other.zone) && Arrays.equals(epochNanos, other.epochNanos);
    }

    @Override
    public int hashCode() {
        return 31 * zone.hashCode() + Arrays.hashCode(epochNanos);
    }

    @Override
    public String toString() {
        return "TimestampIndex(" + zone + ", " + toList() + ")";
    }
}
