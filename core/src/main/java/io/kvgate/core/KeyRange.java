// file: core/src/main/java/io/kvgate/core/KeyRange.java
package io.kvgate.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * A set of keys addressed by one request: a single key, every key sharing a
 * prefix, or an explicit half-open range {@code [start, end)}.
 * <p>
 * Invariants:
 *  - start is never null (it may be the single byte 0x00 for "all keys").
 *  - PREFIX never stores an end; it is derived by {@link #resolveEnd()}.
 *  - RANGE always carries a non-empty end. The store treats an end of
 *    {@code \0} as "every key >= start".
 */
public final class KeyRange {

    public enum Mode { SINGLE, PREFIX, RANGE }

    private static final byte[] ZERO = new byte[] {0};

    private final byte[] start;
    private final byte[] end;
    private final Mode mode;

    private KeyRange(byte[] start, byte[] end, Mode mode) {
        this.start = Arrays.copyOf(start, start.length);
        this.end = end == null ? null : Arrays.copyOf(end, end.length);
        this.mode = mode;
    }

    public static KeyRange single(byte[] key) {
        Objects.requireNonNull(key, "key");
        return new KeyRange(key, null, Mode.SINGLE);
    }

    /** All keys starting with {@code prefix}. The prefix must be usable with {@link Bytes#incrementLastByte}. */
    public static KeyRange prefix(byte[] prefix) {
        Objects.requireNonNull(prefix, "prefix");
        Bytes.incrementLastByte(prefix); // validates
        return new KeyRange(prefix, null, Mode.PREFIX);
    }

    public static KeyRange range(byte[] start, byte[] end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.length == 0) {
            throw new IllegalArgumentException("range end must not be empty");
        }
        return new KeyRange(start, end, Mode.RANGE);
    }

    /** Every key {@code >= start}. */
    public static KeyRange from(byte[] start) {
        return range(start, ZERO);
    }

    /** The whole keyspace. */
    public static KeyRange all() {
        return range(ZERO, ZERO);
    }

    /**
     * General form used at API boundaries that accept (key, rangeEnd, prefix)
     * triples. Rejects rangeEnd together with prefix.
     */
    public static KeyRange of(byte[] key, byte[] rangeEnd, boolean prefix) {
        Objects.requireNonNull(key, "key");
        if (prefix && rangeEnd != null) {
            throw new IllegalArgumentException("either rangeEnd or prefix can be set, but not both");
        }
        if (prefix) {
            return prefix(key);
        }
        if (rangeEnd != null && rangeEnd.length > 0) {
            return range(key, rangeEnd);
        }
        return single(key);
    }

    public byte[] start() {
        return Arrays.copyOf(start, start.length);
    }

    public Mode mode() {
        return mode;
    }

    /**
     * Exclusive end of this range as sent on the wire:
     * null for SINGLE, the explicit end for RANGE, the incremented prefix for PREFIX.
     */
    public byte[] resolveEnd() {
        return switch (mode) {
            case SINGLE -> null;
            case RANGE -> Arrays.copyOf(end, end.length);
            case PREFIX -> Bytes.incrementLastByte(start);
        };
    }

    /**
     * Whether {@code key} falls in this range, using the store's rules
     * (including the {@code \0} end and the all-keys range).
     */
    public boolean contains(byte[] key) {
        byte[] e = resolveEnd();
        if (e == null) {
            return Arrays.equals(start, key);
        }
        boolean openEnded = e.length == 1 && e[0] == 0;
        if (openEnded) {
            boolean allKeys = start.length == 1 && start[0] == 0;
            return allKeys || Bytes.compare(key, start) >= 0;
        }
        return Bytes.compare(key, start) >= 0 && Bytes.compare(key, e) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyRange other)) return false;
        return mode == other.mode && Arrays.equals(start, other.start) && Arrays.equals(end, other.end);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * mode.hashCode() + Arrays.hashCode(start)) + Arrays.hashCode(end);
    }

    @Override
    public String toString() {
        return "KeyRange{" + mode + " start=" + Bytes.display(start)
                + (mode == Mode.SINGLE ? "" : ", end=" + Bytes.display(resolveEnd())) + '}';
    }
}
