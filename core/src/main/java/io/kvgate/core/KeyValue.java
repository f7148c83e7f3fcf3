// file: core/src/main/java/io/kvgate/core/KeyValue.java
package io.kvgate.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * One stored key-value pair as observed from the store.
 * <p>
 * Immutable: every mutation on the server produces a new KeyValue.
 * Defensive copies of key and value bytes are taken on input and output.
 */
public final class KeyValue {
    private final byte[] key;
    private final byte[] value;
    private final long version;
    private final long createRevision;
    private final long modRevision;
    private final long lease;

    public KeyValue(byte[] key, byte[] value, long version, long createRevision, long modRevision, long lease) {
        Objects.requireNonNull(key, "key");
        this.key = Arrays.copyOf(key, key.length);
        this.value = value == null ? new byte[0] : Arrays.copyOf(value, value.length);
        this.version = version;
        this.createRevision = createRevision;
        this.modRevision = modRevision;
        this.lease = lease;
    }

    public byte[] key() { return Arrays.copyOf(key, key.length); }

    public byte[] value() { return Arrays.copyOf(value, value.length); }

    /** Number of modifications since the key's current lifetime began. */
    public long version() { return version; }

    public long createRevision() { return createRevision; }

    public long modRevision() { return modRevision; }

    /** Lease id the key is attached to, 0 if none. */
    public long lease() { return lease; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyValue kv)) return false;
        return version == kv.version && createRevision == kv.createRevision
                && modRevision == kv.modRevision && lease == kv.lease
                && Arrays.equals(key, kv.key) && Arrays.equals(value, kv.value);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(key);
        h = 31 * h + Arrays.hashCode(value);
        h = 31 * h + Long.hashCode(modRevision);
        return h;
    }

    @Override
    public String toString() {
        return "KeyValue{key=" + Bytes.display(key)
                + ", value=" + Bytes.display(value)
                + ", version=" + version
                + ", createRevision=" + createRevision
                + ", modRevision=" + modRevision
                + (lease != 0 ? ", lease=" + lease : "")
                + '}';
    }
}
