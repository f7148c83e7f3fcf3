// file: core/src/main/java/io/kvgate/core/Operation.java
package io.kvgate.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * A single request inside a transaction branch.
 * Each variant maps to exactly one request tag on the wire:
 * {@code request_range}, {@code request_put} or {@code request_delete_range}.
 */
public sealed interface Operation permits Operation.Get, Operation.Set, Operation.Delete {

    static Get get(KeyRange range) {
        return new Get(range, GetOptions.DEFAULT);
    }

    static Get get(KeyRange range, GetOptions options) {
        return new Get(range, options);
    }

    static Set set(byte[] key, byte[] value) {
        return new Set(key, value, 0, false);
    }

    static Delete delete(KeyRange range) {
        return new Delete(range, false);
    }

    record Get(KeyRange range, GetOptions options) implements Operation {
        public Get {
            Objects.requireNonNull(range, "range");
            options = options == null ? GetOptions.DEFAULT : options;
        }
    }

    /**
     * Put of one key.
     *
     * @param leaseId        lease to attach the key to, 0 for none
     * @param returnPrevious ask the store to return the overwritten key-value
     */
    record Set(byte[] key, byte[] value, long leaseId, boolean returnPrevious) implements Operation {
        public Set {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            key = Arrays.copyOf(key, key.length);
            value = Arrays.copyOf(value, value.length);
        }

        @Override
        public byte[] key() {
            return Arrays.copyOf(key, key.length);
        }

        @Override
        public byte[] value() {
            return Arrays.copyOf(value, value.length);
        }

        @Override
        public String toString() {
            return "Set[" + Bytes.display(key) + "=" + Bytes.display(value)
                    + (leaseId != 0 ? ", lease=" + leaseId : "") + "]";
        }
    }

    record Delete(KeyRange range, boolean returnPrevious) implements Operation {
        public Delete {
            Objects.requireNonNull(range, "range");
        }
    }
}
