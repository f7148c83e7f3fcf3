// file: core/src/main/java/io/kvgate/core/Range.java
package io.kvgate.core;

import java.util.List;

/**
 * Result of a range read.
 *
 * @param kvs    matching key-values (empty when only counting)
 * @param header response header
 * @param count  total number of keys in the range
 * @param more   true if a limit cut the result short
 */
public record Range(List<KeyValue> kvs, Header header, long count, boolean more) implements OpResponse {

    public Range {
        kvs = kvs == null ? List.of() : List.copyOf(kvs);
    }

    public boolean isEmpty() {
        return kvs.isEmpty();
    }

    /** First key-value or null. Convenient for single-key reads. */
    public KeyValue first() {
        return kvs.isEmpty() ? null : kvs.get(0);
    }
}
