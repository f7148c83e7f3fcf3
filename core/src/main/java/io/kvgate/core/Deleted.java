// file: core/src/main/java/io/kvgate/core/Deleted.java
package io.kvgate.core;

import java.util.List;

/**
 * Result of a delete-range.
 *
 * @param deleted  number of keys removed
 * @param header   response header
 * @param previous removed key-values when requested, otherwise empty
 */
public record Deleted(long deleted, Header header, List<KeyValue> previous) implements OpResponse {

    public Deleted {
        previous = previous == null ? List.of() : List.copyOf(previous);
    }
}
