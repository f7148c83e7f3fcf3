// file: storage/src/main/java/io/kvgate/storage/Slot.java
package io.kvgate.storage;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Metadata row of the slot table: binds a stable object id to a slot index.
 * Stored as JSON at {@code \0\0 ++ be16(index)}.
 */
public record Slot(UUID oid, int index, String name, String description, List<String> tags, String creator) {
    public Slot {
        Objects.requireNonNull(oid, "oid");
        if (index < 1 || index > PersistentMap.MAX_SLOT) {
            throw new IllegalArgumentException("slot index out of range: " + index);
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
