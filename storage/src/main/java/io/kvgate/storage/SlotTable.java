// file: storage/src/main/java/io/kvgate/storage/SlotTable.java
package io.kvgate.storage;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The metadata table in slot 0, keyed by slot index.
 */
final class SlotTable {

    private static final KeyCodec<Integer> UINT16 = new KeyCodec<>() {
        @Override
        public byte[] encode(Integer key) {
            return PersistentMap.be16(key);
        }

        @Override
        public Integer decode(byte[] bytes) {
            KeyCodecs.expectLength(bytes, 2, "slot index");
            return ByteBuffer.wrap(bytes).getShort() & 0xFFFF;
        }
    };

    private final PersistentMap<Integer, Slot> slots =
            new PersistentMap<>(0, UINT16, ValueCodecs.json(Slot.class), Compression.NONE, true);

    List<Slot> list(DbTransaction txn) {
        return slots.select(txn, null, null, false, true).values();
    }

    Optional<Slot> find(DbTransaction txn, UUID oid) {
        for (Slot s : list(txn)) {
            if (s.oid().equals(oid)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /** Write a row for {@code oid} at the smallest free index. */
    Slot allocate(DbTransaction txn, UUID oid, String name, String description, String creator) {
        int next = 1;
        for (Slot s : list(txn)) {
            if (s.index() != next) {
                break;
            }
            next++;
        }
        if (next > PersistentMap.MAX_SLOT) {
            throw new IllegalStateException("no free slot left");
        }
        Slot slot = new Slot(oid, next, name, description, List.of(), creator);
        slots.put(txn, next, slot);
        return slot;
    }
}
