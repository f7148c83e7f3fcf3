// file: storage/src/main/java/io/kvgate/storage/PersistentMap.java
package io.kvgate.storage;

import io.kvgate.client.KvClient;
import io.kvgate.client.watch.WatchEvent;
import io.kvgate.client.watch.WatchHandle;
import io.kvgate.client.watch.WatchOptions;
import io.kvgate.core.Bytes;
import io.kvgate.core.KeyRange;
import io.kvgate.core.KeyValue;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Typed map stored in one slot of the flat keyspace.
 * <p>
 * Physical layout:
 * <pre>
 *   key   = be16(slot) ++ keyCodec.encode(k)
 *   value = compression.compress(valueCodec.encode(v))
 * </pre>
 * A slot's entries occupy {@code [be16(slot), be16(slot + 1))}; the last slot runs
 * to the end of the keyspace.
 * <p>
 * Every operation goes through a {@link DbTransaction}; writes are buffered
 * there and attached indexes are maintained in the same buffer.
 * <p>
 * Attaching or detaching an index is local bookkeeping. Attaching to a map
 * that already holds data does not back-fill the index; call
 * {@link #rebuildIndex(DbTransaction, Index)}.
 */
public final class PersistentMap<K, V> {
    private static final Logger log = Logger.getLogger(PersistentMap.class.getName());

    static final int MAX_SLOT = 0xFFFF;

    /** Keys and/or values returned by {@link #select}. Lists not asked for are empty. */
    public record Selection<K, V>(List<K> keys, List<V> values) {
    }

    private final int slot;
    private final KeyCodec<K> keyCodec;
    private final ValueCodec<V> valueCodec;
    private final Compression compression;
    private final byte[] prefix;
    private final byte[] end;
    private final List<Index<V, ?, K>> indexes = new ArrayList<>();

    public PersistentMap(int slot, KeyCodec<K> keyCodec, ValueCodec<V> valueCodec, Compression compression) {
        this(slot, keyCodec, valueCodec, compression, false);
    }

    /** Slot 0 is the metadata table and only reachable from inside this package. */
    PersistentMap(int slot, KeyCodec<K> keyCodec, ValueCodec<V> valueCodec, Compression compression, boolean metadata) {
        int min = metadata ? 0 : 1;
        if (slot < min || slot > MAX_SLOT) {
            throw new IllegalArgumentException("slot must be in [" + min + ", " + MAX_SLOT + "], was " + slot);
        }
        this.slot = slot;
        this.keyCodec = Objects.requireNonNull(keyCodec, "keyCodec");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
        this.compression = Objects.requireNonNull(compression, "compression");
        this.prefix = be16(slot);
        byte[] next = Bytes.increment(prefix);
        this.end = next == null ? new byte[] {0} : next;
    }

    public static <K, V> PersistentMap<K, V> of(int slot, KeyCodec<K> keyCodec, ValueCodec<V> valueCodec) {
        return new PersistentMap<>(slot, keyCodec, valueCodec, Compression.NONE);
    }

    public int slot() {
        return slot;
    }

    public Compression compression() {
        return compression;
    }

    public List<Index<V, ?, K>> indexes() {
        return Collections.unmodifiableList(indexes);
    }

    // ---------- index bookkeeping ----------

    /**
     * Attach a secondary index maintained on every later put and delete.
     * Names must be unique per map.
     */
    public <IK> Index<V, IK, K> attachIndex(String name, Function<V, IK> derivation, PersistentMap<IK, K> target) {
        for (Index<V, ?, K> existing : indexes) {
            if (existing.name().equals(name)) {
                throw new IllegalArgumentException("index " + name + " already attached to slot " + slot);
            }
        }
        if (target.slot == slot) {
            throw new IllegalArgumentException("index target must use a different slot than " + slot);
        }
        Index<V, IK, K> index = new Index<>(name, derivation, target);
        indexes.add(index);
        return index;
    }

    /** @return true if the index was attached */
    public boolean detachIndex(Index<V, ?, K> index) {
        return indexes.remove(index);
    }

    // ---------- single-key operations ----------

    /** Value for {@code key}, or null if absent. Serves buffered writes of {@code txn}. */
    public V get(DbTransaction txn, K key) {
        byte[] data = txn.get(physicalKey(key));
        return data == null ? null : decodeValue(data);
    }

    /**
     * Buffer {@code key -> value} and its index entries. When indexes are attached
     * the previous value is read first so index entries that no longer apply are removed.
     */
    public void put(DbTransaction txn, K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        V previous = indexes.isEmpty() ? null : get(txn, key);
        txn.put(physicalKey(key), encodeValue(value));
        for (Index<V, ?, K> index : indexes) {
            reindex(txn, index, key, previous, value);
        }
    }

    /**
     * Buffer removal of {@code key} and, when indexes are attached, of the index
     * entries derived from its current value.
     */
    public void delete(DbTransaction txn, K key) {
        Objects.requireNonNull(key, "key");
        V previous = indexes.isEmpty() ? null : get(txn, key);
        txn.delete(physicalKey(key));
        for (Index<V, ?, K> index : indexes) {
            reindex(txn, index, key, previous, null);
        }
    }

    private <IK> void reindex(DbTransaction txn, Index<V, IK, K> index, K key, V previous, V value) {
        PersistentMap<IK, K> target = index.target();
        IK oldKey = index.derive(previous);
        IK newKey = index.derive(value);
        byte[] oldPhysical = oldKey == null ? null : target.physicalKey(oldKey);
        byte[] newPhysical = newKey == null ? null : target.physicalKey(newKey);
        if (oldPhysical != null && !Arrays.equals(oldPhysical, newPhysical)) {
            txn.delete(oldPhysical);
        }
        if (newPhysical != null) {
            txn.put(newPhysical, target.encodeValue(key));
        }
    }

    // ---------- range operations ----------

    /** Every entry of the map, keys and values. */
    public Selection<K, V> select(DbTransaction txn) {
        return select(txn, null, null, true, true);
    }

    /**
     * Entries with {@code from <= key < to} in key order. Null bounds mean the
     * start or end of the slot.
     */
    public Selection<K, V> select(DbTransaction txn, K from, K to, boolean returnKeys, boolean returnValues) {
        if (!returnKeys && !returnValues) {
            throw new IllegalArgumentException("select must return keys, values or both");
        }
        byte[] lo = from == null ? prefix : physicalKey(from);
        byte[] hi = to == null ? end : physicalKey(to);
        List<K> keys = new ArrayList<>();
        List<V> values = new ArrayList<>();
        for (KeyValue kv : txn.range(lo, hi, !returnValues)) {
            if (returnKeys) {
                keys.add(decodeKey(kv.key()));
            }
            if (returnValues) {
                values.add(decodeValue(kv.value()));
            }
        }
        return new Selection<>(keys, values);
    }

    public long count(DbTransaction txn) {
        return txn.count(prefix, end);
    }

    /** Number of entries whose encoded key starts with the encoding of {@code keyPrefix}. */
    public long count(DbTransaction txn, K keyPrefix) {
        byte[] lo = physicalKey(keyPrefix);
        return txn.count(lo, prefixEnd(lo));
    }

    /** Smallest key greater than every key starting with {@code p}, capped at the slot end. */
    private byte[] prefixEnd(byte[] p) {
        int len = p.length;
        while (len > 0 && (p[len - 1] & 0xFF) == 0xFF) {
            len--;
        }
        if (len <= 2) {
            return end;
        }
        return Bytes.incrementLastByte(Arrays.copyOf(p, len));
    }

    /**
     * Delete every entry of the map.
     *
     * @param rebuildIndexes also rebuild the attached indexes (which empties them)
     * @return number of entries deleted
     */
    public int truncate(DbTransaction txn, boolean rebuildIndexes) {
        int deleted = deleteAll(txn);
        if (rebuildIndexes) {
            rebuildIndexes(txn);
        }
        log.log(Level.FINE, "slot {0} truncated ({1} entries)", new Object[] {slot, deleted});
        return deleted;
    }

    private int deleteAll(DbTransaction txn) {
        List<KeyValue> all = txn.range(prefix, end, true);
        for (KeyValue kv : all) {
            txn.delete(kv.key());
        }
        return all.size();
    }

    /**
     * Empty the index's target map, then write one entry per primary entry.
     *
     * @return number of index entries written
     */
    public <IK> int rebuildIndex(DbTransaction txn, Index<V, IK, K> index) {
        if (!indexes.contains(index)) {
            throw new IllegalArgumentException(index + " is not attached to slot " + slot);
        }
        PersistentMap<IK, K> target = index.target();
        target.deleteAll(txn);
        int written = 0;
        for (KeyValue kv : txn.range(prefix, end, false)) {
            IK ik = index.derive(decodeValue(kv.value()));
            if (ik != null) {
                txn.put(target.physicalKey(ik), target.encodeValue(decodeKey(kv.key())));
                written++;
            }
        }
        return written;
    }

    /** @return total index entries written */
    public int rebuildIndexes(DbTransaction txn) {
        int total = 0;
        for (Index<V, ?, K> index : indexes) {
            total += rebuildIndex(txn, index);
        }
        return total;
    }

    // ---------- watch ----------

    public WatchHandle watch(KvClient client, BiConsumer<K, V> callback) {
        return watch(client, WatchOptions.DEFAULT, callback);
    }

    /**
     * Watch every change in this map's slot. The callback receives the decoded
     * key and value; the value is null for deletes.
     */
    public WatchHandle watch(KvClient client, WatchOptions options, BiConsumer<K, V> callback) {
        Objects.requireNonNull(callback, "callback");
        return client.watch(List.of(KeyRange.range(prefix, end)), options, event -> {
            K key = decodeKey(event.kv().key());
            V value = event.type() == WatchEvent.Type.DELETE ? null : decodeValue(event.kv().value());
            callback.accept(key, value);
        });
    }

    // ---------- encoding ----------

    byte[] physicalKey(K key) {
        return Bytes.concat(prefix, keyCodec.encode(key));
    }

    K decodeKey(byte[] physical) {
        if (physical.length < 2 || physical[0] != prefix[0] || physical[1] != prefix[1]) {
            throw new IllegalStateException("key " + Bytes.display(physical) + " is not in slot " + slot);
        }
        return keyCodec.decode(Arrays.copyOfRange(physical, 2, physical.length));
    }

    byte[] encodeValue(V value) {
        return compression.compress(valueCodec.encode(value));
    }

    V decodeValue(byte[] stored) {
        return valueCodec.decode(compression.uncompress(stored));
    }

    static byte[] be16(int v) {
        return ByteBuffer.allocate(2).putShort((short) v).array();
    }

    @Override
    public String toString() {
        return "PersistentMap(slot=" + slot + ", compression=" + compression + ", indexes=" + indexes.size() + ")";
    }
}
