// file: storage/src/main/java/io/kvgate/storage/DbTransaction.java
package io.kvgate.storage;

import io.kvgate.client.KvClient;
import io.kvgate.core.Bytes;
import io.kvgate.core.Compare;
import io.kvgate.core.CompareOperator;
import io.kvgate.core.GetOptions;
import io.kvgate.core.KeyRange;
import io.kvgate.core.KeyValue;
import io.kvgate.core.Operation;
import io.kvgate.core.Range;
import io.kvgate.core.Transaction;
import io.kvgate.core.TxnOutcome;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Optimistic transaction over physical keys.
 * <p>
 * Lifecycle (each step at most once):
 * <pre>
 *   NEW --open()--> OPEN --commit()--> COMMITTED
 *                        --commit() lost race--> CONFLICTED
 *                        --commit() raised--> FAILED
 *                        --rollback()/close()--> ROLLED_BACK
 * </pre>
 * While OPEN:
 *  - writes go to a local buffer only; nothing reaches the store before commit,
 *  - reads consult the buffer first, then the store; the mod revision of every
 *    key read from the store is remembered.
 * <p>
 * On commit the buffer becomes one guarded store transaction. The guard holds
 * one compare per touched key:
 *  - keys read from the store: mod revision still equals the observed one,
 *  - keys only written: mod revision not newer than the base revision.
 * If any compare fails, nothing is applied and {@link TransactionConflictException} is thrown.
 * <p>
 * Not thread-safe: one transaction belongs to one unit of work.
 */
public final class DbTransaction implements AutoCloseable {
    private static final Logger log = Logger.getLogger(DbTransaction.class.getName());

    public enum State { NEW, OPEN, COMMITTED, CONFLICTED, FAILED, ROLLED_BACK }

    /** A buffered write; {@code value == null} marks a delete. */
    private record Write(byte[] value) {
        boolean isDelete() {
            return value == null;
        }
    }

    private final KvClient client;
    private final boolean write;
    private final TransactionStats stats;
    private final Duration timeout;

    private final NavigableMap<byte[], Write> buffer = new TreeMap<>(Bytes::compare);
    private final NavigableMap<byte[], Long> observed = new TreeMap<>(Bytes::compare);
    private State state = State.NEW;
    private long baseRevision = -1;
    private long committedRevision = -1;

    DbTransaction(KvClient client, boolean write, TransactionStats stats, Duration timeout) {
        this.client = client;
        this.write = write;
        this.stats = stats;
        this.timeout = timeout;
    }

    /** Capture the base revision with one status call. */
    public DbTransaction open() {
        requireState(State.NEW, "open");
        baseRevision = client.status(timeout).header().revision();
        state = State.OPEN;
        log.log(Level.FINE, "transaction opened at revision {0} (write={1})", new Object[] {baseRevision, write});
        return this;
    }

    public State state() {
        return state;
    }

    public boolean isWrite() {
        return write;
    }

    /** Store revision captured by {@link #open()}. */
    public long baseRevision() {
        requireOpened();
        return baseRevision;
    }

    /** Revision of the commit, empty unless a non-empty buffer was committed. */
    public OptionalLong committedRevision() {
        return committedRevision < 0 ? OptionalLong.empty() : OptionalLong.of(committedRevision);
    }

    /** Number of buffered writes. */
    public int pending() {
        return buffer.size();
    }

    // ---------- reads ----------

    /** Value of {@code key}: buffered write if any, otherwise the store's. Null when absent. */
    public byte[] get(byte[] key) {
        requireState(State.OPEN, "get");
        Write w = buffer.get(key);
        if (w != null) {
            return w.isDelete() ? null : w.value().clone();
        }
        Range r = client.get(KeyRange.single(key), GetOptions.DEFAULT, timeout);
        KeyValue kv = r.first();
        observe(key.clone(), kv == null ? 0 : kv.modRevision());
        return kv == null ? null : kv.value();
    }

    /**
     * Key-values in {@code [from, to)} with buffered writes applied, in key order.
     * {@code to = {0}} means no upper bound. Buffered puts appear with zero revisions.
     */
    public List<KeyValue> range(byte[] from, byte[] to, boolean keysOnly) {
        requireState(State.OPEN, "range");
        GetOptions opts = keysOnly ? GetOptions.builder().keysOnly(true).build() : GetOptions.DEFAULT;
        Range r = client.get(KeyRange.range(from, to), opts, timeout);

        NavigableMap<byte[], KeyValue> merged = new TreeMap<>(Bytes::compare);
        for (KeyValue kv : r.kvs()) {
            byte[] key = kv.key();
            merged.put(key, kv);
            if (!buffer.containsKey(key)) {
                observe(key, kv.modRevision());
            }
        }
        for (Map.Entry<byte[], Write> e : pendingIn(from, to).entrySet()) {
            if (e.getValue().isDelete()) {
                merged.remove(e.getKey());
            } else {
                byte[] value = keysOnly ? new byte[0] : e.getValue().value();
                merged.put(e.getKey(), new KeyValue(e.getKey(), value, 0, 0, 0, 0));
            }
        }
        return new ArrayList<>(merged.values());
    }

    /** Number of keys in {@code [from, to)} with buffered writes applied. */
    public long count(byte[] from, byte[] to) {
        requireState(State.OPEN, "count");
        if (pendingIn(from, to).isEmpty()) {
            return client.get(KeyRange.range(from, to), GetOptions.builder().countOnly(true).build(), timeout).count();
        }
        return range(from, to, true).size();
    }

    // ---------- writes ----------

    public void put(byte[] key, byte[] value) {
        requireWritable("put");
        buffer.put(key.clone(), new Write(value.clone()));
        if (stats != null) {
            stats.recordPut();
        }
    }

    public void delete(byte[] key) {
        requireWritable("delete");
        buffer.put(key.clone(), new Write(null));
        if (stats != null) {
            stats.recordDelete();
        }
    }

    // ---------- completion ----------

    /**
     * Submit the buffer as one guarded transaction. An empty buffer completes
     * without contacting the store.
     *
     * @throws TransactionConflictException when a touched key changed since it was observed
     */
    public void commit() {
        requireState(State.OPEN, "commit");
        if (buffer.isEmpty()) {
            state = State.COMMITTED;
            log.log(Level.FINE, "transaction at revision {0} committed empty", baseRevision);
            return;
        }

        Transaction.Builder txn = Transaction.builder();
        TreeSet<byte[]> touched = new TreeSet<>(Bytes::compare);
        touched.addAll(buffer.keySet());
        touched.addAll(observed.keySet());
        for (byte[] key : touched) {
            Long seen = observed.get(key);
            txn.when(seen != null
                    ? Compare.modRevision(key, CompareOperator.EQUAL, seen)
                    : Compare.modRevision(key, CompareOperator.LESS, baseRevision + 1));
        }
        for (Map.Entry<byte[], Write> e : buffer.entrySet()) {
            txn.then(e.getValue().isDelete()
                    ? Operation.delete(KeyRange.single(e.getKey()))
                    : Operation.set(e.getKey(), e.getValue().value()));
        }

        int ops = buffer.size();
        buffer.clear();
        TxnOutcome outcome;
        try {
            outcome = client.submit(txn.build(), timeout);
        } catch (RuntimeException e) {
            // a transport failure leaves the outcome unknown
            state = State.FAILED;
            throw e;
        }
        if (!outcome.succeeded()) {
            state = State.CONFLICTED;
            log.log(Level.FINE, "transaction at revision {0} lost race (store at {1})",
                    new Object[] {baseRevision, outcome.header().revision()});
            throw new TransactionConflictException(baseRevision, outcome.header().revision(), touched.size());
        }
        committedRevision = outcome.header().revision();
        state = State.COMMITTED;
        log.log(Level.FINE, "transaction committed: base={0}, committed={1}, ops={2}",
                new Object[] {baseRevision, committedRevision, ops});
    }

    /** Discard the buffer. Never contacts the store. */
    public void rollback() {
        requireState(State.OPEN, "rollback");
        int dropped = buffer.size();
        buffer.clear();
        state = State.ROLLED_BACK;
        log.log(Level.FINE, "transaction at revision {0} rolled back ({1} buffered ops dropped)",
                new Object[] {baseRevision, dropped});
    }

    /** Rolls back if still open; a no-op after commit or rollback. */
    @Override
    public void close() {
        if (state == State.OPEN) {
            rollback();
        }
    }

    // ---------- helpers ----------

    private void observe(byte[] key, long modRevision) {
        observed.putIfAbsent(key, modRevision);
    }

    private SortedMap<byte[], Write> pendingIn(byte[] from, byte[] to) {
        boolean unbounded = to.length == 1 && to[0] == 0;
        if (!unbounded && Bytes.compare(from, to) >= 0) {
            return new TreeMap<>(Bytes::compare);
        }
        return unbounded ? buffer.tailMap(from, true) : buffer.subMap(from, true, to, false);
    }

    private void requireWritable(String op) {
        requireState(State.OPEN, op);
        if (!write) {
            throw new IllegalStateException(op + " on a read-only transaction");
        }
    }

    private void requireOpened() {
        if (state == State.NEW) {
            throw new IllegalStateException("transaction not opened");
        }
    }

    private void requireState(State expected, String op) {
        if (state != expected) {
            throw new IllegalStateException("cannot " + op + " a transaction in state " + state);
        }
    }

    @Override
    public String toString() {
        return "DbTransaction{state=" + state + ", write=" + write + ", base=" + baseRevision
                + ", pending=" + buffer.size() + '}';
    }
}
