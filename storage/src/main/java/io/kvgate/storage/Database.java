// file: storage/src/main/java/io/kvgate/storage/Database.java
package io.kvgate.storage;

import io.kvgate.client.ClientStats;
import io.kvgate.client.KvClient;
import io.kvgate.core.Status;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the storage layer: hands out {@link DbTransaction}s over one
 * {@link KvClient} and manages the slot table.
 *
 * <pre>
 *   Database db = new Database(client);
 *   PersistentMap&lt;UUID, User&gt; users = db.attachSlot(USERS, slot -&gt;
 *       PersistentMap.of(slot, KeyCodecs.uuid(), ValueCodecs.json(User.class)), true, "users", null);
 *   db.runInTransaction(true, txn -&gt; users.put(txn, id, user));
 * </pre>
 */
public final class Database {
    private static final Logger log = Logger.getLogger(Database.class.getName());

    private final KvClient client;
    private final boolean readOnly;
    private final SlotTable slotTable = new SlotTable();

    public Database(KvClient client) {
        this(client, false);
    }

    public Database(KvClient client, boolean readOnly) {
        this.client = Objects.requireNonNull(client, "client");
        this.readOnly = readOnly;
    }

    public KvClient client() {
        return client;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public ClientStats stats() {
        return client.stats();
    }

    public Status status() {
        return client.status();
    }

    // ---------- transactions ----------

    /** New transaction in state NEW; call {@link DbTransaction#open()} before use. */
    public DbTransaction begin(boolean write) {
        return begin(write, null, null);
    }

    /**
     * @param stats   counters bumped by put/delete, may be null
     * @param timeout per-request timeout, null for the client default
     */
    public DbTransaction begin(boolean write, TransactionStats stats, Duration timeout) {
        if (write && readOnly) {
            throw new IllegalStateException("database is read-only");
        }
        return new DbTransaction(client, write, stats, timeout);
    }

    /**
     * Open a transaction, run {@code work} and commit. Any exception from
     * {@code work} rolls the transaction back and propagates.
     */
    public void runInTransaction(boolean write, Consumer<DbTransaction> work) {
        callInTransaction(write, txn -> {
            work.accept(txn);
            return null;
        });
    }

    /** As {@link #runInTransaction} but returns the result of {@code work}. */
    public <T> T callInTransaction(boolean write, Function<DbTransaction, T> work) {
        DbTransaction txn = begin(write).open();
        T result;
        try {
            result = work.apply(txn);
        } catch (RuntimeException | Error e) {
            txn.rollback();
            throw e;
        }
        txn.commit();
        return result;
    }

    // ---------- slots ----------

    /** All rows of the slot table in index order. */
    public List<Slot> slots() {
        return callInTransaction(false, slotTable::list);
    }

    /**
     * Bind a map to the slot registered for {@code oid}.
     *
     * @param factory     builds the map for the resolved slot index
     * @param create      allocate a slot when {@code oid} has none
     * @param name        stored on allocation
     * @param description stored on allocation, may be null
     * @throws IllegalArgumentException when no slot exists and {@code create} is false
     */
    public <M> M attachSlot(UUID oid, IntFunction<M> factory, boolean create, String name, String description) {
        Objects.requireNonNull(oid, "oid");
        Objects.requireNonNull(factory, "factory");
        Optional<Slot> existing = callInTransaction(false, txn -> slotTable.find(txn, oid));
        Slot slot;
        if (existing.isPresent()) {
            slot = existing.get();
        } else if (!create) {
            throw new IllegalArgumentException("no slot registered for " + oid);
        } else {
            slot = callInTransaction(true, txn -> slotTable.find(txn, oid)
                    .orElseGet(() -> slotTable.allocate(txn, oid, name, description, System.getProperty("user.name"))));
            log.log(Level.INFO, "allocated slot {0} for {1} ({2})", new Object[] {slot.index(), oid, name});
        }
        return factory.apply(slot.index());
    }

    @Override
    public String toString() {
        return "Database{" + client.config().baseUrl() + (readOnly ? ", read-only" : "") + '}';
    }
}
