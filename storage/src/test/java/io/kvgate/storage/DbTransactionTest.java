// file: storage/src/test/java/io/kvgate/storage/DbTransactionTest.java
package io.kvgate.storage;

import io.kvgate.client.ClientConfig;
import io.kvgate.client.Endpoints;
import io.kvgate.client.KvClient;
import io.kvgate.core.Bytes;
import io.kvgate.core.KeyValue;
import io.kvgate.testkit.InMemoryGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Focus: buffering, conflict detection and lifecycle of optimistic transactions.
 */
class DbTransactionTest {

    private InMemoryGateway gateway;
    private KvClient client;
    private Database db;

    @BeforeEach
    void start() {
        gateway = new InMemoryGateway().start();
        client = new KvClient(ClientConfig.of(gateway.baseUrl()));
        db = new Database(client);
    }

    @AfterEach
    void stop() {
        client.close();
        gateway.close();
    }

    private static byte[] b(String s) {
        return Bytes.utf8(s);
    }

    @Test
    void writes_stay_local_until_commit() {
        DbTransaction txn = db.begin(true).open();
        txn.put(b("k"), b("v"));
        assertEquals(1, txn.pending());
        assertNull(gateway.peek(b("k")));

        txn.commit();
        assertEquals(DbTransaction.State.COMMITTED, txn.state());
        assertArrayEquals(b("v"), gateway.peek(b("k")));
        assertEquals(gateway.revision(), txn.committedRevision().getAsLong());
        assertEquals(1, gateway.requestCount(Endpoints.TXN));
    }

    @Test
    void reads_see_own_buffered_writes() {
        client.set(b("k"), b("stored"));
        DbTransaction txn = db.begin(true).open();
        assertArrayEquals(b("stored"), txn.get(b("k")));

        txn.put(b("k"), b("mine"));
        long ranges = gateway.requestCount(Endpoints.RANGE);
        assertArrayEquals(b("mine"), txn.get(b("k")));
        txn.delete(b("k"));
        assertNull(txn.get(b("k")));
        assertEquals(ranges, gateway.requestCount(Endpoints.RANGE), "buffered keys are served locally");
        txn.rollback();
    }

    @Test
    void range_and_count_merge_the_buffer() {
        client.set(b("a"), b("1"));
        client.set(b("b"), b("2"));
        client.set(b("c"), b("3"));

        DbTransaction txn = db.begin(true).open();
        txn.delete(b("b"));
        txn.put(b("bb"), b("new"));
        txn.put(b("z"), b("outside"));

        List<KeyValue> kvs = txn.range(b("a"), b("d"), false);
        assertEquals(List.of("a", "bb", "c"), kvs.stream().map(kv -> new String(kv.key())).toList());
        assertArrayEquals(b("new"), kvs.get(1).value());
        assertEquals(3, txn.count(b("a"), b("d")));
        assertEquals(1, txn.count(b("d"), b("zz")));
        txn.rollback();
    }

    @Test
    void commit_conflicts_when_a_read_key_changed() {
        client.set(b("counter"), b("0"));
        DbTransaction txn = db.begin(true).open();
        assertArrayEquals(b("0"), txn.get(b("counter")));

        client.set(b("counter"), b("5"));
        txn.put(b("counter"), b("1"));
        TransactionConflictException e = assertThrows(TransactionConflictException.class, txn::commit);
        assertEquals(txn.baseRevision(), e.baseRevision());
        assertEquals(gateway.revision(), e.currentRevision());
        assertEquals(DbTransaction.State.CONFLICTED, txn.state());
        assertArrayEquals(b("5"), gateway.peek(b("counter")));
        assertTrue(txn.committedRevision().isEmpty());
    }

    @Test
    void read_only_keys_are_part_of_the_guard() {
        client.set(b("a"), b("1"));
        client.set(b("b"), b("1"));
        DbTransaction txn = db.begin(true).open();
        txn.range(b("a"), b("c"), true);

        client.set(b("b"), b("2"));
        txn.put(b("x"), b("derived"));
        assertThrows(TransactionConflictException.class, txn::commit);
        assertNull(gateway.peek(b("x")));
    }

    @Test
    void absent_key_created_by_someone_else_conflicts() {
        DbTransaction txn = db.begin(true).open();
        assertNull(txn.get(b("fresh")));

        client.set(b("fresh"), b("theirs"));
        txn.put(b("fresh"), b("mine"));
        assertThrows(TransactionConflictException.class, txn::commit);
        assertArrayEquals(b("theirs"), gateway.peek(b("fresh")));
    }

    @Test
    void blind_write_conflicts_only_with_changes_after_open() {
        client.set(b("old"), b("1"));
        DbTransaction ok = db.begin(true).open();
        ok.put(b("old"), b("2"));
        ok.commit();
        assertArrayEquals(b("2"), gateway.peek(b("old")));

        DbTransaction late = db.begin(true).open();
        client.set(b("old"), b("3"));
        late.put(b("old"), b("4"));
        assertThrows(TransactionConflictException.class, late::commit);
        assertArrayEquals(b("3"), gateway.peek(b("old")));
    }

    @Test
    void second_of_two_racing_transactions_loses() {
        client.set(b("counter"), b("0"));
        DbTransaction t1 = db.begin(true).open();
        DbTransaction t2 = db.begin(true).open();
        t1.get(b("counter"));
        t2.get(b("counter"));

        t1.put(b("counter"), b("1"));
        t2.put(b("counter"), b("1"));
        t1.commit();
        assertThrows(TransactionConflictException.class, t2::commit);
        assertArrayEquals(b("1"), gateway.peek(b("counter")));
        assertEquals(3, gateway.revision());
    }

    @Test
    void rollback_never_contacts_the_store() {
        DbTransaction txn = db.begin(true).open();
        long posts = client.stats().totalPosts();
        txn.put(b("k"), b("v"));
        txn.delete(b("other"));
        txn.rollback();

        assertEquals(DbTransaction.State.ROLLED_BACK, txn.state());
        assertEquals(posts, client.stats().totalPosts());
        assertEquals(0, gateway.requestCount(Endpoints.TXN));
        assertEquals(0, gateway.keyCount());
    }

    @Test
    void empty_commit_sends_nothing() {
        client.set(b("k"), b("v"));
        DbTransaction txn = db.begin(false).open();
        txn.get(b("k"));
        txn.commit();

        assertEquals(DbTransaction.State.COMMITTED, txn.state());
        assertTrue(txn.committedRevision().isEmpty());
        assertEquals(0, gateway.requestCount(Endpoints.TXN));
    }

    @Test
    void transaction_is_single_use() {
        DbTransaction txn = db.begin(true);
        assertThrows(IllegalStateException.class, () -> txn.get(b("k")), "not opened");
        assertThrows(IllegalStateException.class, txn::baseRevision);

        txn.open();
        assertThrows(IllegalStateException.class, txn::open);
        txn.put(b("k"), b("v"));
        txn.commit();

        assertThrows(IllegalStateException.class, txn::commit);
        assertThrows(IllegalStateException.class, txn::rollback);
        assertThrows(IllegalStateException.class, () -> txn.put(b("k"), b("again")));
        txn.close();
        assertEquals(DbTransaction.State.COMMITTED, txn.state());
    }

    @Test
    void close_rolls_back_an_open_transaction() {
        DbTransaction kept;
        try (DbTransaction txn = db.begin(true).open()) {
            txn.put(b("k"), b("v"));
            kept = txn;
        }
        assertEquals(DbTransaction.State.ROLLED_BACK, kept.state());
        assertEquals(0, gateway.keyCount());
    }

    @Test
    void read_only_transaction_rejects_writes() {
        DbTransaction txn = db.begin(false).open();
        assertFalse(txn.isWrite());
        assertThrows(IllegalStateException.class, () -> txn.put(b("k"), b("v")));
        assertThrows(IllegalStateException.class, () -> txn.delete(b("k")));
        txn.rollback();
    }

    @Test
    void stats_count_buffered_writes() {
        TransactionStats stats = new TransactionStats();
        DbTransaction txn = db.begin(true, stats, null).open();
        txn.put(b("a"), b("1"));
        txn.put(b("b"), b("2"));
        txn.delete(b("c"));
        txn.commit();

        assertEquals(2, stats.puts());
        assertEquals(1, stats.dels());
        assertFalse(stats.duration().isNegative());

        stats.reset();
        assertEquals(0, stats.puts());
        assertEquals(0, stats.dels());
    }

    @Test
    void scoped_helper_commits_or_rolls_back() {
        db.runInTransaction(true, txn -> txn.put(b("a"), b("1")));
        assertArrayEquals(b("1"), gateway.peek(b("a")));

        IllegalStateException boom = assertThrows(IllegalStateException.class,
                () -> db.runInTransaction(true, txn -> {
                    txn.put(b("b"), b("2"));
                    throw new IllegalStateException("boom");
                }));
        assertEquals("boom", boom.getMessage());
        assertNull(gateway.peek(b("b")));
        assertEquals(1, gateway.requestCount(Endpoints.TXN));

        byte[] read = db.callInTransaction(false, txn -> txn.get(b("a")));
        assertArrayEquals(b("1"), read);
    }
}
