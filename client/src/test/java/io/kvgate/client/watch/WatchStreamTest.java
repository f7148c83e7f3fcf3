// file: client/src/test/java/io/kvgate/client/watch/WatchStreamTest.java
package io.kvgate.client.watch;

import io.kvgate.client.ClientConfig;
import io.kvgate.client.Endpoints;
import io.kvgate.client.KvClient;
import io.kvgate.client.ScriptedGateway;
import io.kvgate.client.WireCodec;
import io.kvgate.core.Bytes;
import io.kvgate.core.KeyRange;
import io.kvgate.core.KeyValue;
import io.kvgate.core.WatchTerminatedException;
import io.kvgate.testkit.InMemoryGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Focus: streaming watch delivery, cancellation and termination.
 */
class WatchStreamTest {

    private InMemoryGateway gateway;
    private KvClient client;

    @BeforeEach
    void start() {
        gateway = new InMemoryGateway().start();
        client = new KvClient(ClientConfig.of(gateway.baseUrl()));
    }

    @AfterEach
    void stop() {
        client.close();
        gateway.close();
    }

    private static void await(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("timed out waiting for " + what);
            }
            Thread.sleep(10);
        }
    }

    /** STREAMING means the server has answered, so the watcher is registered. */
    private static WatchHandle streaming(WatchHandle h) throws InterruptedException {
        await(() -> h.state() == WatchState.STREAMING, "watch to start streaming");
        return h;
    }

    @Test
    void prefix_watch_sees_matching_put_once_and_nothing_after_cancel() throws Exception {
        List<KeyValue> seen = new CopyOnWriteArrayList<>();
        WatchHandle h = streaming(client.watch(List.of(KeyRange.prefix(Bytes.utf8("k/"))), seen::add));

        client.set(Bytes.utf8("other"), Bytes.utf8("ignored"));
        client.set(Bytes.utf8("k/a"), Bytes.utf8("1"));
        await(() -> seen.size() == 1, "one event");
        assertArrayEquals(Bytes.utf8("k/a"), seen.get(0).key());
        assertArrayEquals(Bytes.utf8("1"), seen.get(0).value());

        h.cancel();
        assertEquals(WatchState.CANCELLED, h.state());
        h.termination().get(2, TimeUnit.SECONDS);

        client.set(Bytes.utf8("k/b"), Bytes.utf8("2"));
        Thread.sleep(200);
        assertEquals(1, seen.size(), "no callbacks after cancel");
    }

    @Test
    void several_ranges_share_one_stream_and_deletes_are_typed() throws Exception {
        List<WatchEvent> events = new CopyOnWriteArrayList<>();
        WatchHandle h = streaming(client.watch(
                List.of(KeyRange.single(Bytes.utf8("a")), KeyRange.single(Bytes.utf8("b"))),
                WatchOptions.builder().prevKv(true).build(),
                events::add));

        client.set(Bytes.utf8("a"), Bytes.utf8("1"));
        client.set(Bytes.utf8("b"), Bytes.utf8("2"));
        client.delete(Bytes.utf8("a"));
        await(() -> events.size() == 3, "three events");

        assertEquals(WatchEvent.Type.PUT, events.get(0).type());
        assertEquals(WatchEvent.Type.PUT, events.get(1).type());
        assertEquals(WatchEvent.Type.DELETE, events.get(2).type());
        assertArrayEquals(Bytes.utf8("1"), events.get(2).previous().value());
        assertEquals(1, client.stats().watchesOpened());
        h.cancel();
    }

    @Test
    void start_revision_replays_history() throws Exception {
        client.set(Bytes.utf8("h"), Bytes.utf8("old"));
        long rev = client.set(Bytes.utf8("h"), Bytes.utf8("new")).header().revision();

        List<WatchEvent> events = new CopyOnWriteArrayList<>();
        WatchHandle h = client.watch(List.of(KeyRange.single(Bytes.utf8("h"))),
                WatchOptions.builder().startRevision(rev).build(), events::add);
        await(() -> events.size() == 1, "replayed event");
        assertArrayEquals(Bytes.utf8("new"), events.get(0).kv().value());
        h.cancel();
    }

    @Test
    void remote_close_terminates_exceptionally() throws Exception {
        WatchHandle h = streaming(client.watch(List.of(KeyRange.all()), kv -> { }));

        gateway.closeWatches();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> h.termination().get(5, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof WatchTerminatedException);
        assertEquals(WatchState.CLOSED, h.state());
    }

    @Test
    void callback_exception_does_not_stop_delivery() throws Exception {
        List<KeyValue> seen = new CopyOnWriteArrayList<>();
        WatchHandle h = streaming(client.watch(List.of(KeyRange.prefix(Bytes.utf8("x/"))), kv -> {
            seen.add(kv);
            if (seen.size() == 1) {
                throw new IllegalStateException("boom");
            }
        }));

        client.set(Bytes.utf8("x/1"), Bytes.utf8("1"));
        client.set(Bytes.utf8("x/2"), Bytes.utf8("2"));
        await(() -> seen.size() == 2, "both events despite the failing callback");
        assertFalse(h.state().isTerminal());
        h.cancel();
    }

    @Test
    void empty_range_list_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> client.watch(List.of(), kv -> { }));
    }

    @Test
    void cancel_twice_is_harmless() throws Exception {
        WatchHandle h = streaming(client.watch(List.of(KeyRange.prefix(Bytes.utf8("k/"))), kv -> { }));

        h.cancel();
        h.cancel();
        assertEquals(WatchState.CANCELLED, h.state());
        assertNull(h.termination().get(2, TimeUnit.SECONDS));
        assertFalse(h.termination().isCompletedExceptionally());
    }

    private static String putEvent(String key, String value, long revision) {
        return "{\"result\":{\"header\":{\"revision\":\"" + revision + "\"},\"events\":[{\"kv\":{"
                + "\"key\":\"" + WireCodec.b64(Bytes.utf8(key)) + "\","
                + "\"value\":\"" + WireCodec.b64(Bytes.utf8(value)) + "\","
                + "\"mod_revision\":\"" + revision + "\"}}]}}";
    }

    @Test
    void malformed_messages_are_skipped_and_the_stream_stays_open() throws Exception {
        String lines = "not json\n{\"no_result\":1}\n" + putEvent("k/a", "1", 2) + "\n";
        try (ScriptedGateway scripted = new ScriptedGateway().stream(Endpoints.WATCH, lines).start();
             KvClient other = new KvClient(ClientConfig.of(scripted.baseUrl()))) {
            List<KeyValue> seen = new CopyOnWriteArrayList<>();
            WatchHandle h = other.watch(List.of(KeyRange.prefix(Bytes.utf8("k/"))), seen::add);

            await(() -> seen.size() == 1, "the one valid event");
            Thread.sleep(100);
            assertEquals(1, seen.size());
            assertArrayEquals(Bytes.utf8("k/a"), seen.get(0).key());
            assertEquals(WatchState.STREAMING, h.state());
            h.cancel();
        }
    }

    @Test
    void cancel_from_a_callback_stops_later_deliveries() throws Exception {
        String lines = putEvent("k/a", "1", 2) + "\n" + putEvent("k/b", "2", 3) + "\n" + putEvent("k/c", "3", 4) + "\n";
        try (ScriptedGateway scripted = new ScriptedGateway().stream(Endpoints.WATCH, lines).start();
             KvClient other = new KvClient(ClientConfig.of(scripted.baseUrl()))) {
            List<KeyValue> seen = new CopyOnWriteArrayList<>();
            WatchHandle[] handle = new WatchHandle[1];
            CountDownLatch opened = new CountDownLatch(1);
            handle[0] = other.watch(List.of(KeyRange.prefix(Bytes.utf8("k/"))), kv -> {
                try {
                    opened.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                seen.add(kv);
                handle[0].cancel();
            });
            opened.countDown();

            handle[0].termination().get(2, TimeUnit.SECONDS);
            Thread.sleep(100);
            assertEquals(1, seen.size());
            assertEquals(WatchState.CANCELLED, handle[0].state());
        }
    }
}
