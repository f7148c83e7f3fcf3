// file: client/src/main/java/io/kvgate/client/KvClient.java
package io.kvgate.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kvgate.client.watch.WatchEvent;
import io.kvgate.client.watch.WatchHandle;
import io.kvgate.client.watch.WatchOptions;
import io.kvgate.client.watch.WatchStream;
import io.kvgate.core.Deleted;
import io.kvgate.core.GatewayException;
import io.kvgate.core.GetOptions;
import io.kvgate.core.KeyRange;
import io.kvgate.core.KeyValue;
import io.kvgate.core.ProtocolException;
import io.kvgate.core.Range;
import io.kvgate.core.Revision;
import io.kvgate.core.Status;
import io.kvgate.core.StoreException;
import io.kvgate.core.Transaction;
import io.kvgate.core.TxnOutcome;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Client for the store's v3 HTTP/JSON gateway.
 *
 * Every call is one POST with a JSON body, answered by one JSON body
 * (watch keeps its response open and streams). All methods are thread-safe
 * and share one {@link HttpClient} connection pool.
 *
 * Failures:
 *  - invalid arguments: IllegalArgumentException / NullPointerException before any I/O,
 *  - error body from the gateway: {@link StoreException},
 *  - unreadable body or unexpected status: {@link ProtocolException},
 *  - transport: {@link GatewayException}.
 * Nothing is retried.
 */
public final class KvClient implements AutoCloseable {

    private static final AtomicInteger THREADS = new AtomicInteger();

    private final ClientConfig config;
    private final ClientStats stats;
    private final WireCodec codec;
    private final ExecutorService executor;
    private final HttpClient http;

    public KvClient(ClientConfig config) {
        this(config, new ClientStats());
    }

    public KvClient(ClientConfig config, ClientStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.codec = new WireCodec();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "kvgate-http-" + THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        // the gateway speaks plain HTTP/1.1; h2c upgrade would break streaming watches
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.connectTimeout())
                .executor(executor)
                .build();
    }

    public ClientConfig config() {
        return config;
    }

    public ClientStats stats() {
        return stats;
    }

    WireCodec codec() {
        return codec;
    }

    // ---------- maintenance ----------

    public Status status() {
        return status(null);
    }

    public Status status(Duration timeout) {
        return codec.status(post(Endpoints.STATUS, codec.empty(), timeout));
    }

    // ---------- kv ----------

    public Range get(byte[] key) {
        return get(KeyRange.single(key), GetOptions.DEFAULT, null);
    }

    public Range get(KeyRange range) {
        return get(range, GetOptions.DEFAULT, null);
    }

    public Range get(KeyRange range, GetOptions options) {
        return get(range, options, null);
    }

    public Range get(KeyRange range, GetOptions options, Duration timeout) {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(options, "options");
        return codec.range(post(Endpoints.RANGE, codec.rangeRequest(range, options), timeout));
    }

    /** Value of a single key, or null if absent. */
    public byte[] getValue(byte[] key) {
        KeyValue kv = get(key).first();
        return kv == null ? null : kv.value();
    }

    public Revision set(byte[] key, byte[] value) {
        return set(key, value, null, false, null);
    }

    public Revision set(byte[] key, byte[] value, Lease lease) {
        return set(key, value, lease, false, null);
    }

    /**
     * Put one key.
     *
     * @param lease          lease to attach the key to, or null
     * @param returnPrevious include the overwritten key-value in the result
     */
    public Revision set(byte[] key, byte[] value, Lease lease, boolean returnPrevious, Duration timeout) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long leaseId = lease == null ? 0L : lease.leaseId();
        return codec.revision(post(Endpoints.PUT, codec.putRequest(key, value, leaseId, returnPrevious), timeout));
    }

    public Deleted delete(byte[] key) {
        return delete(KeyRange.single(key), false, null);
    }

    public Deleted delete(KeyRange range) {
        return delete(range, false, null);
    }

    public Deleted delete(KeyRange range, boolean returnPrevious) {
        return delete(range, returnPrevious, null);
    }

    public Deleted delete(KeyRange range, boolean returnPrevious, Duration timeout) {
        Objects.requireNonNull(range, "range");
        return codec.deleted(post(Endpoints.DELETE_RANGE, codec.deleteRequest(range, returnPrevious), timeout));
    }

    // ---------- transactions ----------

    public TxnOutcome submit(Transaction txn) {
        return submit(txn, null);
    }

    /**
     * Submit a guarded transaction. Returns {@link TxnOutcome.Success} with the
     * success-branch responses or {@link TxnOutcome.Failed} with the failure-branch
     * responses; a failed guard is not an exception.
     */
    public TxnOutcome submit(Transaction txn, Duration timeout) {
        Objects.requireNonNull(txn, "txn");
        return codec.txnOutcome(post(Endpoints.TXN, codec.txnRequest(txn), timeout));
    }

    // ---------- leases ----------

    public Lease lease(long ttlSeconds) {
        return lease(ttlSeconds, 0L, null);
    }

    public Lease lease(long ttlSeconds, long leaseId) {
        return lease(ttlSeconds, leaseId, null);
    }

    /**
     * Grant a lease.
     *
     * @param ttlSeconds advisory time-to-live, at least 1
     * @param leaseId    requested id, 0 to let the store choose
     */
    public Lease lease(long ttlSeconds, long leaseId, Duration timeout) {
        if (ttlSeconds < 1) {
            throw new IllegalArgumentException("time to live must be >= 1 second, was " + ttlSeconds);
        }
        JsonNode resp = post(Endpoints.LEASE_GRANT, codec.leaseGrantRequest(ttlSeconds, leaseId), timeout);
        long id = WireCodec.longField(resp, "ID");
        long ttl = WireCodec.longField(resp, "TTL");
        if (id == 0) {
            throw new ProtocolException("lease grant response without ID: " + resp);
        }
        return new Lease(this, id, ttl, codec.header(resp.get("header")));
    }

    // ---------- watch ----------

    /** Watch ranges and receive each changed key-value. */
    public WatchHandle watch(List<KeyRange> ranges, Consumer<KeyValue> callback) {
        Objects.requireNonNull(callback, "callback");
        return watch(ranges, WatchOptions.DEFAULT, event -> callback.accept(event.kv()));
    }

    /**
     * Open one streaming request watching every range in {@code ranges}.
     * Events are delivered in server order on a dedicated thread; see {@link WatchStream}.
     */
    public WatchHandle watch(List<KeyRange> ranges, WatchOptions options, Consumer<WatchEvent> callback) {
        Objects.requireNonNull(ranges, "ranges");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(callback, "callback");
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("at least one range must be watched");
        }
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        for (int i = 0; i < ranges.size(); i++) {
            if (i > 0) {
                body.write('\n');
            }
            body.writeBytes(codec.toBytes(codec.watchCreateRequest(Objects.requireNonNull(ranges.get(i)), options)));
        }
        stats.recordPost(Endpoints.WATCH);
        stats.recordWatchOpened();
        WatchStream stream = new WatchStream(http, config.endpoint(Endpoints.WATCH), body.toByteArray(),
                options, callback, codec);
        return stream.open();
    }

    // ---------- transport ----------

    /**
     * POST a JSON body and return the parsed, error-checked response.
     * Wraps IOException / InterruptedException exactly once.
     */
    JsonNode post(String endpoint, ObjectNode body, Duration timeout) {
        HttpRequest.Builder b = HttpRequest.newBuilder(config.endpoint(endpoint))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(codec.toBytes(body)));
        Duration effective = timeout != null ? timeout : config.requestTimeout();
        if (effective != null) {
            b.timeout(effective);
        }

        long start = System.nanoTime();
        int status = -1;
        RuntimeException error = null;
        stats.recordPost(endpoint);
        try {
            HttpResponse<byte[]> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofByteArray());
            status = resp.statusCode();
            return decode(endpoint, status, resp.body());
        } catch (IOException e) {
            error = new GatewayException("POST " + endpoint + " failed: " + e.getMessage(), e);
            throw error;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = new GatewayException("POST " + endpoint + " interrupted", e);
            throw error;
        } catch (RuntimeException e) {
            error = e;
            throw e;
        } finally {
            if (error != null) {
                stats.recordFailure();
            }
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(endpoint, status, totalMs, error);
        }
    }

    private JsonNode decode(String endpoint, int status, byte[] body) {
        if (status == 200) {
            return codec.parse(body);
        }
        // error statuses normally carry a structured body, which parse() raises as StoreException
        JsonNode node;
        try {
            node = codec.parse(body);
        } catch (ProtocolException e) {
            throw new ProtocolException("POST " + endpoint + " returned HTTP " + status, e);
        }
        throw new ProtocolException("POST " + endpoint + " returned HTTP " + status + ": " + node);
    }

    /** Releases the HTTP worker threads. Open watches should be cancelled first. */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
