// file: testkit/src/main/java/io/kvgate/testkit/InMemoryGateway.java
package io.kvgate.testkit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Undertow server speaking the subset of the v3 JSON gateway the client uses,
 * backed by an in-memory store. Test tooling only.
 *
 * Path layout (all POST, relative to the API prefix):
 *   /maintenance/status
 *   /kv/put  /kv/range  /kv/deleterange  /kv/txn
 *   /lease/grant  /lease/keepalive  /kv/lease/revoke  /kv/lease/timetolive
 *   /watch   (streaming, newline-delimited JSON)
 *
 * Errors are answered as {"error": msg, "code": n, "message": msg} with the
 * HTTP status the real gateway uses for that code.
 */
public final class InMemoryGateway implements AutoCloseable {
    private static final Logger log = Logger.getLogger(InMemoryGateway.class.getName());
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final ObjectMapper json = new ObjectMapper();
    private final String apiPrefix;
    private final MemoryStore store;
    private final Undertow server;
    private final ScheduledExecutorService reaper;
    private final Map<String, AtomicLong> requests = new ConcurrentHashMap<>();
    private final Map<String, Function<JsonNode, JsonNode>> routes;
    private volatile boolean stopped;
    private int port;

    public InMemoryGateway() {
        this("/v3alpha");
    }

    public InMemoryGateway(String apiPrefix) {
        this.apiPrefix = apiPrefix;
        this.store = new MemoryStore(json, System::currentTimeMillis);
        this.routes = Map.of(
                "/maintenance/status", req -> store.status(),
                "/kv/put", store::put,
                "/kv/range", store::range,
                "/kv/deleterange", store::deleteRange,
                "/kv/txn", store::txn,
                "/lease/grant", store::leaseGrant,
                "/lease/keepalive", store::leaseKeepAlive,
                "/kv/lease/revoke", store::leaseRevoke,
                "/kv/lease/timetolive", store::leaseTimeToLive
        );
        this.server = Undertow.builder()
                .addHttpListener(0, "127.0.0.1")
                .setWorkerThreads(32)
                .setHandler(exchange -> {
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(this::handle);
                        return;
                    }
                    handle(exchange);
                }).build();
        this.reaper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-lease-reaper");
            t.setDaemon(true);
            return t;
        });
    }

    public InMemoryGateway start() {
        server.start();
        port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
        reaper.scheduleWithFixedDelay(store::expireLeases, 50, 50, TimeUnit.MILLISECONDS);
        return this;
    }

    /** e.g. http://127.0.0.1:41234 */
    public String baseUrl() {
        return "http://127.0.0.1:" + port;
    }

    public String apiPrefix() {
        return apiPrefix;
    }

    // ---------- test introspection ----------

    /** Requests received on {@code path} (relative to the API prefix). */
    public long requestCount(String path) {
        AtomicLong c = requests.get(path);
        return c == null ? 0 : c.get();
    }

    public Map<String, Long> requestCounts() {
        Map<String, Long> out = new TreeMap<>();
        requests.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    public long revision() {
        return store.revision();
    }

    public int keyCount() {
        return store.size();
    }

    /** Current value of {@code key}, read directly without HTTP; null if absent. */
    public byte[] peek(byte[] key) {
        return store.value(key);
    }

    public List<byte[]> keys() {
        return store.keys();
    }

    /** End every open watch stream from the server side. */
    public void closeWatches() {
        store.closeAllWatches();
    }

    @Override
    public void close() {
        stopped = true;
        store.closeAllWatches();
        reaper.shutdownNow();
        server.stop();
    }

    // ---------- handlers ----------

    private void handle(HttpServerExchange ex) {
        long start = System.nanoTime();
        String path = ex.getRequestPath();
        String route = path.startsWith(apiPrefix) ? path.substring(apiPrefix.length()) : path;
        int status = 200;
        Throwable error = null;
        requests.computeIfAbsent(route, r -> new AtomicLong()).incrementAndGet();

        ex.startBlocking();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        try {
            if (!"POST".equals(ex.getRequestMethod().toString())) {
                status = 405;
                send(ex, status, Map.of("error", "method not allowed", "code", 12, "message", "method not allowed"));
                return;
            }
            byte[] body = ex.getInputStream().readNBytes(MAX_BODY_BYTES + 1);
            if (body.length > MAX_BODY_BYTES) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large", "code", 8, "message", "request body too large"));
                return;
            }
            if ("/watch".equals(route)) {
                streamWatch(ex, body);
                return;
            }
            Function<JsonNode, JsonNode> op = routes.get(route);
            if (op == null) {
                status = 404;
                send(ex, status, Map.of("error", "Not Found", "code", 5, "message", "Not Found"));
                return;
            }
            JsonNode req = body.length == 0 ? json.createObjectNode() : json.readTree(body);
            send(ex, status, op.apply(req));
        } catch (GatewayError e) {
            status = e.httpStatus();
            send(ex, status, Map.of("error", e.getMessage(), "code", e.code(), "message", e.getMessage()));
        } catch (JsonProcessingException e) {
            status = 400;
            error = e;
            send(ex, status, Map.of("error", "invalid JSON", "code", 3, "message", "invalid JSON"));
        } catch (Exception e) {
            status = 500;
            error = e;
            String msg = String.valueOf(e.getMessage());
            send(ex, status, Map.of("error", msg, "code", 13, "message", msg));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            if (error != null) {
                log.log(Level.WARNING, "POST " + path + " -> " + status + " (total=" + totalMs + "ms)", error);
            } else {
                log.log(Level.FINE, "POST {0} -> {1} (total={2}ms)", new Object[] {path, status, totalMs});
            }
        }
    }

    /**
     * Holds the exchange open and writes one JSON line per message until the
     * client goes away or the watch is closed from this side.
     */
    private void streamWatch(HttpServerExchange ex, byte[] body) throws IOException {
        MemoryStore.WatchSession session = store.openWatch(store.parseLines(body));
        ex.setStatusCode(200);
        OutputStream out = ex.getOutputStream();
        try {
            while (!session.closed && !stopped) {
                String line = session.lines.poll(50, TimeUnit.MILLISECONDS);
                if (line != null) {
                    out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
                    out.flush();
                }
            }
            // drain what was queued before the close
            String line;
            while ((line = session.lines.poll()) != null) {
                out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            }
            out.flush();
        } catch (IOException e) {
            log.log(Level.FINE, "watch client went away: {0}", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            store.closeWatch(session);
        }
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\",\"code\":13}");
        }
    }
}
