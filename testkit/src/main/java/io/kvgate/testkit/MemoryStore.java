// file: testkit/src/main/java/io/kvgate/testkit/MemoryStore.java
package io.kvgate.testkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kvgate.core.Bytes;
import io.kvgate.core.KeyRange;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.LongSupplier;

/**
 * Single-node, in-memory model of the store behind the gateway.
 *
 * State:
 *  - sorted keyspace (unsigned byte order) with per-key version / create / mod revisions,
 *  - a global revision, starting at 1 and bumped once per mutating request,
 *  - leases with wall-clock deadlines; expiry deletes the attached keys,
 *  - an event history and the registered watchers.
 *
 * Every public method is synchronized: requests are applied one at a time,
 * which gives the same atomicity a real store gives a single request.
 * Requests and responses are JSON trees in the gateway's wire shape.
 */
final class MemoryStore {
    static final long CLUSTER_ID = 0x1c2d3e4f5a6b7c8dL;
    static final long MEMBER_ID = 0x8a9b0c1d2e3f4a5bL;
    static final long RAFT_TERM = 2;

    private static final Base64.Encoder B64 = Base64.getEncoder();
    private static final Base64.Decoder B64D = Base64.getDecoder();

    private record Entry(byte[] value, long version, long createRevision, long modRevision, long lease) {
    }

    private record Event(boolean delete, byte[] key, Entry kv, Entry prev) {
    }

    private record Committed(long revision, List<Event> events) {
    }

    private static final class LeaseState {
        final long id;
        final long grantedTtl;
        long deadlineMillis;
        final TreeSet<byte[]> keys = new TreeSet<>(Bytes::compare);

        LeaseState(long id, long grantedTtl, long deadlineMillis) {
            this.id = id;
            this.grantedTtl = grantedTtl;
            this.deadlineMillis = deadlineMillis;
        }
    }

    /** One create_request of a watch stream. */
    private record Watcher(long id, KeyRange range, boolean prevKv, boolean noPut, boolean noDelete,
                           WatchSession session) {
    }

    /** Outgoing lines of one streaming watch response. */
    static final class WatchSession {
        final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
        volatile boolean closed;
    }

    private final ObjectMapper json;
    private final LongSupplier clock;
    private final NavigableMap<byte[], Entry> data = new TreeMap<>(Bytes::compare);
    private final Map<Long, LeaseState> leases = new HashMap<>();
    private final List<Watcher> watchers = new ArrayList<>();
    private final List<Committed> history = new ArrayList<>();
    private long revision = 1;
    private long nextLeaseId = 0x694d7a1b2c3d0001L;
    private long nextWatchId = 1;

    MemoryStore(ObjectMapper json, LongSupplier clock) {
        this.json = json;
        this.clock = clock;
    }

    // ---------- introspection for tests ----------

    synchronized long revision() {
        return revision;
    }

    synchronized int size() {
        return data.size();
    }

    synchronized byte[] value(byte[] key) {
        Entry e = data.get(key);
        return e == null ? null : Arrays.copyOf(e.value, e.value.length);
    }

    synchronized List<byte[]> keys() {
        return new ArrayList<>(data.keySet());
    }

    // ---------- maintenance ----------

    synchronized ObjectNode status() {
        long size = 0;
        for (Map.Entry<byte[], Entry> e : data.entrySet()) {
            size += e.getKey().length + e.getValue().value.length;
        }
        ObjectNode n = json.createObjectNode();
        n.set("header", header());
        n.put("version", "3.5.0");
        n.put("dbSize", Long.toString(size));
        n.put("leader", Long.toUnsignedString(MEMBER_ID));
        n.put("raftIndex", Long.toString(revision));
        n.put("raftTerm", Long.toString(RAFT_TERM));
        return n;
    }

    // ---------- kv ----------

    synchronized ObjectNode put(JsonNode req) {
        expireLeases();
        checkLease(req);
        List<Event> events = new ArrayList<>();
        ObjectNode resp = applyPut(req, revision + 1, events);
        commit(revision + 1, events);
        resp.set("header", header());
        return resp;
    }

    synchronized ObjectNode range(JsonNode req) {
        expireLeases();
        ObjectNode resp = applyRange(req);
        resp.set("header", header());
        return resp;
    }

    synchronized ObjectNode deleteRange(JsonNode req) {
        expireLeases();
        List<Event> events = new ArrayList<>();
        ObjectNode resp = applyDelete(req, revision + 1, events);
        if (!events.isEmpty()) {
            commit(revision + 1, events);
        }
        resp.set("header", header());
        return resp;
    }

    /**
     * Evaluate the guard, then apply one branch at a single new revision.
     * Both branches are checked for duplicate keys up front.
     */
    synchronized ObjectNode txn(JsonNode req) {
        expireLeases();
        checkBranch(req.path("success"));
        checkBranch(req.path("failure"));

        boolean succeeded = true;
        for (JsonNode cmp : req.path("compare")) {
            if (!evaluate(cmp)) {
                succeeded = false;
                break;
            }
        }
        JsonNode ops = req.path(succeeded ? "success" : "failure");
        for (JsonNode op : ops) {
            if (op.has("request_put")) {
                checkLease(op.get("request_put"));
            }
        }

        long next = revision + 1;
        List<Event> events = new ArrayList<>();
        List<ObjectNode> bodies = new ArrayList<>();
        ArrayNode responses = json.createArrayNode();
        for (JsonNode op : ops) {
            ObjectNode item = json.createObjectNode();
            ObjectNode body;
            if (op.has("request_range")) {
                body = applyRange(op.get("request_range"));
                item.set("response_range", body);
            } else if (op.has("request_put")) {
                body = applyPut(op.get("request_put"), next, events);
                item.set("response_put", body);
            } else if (op.has("request_delete_range")) {
                body = applyDelete(op.get("request_delete_range"), next, events);
                item.set("response_delete_range", body);
            } else {
                throw new GatewayError(GatewayError.INVALID_ARGUMENT, "unsupported txn request item: " + op);
            }
            bodies.add(body);
            responses.add(item);
        }
        if (!events.isEmpty()) {
            commit(next, events);
        }
        for (ObjectNode body : bodies) {
            body.set("header", header());
        }

        ObjectNode resp = json.createObjectNode();
        resp.set("header", header());
        if (succeeded) {
            resp.put("succeeded", true);
        }
        if (!responses.isEmpty()) {
            resp.set("responses", responses);
        }
        return resp;
    }

    private ObjectNode applyPut(JsonNode req, long rev, List<Event> events) {
        byte[] key = bytes(req, "key");
        if (key.length == 0) {
            throw new GatewayError(GatewayError.INVALID_ARGUMENT, "etcdserver: key is not provided");
        }
        byte[] value = bytes(req, "value");
        long lease = number(req, "lease");
        Entry prev = data.get(key);
        Entry next = prev == null
                ? new Entry(value, 1, rev, rev, lease)
                : new Entry(value, prev.version + 1, prev.createRevision, rev, lease);
        data.put(key, next);
        if (prev != null && prev.lease != 0 && prev.lease != lease) {
            LeaseState old = leases.get(prev.lease);
            if (old != null) {
                old.keys.remove(key);
            }
        }
        if (lease != 0) {
            leases.get(lease).keys.add(key);
        }
        events.add(new Event(false, key, next, prev));

        ObjectNode resp = json.createObjectNode();
        if (req.path("prev_kv").asBoolean(false) && prev != null) {
            resp.set("prev_kv", kv(key, prev, false));
        }
        return resp;
    }

    private ObjectNode applyRange(JsonNode req) {
        long atRevision = number(req, "revision");
        if (atRevision > revision) {
            throw new GatewayError(GatewayError.OUT_OF_RANGE, "etcdserver: mvcc: required revision is a future revision");
        }
        if (atRevision > 0 && atRevision < revision) {
            throw new GatewayError(GatewayError.OUT_OF_RANGE, "etcdserver: historical reads are not kept by this store");
        }
        List<Map.Entry<byte[], Entry>> matches = new ArrayList<>();
        for (Map.Entry<byte[], Entry> e : select(req).entrySet()) {
            Entry v = e.getValue();
            if (outside(v.modRevision, number(req, "min_mod_revision"), number(req, "max_mod_revision"))
                    || outside(v.createRevision, number(req, "min_create_revision"), number(req, "max_create_revision"))) {
                continue;
            }
            matches.add(e);
        }
        sort(matches, req.path("sort_order").asText("NONE"), req.path("sort_target").asText("KEY"));

        ObjectNode resp = json.createObjectNode();
        long count = matches.size();
        if (count > 0) {
            resp.put("count", Long.toString(count));
        }
        if (req.path("count_only").asBoolean(false)) {
            return resp;
        }
        long limit = number(req, "limit");
        boolean keysOnly = req.path("keys_only").asBoolean(false);
        ArrayNode kvs = json.createArrayNode();
        for (Map.Entry<byte[], Entry> e : matches) {
            if (limit > 0 && kvs.size() >= limit) {
                resp.put("more", true);
                break;
            }
            kvs.add(kv(e.getKey(), e.getValue(), keysOnly));
        }
        if (!kvs.isEmpty()) {
            resp.set("kvs", kvs);
        }
        return resp;
    }

    private ObjectNode applyDelete(JsonNode req, long rev, List<Event> events) {
        List<byte[]> doomed = new ArrayList<>(select(req).keySet());
        boolean prevKv = req.path("prev_kv").asBoolean(false);
        ArrayNode prevs = json.createArrayNode();
        for (byte[] key : doomed) {
            Entry prev = removeKey(key);
            events.add(new Event(true, key, new Entry(new byte[0], 0, 0, rev, 0), prev));
            if (prevKv) {
                prevs.add(kv(key, prev, false));
            }
        }
        ObjectNode resp = json.createObjectNode();
        if (!doomed.isEmpty()) {
            resp.put("deleted", Long.toString(doomed.size()));
        }
        if (!prevs.isEmpty()) {
            resp.set("prev_kvs", prevs);
        }
        return resp;
    }

    private Entry removeKey(byte[] key) {
        Entry prev = data.remove(key);
        if (prev != null && prev.lease != 0) {
            LeaseState l = leases.get(prev.lease);
            if (l != null) {
                l.keys.remove(key);
            }
        }
        return prev;
    }

    private NavigableMap<byte[], Entry> select(JsonNode req) {
        KeyRange r = keyRange(req);
        byte[] start = r.start();
        byte[] end = r.resolveEnd();
        if (end == null) {
            Entry e = data.get(start);
            NavigableMap<byte[], Entry> one = new TreeMap<>(Bytes::compare);
            if (e != null) {
                one.put(start, e);
            }
            return one;
        }
        boolean openEnded = end.length == 1 && end[0] == 0;
        if (openEnded) {
            boolean all = start.length == 1 && start[0] == 0;
            return all ? data : data.tailMap(start, true);
        }
        if (Bytes.compare(start, end) >= 0) {
            return new TreeMap<>(Bytes::compare);
        }
        return data.subMap(start, true, end, false);
    }

    private static boolean outside(long v, long min, long max) {
        return (min > 0 && v < min) || (max > 0 && v > max);
    }

    private static void sort(List<Map.Entry<byte[], Entry>> kvs, String order, String target) {
        if ("NONE".equals(order)) {
            return;
        }
        Comparator<Map.Entry<byte[], Entry>> cmp = switch (target) {
            case "VERSION" -> Comparator.comparingLong(e -> e.getValue().version);
            case "CREATE" -> Comparator.comparingLong(e -> e.getValue().createRevision);
            case "MOD" -> Comparator.comparingLong(e -> e.getValue().modRevision);
            case "VALUE" -> (a, b) -> Bytes.compare(a.getValue().value, b.getValue().value);
            default -> (a, b) -> Bytes.compare(a.getKey(), b.getKey());
        };
        kvs.sort("DESCEND".equals(order) ? cmp.reversed() : cmp);
    }

    // ---------- txn helpers ----------

    /**
     * A key missing from the store fails every VALUE compare and compares as 0
     * for the numeric targets.
     */
    private boolean evaluate(JsonNode cmp) {
        byte[] key = bytes(cmp, "key");
        Entry e = data.get(key);
        String target = cmp.path("target").asText("VERSION");
        int c;
        if ("VALUE".equals(target)) {
            if (e == null) {
                return false;
            }
            c = Bytes.compare(e.value, bytes(cmp, "value"));
        } else {
            long actual;
            long expected;
            switch (target) {
                case "VERSION" -> {
                    actual = e == null ? 0 : e.version;
                    expected = number(cmp, "version");
                }
                case "CREATE" -> {
                    actual = e == null ? 0 : e.createRevision;
                    expected = number(cmp, "create_revision");
                }
                case "MOD" -> {
                    actual = e == null ? 0 : e.modRevision;
                    expected = number(cmp, "mod_revision");
                }
                case "LEASE" -> {
                    actual = e == null ? 0 : e.lease;
                    expected = number(cmp, "lease");
                }
                default -> throw new GatewayError(GatewayError.INVALID_ARGUMENT, "unknown compare target: " + target);
            }
            c = Long.compare(actual, expected);
        }
        String result = cmp.path("result").asText("EQUAL");
        return switch (result) {
            case "EQUAL" -> c == 0;
            case "NOT_EQUAL" -> c != 0;
            case "GREATER" -> c > 0;
            case "LESS" -> c < 0;
            default -> throw new GatewayError(GatewayError.INVALID_ARGUMENT, "unknown compare result: " + result);
        };
    }

    /** A branch may not put the same key twice, nor put a key it also deletes. */
    private void checkBranch(JsonNode ops) {
        TreeSet<byte[]> puts = new TreeSet<>(Bytes::compare);
        List<KeyRange> deletes = new ArrayList<>();
        for (JsonNode op : ops) {
            if (op.has("request_put")) {
                if (!puts.add(bytes(op.get("request_put"), "key"))) {
                    throw duplicateKey();
                }
            } else if (op.has("request_delete_range")) {
                deletes.add(keyRange(op.get("request_delete_range")));
            }
        }
        for (byte[] key : puts) {
            for (KeyRange d : deletes) {
                if (d.contains(key)) {
                    throw duplicateKey();
                }
            }
        }
    }

    private static GatewayError duplicateKey() {
        return new GatewayError(GatewayError.INVALID_ARGUMENT, "etcdserver: duplicate key given in txn request");
    }

    private void checkLease(JsonNode put) {
        long lease = number(put, "lease");
        if (lease != 0 && !leases.containsKey(lease)) {
            throw new GatewayError(GatewayError.NOT_FOUND, "etcdserver: requested lease not found");
        }
    }

    // ---------- leases ----------

    synchronized ObjectNode leaseGrant(JsonNode req) {
        expireLeases();
        long ttl = number(req, "TTL");
        long id = number(req, "ID");
        if (ttl <= 0) {
            throw new GatewayError(GatewayError.OUT_OF_RANGE, "etcdserver: too large lease TTL");
        }
        if (id == 0) {
            while (leases.containsKey(nextLeaseId)) {
                nextLeaseId++;
            }
            id = nextLeaseId++;
        } else if (leases.containsKey(id)) {
            throw new GatewayError(GatewayError.FAILED_PRECONDITION, "etcdserver: lease already exists");
        }
        leases.put(id, new LeaseState(id, ttl, clock.getAsLong() + ttl * 1000L));
        ObjectNode n = json.createObjectNode();
        n.set("header", header());
        n.put("ID", Long.toUnsignedString(id));
        n.put("TTL", Long.toString(ttl));
        return n;
    }

    /** Keepalive of an unknown lease answers without a TTL, as the real gateway does. */
    synchronized ObjectNode leaseKeepAlive(JsonNode req) {
        expireLeases();
        long id = number(req, "ID");
        ObjectNode result = json.createObjectNode();
        result.set("header", header());
        result.put("ID", Long.toUnsignedString(id));
        LeaseState l = leases.get(id);
        if (l != null) {
            l.deadlineMillis = clock.getAsLong() + l.grantedTtl * 1000L;
            result.put("TTL", Long.toString(l.grantedTtl));
        }
        ObjectNode n = json.createObjectNode();
        n.set("result", result);
        return n;
    }

    synchronized ObjectNode leaseRevoke(JsonNode req) {
        expireLeases();
        long id = number(req, "ID");
        if (!leases.containsKey(id)) {
            throw new GatewayError(GatewayError.NOT_FOUND, "etcdserver: requested lease not found");
        }
        revoke(id);
        ObjectNode n = json.createObjectNode();
        n.set("header", header());
        return n;
    }

    synchronized ObjectNode leaseTimeToLive(JsonNode req) {
        expireLeases();
        long id = number(req, "ID");
        ObjectNode n = json.createObjectNode();
        n.set("header", header());
        n.put("ID", Long.toUnsignedString(id));
        LeaseState l = leases.get(id);
        if (l == null) {
            n.put("TTL", "-1");
            return n;
        }
        long remainingMillis = l.deadlineMillis - clock.getAsLong();
        n.put("TTL", Long.toString(Math.max(1, (remainingMillis + 999) / 1000)));
        n.put("grantedTTL", Long.toString(l.grantedTtl));
        if (req.path("keys").asBoolean(false)) {
            ArrayNode keys = n.putArray("keys");
            for (byte[] k : l.keys) {
                keys.add(B64.encodeToString(k));
            }
        }
        return n;
    }

    /** Revoke every lease whose deadline has passed. */
    synchronized void expireLeases() {
        long now = clock.getAsLong();
        List<Long> due = new ArrayList<>();
        for (LeaseState l : leases.values()) {
            if (l.deadlineMillis <= now) {
                due.add(l.id);
            }
        }
        due.forEach(this::revoke);
    }

    private void revoke(long id) {
        LeaseState l = leases.remove(id);
        if (l == null || l.keys.isEmpty()) {
            return;
        }
        long rev = revision + 1;
        List<Event> events = new ArrayList<>();
        for (byte[] key : new ArrayList<>(l.keys)) {
            Entry prev = data.remove(key);
            if (prev != null) {
                events.add(new Event(true, key, new Entry(new byte[0], 0, 0, rev, 0), prev));
            }
        }
        if (!events.isEmpty()) {
            commit(rev, events);
        }
    }

    // ---------- watches ----------

    /**
     * Register one watcher per create_request and queue its "created" line.
     * Events from {@code start_revision} onwards are replayed from history.
     */
    synchronized WatchSession openWatch(List<JsonNode> createRequests) {
        WatchSession session = new WatchSession();
        for (JsonNode req : createRequests) {
            JsonNode create = req.get("create_request");
            if (create == null) {
                throw new GatewayError(GatewayError.INVALID_ARGUMENT, "expected create_request");
            }
            boolean noPut = false;
            boolean noDelete = false;
            for (JsonNode f : create.path("filters")) {
                noPut |= "NOPUT".equals(f.asText());
                noDelete |= "NODELETE".equals(f.asText());
            }
            Watcher w = new Watcher(nextWatchId++, keyRange(create), create.path("prev_kv").asBoolean(false),
                    noPut, noDelete, session);

            ObjectNode result = json.createObjectNode();
            result.set("header", header());
            result.put("watch_id", Long.toString(w.id));
            result.put("created", true);
            session.lines.add(wrap(result));

            long start = number(create, "start_revision");
            if (start > 0) {
                for (Committed c : history) {
                    if (c.revision >= start) {
                        deliver(w, c.events, c.revision);
                    }
                }
            }
            watchers.add(w);
        }
        return session;
    }

    synchronized void closeWatch(WatchSession session) {
        session.closed = true;
        watchers.removeIf(w -> w.session == session);
    }

    synchronized void closeAllWatches() {
        for (Watcher w : watchers) {
            w.session.closed = true;
        }
        watchers.clear();
    }

    private void commit(long rev, List<Event> events) {
        revision = rev;
        history.add(new Committed(rev, events));
        for (Watcher w : watchers) {
            deliver(w, events, rev);
        }
    }

    private void deliver(Watcher w, List<Event> events, long rev) {
        ArrayNode out = json.createArrayNode();
        for (Event e : events) {
            if (!w.range.contains(e.key) || (e.delete ? w.noDelete : w.noPut)) {
                continue;
            }
            ObjectNode ev = json.createObjectNode();
            if (e.delete) {
                ev.put("type", "DELETE");
                ObjectNode kv = json.createObjectNode();
                kv.put("key", B64.encodeToString(e.key));
                kv.put("mod_revision", Long.toString(rev));
                ev.set("kv", kv);
            } else {
                ev.set("kv", kv(e.key, e.kv, false));
            }
            if (w.prevKv && e.prev != null) {
                ev.set("prev_kv", kv(e.key, e.prev, false));
            }
            out.add(ev);
        }
        if (out.isEmpty()) {
            return;
        }
        ObjectNode result = json.createObjectNode();
        ObjectNode h = header();
        h.put("revision", Long.toString(rev));
        result.set("header", h);
        result.put("watch_id", Long.toString(w.id));
        result.set("events", out);
        w.session.lines.add(wrap(result));
    }

    private String wrap(ObjectNode result) {
        ObjectNode msg = json.createObjectNode();
        msg.set("result", result);
        return msg.toString();
    }

    // ---------- JSON helpers ----------

    private ObjectNode header() {
        ObjectNode h = json.createObjectNode();
        h.put("cluster_id", Long.toUnsignedString(CLUSTER_ID));
        h.put("member_id", Long.toUnsignedString(MEMBER_ID));
        h.put("revision", Long.toString(revision));
        h.put("raft_term", Long.toString(RAFT_TERM));
        return h;
    }

    /** Zero-valued fields are omitted, as the gateway's JSON marshaller does. */
    private ObjectNode kv(byte[] key, Entry e, boolean keysOnly) {
        ObjectNode n = json.createObjectNode();
        n.put("key", B64.encodeToString(key));
        n.put("create_revision", Long.toString(e.createRevision));
        n.put("mod_revision", Long.toString(e.modRevision));
        n.put("version", Long.toString(e.version));
        if (!keysOnly && e.value.length > 0) {
            n.put("value", B64.encodeToString(e.value));
        }
        if (e.lease != 0) {
            n.put("lease", Long.toUnsignedString(e.lease));
        }
        return n;
    }

    private static KeyRange keyRange(JsonNode req) {
        byte[] key = bytes(req, "key");
        byte[] end = bytes(req, "range_end");
        if (end.length == 0) {
            return KeyRange.single(key);
        }
        return KeyRange.range(key, end);
    }

    static byte[] bytes(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return new byte[0];
        }
        try {
            return B64D.decode(v.asText());
        } catch (IllegalArgumentException e) {
            throw new GatewayError(GatewayError.INVALID_ARGUMENT, "field " + field + " is not base64");
        }
    }

    static long number(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return 0;
        }
        if (v.isIntegralNumber()) {
            return v.bigIntegerValue().longValue();
        }
        String s = v.asText();
        try {
            return s.startsWith("-") ? Long.parseLong(s) : Long.parseUnsignedLong(s);
        } catch (NumberFormatException e) {
            throw new GatewayError(GatewayError.INVALID_ARGUMENT, "field " + field + " is not an integer: " + s);
        }
    }

    /** Split a watch request body into its newline-separated JSON objects. */
    List<JsonNode> parseLines(byte[] body) throws IOException {
        List<JsonNode> out = new ArrayList<>();
        Iterator<JsonNode> it = json.readerFor(JsonNode.class).readValues(body);
        while (it.hasNext()) {
            out.add(it.next());
        }
        return out;
    }
}
