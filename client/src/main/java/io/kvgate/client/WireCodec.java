// file: client/src/main/java/io/kvgate/client/WireCodec.java
package io.kvgate.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kvgate.client.watch.WatchEvent;
import io.kvgate.client.watch.WatchOptions;
import io.kvgate.core.Compare;
import io.kvgate.core.CompareTarget;
import io.kvgate.core.Deleted;
import io.kvgate.core.GetOptions;
import io.kvgate.core.Header;
import io.kvgate.core.KeyRange;
import io.kvgate.core.KeyValue;
import io.kvgate.core.OpResponse;
import io.kvgate.core.Operation;
import io.kvgate.core.ProtocolException;
import io.kvgate.core.Range;
import io.kvgate.core.Revision;
import io.kvgate.core.Status;
import io.kvgate.core.StoreException;
import io.kvgate.core.Transaction;
import io.kvgate.core.TxnOutcome;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;

/**
 * JSON marshalling for the gateway.
 *
 * Wire rules:
 *  - key / value / range_end bytes travel as standard base64 strings.
 *  - 64-bit integers travel as decimal strings; ids are unsigned.
 *  - Fields with default values may be omitted by the server; absent
 *    numbers read as 0, absent bytes as empty, absent header as {@link Header#EMPTY}.
 *  - An error body ({@code error}, or {@code code} + {@code message}) becomes a {@link StoreException}.
 */
public final class WireCodec {

    private static final Base64.Encoder B64 = Base64.getEncoder();
    private static final Base64.Decoder B64D = Base64.getDecoder();

    private final ObjectMapper mapper;

    public WireCodec() {
        this(new ObjectMapper());
    }

    public WireCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ---------- requests ----------

    public ObjectNode empty() {
        return mapper.createObjectNode();
    }

    public ObjectNode putRequest(byte[] key, byte[] value, long leaseId, boolean prevKv) {
        ObjectNode n = mapper.createObjectNode();
        n.put("key", b64(key));
        n.put("value", b64(value));
        if (leaseId != 0) {
            n.put("lease", Long.toUnsignedString(leaseId));
        }
        if (prevKv) {
            n.put("prev_kv", true);
        }
        return n;
    }

    public ObjectNode rangeRequest(KeyRange range, GetOptions opts) {
        ObjectNode n = keyRange(range);
        if (opts.countOnly()) n.put("count_only", true);
        if (opts.keysOnly()) n.put("keys_only", true);
        if (opts.limit() > 0) n.put("limit", Long.toString(opts.limit()));
        if (opts.revision() > 0) n.put("revision", Long.toString(opts.revision()));
        if (opts.serializable()) n.put("serializable", true);
        if (opts.sortOrder() != GetOptions.SortOrder.NONE) {
            n.put("sort_order", opts.sortOrder().name());
            n.put("sort_target", opts.sortTarget().name());
        }
        if (opts.minModRevision() > 0) n.put("min_mod_revision", Long.toString(opts.minModRevision()));
        if (opts.maxModRevision() > 0) n.put("max_mod_revision", Long.toString(opts.maxModRevision()));
        if (opts.minCreateRevision() > 0) n.put("min_create_revision", Long.toString(opts.minCreateRevision()));
        if (opts.maxCreateRevision() > 0) n.put("max_create_revision", Long.toString(opts.maxCreateRevision()));
        return n;
    }

    public ObjectNode deleteRequest(KeyRange range, boolean prevKv) {
        ObjectNode n = keyRange(range);
        if (prevKv) {
            n.put("prev_kv", true);
        }
        return n;
    }

    public ObjectNode compare(Compare c) {
        ObjectNode n = mapper.createObjectNode();
        n.put("key", b64(c.key()));
        n.put("result", c.operator().name());
        n.put("target", c.target().name());
        if (c.target() == CompareTarget.VALUE) {
            n.put(c.target().field(), b64(c.valueOperand()));
        } else {
            n.put(c.target().field(), Long.toString(c.numberOperand()));
        }
        return n;
    }

    /** One request item of a transaction branch, tagged by its operation kind. */
    public ObjectNode requestOp(Operation op) {
        ObjectNode item = mapper.createObjectNode();
        if (op instanceof Operation.Get get) {
            item.set("request_range", rangeRequest(get.range(), get.options()));
        } else if (op instanceof Operation.Set set) {
            item.set("request_put", putRequest(set.key(), set.value(), set.leaseId(), set.returnPrevious()));
        } else if (op instanceof Operation.Delete del) {
            item.set("request_delete_range", deleteRequest(del.range(), del.returnPrevious()));
        }
        return item;
    }

    public ObjectNode txnRequest(Transaction txn) {
        ObjectNode n = mapper.createObjectNode();
        if (!txn.compare().isEmpty()) {
            ArrayNode cmp = n.putArray("compare");
            txn.compare().forEach(c -> cmp.add(compare(c)));
        }
        if (!txn.success().isEmpty()) {
            ArrayNode ok = n.putArray("success");
            txn.success().forEach(op -> ok.add(requestOp(op)));
        }
        if (!txn.failure().isEmpty()) {
            ArrayNode fail = n.putArray("failure");
            txn.failure().forEach(op -> fail.add(requestOp(op)));
        }
        return n;
    }

    public ObjectNode watchCreateRequest(KeyRange range, WatchOptions opts) {
        ObjectNode create = keyRange(range);
        if (opts.startRevision() > 0) {
            create.put("start_revision", Long.toString(opts.startRevision()));
        }
        if (opts.progressNotify()) {
            create.put("progress_notify", true);
        }
        if (opts.prevKv()) {
            create.put("prev_kv", true);
        }
        if (!opts.filters().isEmpty()) {
            ArrayNode f = create.putArray("filters");
            for (WatchOptions.Filter filter : WatchOptions.Filter.values()) {
                if (opts.filters().contains(filter)) {
                    f.add(filter.name());
                }
            }
        }
        ObjectNode n = mapper.createObjectNode();
        n.set("create_request", create);
        return n;
    }

    public ObjectNode leaseGrantRequest(long ttl, long leaseId) {
        ObjectNode n = mapper.createObjectNode();
        n.put("TTL", Long.toString(ttl));
        n.put("ID", Long.toUnsignedString(leaseId));
        return n;
    }

    public ObjectNode leaseRequest(long leaseId) {
        ObjectNode n = mapper.createObjectNode();
        n.put("ID", Long.toUnsignedString(leaseId));
        return n;
    }

    public ObjectNode leaseTimeToLiveRequest(long leaseId, boolean keys) {
        ObjectNode n = leaseRequest(leaseId);
        if (keys) {
            n.put("keys", true);
        }
        return n;
    }

    public byte[] toBytes(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize request body", e);
        }
    }

    private ObjectNode keyRange(KeyRange range) {
        ObjectNode n = mapper.createObjectNode();
        n.put("key", b64(range.start()));
        byte[] end = range.resolveEnd();
        if (end != null) {
            n.put("range_end", b64(end));
        }
        return n;
    }

    // ---------- responses ----------

    /**
     * Parse a response body and raise the store error it carries, if any.
     */
    public JsonNode parse(byte[] body) {
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (IOException e) {
            throw new ProtocolException("response is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("response is not a JSON object");
        }
        raiseIfError(node);
        return node;
    }

    /** Throws {@link StoreException} when {@code node} is an error body. */
    public void raiseIfError(JsonNode node) {
        JsonNode err = node.get("error");
        boolean codeAndMessage = node.has("code") && node.has("message") && !node.has("header");
        if (err == null && !codeAndMessage) {
            return;
        }
        int code = (int) longField(node, "code");
        String message;
        if (err != null && err.isTextual()) {
            message = err.asText();
        } else if (err != null && err.isObject()) {
            // streamed errors nest the status object
            code = (int) longField(err, "code");
            message = err.path("message").asText("");
        } else {
            message = node.path("message").asText("");
        }
        throw new StoreException(code, message);
    }

    public Header header(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Header.EMPTY;
        }
        return new Header(
                longField(node, "raft_term"),
                longField(node, "revision"),
                longField(node, "cluster_id"),
                longField(node, "member_id")
        );
    }

    public KeyValue keyValue(JsonNode node) {
        return new KeyValue(
                bytesField(node, "key"),
                bytesField(node, "value"),
                longField(node, "version"),
                longField(node, "create_revision"),
                longField(node, "mod_revision"),
                longField(node, "lease")
        );
    }

    public Status status(JsonNode node) {
        return new Status(
                node.path("version").asText(null),
                longField(node, "dbSize"),
                longField(node, "leader"),
                longField(node, "raftIndex"),
                longField(node, "raftTerm"),
                header(node.get("header"))
        );
    }

    public Revision revision(JsonNode node) {
        JsonNode prev = node.get("prev_kv");
        return new Revision(header(node.get("header")), prev == null || prev.isNull() ? null : keyValue(prev));
    }

    public Deleted deleted(JsonNode node) {
        return new Deleted(longField(node, "deleted"), header(node.get("header")), keyValues(node.get("prev_kvs")));
    }

    public Range range(JsonNode node) {
        return new Range(
                keyValues(node.get("kvs")),
                header(node.get("header")),
                longField(node, "count"),
                node.path("more").asBoolean(false)
        );
    }

    /**
     * Decode a txn response. Each response item must carry exactly one known tag;
     * anything else is a {@link ProtocolException}.
     */
    public TxnOutcome txnOutcome(JsonNode node) {
        Header header = header(node.get("header"));
        List<OpResponse> responses = new ArrayList<>();
        JsonNode items = node.get("responses");
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                responses.add(responseOp(item));
            }
        }
        return node.path("succeeded").asBoolean(false)
                ? new TxnOutcome.Success(header, responses)
                : new TxnOutcome.Failed(header, responses);
    }

    private OpResponse responseOp(JsonNode item) {
        if (!item.isObject() || item.size() != 1) {
            throw new ProtocolException("bogus transaction response item (expected exactly one tag): " + item);
        }
        Iterator<String> names = item.fieldNames();
        String tag = names.next();
        JsonNode body = item.get(tag);
        return switch (tag) {
            case "response_put" -> revision(body);
            case "response_delete_range" -> deleted(body);
            case "response_range" -> range(body);
            default -> throw new ProtocolException("unknown transaction response tag: " + tag);
        };
    }

    /**
     * Events carried by one streamed watch message. A message without
     * {@code result} is a protocol violation; one with an error is a store error.
     */
    public List<WatchEvent> watchEvents(JsonNode message) {
        raiseIfError(message);
        JsonNode result = message.get("result");
        if (result == null || !result.isObject()) {
            throw new ProtocolException("watch message without result: " + message);
        }
        JsonNode events = result.get("events");
        if (events == null || !events.isArray() || events.isEmpty()) {
            return List.of();
        }
        List<WatchEvent> out = new ArrayList<>(events.size());
        for (JsonNode ev : events) {
            JsonNode kv = ev.get("kv");
            if (kv == null || kv.isNull()) {
                continue;
            }
            WatchEvent.Type type = "DELETE".equals(ev.path("type").asText("PUT"))
                    ? WatchEvent.Type.DELETE
                    : WatchEvent.Type.PUT;
            JsonNode prev = ev.get("prev_kv");
            out.add(new WatchEvent(type, keyValue(kv), prev == null || prev.isNull() ? null : keyValue(prev)));
        }
        return out;
    }

    public JsonNode readTree(byte[] chunk) throws IOException {
        return mapper.readTree(chunk);
    }

    private List<KeyValue> keyValues(JsonNode arr) {
        if (arr == null || !arr.isArray()) {
            return List.of();
        }
        List<KeyValue> out = new ArrayList<>(arr.size());
        for (JsonNode kv : arr) {
            out.add(keyValue(kv));
        }
        return out;
    }

    // ---------- field helpers ----------

    /**
     * Integers arrive as decimal strings (sometimes as JSON numbers).
     * Values above Long.MAX_VALUE are unsigned 64-bit ids and wrap into the sign bit.
     */
    public static long longField(JsonNode node, String name) {
        JsonNode v = node.get(name);
        if (v == null || v.isNull()) {
            return 0L;
        }
        if (v.isIntegralNumber()) {
            return v.bigIntegerValue().longValue();
        }
        String s = v.asText().trim();
        if (s.isEmpty()) {
            return 0L;
        }
        try {
            return s.startsWith("-") ? Long.parseLong(s) : Long.parseUnsignedLong(s);
        } catch (NumberFormatException e) {
            throw new ProtocolException("field '" + name + "' is not an integer: " + s, e);
        }
    }

    public static byte[] bytesField(JsonNode node, String name) {
        return bytesValue(node.get(name), name);
    }

    /** Decode one base64 JSON value; {@code name} labels it in the error. */
    public static byte[] bytesValue(JsonNode v, String name) {
        if (v == null || v.isNull()) {
            return new byte[0];
        }
        try {
            return B64D.decode(v.asText());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("field '" + name + "' is not base64", e);
        }
    }

    public static String b64(byte[] bytes) {
        return B64.encodeToString(bytes);
    }
}
