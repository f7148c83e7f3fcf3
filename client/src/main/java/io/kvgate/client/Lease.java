// file: client/src/main/java/io/kvgate/client/Lease.java
package io.kvgate.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvgate.core.Header;
import io.kvgate.core.LeaseExpiredException;
import io.kvgate.core.ProtocolException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A granted lease. Keys attached to it are deleted by the store when it
 * expires or is revoked.
 *
 * Lifecycle: ACTIVE until any call observes a missing or non-positive TTL,
 * or {@link #revoke()} completes; then EXPIRED for good. Every call on an
 * expired lease fails fast with {@link LeaseExpiredException} without a round trip.
 *
 * Refresh scheduling is up to the caller; {@link #refresh()} is one keepalive.
 */
public final class Lease {
    private static final Logger log = Logger.getLogger(Lease.class.getName());

    private final KvClient client;
    private final long leaseId;
    private final Header grantHeader;
    private volatile long timeToLive;
    private volatile boolean expired;

    Lease(KvClient client, long leaseId, long timeToLive, Header grantHeader) {
        this.client = client;
        this.leaseId = leaseId;
        this.timeToLive = timeToLive;
        this.grantHeader = grantHeader;
    }

    public long leaseId() {
        return leaseId;
    }

    /** TTL granted or last reported by a keepalive, in seconds. */
    public long timeToLive() {
        return timeToLive;
    }

    public Header header() {
        return grantHeader;
    }

    public boolean isExpired() {
        return expired;
    }

    /** Remaining TTL in seconds as reported by the store. */
    public long remaining() {
        ensureActive();
        JsonNode resp = client.post(Endpoints.LEASE_TIME_TO_LIVE,
                client.codec().leaseTimeToLiveRequest(leaseId, false), null);
        return checkTtl(WireCodec.longField(resp, "TTL"));
    }

    /** Keys currently attached to this lease. */
    public List<byte[]> keys() {
        ensureActive();
        JsonNode resp = client.post(Endpoints.LEASE_TIME_TO_LIVE,
                client.codec().leaseTimeToLiveRequest(leaseId, true), null);
        checkTtl(WireCodec.longField(resp, "TTL"));
        List<byte[]> keys = new ArrayList<>();
        for (JsonNode k : resp.path("keys")) {
            keys.add(WireCodec.bytesValue(k, "keys"));
        }
        return keys;
    }

    /** One keepalive round trip. Resets the server-side countdown. */
    public Header refresh() {
        ensureActive();
        JsonNode resp = client.post(Endpoints.LEASE_KEEPALIVE, client.codec().leaseRequest(leaseId), null);
        JsonNode result = resp.get("result");
        if (result == null || !result.isObject()) {
            throw new ProtocolException("bogus lease keepalive response (missing result): " + resp);
        }
        long ttl = checkTtl(WireCodec.longField(result, "TTL"));
        timeToLive = ttl;
        return client.codec().header(result.get("header"));
    }

    /** Revoke the lease; the store deletes every attached key. */
    public Header revoke() {
        ensureActive();
        JsonNode resp = client.post(Endpoints.LEASE_REVOKE, client.codec().leaseRequest(leaseId), null);
        expired = true;
        log.log(Level.FINE, "lease {0} revoked", Long.toUnsignedString(leaseId));
        return client.codec().header(resp.get("header"));
    }

    private void ensureActive() {
        if (expired) {
            throw new LeaseExpiredException(leaseId);
        }
    }

    private long checkTtl(long ttl) {
        if (ttl <= 0) {
            expired = true;
            throw new LeaseExpiredException(leaseId);
        }
        return ttl;
    }

    @Override
    public String toString() {
        return "Lease{id=" + Long.toUnsignedString(leaseId)
                + ", ttl=" + timeToLive
                + ", expired=" + expired + '}';
    }
}
