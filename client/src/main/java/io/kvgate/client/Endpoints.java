// file: client/src/main/java/io/kvgate/client/Endpoints.java
package io.kvgate.client;

/**
 * Gateway paths, relative to {@code baseUrl + apiPrefix}.
 */
public final class Endpoints {
    public static final String STATUS = "/maintenance/status";
    public static final String PUT = "/kv/put";
    public static final String RANGE = "/kv/range";
    public static final String DELETE_RANGE = "/kv/deleterange";
    public static final String TXN = "/kv/txn";
    public static final String WATCH = "/watch";
    public static final String LEASE_GRANT = "/lease/grant";
    public static final String LEASE_KEEPALIVE = "/lease/keepalive";
    public static final String LEASE_REVOKE = "/kv/lease/revoke";
    public static final String LEASE_TIME_TO_LIVE = "/kv/lease/timetolive";

    private Endpoints() {
        // constants
    }
}
