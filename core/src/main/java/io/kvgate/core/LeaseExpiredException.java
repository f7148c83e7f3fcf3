// file: core/src/main/java/io/kvgate/core/LeaseExpiredException.java
package io.kvgate.core;

/** The lease is gone. Terminal: the lease id must not be reused. */
public class LeaseExpiredException extends KvGateException {
    private final long leaseId;

    public LeaseExpiredException(long leaseId) {
        super("lease " + Long.toUnsignedString(leaseId) + " expired");
        this.leaseId = leaseId;
    }

    public long leaseId() {
        return leaseId;
    }
}
