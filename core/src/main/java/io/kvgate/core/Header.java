// file: core/src/main/java/io/kvgate/core/Header.java
package io.kvgate.core;

/**
 * Response header attached to every gateway reply.
 * {@code revision} is the store-wide logical clock at the time of the reply.
 * Cluster and member ids are unsigned 64-bit values held in a long.
 */
public record Header(long raftTerm, long revision, long clusterId, long memberId) {

    public static final Header EMPTY = new Header(0, 0, 0, 0);

    @Override
    public String toString() {
        return "Header{raftTerm=" + raftTerm
                + ", revision=" + revision
                + ", clusterId=" + Long.toUnsignedString(clusterId)
                + ", memberId=" + Long.toUnsignedString(memberId) + '}';
    }
}
