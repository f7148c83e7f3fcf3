// file: core/src/main/java/io/kvgate/core/Status.java
package io.kvgate.core;

/**
 * Cluster member status as reported by the maintenance endpoint.
 */
public record Status(String version, long dbSize, long leader, long raftIndex, long raftTerm, Header header) {
}
