// file: core/src/main/java/io/kvgate/core/Revision.java
package io.kvgate.core;

/**
 * Result of a put.
 *
 * @param header   response header, revision is the revision of the write
 * @param previous previous key-value when requested and present, otherwise null
 */
public record Revision(Header header, KeyValue previous) implements OpResponse {
}
