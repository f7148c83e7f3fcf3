// file: storage/src/main/java/io/kvgate/storage/ValueCodec.java
package io.kvgate.storage;

/**
 * Serializes map values. Applied before {@link Compression} on write
 * and after it on read.
 */
public interface ValueCodec<V> {

    byte[] encode(V value);

    V decode(byte[] bytes);
}
