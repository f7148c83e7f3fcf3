// file: storage/src/main/java/io/kvgate/storage/KeyCodec.java
package io.kvgate.storage;

/**
 * Maps application keys to the bytes that follow the slot prefix.
 * <p>
 * The encoding must be injective, and should preserve the natural order of
 * {@code K} under unsigned byte comparison so that {@code select} ranges and
 * {@code count} prefixes mean what the caller expects.
 */
public interface KeyCodec<K> {

    byte[] encode(K key);

    K decode(byte[] bytes);
}
