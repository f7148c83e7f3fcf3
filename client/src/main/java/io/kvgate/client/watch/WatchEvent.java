// file: client/src/main/java/io/kvgate/client/watch/WatchEvent.java
package io.kvgate.client.watch;

import io.kvgate.core.KeyValue;

/**
 * One change observed on a watched range.
 *
 * @param type     PUT or DELETE
 * @param kv       key-value after the change (for DELETE: key and mod revision only)
 * @param previous key-value before the change, only when requested via {@link WatchOptions#prevKv()}
 */
public record WatchEvent(Type type, KeyValue kv, KeyValue previous) {

    public enum Type { PUT, DELETE }
}
