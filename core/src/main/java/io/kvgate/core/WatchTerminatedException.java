// file: core/src/main/java/io/kvgate/core/WatchTerminatedException.java
package io.kvgate.core;

/** A watch stream ended for any reason other than local cancellation. */
public class WatchTerminatedException extends KvGateException {

    public WatchTerminatedException(String message) {
        super(message);
    }

    public WatchTerminatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
