// file: core/src/main/java/io/kvgate/core/KvGateException.java
package io.kvgate.core;

/**
 * Base type of every fault raised by the client runtime.
 * Argument validation uses the JDK's IllegalArgumentException / NullPointerException instead.
 */
public class KvGateException extends RuntimeException {

    public KvGateException(String message) {
        super(message);
    }

    public KvGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
