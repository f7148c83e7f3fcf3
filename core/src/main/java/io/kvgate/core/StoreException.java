// file: core/src/main/java/io/kvgate/core/StoreException.java
package io.kvgate.core;

/**
 * The gateway answered with a structured error body ({@code error} / {@code code} / {@code message}).
 * Codes follow the store's gRPC status numbering (3 = invalid argument, 5 = not found, ...).
 */
public class StoreException extends KvGateException {
    private final int code;

    public StoreException(int code, String message) {
        super("store error " + code + ": " + message);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
