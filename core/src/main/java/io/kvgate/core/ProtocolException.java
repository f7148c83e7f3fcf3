// file: core/src/main/java/io/kvgate/core/ProtocolException.java
package io.kvgate.core;

/** The gateway returned a body this client cannot interpret. Never retried. */
public class ProtocolException extends KvGateException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
