// file: core/src/main/java/io/kvgate/core/GatewayException.java
package io.kvgate.core;

/** Transport failure talking to the gateway (connect, I/O, timeout, interrupt). */
public class GatewayException extends KvGateException {

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
