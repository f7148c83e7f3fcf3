// file: client/src/main/java/io/kvgate/client/watch/WatchState.java
package io.kvgate.client.watch;

/**
 * IDLE -> REQUESTING -> STREAMING -> one of CANCELLED / CLOSED / ERRORED.
 * REQUESTING may also end directly in CANCELLED or ERRORED.
 */
public enum WatchState {
    IDLE,
    REQUESTING,
    STREAMING,
    /** Cancelled locally; the resulting connection close is not an error. */
    CANCELLED,
    /** The server ended the stream. */
    CLOSED,
    /** Transport failure, non-200 status or error message. */
    ERRORED;

    public boolean isTerminal() {
        return this == CANCELLED || this == CLOSED || this == ERRORED;
    }
}
