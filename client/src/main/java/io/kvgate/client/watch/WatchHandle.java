// file: client/src/main/java/io/kvgate/client/watch/WatchHandle.java
package io.kvgate.client.watch;

import java.util.concurrent.CompletableFuture;

/**
 * Caller's side of an open watch.
 */
public interface WatchHandle {

    /**
     * Stop the watch. Non-blocking and idempotent. No callback starts after
     * this returns; a callback already running when it is called may finish.
     */
    void cancel();

    WatchState state();

    /**
     * Completes normally after {@link #cancel()}; completes exceptionally with
     * {@link io.kvgate.core.WatchTerminatedException} for any other ending.
     */
    CompletableFuture<Void> termination();
}
