// file: client/src/main/java/io/kvgate/client/watch/WatchStream.java
package io.kvgate.client.watch;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvgate.client.WireCodec;
import io.kvgate.core.ProtocolException;
import io.kvgate.core.StoreException;
import io.kvgate.core.WatchTerminatedException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One long-lived streaming POST to the gateway's watch endpoint.
 *
 * Pipeline:
 *  - the HTTP client pushes response buffers into a {@link WatchChunkDecoder},
 *  - each complete line is parsed and its events are put on a bounded queue
 *    (the transport waits while the queue is full),
 *  - a dedicated dispatcher thread takes events off the queue and calls the callback.
 *
 * Callback exceptions are logged and swallowed. Malformed lines are logged and
 * skipped. An error message from the server, a server-side cancel, a remote close
 * or a transport failure end the stream with {@link WatchTerminatedException};
 * {@link #cancel()} ends it quietly. There is no reconnect.
 */
public final class WatchStream implements WatchHandle {
    private static final Logger log = Logger.getLogger(WatchStream.class.getName());

    private static final Object END = new Object();
    private static final long POLL_MILLIS = 100;
    private static final AtomicInteger IDS = new AtomicInteger();

    private final HttpClient http;
    private final URI uri;
    private final byte[] requestBody;
    private final Consumer<WatchEvent> callback;
    private final WireCodec codec;
    private final BlockingQueue<Object> queue;

    private final AtomicReference<WatchState> state = new AtomicReference<>(WatchState.IDLE);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private volatile boolean cancelled;
    private volatile Throwable failure;
    private volatile Flow.Subscription subscription;
    private volatile CompletableFuture<HttpResponse<Void>> inflight;

    public WatchStream(HttpClient http,
                       URI uri,
                       byte[] requestBody,
                       WatchOptions options,
                       Consumer<WatchEvent> callback,
                       WireCodec codec) {
        this.http = http;
        this.uri = uri;
        this.requestBody = requestBody;
        this.callback = callback;
        this.codec = codec;
        this.queue = new ArrayBlockingQueue<>(options.queueCapacity());
    }

    /** Send the request and start the dispatcher. May be called once. */
    public WatchHandle open() {
        if (!state.compareAndSet(WatchState.IDLE, WatchState.REQUESTING)) {
            throw new IllegalStateException("watch already opened");
        }
        Thread dispatcher = new Thread(this::dispatchLoop, "kvgate-watch-" + IDS.incrementAndGet());
        dispatcher.setDaemon(true);
        dispatcher.start();

        HttpRequest req = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(requestBody))
                .build();
        inflight = http.sendAsync(req, this::bodyFor);
        inflight.whenComplete((resp, err) -> {
            if (err != null) {
                Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                end(WatchState.ERRORED, new WatchTerminatedException("watch request failed: " + cause, cause));
            } else if (resp.statusCode() != 200) {
                end(WatchState.ERRORED, new WatchTerminatedException("unexpected watch response status " + resp.statusCode()));
            }
        });
        return this;
    }

    @Override
    public void cancel() {
        cancelled = true;
        if (!transition(WatchState.CANCELLED)) {
            return;
        }
        Flow.Subscription s = subscription;
        if (s != null) {
            s.cancel();
        }
        CompletableFuture<HttpResponse<Void>> f = inflight;
        if (f != null) {
            f.cancel(true);
        }
        termination.complete(null);
        queue.clear();
        queue.offer(END);
        log.log(Level.FINE, "watch on {0} cancelled", uri);
    }

    @Override
    public WatchState state() {
        return state.get();
    }

    @Override
    public CompletableFuture<Void> termination() {
        return termination;
    }

    // ---------- transport side ----------

    private HttpResponse.BodySubscriber<Void> bodyFor(HttpResponse.ResponseInfo info) {
        if (info.statusCode() != 200) {
            return HttpResponse.BodySubscribers.discarding();
        }
        state.compareAndSet(WatchState.REQUESTING, WatchState.STREAMING);
        return new ChunkSubscriber();
    }

    private void handleLine(byte[] line) {
        JsonNode message;
        List<WatchEvent> events;
        try {
            message = codec.readTree(line);
            events = codec.watchEvents(message);
        } catch (StoreException e) {
            end(WatchState.ERRORED, new WatchTerminatedException("watch ended by store error", e));
            return;
        } catch (IOException | ProtocolException e) {
            log.log(Level.WARNING, "skipping malformed watch message: "
                    + new String(line, StandardCharsets.UTF_8), e);
            return;
        }
        for (WatchEvent ev : events) {
            if (!enqueue(ev)) {
                return;
            }
        }
        JsonNode result = message.path("result");
        if (result.path("canceled").asBoolean(false)) {
            end(WatchState.ERRORED, new WatchTerminatedException(
                    "watch cancelled by server: " + result.path("cancel_reason").asText("")));
        }
    }

    /** Waits for queue space; gives up once the watch is cancelled. */
    private boolean enqueue(Object item) {
        try {
            while (!cancelled) {
                if (queue.offer(item, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private void end(WatchState target, WatchTerminatedException reason) {
        if (!transition(target)) {
            return;
        }
        failure = reason;
        log.log(Level.WARNING, "watch on " + uri + " terminated: " + reason.getMessage());
        Flow.Subscription s = subscription;
        if (s != null && target == WatchState.ERRORED) {
            s.cancel();
        }
        if (!enqueue(END)) {
            termination.completeExceptionally(reason);
        }
    }

    /** Move to a terminal state unless one was reached already. */
    private boolean transition(WatchState target) {
        while (true) {
            WatchState cur = state.get();
            if (cur.isTerminal()) {
                return false;
            }
            if (state.compareAndSet(cur, target)) {
                return true;
            }
        }
    }

    // ---------- dispatcher side ----------

    private void dispatchLoop() {
        try {
            while (true) {
                Object item = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (item == END || cancelled) {
                    break;
                }
                if (item != null) {
                    deliver((WatchEvent) item);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Throwable f = failure;
        if (f != null) {
            termination.completeExceptionally(f);
        } else {
            termination.complete(null);
        }
    }

    private void deliver(WatchEvent event) {
        if (cancelled) {
            return;
        }
        try {
            callback.accept(event);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "exception raised from watch callback swallowed", e);
        }
    }

    private final class ChunkSubscriber implements HttpResponse.BodySubscriber<Void> {
        private final CompletableFuture<Void> body = new CompletableFuture<>();
        private final WatchChunkDecoder decoder = new WatchChunkDecoder();

        @Override
        public CompletableFuture<Void> getBody() {
            return body;
        }

        @Override
        public void onSubscribe(Flow.Subscription s) {
            subscription = s;
            if (cancelled) {
                s.cancel();
                body.complete(null);
                return;
            }
            s.request(1);
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            for (ByteBuffer buf : items) {
                for (byte[] line : decoder.feed(buf)) {
                    if (state.get().isTerminal()) {
                        return;
                    }
                    handleLine(line);
                }
            }
            if (!state.get().isTerminal()) {
                subscription.request(1);
            }
        }

        @Override
        public void onError(Throwable t) {
            body.completeExceptionally(t);
            end(WatchState.ERRORED, new WatchTerminatedException("watch stream failed: " + t, t));
        }

        @Override
        public void onComplete() {
            body.complete(null);
            end(WatchState.CLOSED, new WatchTerminatedException("watch stream closed by server"));
        }
    }
}
