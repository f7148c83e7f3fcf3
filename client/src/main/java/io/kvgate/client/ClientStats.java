// file: client/src/main/java/io/kvgate/client/ClientStats.java
package io.kvgate.client;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory request counters for one {@link KvClient}.
 *
 * Tracks:
 *  - posts per endpoint path,
 *  - failed calls (transport, protocol or store errors),
 *  - watch streams opened.
 */
public final class ClientStats {

    private final ConcurrentHashMap<String, AtomicLong> posts = new ConcurrentHashMap<>();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong watchesOpened = new AtomicLong();

    public void recordPost(String endpoint) {
        posts.computeIfAbsent(endpoint, e -> new AtomicLong()).incrementAndGet();
    }

    public void recordFailure() {
        failures.incrementAndGet();
    }

    public void recordWatchOpened() {
        watchesOpened.incrementAndGet();
    }

    public long posts(String endpoint) {
        AtomicLong c = posts.get(endpoint);
        return c == null ? 0L : c.get();
    }

    public long totalPosts() {
        return posts.values().stream().mapToLong(AtomicLong::get).sum();
    }

    public long failures()      { return failures.get(); }
    public long watchesOpened() { return watchesOpened.get(); }

    /** Sorted copy of the per-endpoint post counters. */
    public Map<String, Long> postsByEndpoint() {
        Map<String, Long> out = new TreeMap<>();
        posts.forEach((k, v) -> out.put(k, v.get()));
        return out;
    }

    @Override
    public String toString() {
        return "ClientStats{" +
                "posts=" + postsByEndpoint() +
                ", failures=" + failures.get() +
                ", watchesOpened=" + watchesOpened.get() +
                '}';
    }
}
