// file: client/src/main/java/io/kvgate/client/watch/WatchOptions.java
package io.kvgate.client.watch;

import java.util.EnumSet;
import java.util.Set;

/**
 * Options applied to every range of one watch stream.
 */
public final class WatchOptions {

    /** Server-side event filters. */
    public enum Filter { NOPUT, NODELETE }

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    public static final WatchOptions DEFAULT = builder().build();

    private final long startRevision;
    private final boolean prevKv;
    private final boolean progressNotify;
    private final Set<Filter> filters;
    private final int queueCapacity;

    private WatchOptions(Builder b) {
        this.startRevision = b.startRevision;
        this.prevKv = b.prevKv;
        this.progressNotify = b.progressNotify;
        this.filters = b.filters.isEmpty() ? Set.of() : Set.copyOf(b.filters);
        this.queueCapacity = b.queueCapacity;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Revision to start watching from (inclusive), 0 for "now". */
    public long startRevision() { return startRevision; }

    public boolean prevKv() { return prevKv; }

    public boolean progressNotify() { return progressNotify; }

    public Set<Filter> filters() { return filters; }

    /** Capacity of the queue between the transport and the callback thread. */
    public int queueCapacity() { return queueCapacity; }

    public static final class Builder {
        private long startRevision;
        private boolean prevKv;
        private boolean progressNotify = true;
        private final EnumSet<Filter> filters = EnumSet.noneOf(Filter.class);
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;

        private Builder() {
        }

        public Builder startRevision(long revision) {
            if (revision < 0) throw new IllegalArgumentException("startRevision must be >= 0");
            this.startRevision = revision;
            return this;
        }

        public Builder prevKv(boolean prevKv) {
            this.prevKv = prevKv;
            return this;
        }

        public Builder progressNotify(boolean progressNotify) {
            this.progressNotify = progressNotify;
            return this;
        }

        public Builder filter(Filter filter) {
            filters.add(filter);
            return this;
        }

        public Builder queueCapacity(int capacity) {
            if (capacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1");
            this.queueCapacity = capacity;
            return this;
        }

        public WatchOptions build() {
            return new WatchOptions(this);
        }
    }
}
