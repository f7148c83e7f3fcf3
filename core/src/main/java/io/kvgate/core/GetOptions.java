// file: core/src/main/java/io/kvgate/core/GetOptions.java
package io.kvgate.core;

/**
 * Optional knobs for a range read. Immutable; build with {@link #builder()}.
 * Zero means "not set" for every numeric option.
 */
public final class GetOptions {

    public enum SortOrder { NONE, ASCEND, DESCEND }

    public enum SortTarget { KEY, VERSION, CREATE, MOD, VALUE }

    public static final GetOptions DEFAULT = builder().build();

    private final boolean countOnly;
    private final boolean keysOnly;
    private final long limit;
    private final long revision;
    private final long minModRevision;
    private final long maxModRevision;
    private final long minCreateRevision;
    private final long maxCreateRevision;
    private final boolean serializable;
    private final SortOrder sortOrder;
    private final SortTarget sortTarget;

    private GetOptions(Builder b) {
        this.countOnly = b.countOnly;
        this.keysOnly = b.keysOnly;
        this.limit = b.limit;
        this.revision = b.revision;
        this.minModRevision = b.minModRevision;
        this.maxModRevision = b.maxModRevision;
        this.minCreateRevision = b.minCreateRevision;
        this.maxCreateRevision = b.maxCreateRevision;
        this.serializable = b.serializable;
        this.sortOrder = b.sortOrder;
        this.sortTarget = b.sortTarget;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean countOnly() { return countOnly; }

    public boolean keysOnly() { return keysOnly; }

    public long limit() { return limit; }

    /** Point-in-time revision to read at, 0 for latest. */
    public long revision() { return revision; }

    public long minModRevision() { return minModRevision; }

    public long maxModRevision() { return maxModRevision; }

    public long minCreateRevision() { return minCreateRevision; }

    public long maxCreateRevision() { return maxCreateRevision; }

    public boolean serializable() { return serializable; }

    public SortOrder sortOrder() { return sortOrder; }

    public SortTarget sortTarget() { return sortTarget; }

    public static final class Builder {
        private boolean countOnly;
        private boolean keysOnly;
        private long limit;
        private long revision;
        private long minModRevision;
        private long maxModRevision;
        private long minCreateRevision;
        private long maxCreateRevision;
        private boolean serializable;
        private SortOrder sortOrder = SortOrder.NONE;
        private SortTarget sortTarget = SortTarget.KEY;

        private Builder() {
        }

        public Builder countOnly(boolean countOnly) {
            this.countOnly = countOnly;
            return this;
        }

        public Builder keysOnly(boolean keysOnly) {
            this.keysOnly = keysOnly;
            return this;
        }

        public Builder limit(long limit) {
            if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
            this.limit = limit;
            return this;
        }

        public Builder revision(long revision) {
            if (revision < 0) throw new IllegalArgumentException("revision must be >= 0");
            this.revision = revision;
            return this;
        }

        public Builder minModRevision(long rev) {
            this.minModRevision = rev;
            return this;
        }

        public Builder maxModRevision(long rev) {
            this.maxModRevision = rev;
            return this;
        }

        public Builder minCreateRevision(long rev) {
            this.minCreateRevision = rev;
            return this;
        }

        public Builder maxCreateRevision(long rev) {
            this.maxCreateRevision = rev;
            return this;
        }

        public Builder serializable(boolean serializable) {
            this.serializable = serializable;
            return this;
        }

        public Builder sort(SortOrder order, SortTarget target) {
            if (order == null || target == null) throw new NullPointerException("sort order and target are required");
            this.sortOrder = order;
            this.sortTarget = target;
            return this;
        }

        public GetOptions build() {
            return new GetOptions(this);
        }
    }
}
