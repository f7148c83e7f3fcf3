// file: storage/src/main/java/io/kvgate/storage/TransactionConflictException.java
package io.kvgate.storage;

import io.kvgate.core.KvGateException;

/**
 * Commit of a {@link DbTransaction} lost the race: at least one key it read or
 * wrote was modified after the transaction observed it. Nothing was applied.
 */
public class TransactionConflictException extends KvGateException {
    private final long baseRevision;
    private final long currentRevision;

    public TransactionConflictException(long baseRevision, long currentRevision, int keys) {
        super("transaction conflict: " + keys + " key(s) checked against base revision " + baseRevision
                + ", store is at revision " + currentRevision);
        this.baseRevision = baseRevision;
        this.currentRevision = currentRevision;
    }

    public long baseRevision() {
        return baseRevision;
    }

    public long currentRevision() {
        return currentRevision;
    }
}
