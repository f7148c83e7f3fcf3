// file: core/src/main/java/io/kvgate/core/TransactionFailedException.java
package io.kvgate.core;

/** Raised by {@link TxnOutcome#orThrow()} when the guard evaluated false. */
public class TransactionFailedException extends KvGateException {
    private final transient TxnOutcome.Failed outcome;

    public TransactionFailedException(TxnOutcome.Failed outcome) {
        super("transaction compare failed at revision " + outcome.header().revision());
        this.outcome = outcome;
    }

    public TxnOutcome.Failed outcome() {
        return outcome;
    }
}
