// file: core/src/main/java/io/kvgate/core/TxnOutcome.java
package io.kvgate.core;

import java.util.List;

/**
 * Result of submitting a {@link Transaction}.
 * <p>
 * {@link Success} carries the success-branch responses, {@link Failed} the
 * failure-branch responses. A failed guard is a normal outcome, not an error;
 * use {@link #orThrow()} where an exception reads better.
 */
public sealed interface TxnOutcome permits TxnOutcome.Success, TxnOutcome.Failed {

    Header header();

    List<OpResponse> responses();

    boolean succeeded();

    /** Returns this outcome if it succeeded, otherwise throws {@link TransactionFailedException}. */
    default Success orThrow() {
        if (this instanceof Success s) {
            return s;
        }
        throw new TransactionFailedException((Failed) this);
    }

    record Success(Header header, List<OpResponse> responses) implements TxnOutcome {
        public Success {
            responses = List.copyOf(responses);
        }

        @Override
        public boolean succeeded() {
            return true;
        }
    }

    record Failed(Header header, List<OpResponse> responses) implements TxnOutcome {
        public Failed {
            responses = List.copyOf(responses);
        }

        @Override
        public boolean succeeded() {
            return false;
        }
    }
}
