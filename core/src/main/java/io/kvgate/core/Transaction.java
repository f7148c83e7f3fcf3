// file: core/src/main/java/io/kvgate/core/Transaction.java
package io.kvgate.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Guarded multi-operation request evaluated atomically by the store.
 * <p>
 * If every compare holds, the success branch runs; otherwise the failure
 * branch runs. The store rejects a branch that mutates the same key twice;
 * the client does not pre-validate this.
 */
public final class Transaction {
    private final List<Compare> compare;
    private final List<Operation> success;
    private final List<Operation> failure;

    public Transaction(List<Compare> compare, List<Operation> success, List<Operation> failure) {
        this.compare = List.copyOf(Objects.requireNonNull(compare, "compare"));
        this.success = List.copyOf(Objects.requireNonNull(success, "success"));
        this.failure = List.copyOf(Objects.requireNonNull(failure, "failure"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Unconditional transaction: no guards, only a success branch. */
    public static Transaction of(List<Operation> operations) {
        return new Transaction(List.of(), operations, List.of());
    }

    public List<Compare> compare() {
        return compare;
    }

    public List<Operation> success() {
        return success;
    }

    public List<Operation> failure() {
        return failure;
    }

    public boolean isEmpty() {
        return success.isEmpty() && failure.isEmpty();
    }

    @Override
    public String toString() {
        return "Transaction{compare=" + compare + ", success=" + success + ", failure=" + failure + '}';
    }

    public static final class Builder {
        private final List<Compare> compare = new ArrayList<>();
        private final List<Operation> success = new ArrayList<>();
        private final List<Operation> failure = new ArrayList<>();

        private Builder() {
        }

        public Builder when(Compare c) {
            compare.add(Objects.requireNonNull(c, "compare"));
            return this;
        }

        public Builder then(Operation op) {
            success.add(Objects.requireNonNull(op, "operation"));
            return this;
        }

        public Builder otherwise(Operation op) {
            failure.add(Objects.requireNonNull(op, "operation"));
            return this;
        }

        public Transaction build() {
            return new Transaction(compare, success, failure);
        }
    }
}
