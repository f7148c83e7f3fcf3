// file: core/src/main/java/io/kvgate/core/Compare.java
package io.kvgate.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * One predicate of a transaction guard: {@code target(key) operator operand}.
 * <p>
 * All predicates of a {@link Transaction} are AND-ed by the store. There is no
 * disjunction primitive.
 */
public final class Compare {
    private final byte[] key;
    private final CompareOperator operator;
    private final CompareTarget target;
    private final byte[] value;   // VALUE target only
    private final long number;    // VERSION / CREATE / MOD targets

    private Compare(byte[] key, CompareOperator operator, CompareTarget target, byte[] value, long number) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operator, "operator");
        this.key = Arrays.copyOf(key, key.length);
        this.operator = operator;
        this.target = target;
        this.value = value == null ? null : Arrays.copyOf(value, value.length);
        this.number = number;
    }

    public static Compare value(byte[] key, CompareOperator operator, byte[] value) {
        Objects.requireNonNull(value, "value");
        return new Compare(key, operator, CompareTarget.VALUE, value, 0);
    }

    public static Compare version(byte[] key, CompareOperator operator, long version) {
        return new Compare(key, operator, CompareTarget.VERSION, null, version);
    }

    public static Compare createRevision(byte[] key, CompareOperator operator, long revision) {
        return new Compare(key, operator, CompareTarget.CREATE, null, revision);
    }

    public static Compare modRevision(byte[] key, CompareOperator operator, long revision) {
        return new Compare(key, operator, CompareTarget.MOD, null, revision);
    }

    // shorthands used by the OCC commit path and tests

    public static Compare valueEquals(byte[] key, byte[] value) {
        return value(key, CompareOperator.EQUAL, value);
    }

    public static Compare modRevisionEquals(byte[] key, long revision) {
        return modRevision(key, CompareOperator.EQUAL, revision);
    }

    public byte[] key() {
        return Arrays.copyOf(key, key.length);
    }

    public CompareOperator operator() {
        return operator;
    }

    public CompareTarget target() {
        return target;
    }

    /** Byte operand, only meaningful for {@link CompareTarget#VALUE}. */
    public byte[] valueOperand() {
        return value == null ? null : Arrays.copyOf(value, value.length);
    }

    /** Integer operand for the version and revision targets. */
    public long numberOperand() {
        return number;
    }

    @Override
    public String toString() {
        String operand = target == CompareTarget.VALUE ? Bytes.display(value) : Long.toString(number);
        return target + "(" + Bytes.display(key) + ") " + operator + " " + operand;
    }
}
