// file: core/src/main/java/io/kvgate/core/CompareOperator.java
package io.kvgate.core;

/** Relation tested by a {@link Compare}. The wire names are the enum names. */
public enum CompareOperator {
    EQUAL,
    NOT_EQUAL,
    GREATER,
    LESS
}
