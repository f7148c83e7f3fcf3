// file: core/src/main/java/io/kvgate/core/CompareTarget.java
package io.kvgate.core;

/**
 * Which attribute of the stored key a {@link Compare} looks at.
 * VALUE compares bytes; the others compare 64-bit integers.
 */
public enum CompareTarget {
    VALUE("value"),
    VERSION("version"),
    CREATE("create_revision"),
    MOD("mod_revision");

    private final String field;

    CompareTarget(String field) {
        this.field = field;
    }

    /** JSON field carrying the operand for this target. */
    public String field() {
        return field;
    }
}
