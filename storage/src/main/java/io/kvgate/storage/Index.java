// file: storage/src/main/java/io/kvgate/storage/Index.java
package io.kvgate.storage;

import java.util.Objects;
import java.util.function.Function;

/**
 * Secondary index of a {@link PersistentMap}: for each primary entry {@code k -> v}
 * the target map holds {@code derivation(v) -> k}.
 * <p>
 * Entries are written and removed in the same transaction as the primary entry.
 * A derivation may return null to leave a value unindexed.
 *
 * @param <V>  primary value type
 * @param <IK> index key type
 * @param <K>  primary key type (the index map's value type)
 */
public final class Index<V, IK, K> {
    private final String name;
    private final Function<V, IK> derivation;
    private final PersistentMap<IK, K> target;

    Index(String name, Function<V, IK> derivation, PersistentMap<IK, K> target) {
        this.name = Objects.requireNonNull(name, "name");
        this.derivation = Objects.requireNonNull(derivation, "derivation");
        this.target = Objects.requireNonNull(target, "target");
    }

    public String name() {
        return name;
    }

    public PersistentMap<IK, K> target() {
        return target;
    }

    /** Index key for {@code value}, or null if the value is not indexed. */
    public IK derive(V value) {
        return value == null ? null : derivation.apply(value);
    }

    @Override
    public String toString() {
        return "Index{" + name + " -> slot " + target.slot() + '}';
    }
}
