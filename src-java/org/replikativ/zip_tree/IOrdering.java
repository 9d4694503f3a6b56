package org.replikativ.zip_tree;

import java.util.Comparator;
import clojure.lang.RT;

/**
 * Key ordering derived from a single strict "less than" predicate.
 *
 * Callers implement {@link #lessThan} only. Every other relation the tree
 * needs is derived from it, so no two comparisons can disagree.
 * The predicate must be a strict weak ordering, otherwise none of the
 * tree invariants hold.
 *
 * @param <Key> the type of keys being ordered
 */
@FunctionalInterface
public interface IOrdering<Key> {

    /**
     * a &lt; b
     */
    boolean lessThan(Key a, Key b);

    /**
     * a &gt; b, i.e. b &lt; a
     */
    default boolean greaterThan(Key a, Key b) {
        return lessThan(b, a);
    }

    /**
     * a &lt;= b, i.e. !(b &lt; a)
     */
    default boolean lessThanOrEqual(Key a, Key b) {
        return !lessThan(b, a);
    }

    /**
     * a &gt;= b, i.e. !(a &lt; b)
     */
    default boolean greaterThanOrEqual(Key a, Key b) {
        return !lessThan(a, b);
    }

    /**
     * Neither key is ordered before the other.
     */
    default boolean equal(Key a, Key b) {
        return !lessThan(a, b) && !lessThan(b, a);
    }

    /**
     * Three-way comparison in {@link Comparator} convention.
     */
    default int compare(Key a, Key b) {
        if (lessThan(a, b)) return -1;
        if (lessThan(b, a)) return 1;
        return 0;
    }

    default Comparator<Key> asComparator() {
        return this::compare;
    }

    static <Key> IOrdering<Key> of(Comparator<? super Key> cmp) {
        if (cmp == null) {
            throw new IllegalArgumentException("Comparator must not be null");
        }
        return (a, b) -> cmp.compare(a, b) < 0;
    }

    /**
     * Clojure's default ordering: numbers by value, then Comparable.compareTo.
     */
    @SuppressWarnings("unchecked")
    static <Key> IOrdering<Key> natural() {
        return (IOrdering<Key>) of(RT.DEFAULT_COMPARATOR);
    }
}
