package com.rtbhouse.rangeset.api;

import java.util.Comparator;

/**
 * Describes a discrete, totally ordered and bounded domain of values which can be stored in a {@link RangeSet}.
 * Implementations have to be stateless: all the methods are pure and total on their documented domains.
 *
 * @param <T>
 *            type of the domain values
 */
public interface DomainTraits<T> {

    /**
     * @return the least value of the domain
     */
    T min();

    /**
     * @return the greatest value of the domain
     */
    T max();

    /**
     * Returns the predecessor of the given value.
     *
     * @param value
     *            value greater than {@link #min()}
     */
    T prev(T value);

    /**
     * Returns the successor of the given value.
     *
     * @param value
     *            value less than {@link #max()}
     */
    T next(T value);

    /**
     * Strict total order of the domain.
     */
    boolean less(T lhs, T rhs);

    /**
     * Returns the number of values in {@code [lhs, rhs)}, read as an unsigned long.
     *
     * @param lhs
     *            lower value
     * @param rhs
     *            upper value, not less than {@code lhs}
     */
    long distance(T lhs, T rhs);

    default boolean equal(T lhs, T rhs) {
        return !less(lhs, rhs) && !less(rhs, lhs);
    }

    /**
     * @return true if the value lies in {@code [min(), max()]}
     */
    default boolean inside(T value) {
        return !less(value, min()) && !less(max(), value);
    }

    /**
     * Hash code consistent with {@link #equal(Object, Object)}.
     */
    default int hash(T value) {
        return value.hashCode();
    }

    default Comparator<T> comparator() {
        return (lhs, rhs) -> less(lhs, rhs) ? -1 : (less(rhs, lhs) ? 1 : 0);
    }
}
