package com.rtbhouse.rangeset.api;

import static com.rtbhouse.rangeset.impl.Contracts.checkArgument;
import static com.rtbhouse.rangeset.impl.Contracts.checkState;

import java.util.List;

import com.google.common.primitives.Ints;

/**
 * Immutable random access position in the {@link RangeSet.Intervals} of a set. A position is either valid, pointing
 * at one of the intervals, or past-the-end.
 * <p>
 * Positions are ordered and can be subtracted only if they come from the same set.
 */
public final class IntervalPosition<T> implements Comparable<IntervalPosition<T>> {

    private final DomainTraits<T> traits;
    private final List<T> endpoints;
    // index of the current interval start endpoint, twice the interval index
    private final int index;

    private IntervalPosition(DomainTraits<T> traits, List<T> endpoints, int index) {
        checkArgument(index % 2 == 0, "odd endpoint index %s", index);
        checkArgument(0 <= index && index <= endIndex(endpoints), "endpoint index %s out of [0, %s]", index,
                endIndex(endpoints));
        this.traits = traits;
        this.endpoints = endpoints;
        this.index = index;
    }

    static <T> IntervalPosition<T> begin(DomainTraits<T> traits, List<T> endpoints) {
        return new IntervalPosition<>(traits, endpoints, 0);
    }

    static <T> IntervalPosition<T> end(DomainTraits<T> traits, List<T> endpoints) {
        return new IntervalPosition<>(traits, endpoints, endIndex(endpoints));
    }

    private static int endIndex(List<?> endpoints) {
        return ((endpoints.size() + 1) / 2) * 2;
    }

    static <T> Interval<T> intervalAt(DomainTraits<T> traits, List<T> endpoints, int index) {
        if (index == endpoints.size() - 1) {
            return Interval.of(endpoints.get(index), traits.max());
        }
        return Interval.of(endpoints.get(index), traits.prev(endpoints.get(index + 1)));
    }

    DomainTraits<T> traits() {
        return traits;
    }

    /**
     * @return true if the position points at an interval
     */
    public boolean isValid() {
        return index < endpoints.size();
    }

    /**
     * @return the interval at this position, which must be valid
     */
    public Interval<T> get() {
        checkState(isValid(), "dereferencing past-the-end interval position");
        return intervalAt(traits, endpoints, index);
    }

    /**
     * @return the interval {@code n} positions after this one
     */
    public Interval<T> get(int n) {
        return plus(n).get();
    }

    /**
     * Returns the position {@code n} intervals after this one. Negative {@code n} moves backwards. The result must
     * not be before the first interval nor after the past-the-end position.
     */
    public IntervalPosition<T> plus(int n) {
        return moveBy(n);
    }

    public IntervalPosition<T> minus(int n) {
        return moveBy(-(long) n);
    }

    public IntervalPosition<T> next() {
        return moveBy(1);
    }

    public IntervalPosition<T> previous() {
        return moveBy(-1);
    }

    private IntervalPosition<T> moveBy(long n) {
        long newIndex = index + 2 * n;
        checkArgument(0 <= newIndex && newIndex <= endIndex(endpoints), "moving interval position %s by %s "
                + "out of [0, %s]", index / 2, n, endIndex(endpoints) / 2);
        return new IntervalPosition<>(traits, endpoints, Ints.checkedCast(newIndex));
    }

    /**
     * @return signed number of intervals between the other position and this one
     */
    public int distanceFrom(IntervalPosition<T> other) {
        checkSameSet(other);
        return Ints.checkedCast(((long) index - other.index) / 2);
    }

    @Override
    public int compareTo(IntervalPosition<T> other) {
        checkSameSet(other);
        return Integer.compare(index, other.index);
    }

    private void checkSameSet(IntervalPosition<T> other) {
        checkArgument(endpoints == other.endpoints, "comparing interval positions of different sets");
    }

    /**
     * Positions are equal if they point at the same interval of the same set.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IntervalPosition)) {
            return false;
        }
        IntervalPosition<?> other = (IntervalPosition<?>) o;
        return endpoints == other.endpoints && index == other.index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(endpoints) + index;
    }

    @Override
    public String toString() {
        return "IntervalPosition{" + (isValid() ? "interval=" + get() : "end") + ", index=" + index / 2 + "}";
    }
}
