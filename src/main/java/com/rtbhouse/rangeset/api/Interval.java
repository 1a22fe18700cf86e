package com.rtbhouse.rangeset.api;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/**
 * Closed interval {@code [lowerEndpoint, upperEndpoint]} of a {@link RangeSet}. Equality of endpoints is the
 * {@link Object#equals(Object)} of the domain type.
 */
public final class Interval<T> {
    private final T lowerEndpoint;
    private final T upperEndpoint;

    public static <T> Interval<T> of(T lowerEndpoint, T upperEndpoint) {
        return new Interval<>(lowerEndpoint, upperEndpoint);
    }

    private Interval(T lowerEndpoint, T upperEndpoint) {
        this.lowerEndpoint = checkNotNull(lowerEndpoint);
        this.upperEndpoint = checkNotNull(upperEndpoint);
    }

    public T lowerEndpoint() {
        return lowerEndpoint;
    }

    public T upperEndpoint() {
        return upperEndpoint;
    }

    public boolean contains(T value, DomainTraits<T> traits) {
        return !traits.less(value, lowerEndpoint) && !traits.less(upperEndpoint, value);
    }

    /**
     * @return number of values in the interval, read as an unsigned long
     */
    public long size(DomainTraits<T> traits) {
        return traits.distance(lowerEndpoint, upperEndpoint) + 1;
    }

    /**
     * Compares endpoints with {@link DomainTraits#equal(Object, Object)} instead of {@link #equals(Object)}.
     */
    public boolean equalTo(Interval<T> other, DomainTraits<T> traits) {
        return traits.equal(lowerEndpoint, other.lowerEndpoint) && traits.equal(upperEndpoint, other.upperEndpoint);
    }

    /**
     * Endpoints are compared with their own {@code equals}.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Interval)) {
            return false;
        }
        Interval<?> other = (Interval<?>) o;
        return lowerEndpoint.equals(other.lowerEndpoint) && upperEndpoint.equals(other.upperEndpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowerEndpoint, upperEndpoint);
    }

    @Override
    public String toString() {
        return "[" + lowerEndpoint + ", " + upperEndpoint + "]";
    }
}
