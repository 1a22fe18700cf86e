package com.rtbhouse.rangeset.api;

import static com.rtbhouse.rangeset.impl.Contracts.checkState;

/**
 * Immutable bidirectional position in the values of a {@link RangeSet}: the current interval and the current value
 * inside it. The past-the-end position keeps {@link DomainTraits#max()} as its value.
 */
public final class ElementPosition<T> {

    private final IntervalPosition<T> interval;
    private final T element;

    private ElementPosition(IntervalPosition<T> interval, T element) {
        this.interval = interval;
        this.element = element;
    }

    static <T> ElementPosition<T> at(IntervalPosition<T> interval) {
        return new ElementPosition<>(interval, intervalStartOrMax(interval));
    }

    private static <T> T intervalStartOrMax(IntervalPosition<T> interval) {
        return interval.isValid() ? interval.get().lowerEndpoint() : interval.traits().max();
    }

    public boolean isValid() {
        return interval.isValid();
    }

    /**
     * @return the value at this position, which must be valid
     */
    public T get() {
        checkState(isValid(), "dereferencing past-the-end element position");
        return element;
    }

    /**
     * @return position of the interval containing the current value
     */
    public IntervalPosition<T> interval() {
        return interval;
    }

    /**
     * Returns the position of the next greater value of the set, or past-the-end. This position must be valid.
     */
    public ElementPosition<T> next() {
        checkState(isValid(), "incrementing past-the-end element position");
        DomainTraits<T> traits = interval.traits();
        if (traits.less(element, interval.get().upperEndpoint())) {
            return new ElementPosition<>(interval, traits.next(element));
        }
        return at(interval.next());
    }

    /**
     * Returns the position of the next smaller value of the set. This position must not be the first one.
     */
    public ElementPosition<T> previous() {
        DomainTraits<T> traits = interval.traits();
        if (interval.isValid() && traits.less(interval.get().lowerEndpoint(), element)) {
            return new ElementPosition<>(interval, traits.prev(element));
        }
        IntervalPosition<T> previousInterval = interval.previous();
        return new ElementPosition<>(previousInterval, previousInterval.get().upperEndpoint());
    }

    /**
     * Positions are equal if they point at the same interval of the same set and their values are equal.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ElementPosition)) {
            return false;
        }
        ElementPosition<?> other = (ElementPosition<?>) o;
        if (!interval.equals(other.interval)) {
            return false;
        }
        @SuppressWarnings("unchecked")
        T otherElement = (T) other.element;
        return interval.traits().equal(element, otherElement);
    }

    @Override
    public int hashCode() {
        return 31 * interval.hashCode() + interval.traits().hash(element);
    }

    @Override
    public String toString() {
        return "ElementPosition{" + (isValid() ? "element=" + element : "end") + "}";
    }
}
