package com.rtbhouse.rangeset.api;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.rtbhouse.rangeset.impl.Contracts.checkArgument;
import static com.rtbhouse.rangeset.impl.Contracts.checkState;

import java.util.AbstractList;
import java.util.Iterator;
import java.util.RandomAccess;
import java.util.stream.Stream;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;
import com.rtbhouse.rangeset.impl.Contracts;
import com.rtbhouse.rangeset.impl.collection.CollectionUtils;
import com.rtbhouse.rangeset.impl.iterator.AscendingElementsIterator;
import com.rtbhouse.rangeset.impl.iterator.DescendingElementsIterator;
import com.rtbhouse.rangeset.impl.merge.EndpointsMerger;
import com.rtbhouse.rangeset.impl.range.EndpointsBuilder;

/**
 * Immutable set of values of a discrete ordered domain described by {@link DomainTraits}, stored as the union of
 * disjoint maximal intervals.
 * <p>
 * The set is encoded as a strictly ascending list of endpoints: endpoints at even indices are inclusive interval
 * starts, endpoints at odd indices are exclusive interval ends. If the list has odd length the last interval extends
 * up to {@link DomainTraits#max()} inclusive. All factories and combinators produce the unique minimal encoding, so
 * two sets contain the same values if and only if their endpoints are equal.
 * <p>
 * Preconditions of the operations are checked by {@link Contracts} and reported with an unchecked
 * {@code ContractViolationException}.
 *
 * @param <T>
 *            type of the set elements
 */
public final class RangeSet<T> implements Iterable<T> {

    private final DomainTraits<T> traits;
    private final ImmutableList<T> endpoints;

    private int hash = 0;

    private RangeSet(DomainTraits<T> traits, ImmutableList<T> endpoints) {
        this.traits = checkNotNull(traits);
        this.endpoints = endpoints;
        if (Contracts.endpointsValidationEnabled()) {
            for (T endpoint : endpoints) {
                checkArgument(traits.inside(endpoint), "endpoint %s outside of %s domain", endpoint, traits);
            }
            checkArgument(CollectionUtils.isStrictlyAscending(endpoints, traits.comparator()),
                    "endpoints are not strictly ascending: %s", endpoints);
        }
    }

    /**
     * Constructs an empty set.
     */
    public static <T> RangeSet<T> makeEmpty(DomainTraits<T> traits) {
        return new RangeSet<>(traits, ImmutableList.of());
    }

    /**
     * Constructs a set containing all the values of the domain.
     */
    public static <T> RangeSet<T> makeAll(DomainTraits<T> traits) {
        return new RangeSet<>(traits, ImmutableList.of(traits.min()));
    }

    /**
     * Constructs a set containing the single given value.
     */
    public static <T> RangeSet<T> makeSingleValue(DomainTraits<T> traits, T value) {
        checkInsideDomain(traits, value);
        if (traits.less(value, traits.max())) {
            return new RangeSet<>(traits, ImmutableList.of(value, traits.next(value)));
        }
        return makeGreaterEqual(traits, value);
    }

    /**
     * Constructs a set containing all the values greater than or equal to the given one.
     */
    public static <T> RangeSet<T> makeGreaterEqual(DomainTraits<T> traits, T value) {
        checkInsideDomain(traits, value);
        return new RangeSet<>(traits, ImmutableList.of(value));
    }

    /**
     * Constructs a set containing all the values greater than the given one.
     */
    public static <T> RangeSet<T> makeGreater(DomainTraits<T> traits, T value) {
        checkInsideDomain(traits, value);
        if (traits.less(value, traits.max())) {
            return new RangeSet<>(traits, ImmutableList.of(traits.next(value)));
        }
        return makeEmpty(traits);
    }

    /**
     * Constructs a set containing all the values less than the given one.
     */
    public static <T> RangeSet<T> makeLess(DomainTraits<T> traits, T value) {
        checkInsideDomain(traits, value);
        if (traits.less(traits.min(), value)) {
            return new RangeSet<>(traits, ImmutableList.of(traits.min(), value));
        }
        return makeEmpty(traits);
    }

    /**
     * Constructs a set containing all the values less than or equal to the given one.
     */
    public static <T> RangeSet<T> makeLessEqual(DomainTraits<T> traits, T value) {
        checkInsideDomain(traits, value);
        if (traits.less(value, traits.max())) {
            return new RangeSet<>(traits, ImmutableList.of(traits.min(), traits.next(value)));
        }
        return makeAll(traits);
    }

    /**
     * Constructs a set containing all the values between the given bounds.
     *
     * @param infimum
     *            lower bound
     * @param infimumIncluded
     *            whether the lower bound belongs to the set
     * @param supremum
     *            upper bound, not less than {@code infimum}
     * @param supremumIncluded
     *            whether the upper bound belongs to the set
     */
    public static <T> RangeSet<T> makeInterval(DomainTraits<T> traits,
                                               T infimum,
                                               boolean infimumIncluded,
                                               T supremum,
                                               boolean supremumIncluded) {
        checkInsideDomain(traits, infimum);
        checkInsideDomain(traits, supremum);
        checkArgument(!traits.less(supremum, infimum), "condition not met [infimum <= supremum]: %s, %s",
                infimum, supremum);

        if (!infimumIncluded && !traits.less(infimum, traits.max())) {
            return makeEmpty(traits);
        }
        T firstEndpoint = infimumIncluded ? infimum : traits.next(infimum);

        // the exclusive end of an interval reaching the domain maximum is omitted
        if (supremumIncluded && !traits.less(supremum, traits.max())) {
            return new RangeSet<>(traits, ImmutableList.of(firstEndpoint));
        }

        T secondEndpoint = supremumIncluded ? traits.next(supremum) : supremum;
        if (!traits.less(firstEndpoint, secondEndpoint)) {
            return makeEmpty(traits);
        }
        return new RangeSet<>(traits, ImmutableList.of(firstEndpoint, secondEndpoint));
    }

    /**
     * Constructs a set of the given strictly ascending values.
     */
    public static <T> RangeSet<T> fromSortedValues(DomainTraits<T> traits, Iterable<? extends T> values) {
        return new RangeSet<>(traits, EndpointsBuilder.endpointsFromValues(traits, values));
    }

    /**
     * Constructs the set of all the values for which {@code op.apply(lhs.contains(value), rhs.contains(value))}
     * is true. The operation has to return false for two false arguments.
     */
    public static <T> RangeSet<T> makeBoolean(RangeSet<T> lhs, RangeSet<T> rhs, BooleanOperation op) {
        checkNotNull(op);
        checkArgument(!op.apply(false, false), "operation %s is true for values outside of both sets", op);
        checkArgument(lhs.traits.equals(rhs.traits), "combining sets of different domains: %s, %s",
                lhs.traits, rhs.traits);
        return new RangeSet<>(lhs.traits, EndpointsMerger.merge(lhs.traits, lhs.endpoints, rhs.endpoints, op));
    }

    public static <T> RangeSet<T> makeUnion(RangeSet<T> lhs, RangeSet<T> rhs) {
        return makeBoolean(lhs, rhs, BooleanOperation.UNION);
    }

    public static <T> RangeSet<T> makeIntersection(RangeSet<T> lhs, RangeSet<T> rhs) {
        return makeBoolean(lhs, rhs, BooleanOperation.INTERSECTION);
    }

    public static <T> RangeSet<T> makeDifference(RangeSet<T> lhs, RangeSet<T> rhs) {
        return makeBoolean(lhs, rhs, BooleanOperation.DIFFERENCE);
    }

    public static <T> RangeSet<T> makeSymmetricDifference(RangeSet<T> lhs, RangeSet<T> rhs) {
        return makeBoolean(lhs, rhs, BooleanOperation.SYMMETRIC_DIFFERENCE);
    }

    /**
     * Constructs the set of all the domain values not contained in this set.
     */
    public RangeSet<T> complement() {
        if (endpoints.isEmpty() || !traits.equal(endpoints.get(0), traits.min())) {
            return new RangeSet<>(traits, ImmutableList.<T>builderWithExpectedSize(endpoints.size() + 1)
                    .add(traits.min())
                    .addAll(endpoints)
                    .build());
        }
        return new RangeSet<>(traits, endpoints.subList(1, endpoints.size()));
    }

    public DomainTraits<T> traits() {
        return traits;
    }

    public boolean isEmpty() {
        return endpoints.isEmpty();
    }

    /**
     * @return true if the set contains all the values of the domain
     */
    public boolean isAll() {
        return endpoints.size() == 1 && traits.equal(endpoints.get(0), traits.min());
    }

    public boolean contains(T value) {
        checkInsideDomain(traits, value);
        return CollectionUtils.upperBound(endpoints, value, traits.comparator()) % 2 == 1;
    }

    /**
     * @return the least value of the set, which must not be empty
     */
    public T min() {
        checkState(!isEmpty(), "min() of an empty set");
        return endpoints.get(0);
    }

    /**
     * @return the greatest value of the set, which must not be empty
     */
    public T max() {
        checkState(!isEmpty(), "max() of an empty set");
        if (endpoints.size() % 2 == 0) {
            return traits.prev(endpoints.get(endpoints.size() - 1));
        }
        return traits.max();
    }

    /**
     * Returns the number of values in the set. The result is an unsigned long: it is exact for domains of at most
     * 2<sup>64</sup> - 1 values.
     */
    public long size() {
        long result = 0;
        for (int i = 0; i + 1 < endpoints.size(); i += 2) {
            result += traits.distance(endpoints.get(i), endpoints.get(i + 1));
        }
        if (endpoints.size() % 2 == 1) {
            result += traits.distance(endpoints.get(endpoints.size() - 1), traits.max());
            ++result;
        }
        return result;
    }

    /**
     * @return all the maximal intervals of the set, in ascending order
     */
    public Intervals<T> intervals() {
        return new Intervals<>(traits, endpoints);
    }

    /**
     * @return position of the least value of the set
     */
    public ElementPosition<T> begin() {
        return ElementPosition.at(intervals().begin());
    }

    /**
     * @return past-the-end position of the set values
     */
    public ElementPosition<T> end() {
        return ElementPosition.at(intervals().end());
    }

    /**
     * Iterates over the values of the set in ascending order.
     */
    @Override
    public Iterator<T> iterator() {
        return new AscendingElementsIterator<>(begin(), end());
    }

    /**
     * Iterates over the values of the set in descending order.
     */
    public Iterator<T> descendingIterator() {
        return new DescendingElementsIterator<>(begin(), end());
    }

    public Stream<T> stream() {
        return Streams.stream(this);
    }

    private static <T> void checkInsideDomain(DomainTraits<T> traits, T value) {
        checkNotNull(value);
        checkArgument(traits.inside(value), "value %s outside of %s domain", value, traits);
    }

    /**
     * Two sets are equal if they are defined over equal domains and contain the same values.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeSet)) {
            return false;
        }
        RangeSet<?> other = (RangeSet<?>) o;
        if (!traits.equals(other.traits) || endpoints.size() != other.endpoints.size()) {
            return false;
        }
        @SuppressWarnings("unchecked")
        ImmutableList<T> otherEndpoints = (ImmutableList<T>) other.endpoints;
        for (int i = 0; i < endpoints.size(); i++) {
            if (!traits.equal(endpoints.get(i), otherEndpoints.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        if (hash != 0) {
            return hash;
        }
        final int prime = 31;
        int result = 1;
        for (T endpoint : endpoints) {
            result = prime * result + traits.hash(endpoint);
        }
        this.hash = result;
        return result;
    }

    @Override
    public String toString() {
        return "RangeSet{" + Joiner.on(", ").join(intervals()) + "}";
    }

    /**
     * Read-only random access list of the maximal intervals of a {@link RangeSet}, backed by the set endpoints.
     * <p>
     * List equality compares intervals with {@link Interval#equals(Object)}, i.e. with the {@code equals} of the
     * domain type. For domains whose type does not implement {@code equals} consistently with
     * {@link DomainTraits#equal(Object, Object)}, compare the sets themselves or use
     * {@link Interval#equalTo(Interval, DomainTraits)}.
     */
    public static final class Intervals<T> extends AbstractList<Interval<T>> implements RandomAccess {
        private final DomainTraits<T> traits;
        private final ImmutableList<T> endpoints;

        private Intervals(DomainTraits<T> traits, ImmutableList<T> endpoints) {
            this.traits = traits;
            this.endpoints = endpoints;
        }

        @Override
        public int size() {
            return (endpoints.size() + 1) / 2;
        }

        @Override
        public Interval<T> get(int index) {
            checkElementIndex(index, size());
            return IntervalPosition.intervalAt(traits, endpoints, 2 * index);
        }

        /**
         * @return position of the first interval
         */
        public IntervalPosition<T> begin() {
            return IntervalPosition.begin(traits, endpoints);
        }

        /**
         * @return past-the-end interval position
         */
        public IntervalPosition<T> end() {
            return IntervalPosition.end(traits, endpoints);
        }
    }
}
