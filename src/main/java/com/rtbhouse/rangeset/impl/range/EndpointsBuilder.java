package com.rtbhouse.rangeset.impl.range;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.rtbhouse.rangeset.impl.Contracts.checkArgument;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.rtbhouse.rangeset.api.DomainTraits;

/**
 * Collects strictly ascending values into canonical endpoints, joining consecutive values into one interval.
 */
public class EndpointsBuilder<T> {
    private final DomainTraits<T> traits;
    private final List<T> endpoints = new ArrayList<>();
    private T lastValue;

    public EndpointsBuilder(DomainTraits<T> traits) {
        this.traits = checkNotNull(traits);
    }

    public static <T> ImmutableList<T> endpointsFromValues(DomainTraits<T> traits, Iterable<? extends T> values) {
        EndpointsBuilder<T> builder = new EndpointsBuilder<>(traits);
        for (T value : values) {
            builder.add(value);
        }
        return builder.build();
    }

    public EndpointsBuilder<T> add(T value) {
        checkNotNull(value);
        checkArgument(traits.inside(value), "value %s outside of %s domain", value, traits);

        if (lastValue == null) {
            endpoints.add(value);
            lastValue = value;
            return this;
        }

        checkArgument(traits.less(lastValue, value), "condition not met [lastValue < value]: %s, %s",
                lastValue, value);

        T lastValueSuccessor = traits.next(lastValue);
        if (!traits.equal(lastValueSuccessor, value)) {
            endpoints.add(lastValueSuccessor);
            endpoints.add(value);
        }
        lastValue = value;
        return this;
    }

    public ImmutableList<T> build() {
        ImmutableList.Builder<T> builder = ImmutableList.<T>builder().addAll(endpoints);
        if (lastValue != null && traits.less(lastValue, traits.max())) {
            builder.add(traits.next(lastValue));
        }
        return builder.build();
    }
}
