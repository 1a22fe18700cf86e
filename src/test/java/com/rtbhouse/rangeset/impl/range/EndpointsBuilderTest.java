package com.rtbhouse.rangeset.impl.range;

import static com.rtbhouse.rangeset.api.IntegralDomains.LONG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;

import com.rtbhouse.rangeset.api.BooleanOperation;
import com.rtbhouse.rangeset.impl.errors.ContractViolationException;
import com.rtbhouse.rangeset.impl.merge.EndpointsMerger;
import com.rtbhouse.rangeset.test.utils.ListShuffler;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;

@RunWith(JUnitParamsRunner.class)
public class EndpointsBuilderTest {

    private static final long MAX = Long.MAX_VALUE;

    private Object[] parametersForTestEndpointsFromValues() {
        return new Object[] {
                new Object[] {List.of(), List.of()},
                new Object[] {List.of(1L), List.of(1L, 2L)},
                new Object[] {List.of(1L, 3L, 5L), List.of(1L, 2L, 3L, 4L, 5L, 6L)},
                new Object[] {List.of(1L, 2L, 5L), List.of(1L, 3L, 5L, 6L)},
                new Object[] {List.of(1L, 4L, 5L), List.of(1L, 2L, 4L, 6L)},
                new Object[] {List.of(1L, 2L, 3L), List.of(1L, 4L)},
                new Object[] {List.of(1L, 2L, 3L, 5L, 6L, 7L), List.of(1L, 4L, 5L, 8L)},
                new Object[] {List.of(10L, 11L, 12L, 20L, 30L, 31L), List.of(10L, 13L, 20L, 21L, 30L, 32L)},
                new Object[] {List.of(MAX), List.of(MAX)},
                new Object[] {List.of(0L, MAX - 1, MAX), List.of(0L, 1L, MAX - 1)},
                new Object[] {List.of(Long.MIN_VALUE, Long.MIN_VALUE + 1), List.of(Long.MIN_VALUE, Long.MIN_VALUE + 2)}
        };
    }

    @Test
    @Parameters
    public void testEndpointsFromValues(List<Long> values, List<Long> expectedEndpoints) {
        //when
        List<Long> endpoints = EndpointsBuilder.endpointsFromValues(LONG, values);

        //then
        assertThat(endpoints).containsExactlyElementsOf(expectedEndpoints);
    }

    private Object[] parametersForUnionOfSingletonsShouldNotDependOnOrder() {
        return new Object[] {
                new Object[] {ListShuffler.forward()},
                new Object[] {ListShuffler.reversed()},
                new Object[] {ListShuffler.random(1)},
                new Object[] {ListShuffler.random(2)},
                new Object[] {ListShuffler.random(3)}
        };
    }

    @Test
    @Parameters
    public void unionOfSingletonsShouldNotDependOnOrder(ListShuffler<Long> shuffler) {
        //given
        List<Long> values = List.of(-7L, -6L, -5L, 0L, 2L, 3L, 9L, MAX - 1, MAX);

        //when
        List<Long> union = List.of();
        for (Long value : shuffler.getShuffled(values)) {
            List<Long> singleton = EndpointsBuilder.endpointsFromValues(LONG, List.of(value));
            union = EndpointsMerger.merge(LONG, union, singleton, BooleanOperation.UNION);
        }

        //then
        assertThat(union).containsExactlyElementsOf(EndpointsBuilder.endpointsFromValues(LONG, values));
    }

    @Test
    public void shouldRejectUnsortedValues() {
        //given
        EndpointsBuilder<Long> builder = new EndpointsBuilder<>(LONG).add(3L);

        //then
        assertThatThrownBy(() -> builder.add(3L))
                .isInstanceOf(ContractViolationException.class)
                .hasMessage("condition not met [lastValue < value]: 3, 3");
        assertThatThrownBy(() -> builder.add(2L))
                .isInstanceOf(ContractViolationException.class)
                .hasMessage("condition not met [lastValue < value]: 3, 2");
    }
}
