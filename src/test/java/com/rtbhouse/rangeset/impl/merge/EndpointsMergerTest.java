package com.rtbhouse.rangeset.impl.merge;

import static com.rtbhouse.rangeset.api.IntegralDomains.INTEGER;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;

import com.rtbhouse.rangeset.api.BooleanOperation;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;

@RunWith(JUnitParamsRunner.class)
public class EndpointsMergerTest {

    private Object[] parametersForShouldMergeEndpoints() {
        return new Object[] {
                // disjoint
                new Object[] {List.of(0, 2), List.of(5, 7), BooleanOperation.UNION, List.of(0, 2, 5, 7)},
                new Object[] {List.of(0, 2), List.of(5, 7), BooleanOperation.INTERSECTION, List.of()},
                // touching intervals are joined
                new Object[] {List.of(0, 5), List.of(5, 7), BooleanOperation.UNION, List.of(0, 7)},
                new Object[] {List.of(0, 5), List.of(5, 7), BooleanOperation.SYMMETRIC_DIFFERENCE, List.of(0, 7)},
                // equal starts and ends
                new Object[] {List.of(0, 5), List.of(0, 5), BooleanOperation.UNION, List.of(0, 5)},
                new Object[] {List.of(0, 5), List.of(0, 5), BooleanOperation.DIFFERENCE, List.of()},
                new Object[] {List.of(0, 5), List.of(0, 3), BooleanOperation.DIFFERENCE, List.of(3, 5)},
                new Object[] {List.of(0, 5), List.of(3, 5), BooleanOperation.SYMMETRIC_DIFFERENCE, List.of(0, 3)},
                // open to the domain maximum
                new Object[] {List.of(0), List.of(3, 5), BooleanOperation.DIFFERENCE, List.of(0, 3, 5)},
                new Object[] {List.of(0), List.of(10), BooleanOperation.INTERSECTION, List.of(10)},
                new Object[] {List.of(0), List.of(10), BooleanOperation.SYMMETRIC_DIFFERENCE, List.of(0, 10)},
                new Object[] {List.of(0), List.of(0), BooleanOperation.SYMMETRIC_DIFFERENCE, List.of()},
                // overlapping
                new Object[] {List.of(0, 5, 10, 15), List.of(3, 12), BooleanOperation.UNION, List.of(0, 15)},
                new Object[] {List.of(0, 5, 10, 15), List.of(3, 12), BooleanOperation.INTERSECTION, List.of(3, 5, 10, 12)},
                new Object[] {List.of(0, 5, 10, 15), List.of(3, 12), BooleanOperation.DIFFERENCE, List.of(0, 3, 12, 15)},
                new Object[] {List.of(), List.of(3, 12), BooleanOperation.UNION, List.of(3, 12)}
        };
    }

    @Test
    @Parameters
    public void shouldMergeEndpoints(List<Integer> lhs, List<Integer> rhs, BooleanOperation op,
                                     List<Integer> expected) {
        //when
        List<Integer> merged = EndpointsMerger.merge(INTEGER, lhs, rhs, op);

        //then
        assertThat(merged).containsExactlyElementsOf(expected);
    }

    @Test
    public void shouldApplyCustomOperation() {
        //given
        BooleanOperation onlyRhs = (inLhs, inRhs) -> inRhs;

        //when
        List<Integer> merged = EndpointsMerger.merge(INTEGER, List.of(0, 5), List.of(3, 8), onlyRhs);

        //then
        assertThat(merged).containsExactly(3, 8);
    }
}
