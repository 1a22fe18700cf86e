package com.rtbhouse.rangeset.api;

/**
 * Membership rule of a set combined from two sets with {@link RangeSet#makeBoolean(RangeSet, RangeSet,
 * BooleanOperation)}: a value belongs to the result if {@code apply(lhs.contains(value), rhs.contains(value))}.
 */
@FunctionalInterface
public interface BooleanOperation {

    BooleanOperation UNION = (inLhs, inRhs) -> inLhs || inRhs;

    BooleanOperation INTERSECTION = (inLhs, inRhs) -> inLhs && inRhs;

    BooleanOperation DIFFERENCE = (inLhs, inRhs) -> inLhs && !inRhs;

    BooleanOperation SYMMETRIC_DIFFERENCE = (inLhs, inRhs) -> inLhs ^ inRhs;

    boolean apply(boolean inLhs, boolean inRhs);
}
