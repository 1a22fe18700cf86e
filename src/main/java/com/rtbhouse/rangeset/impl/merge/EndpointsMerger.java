package com.rtbhouse.rangeset.impl.merge;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.rtbhouse.rangeset.api.BooleanOperation;
import com.rtbhouse.rangeset.api.DomainTraits;

/**
 * Combines two canonical endpoint lists in a single sorted merge pass. Every endpoint toggles membership in its own
 * list; an endpoint is emitted whenever the combined membership changes, so the result is canonical as well.
 */
public class EndpointsMerger {

    private static final Logger logger = LoggerFactory.getLogger(EndpointsMerger.class);

    public static <T> ImmutableList<T> merge(DomainTraits<T> traits, List<T> lhs, List<T> rhs, BooleanOperation op) {
        ImmutableList.Builder<T> endpoints = ImmutableList.builderWithExpectedSize(lhs.size() + rhs.size());
        boolean inside = false;

        int lhsIndex = 0;
        boolean insideLhs = false;

        int rhsIndex = 0;
        boolean insideRhs = false;

        while (lhsIndex < lhs.size() || rhsIndex < rhs.size()) {
            T value;
            if (rhsIndex == rhs.size() || (lhsIndex < lhs.size() && traits.less(lhs.get(lhsIndex), rhs.get(rhsIndex)))) {
                insideLhs = !insideLhs;
                value = lhs.get(lhsIndex++);
            } else if (lhsIndex == lhs.size() || traits.less(rhs.get(rhsIndex), lhs.get(lhsIndex))) {
                insideRhs = !insideRhs;
                value = rhs.get(rhsIndex++);
            } else {
                // equal endpoints, both memberships change at the same value
                insideLhs = !insideLhs;
                insideRhs = !insideRhs;
                lhsIndex++;
                value = rhs.get(rhsIndex++);
            }

            boolean newInside = op.apply(insideLhs, insideRhs);
            if (inside != newInside) {
                inside = newInside;
                endpoints.add(value);
            }
        }

        ImmutableList<T> result = endpoints.build();
        logger.debug("merged {} and {} endpoints into {}", lhs.size(), rhs.size(), result.size());
        return result;
    }
}
