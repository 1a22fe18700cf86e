package com.rtbhouse.rangeset.impl.collection;

import java.util.Comparator;
import java.util.List;
import java.util.RandomAccess;

import com.rtbhouse.rangeset.impl.Contracts;

public class CollectionUtils {

    /**
     * Returns the index of the first element in this sorted list which is greater than the given key, or the size of the list if there is no such element.
     */
    public static <E> int upperBound(List<E> sortedElements, E key, Comparator<? super E> comparator) {
        Contracts.checkArgument(sortedElements instanceof RandomAccess, "binary search over non random access list: %s",
                sortedElements.getClass());
        int low = 0;
        int high = sortedElements.size() - 1;

        while (low <= high) {
            int mid = (low + high) >>> 1;
            int cmp = comparator.compare(sortedElements.get(mid), key);

            if (cmp <= 0)
                low = mid + 1;
            else
                high = mid - 1;
        }

        return low;
    }

    /**
     * Returns true if every element of the list is less than the following one.
     */
    public static <E> boolean isStrictlyAscending(List<E> elements, Comparator<? super E> comparator) {
        for (int i = 1; i < elements.size(); i++) {
            if (comparator.compare(elements.get(i - 1), elements.get(i)) >= 0) {
                return false;
            }
        }
        return true;
    }
}
