package com.rtbhouse.rangeset.test.utils;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.rtbhouse.rangeset.api.IntegralDomains;
import com.rtbhouse.rangeset.api.RangeSet;

/**
 * Seeded generator of sets over the {@link IntegralDomains#BYTE} domain, small enough to be compared with brute force
 * enumeration of the domain.
 */
public final class RandomRangeSets {

    public static final List<Byte> ALL_BYTES = IntStream.rangeClosed(Byte.MIN_VALUE, Byte.MAX_VALUE)
            .mapToObj(value -> (byte) value)
            .collect(Collectors.toUnmodifiableList());

    private final Random random;

    public RandomRangeSets(int seed) {
        this.random = new Random(seed);
    }

    public RangeSet<Byte> next() {
        RangeSet<Byte> set = RangeSet.makeEmpty(IntegralDomains.BYTE);
        int intervals = random.nextInt(5);
        for (int i = 0; i < intervals; i++) {
            set = RangeSet.makeUnion(set, nextInterval());
        }
        return set;
    }

    private RangeSet<Byte> nextInterval() {
        switch (random.nextInt(6)) {
            case 0:
                return RangeSet.makeSingleValue(IntegralDomains.BYTE, nextByte());
            case 1:
                return RangeSet.makeLess(IntegralDomains.BYTE, nextByte());
            case 2:
                return RangeSet.makeGreaterEqual(IntegralDomains.BYTE, nextByte());
            default:
                byte first = nextByte();
                byte second = nextByte();
                return RangeSet.makeInterval(IntegralDomains.BYTE, (byte) Math.min(first, second), random.nextBoolean(),
                        (byte) Math.max(first, second), random.nextBoolean());
        }
    }

    private byte nextByte() {
        // domain bounds are drawn more often than other values
        int draw = random.nextInt(20);
        if (draw == 0) {
            return Byte.MIN_VALUE;
        }
        if (draw == 1) {
            return Byte.MAX_VALUE;
        }
        return (byte) (random.nextInt(256) + Byte.MIN_VALUE);
    }
}
