package com.rtbhouse.rangeset.api;

import static com.rtbhouse.rangeset.impl.Contracts.checkArgument;

/**
 * {@link DomainTraits} of the built-in fixed-width integral types: bounds of the type, successor and predecessor
 * differing by one and the numeric order.
 */
public final class IntegralDomains {

    public static final DomainTraits<Byte> BYTE = new NumericDomain<>("BYTE", Byte.MIN_VALUE, Byte.MAX_VALUE) {
        @Override
        Byte fromLong(long value) {
            return (byte) value;
        }
    };

    public static final DomainTraits<Short> SHORT = new NumericDomain<>("SHORT", Short.MIN_VALUE, Short.MAX_VALUE) {
        @Override
        Short fromLong(long value) {
            return (short) value;
        }
    };

    public static final DomainTraits<Integer> INTEGER = new NumericDomain<>("INTEGER", Integer.MIN_VALUE,
            Integer.MAX_VALUE) {
        @Override
        Integer fromLong(long value) {
            return (int) value;
        }
    };

    public static final DomainTraits<Long> LONG = new NumericDomain<>("LONG", Long.MIN_VALUE, Long.MAX_VALUE) {
        @Override
        Long fromLong(long value) {
            return value;
        }
    };

    public static final DomainTraits<Character> CHARACTER = new CharacterDomain();

    private IntegralDomains() {
    }

    private abstract static class NumericDomain<T extends Number> implements DomainTraits<T> {
        private final String name;
        private final T min;
        private final T max;

        NumericDomain(String name, T min, T max) {
            this.name = name;
            this.min = min;
            this.max = max;
        }

        abstract T fromLong(long value);

        @Override
        public T min() {
            return min;
        }

        @Override
        public T max() {
            return max;
        }

        @Override
        public T prev(T value) {
            checkArgument(value.longValue() > min.longValue(), "no predecessor of %s in %s domain", value, name);
            return fromLong(value.longValue() - 1);
        }

        @Override
        public T next(T value) {
            checkArgument(value.longValue() < max.longValue(), "no successor of %s in %s domain", value, name);
            return fromLong(value.longValue() + 1);
        }

        @Override
        public boolean less(T lhs, T rhs) {
            return lhs.longValue() < rhs.longValue();
        }

        @Override
        public long distance(T lhs, T rhs) {
            checkArgument(lhs.longValue() <= rhs.longValue(), "distance from %s to %s is negative", lhs, rhs);
            // wraps for the widest LONG distances, the result is read as unsigned
            return rhs.longValue() - lhs.longValue();
        }

        @Override
        public boolean inside(T value) {
            return true;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static class CharacterDomain implements DomainTraits<Character> {

        @Override
        public Character min() {
            return Character.MIN_VALUE;
        }

        @Override
        public Character max() {
            return Character.MAX_VALUE;
        }

        @Override
        public Character prev(Character value) {
            checkArgument(value > Character.MIN_VALUE, "no predecessor of %s in CHARACTER domain", (int) value);
            return (char) (value - 1);
        }

        @Override
        public Character next(Character value) {
            checkArgument(value < Character.MAX_VALUE, "no successor of %s in CHARACTER domain", (int) value);
            return (char) (value + 1);
        }

        @Override
        public boolean less(Character lhs, Character rhs) {
            return lhs < rhs;
        }

        @Override
        public long distance(Character lhs, Character rhs) {
            checkArgument(lhs <= rhs, "distance from %s to %s is negative", (int) lhs, (int) rhs);
            return rhs - lhs;
        }

        @Override
        public boolean inside(Character value) {
            return true;
        }

        @Override
        public String toString() {
            return "CHARACTER";
        }
    }
}
