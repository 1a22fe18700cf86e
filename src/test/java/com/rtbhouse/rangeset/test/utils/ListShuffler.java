package com.rtbhouse.rangeset.test.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.UnaryOperator;

import com.google.common.collect.Lists;

/**
 * Named order in which operands are fed to an order-independent operation.
 */
public final class ListShuffler<E> {
    private final String name;
    private final UnaryOperator<List<E>> reorder;

    private ListShuffler(String name, UnaryOperator<List<E>> reorder) {
        this.name = name;
        this.reorder = reorder;
    }

    public static <E> ListShuffler<E> forward() {
        return new ListShuffler<>("forward", input -> input);
    }

    public static <E> ListShuffler<E> reversed() {
        return new ListShuffler<>("reversed", Lists::reverse);
    }

    public static <E> ListShuffler<E> random(int seed) {
        return new ListShuffler<>("random(" + seed + ")", input -> {
            List<E> copy = new ArrayList<>(input);
            Collections.shuffle(copy, new Random(seed));
            return copy;
        });
    }

    public List<E> getShuffled(List<E> input) {
        return reorder.apply(input);
    }

    @Override
    public String toString() {
        return name;
    }
}
