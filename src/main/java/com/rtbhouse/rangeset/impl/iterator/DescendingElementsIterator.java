package com.rtbhouse.rangeset.impl.iterator;

import java.util.Iterator;
import java.util.NoSuchElementException;

import com.rtbhouse.rangeset.api.ElementPosition;

public class DescendingElementsIterator<T> implements Iterator<T> {

    private final ElementPosition<T> begin;
    private ElementPosition<T> position;

    public DescendingElementsIterator(ElementPosition<T> begin, ElementPosition<T> end) {
        this.begin = begin;
        this.position = end;
    }

    @Override
    public boolean hasNext() {
        return !position.equals(begin);
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        position = position.previous();
        return position.get();
    }
}
