package com.rtbhouse.rangeset.impl.iterator;

import java.util.Iterator;
import java.util.NoSuchElementException;

import com.rtbhouse.rangeset.api.ElementPosition;

public class AscendingElementsIterator<T> implements Iterator<T> {

    private ElementPosition<T> position;
    private final ElementPosition<T> end;

    public AscendingElementsIterator(ElementPosition<T> begin, ElementPosition<T> end) {
        this.position = begin;
        this.end = end;
    }

    @Override
    public boolean hasNext() {
        return !position.equals(end);
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T element = position.get();
        position = position.next();
        return element;
    }
}
