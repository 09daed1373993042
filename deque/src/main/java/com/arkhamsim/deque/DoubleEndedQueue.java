package com.arkhamsim.deque;

import java.util.ArrayList;
import java.util.List;

/**
 * A sequence that can be grown and shrunk at both ends.
 * <p>
 * Enqueue at the rear and dequeue at the front for FIFO; enqueue and dequeue at the same end for LIFO.
 * Null items are not allowed. Iteration runs front to rear.
 *
 * @param <T> item type
 */
public interface DoubleEndedQueue<T> extends Iterable<T> {

    void enqueueFront(T item);

    void enqueueRear(T item);

    /** @throws EmptyDequeException if empty */
    T dequeueFront();

    /** @throws EmptyDequeException if empty */
    T dequeueRear();

    /** @throws EmptyDequeException if empty */
    T peekFront();

    /** @throws EmptyDequeException if empty */
    T peekRear();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /** Copy of the contents, front first. */
    default List<T> toList() {
        List<T> result = new ArrayList<>(size());
        for (T item : this) result.add(item);
        return result;
    }
}
