package com.arkhamsim.deque;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Array-backed double-ended queue. Items live in a circular array whose capacity is always a power of two,
 * so index arithmetic is a mask instead of a modulo. The array doubles when full, which keeps every
 * operation O(1) amortized.
 * <p>
 * Single-threaded API: all calls must be made from the same thread, or externally synchronised.
 *
 * @param <T> item type. Never null.
 */
public final class RingBufferDeque<T> implements DoubleEndedQueue<T> {

    static final int DEFAULT_CAPACITY = 16;

    private T[] items;   // null means empty slot
    private int mask;    // items.length - 1 (power-of-two invariant)
    private int head;    // index of the front item
    private int size;    // number of occupied slots
    private int modCount;

    public RingBufferDeque() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param initialCapacity rounded up to the next power of two; must be > 0
     */
    @SuppressWarnings("unchecked")
    public RingBufferDeque(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be > 0");
        }
        int capacity = Integer.bitCount(initialCapacity) == 1
                ? initialCapacity
                : Integer.highestOneBit(initialCapacity) << 1;
        if (capacity <= 0) {
            throw new IllegalArgumentException("initialCapacity too large: " + initialCapacity);
        }
        this.items = (T[]) new Object[capacity];
        this.mask = capacity - 1;
    }

    /** A deque holding {@code source} in iteration order: the first item ends up at the front. */
    public static <T> RingBufferDeque<T> of(Iterable<? extends T> source) {
        Objects.requireNonNull(source, "source");
        RingBufferDeque<T> deque = new RingBufferDeque<>();
        for (T item : source) deque.enqueueRear(item);
        return deque;
    }

    @SafeVarargs
    public static <T> RingBufferDeque<T> of(T... source) {
        RingBufferDeque<T> deque = new RingBufferDeque<>(Math.max(1, source.length));
        for (T item : source) deque.enqueueRear(item);
        return deque;
    }

    @Override
    public void enqueueFront(T item) {
        Objects.requireNonNull(item, "item");
        growIfFull();
        head = (head - 1) & mask;
        items[head] = item;
        size++;
        modCount++;
    }

    @Override
    public void enqueueRear(T item) {
        Objects.requireNonNull(item, "item");
        growIfFull();
        items[(head + size) & mask] = item;
        size++;
        modCount++;
    }

    @Override
    public T dequeueFront() {
        if (size == 0) throw new EmptyDequeException("dequeue from empty deque");
        T item = items[head];
        items[head] = null;
        head = (head + 1) & mask;
        size--;
        modCount++;
        return item;
    }

    @Override
    public T dequeueRear() {
        if (size == 0) throw new EmptyDequeException("dequeue from empty deque");
        int tail = (head + size - 1) & mask;
        T item = items[tail];
        items[tail] = null;
        size--;
        modCount++;
        return item;
    }

    @Override
    public T peekFront() {
        if (size == 0) throw new EmptyDequeException("peek from empty deque");
        return items[head];
    }

    @Override
    public T peekRear() {
        if (size == 0) throw new EmptyDequeException("peek from empty deque");
        return items[(head + size - 1) & mask];
    }

    @Override
    public int size() { return size; }

    /** Current length of the backing array (primarily for tests). */
    int capacity() { return items.length; }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private final int expectedModCount = modCount;
            private int offset = 0;

            @Override
            public boolean hasNext() {
                return offset < size;
            }

            @Override
            public T next() {
                if (modCount != expectedModCount) throw new ConcurrentModificationException();
                if (offset >= size) throw new NoSuchElementException();
                return items[(head + offset++) & mask];
            }
        };
    }

    // Unwraps into a fresh array twice as long, front item at index 0.
    @SuppressWarnings("unchecked")
    private void growIfFull() {
        if (size < items.length) return;
        int newCapacity = items.length << 1;
        if (newCapacity <= 0) throw new IllegalStateException("Deque too large: " + size);
        T[] bigger = (T[]) new Object[newCapacity];
        for (int i = 0; i < size; i++) {
            bigger[i] = items[(head + i) & mask];
        }
        items = bigger;
        mask = newCapacity - 1;
        head = 0;
    }

    @Override
    public String toString() {
        return "Deque(size=" + size + ")";
    }
}
