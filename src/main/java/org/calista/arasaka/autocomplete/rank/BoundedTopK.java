package org.calista.arasaka.autocomplete.rank;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * BoundedTopK keeps the best {@code capacity} elements ever offered to it under a total order.
 *
 * <p>
 * Backed by a heap whose head is the <em>worst</em> retained element, so admission is a single
 * comparison against the head and eviction is O(log K). Reading the ranked view copies and sorts,
 * O(K log K), and never mutates the heap.
 * </p>
 *
 * <p>
 * Rejected and evicted elements are gone for good: capacity never relaxes.
 * Not thread-safe.
 * </p>
 *
 * @param <T> element type
 */
public final class BoundedTopK<T> {

    private final int capacity;
    private final Comparator<? super T> bestFirst;
    private final PriorityQueue<T> heap;

    /**
     * @param capacity  maximum number of retained elements (K), must be positive
     * @param bestFirst order in which {@link #ranked()} returns elements; the first element is the best
     */
    public BoundedTopK(int capacity, Comparator<? super T> bestFirst) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0: " + capacity);
        this.capacity = capacity;
        this.bestFirst = Objects.requireNonNull(bestFirst, "bestFirst");
        // head = worst
        Comparator<T> worstFirst = (a, b) -> bestFirst.compare(b, a);
        this.heap = new PriorityQueue<>(Math.min(capacity, 64) + 1, worstFirst);
    }

    /**
     * Offers an element.
     *
     * @return true if the element is retained, false if it was discarded
     */
    public boolean offer(T element) {
        Objects.requireNonNull(element, "element");

        if (heap.size() < capacity) {
            heap.add(element);
            return true;
        }

        T worst = heap.peek();
        if (bestFirst.compare(element, worst) >= 0) return false;

        heap.poll();
        heap.add(element);
        return true;
    }

    /** Retained elements, best first. Returns a fresh mutable list. */
    public List<T> ranked() {
        ArrayList<T> out = new ArrayList<>(heap);
        out.sort(bestFirst);
        return out;
    }

    /** Current admission threshold: a new element must outrank this one once the container is full. */
    public Optional<T> worst() {
        return Optional.ofNullable(heap.peek());
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    public int size() {
        return heap.size();
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return "BoundedTopK{capacity=" + capacity + ", size=" + heap.size() + '}';
    }
}
