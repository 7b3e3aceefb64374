package com.project.image.bgremoval.core;

/**
 * Fixed-capacity FIFO of pixel indices. The flood fill enqueues each pixel at most once, so a
 * capacity of {@code width * height} is never exceeded and no wrap-around is needed.
 */
final class WorkQueue {
    private final int[] items;
    private int head;
    private int tail;

    WorkQueue(int capacity) {
        this.items = new int[capacity];
    }

    void add(int index) {
        if (tail == items.length) {
            throw new IllegalStateException("Work queue capacity " + items.length + " exceeded");
        }
        items[tail++] = index;
    }

    int remove() {
        if (head == tail) {
            throw new IllegalStateException("Work queue is empty");
        }
        return items[head++];
    }

    boolean isEmpty() {
        return head == tail;
    }

    int size() {
        return tail - head;
    }

    /** Total number of {@link #add} calls so far. */
    int enqueuedCount() {
        return tail;
    }
}
