package io.bucketstore.storage;

import java.util.Arrays;

/**
 * LIFO stack of free slot indices local to one bucket.
 * <p>
 * Backed by a growable int array, so push and pop are O(1) amortized and the
 * most recently freed slot is handed out first.
 */
final class SlotFreeList {

    private static final int INITIAL_CAPACITY = 8;

    private final int maxEntries;
    private int[] slots;
    private int size;

    /**
     * @param maxEntries upper bound on simultaneously free slots (the bucket capacity)
     */
    SlotFreeList(int maxEntries) {
        this.maxEntries = maxEntries;
        this.slots = new int[Math.min(INITIAL_CAPACITY, maxEntries)];
    }

    /**
     * Push a slot index onto the stack.
     *
     * @param slot the freed slot index
     */
    void push(int slot) {
        assert size < maxEntries : "free list overflow: " + slot;
        if (size == slots.length) {
            slots = Arrays.copyOf(slots, Math.min(maxEntries, Math.max(1, slots.length * 2)));
        }
        slots[size++] = slot;
    }

    /**
     * Pop the most recently pushed slot index.
     *
     * @return the slot index, or -1 if empty
     */
    int pop() {
        if (size == 0) {
            return -1;
        }
        return slots[--size];
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    void clear() {
        size = 0;
    }
}
