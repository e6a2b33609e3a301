package io.bucketstore.storage;

/**
 * Fixed-capacity block of element slots.
 * <p>
 * A bucket never grows, shrinks or moves its slots after creation, so an
 * element keeps its (bucket, slot) address until it is erased. Slots are
 * handed out from a LIFO free list first, then from the never-used tail
 * ({@code highWater}). Occupancy is tracked per slot, so {@code null} is a
 * legal element.
 * <p>
 * Buckets are linked in creation order by the owning {@link BucketChain};
 * the links are maintained there.
 *
 * @param <E> element type
 */
final class Bucket<E> {

    private final long sequence;
    private final Object[] slots;
    private final boolean[] occupied;
    private final SlotFreeList freeList;
    private int highWater;
    private int liveCount;

    Bucket<E> previous;
    Bucket<E> next;

    Bucket(long sequence, int capacity) {
        this.sequence = sequence;
        this.slots = new Object[capacity];
        this.occupied = new boolean[capacity];
        this.freeList = new SlotFreeList(capacity);
    }

    long sequence() {
        return sequence;
    }

    int capacity() {
        return slots.length;
    }

    int liveCount() {
        return liveCount;
    }

    boolean isFull() {
        return liveCount == slots.length;
    }

    boolean isEmpty() {
        return liveCount == 0;
    }

    /**
     * Reserve a slot for a new element.
     *
     * @return the slot index, or -1 if the bucket is full
     */
    int tryAcquireSlot() {
        int slot;
        if (freeList.isEmpty()) {
            if (highWater == slots.length) {
                return -1;
            }
            slot = highWater++;
        } else {
            slot = freeList.pop();
        }
        occupied[slot] = true;
        liveCount++;
        return slot;
    }

    /**
     * Free an occupied slot and push it onto the free list.
     *
     * @param slot the slot to free
     * @return the element that was stored there
     */
    E releaseSlot(int slot) {
        assert occupied[slot] : "slot " + slot + " of bucket #" + sequence + " is not occupied";
        var element = get(slot);
        slots[slot] = null;
        occupied[slot] = false;
        freeList.push(slot);
        liveCount--;
        assert freeList.size() == highWater - liveCount : "free list out of sync in bucket #" + sequence;
        return element;
    }

    boolean isOccupied(int slot) {
        return occupied[slot];
    }

    @SuppressWarnings("unchecked")
    E get(int slot) {
        return (E) slots[slot];
    }

    void set(int slot, E element) {
        slots[slot] = element;
    }

    /**
     * First occupied slot at or after {@code from}.
     *
     * @return the slot index, or -1 if there is none
     */
    int nextOccupied(int from) {
        for (var slot = from; slot < highWater; slot++) {
            if (occupied[slot]) {
                return slot;
            }
        }
        return -1;
    }

    /**
     * Last occupied slot at or before {@code from}.
     *
     * @return the slot index, or -1 if there is none
     */
    int previousOccupied(int from) {
        for (var slot = Math.min(from, highWater - 1); slot >= 0; slot--) {
            if (occupied[slot]) {
                return slot;
            }
        }
        return -1;
    }

    /**
     * Number of occupied slots in {@code [from, to)}.
     */
    int countOccupied(int from, int to) {
        if (isFull()) {
            return to - from;
        }
        var count = 0;
        for (var slot = from; slot < Math.min(to, highWater); slot++) {
            if (occupied[slot]) {
                count++;
            }
        }
        return count;
    }

    /**
     * Drop every element reference and unlink. Called when the bucket leaves
     * its chain.
     */
    void discard() {
        for (var slot = 0; slot < highWater; slot++) {
            slots[slot] = null;
            occupied[slot] = false;
        }
        freeList.clear();
        highWater = 0;
        liveCount = 0;
        previous = null;
        next = null;
    }

    @Override
    public String toString() {
        return "Bucket{sequence=" + sequence + ", live=" + liveCount + "/" + slots.length + "}";
    }
}
