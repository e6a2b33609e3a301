package io.bucketstore.storage;

import io.bucketstore.kernel.SlotPosition;

/**
 * Immutable read-only position in a {@link BucketStorage}.
 * <p>
 * A cursor names a (bucket, slot) pair, or the past-the-end position. Stepping
 * returns a new cursor and skips free slots and emptied buckets. Cursors stay
 * valid until the element they refer to is erased or the storage is cleared;
 * inserting or erasing other elements never moves them.
 * <p>
 * Ordering follows position order: bucket creation sequence first, then slot
 * index, with the end position last. Comparing cursors of different storages
 * is undefined.
 *
 * @param <E> element type
 */
public class ReadOnlyCursor<E> implements Comparable<ReadOnlyCursor<E>> {

    final BucketChain<E> chain;
    final Bucket<E> bucket;
    final int slot;

    ReadOnlyCursor(BucketChain<E> chain, Bucket<E> bucket, int slot) {
        this.chain = chain;
        this.bucket = bucket;
        this.slot = slot;
    }

    /**
     * Cursor of the same kind as this one at another position.
     */
    ReadOnlyCursor<E> at(Bucket<E> bucket, int slot) {
        return new ReadOnlyCursor<>(chain, bucket, slot);
    }

    /**
     * First live position at or after the start of {@code from}, or end.
     */
    ReadOnlyCursor<E> firstFrom(Bucket<E> from) {
        var target = BucketChain.firstNonEmpty(from);
        return target == null ? at(null, 0) : at(target, target.nextOccupied(0));
    }

    /**
     * Get the element at this position.
     *
     * @return the element (may be null if null was inserted)
     */
    public E get() {
        assert bucket != null : "cannot dereference end";
        assert bucket.isOccupied(slot) : "cursor refers to a freed slot";
        return bucket.get(slot);
    }

    public boolean isEnd() {
        return bucket == null;
    }

    /**
     * Cursor to the next live element, or end.
     *
     * @return the following cursor
     */
    public ReadOnlyCursor<E> next() {
        assert bucket != null : "cannot advance past end";
        var following = bucket.nextOccupied(slot + 1);
        if (following >= 0) {
            return at(bucket, following);
        }
        return firstFrom(bucket.next);
    }

    /**
     * Cursor to the previous live element.
     *
     * @return the preceding cursor
     */
    public ReadOnlyCursor<E> previous() {
        Bucket<E> candidate;
        if (bucket == null) {
            candidate = chain.tail();
        } else {
            var preceding = bucket.previousOccupied(slot - 1);
            if (preceding >= 0) {
                return at(bucket, preceding);
            }
            candidate = bucket.previous;
        }
        var target = BucketChain.lastNonEmpty(candidate);
        assert target != null : "cannot step before begin";
        return at(target, target.previousOccupied(target.capacity() - 1));
    }

    /**
     * Get the order key of this cursor.
     *
     * @return slot position, or {@link SlotPosition#END}
     */
    public SlotPosition position() {
        return bucket == null ? SlotPosition.END : new SlotPosition(bucket.sequence(), slot);
    }

    long orderKey() {
        return bucket == null ? Long.MAX_VALUE : SlotPosition.pack(bucket.sequence(), slot);
    }

    @Override
    public final int compareTo(ReadOnlyCursor<E> other) {
        return Long.compare(orderKey(), other.orderKey());
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ReadOnlyCursor<?> other)) {
            return false;
        }
        return chain == other.chain && bucket == other.bucket && slot == other.slot;
    }

    @Override
    public final int hashCode() {
        return 31 * System.identityHashCode(bucket) + slot;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + position() + "}";
    }
}
