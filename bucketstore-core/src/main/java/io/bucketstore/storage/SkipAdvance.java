package io.bucketstore.storage;

import java.util.concurrent.atomic.LongAdder;

/**
 * Block-aware multi-step cursor movement.
 * <p>
 * A full bucket has no holes, so the live slots ahead of any slot in it are
 * exactly {@code capacity - slot}. That lets a walk cross a full bucket in
 * O(1) and land inside one by index arithmetic. Buckets with holes are walked
 * slot by slot.
 */
final class SkipAdvance {

    private SkipAdvance() {
    }

    /**
     * Equivalent to calling {@link ReadOnlyCursor#next()} {@code distance} times.
     *
     * @param from     start cursor
     * @param distance number of steps, must be non-negative
     * @return cursor of the same kind as {@code from}
     * @throws IllegalArgumentException if distance is negative
     */
    static <E> ReadOnlyCursor<E> advance(ReadOnlyCursor<E> from, long distance) {
        return advance(from, distance, null);
    }

    /**
     * As {@link #advance(ReadOnlyCursor, long)}, counting every single-slot
     * step into {@code slotSteps} when it is non-null.
     */
    static <E> ReadOnlyCursor<E> advance(ReadOnlyCursor<E> from, long distance, LongAdder slotSteps) {
        if (distance < 0) {
            throw new IllegalArgumentException("distance must be non-negative: " + distance);
        }
        if (distance == 0) {
            return from;
        }
        var bucket = from.bucket;
        var slot = from.slot;
        var remaining = distance;
        while (remaining > 0) {
            assert bucket != null : "advanced past end by " + remaining;
            if (bucket.isFull()) {
                var ahead = bucket.capacity() - slot;
                if (remaining < ahead) {
                    slot += (int) remaining;
                    break;
                }
                remaining -= ahead;
                bucket = BucketChain.firstNonEmpty(bucket.next);
                slot = bucket == null ? 0 : bucket.nextOccupied(0);
                continue;
            }
            var following = bucket.nextOccupied(slot + 1);
            if (following >= 0) {
                slot = following;
            } else {
                bucket = BucketChain.firstNonEmpty(bucket.next);
                slot = bucket == null ? 0 : bucket.nextOccupied(0);
            }
            remaining--;
            if (slotSteps != null) {
                slotSteps.increment();
            }
        }
        return from.at(bucket, slot);
    }

    /**
     * Number of {@code next()} steps from {@code first} to {@code last}.
     *
     * @param first start cursor
     * @param last  end cursor, at or after {@code first}
     * @return the step count
     */
    static <E> long distance(ReadOnlyCursor<E> first, ReadOnlyCursor<E> last) {
        var bucket = first.bucket;
        var slot = first.slot;
        var steps = 0L;
        while (bucket != last.bucket) {
            assert bucket != null : "last is not reachable from first";
            steps += bucket.countOccupied(slot, bucket.capacity());
            bucket = BucketChain.firstNonEmpty(bucket.next);
            slot = bucket == null ? 0 : bucket.nextOccupied(0);
        }
        if (bucket != null) {
            assert slot <= last.slot : "last precedes first";
            steps += bucket.countOccupied(slot, last.slot);
        }
        return steps;
    }
}
