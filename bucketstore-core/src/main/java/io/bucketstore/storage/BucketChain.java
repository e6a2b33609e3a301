package io.bucketstore.storage;

import io.bucketstore.core.BucketAllocationException;
import io.bucketstore.core.BucketStoreConfiguration;
import io.bucketstore.kernel.SlotPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered chain of buckets backing one {@link BucketStorage}.
 * <p>
 * Owns bucket lifecycle:
 * <ul>
 *   <li>Buckets are created lazily, only when no bucket from the insert cursor on has a free slot</li>
 *   <li>Emptied buckets are retained for reuse</li>
 *   <li>Buckets are destroyed only by {@link #clear()} or {@link #shrinkToFit()}</li>
 * </ul>
 * <p>
 * Every bucket strictly before {@code insertBucket} is full, so the first
 * bucket with a free slot is found by scanning forward from it.
 * <p>
 * Cursors keep a reference to the chain rather than to the container, which
 * lets {@link BucketStorage#swap(BucketStorage)} hand whole chains over
 * without touching a single cursor.
 *
 * @param <E> element type
 */
final class BucketChain<E> {

    private static final Logger log = LoggerFactory.getLogger(BucketChain.class);

    private final BucketStoreConfiguration configuration;
    private final int blockCapacity;

    private Bucket<E> head;
    private Bucket<E> tail;
    private Bucket<E> insertBucket;
    private int bucketCount;
    private long size;
    private long nextSequence;
    private int modCount;

    BucketChain(BucketStoreConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        var capacity = configuration.blockCapacity();
        if (capacity <= 0) {
            throw new IllegalArgumentException("blockCapacity must be positive: " + capacity);
        }
        if (capacity > BucketStoreConfiguration.MAX_BLOCK_CAPACITY) {
            throw new IllegalArgumentException("blockCapacity exceeds max slot index: " + capacity);
        }
        if (configuration.maxBuckets() <= 0) {
            throw new IllegalArgumentException("maxBuckets must be positive: " + configuration.maxBuckets());
        }
        this.configuration = configuration;
        this.blockCapacity = capacity;
    }

    BucketStoreConfiguration configuration() {
        return configuration;
    }

    int blockCapacity() {
        return blockCapacity;
    }

    long size() {
        return size;
    }

    long capacity() {
        return (long) blockCapacity * bucketCount;
    }

    int bucketCount() {
        return bucketCount;
    }

    int modCount() {
        return modCount;
    }

    Bucket<E> head() {
        return head;
    }

    Bucket<E> tail() {
        return tail;
    }

    /**
     * Store an element in the first bucket with a free slot, appending a new
     * bucket when every existing one is full.
     *
     * @param element the element to store
     * @return cursor to the stored element
     * @throws BucketAllocationException if a new bucket was needed and could not be allocated
     */
    Cursor<E> store(E element) {
        while (insertBucket != null && insertBucket.isFull()) {
            insertBucket = insertBucket.next;
        }
        if (insertBucket == null) {
            insertBucket = appendBucket();
        }
        var slot = insertBucket.tryAcquireSlot();
        assert slot >= 0 : "insert bucket has no free slot";
        insertBucket.set(slot, element);
        size++;
        modCount++;
        return new Cursor<>(this, insertBucket, slot);
    }

    /**
     * Release an occupied slot.
     *
     * @return the removed element
     */
    E release(Bucket<E> bucket, int slot) {
        var element = bucket.releaseSlot(slot);
        size--;
        modCount++;
        if (insertBucket == null || bucket.sequence() < insertBucket.sequence()) {
            insertBucket = bucket;
        }
        return element;
    }

    /**
     * Drop every element and every bucket.
     */
    void clear() {
        var released = bucketCount;
        var bucket = head;
        while (bucket != null) {
            var following = bucket.next;
            bucket.discard();
            bucket = following;
        }
        head = null;
        tail = null;
        insertBucket = null;
        bucketCount = 0;
        size = 0;
        modCount++;
        if (released > 0) {
            log.debug("Cleared '{}': released {} bucket(s)", configuration.name(), released);
        }
    }

    /**
     * Release every bucket that holds no live element. Surviving buckets keep
     * their sequence numbers, so positions and their order are unaffected.
     *
     * @return the number of buckets released
     */
    int shrinkToFit() {
        var released = 0;
        var bucket = head;
        while (bucket != null) {
            var following = bucket.next;
            if (bucket.isEmpty()) {
                unlink(bucket);
                bucket.discard();
                released++;
            }
            bucket = following;
        }
        if (released > 0) {
            insertBucket = head;
            modCount++;
            log.debug("Shrunk '{}': released {} empty bucket(s), capacity now {}",
                    configuration.name(), released, capacity());
        }
        return released;
    }

    /**
     * First bucket at or after {@code from} that holds a live element.
     *
     * @return the bucket, or null if none
     */
    static <E> Bucket<E> firstNonEmpty(Bucket<E> from) {
        var bucket = from;
        while (bucket != null && bucket.isEmpty()) {
            bucket = bucket.next;
        }
        return bucket;
    }

    /**
     * Last bucket at or before {@code from} that holds a live element.
     *
     * @return the bucket, or null if none
     */
    static <E> Bucket<E> lastNonEmpty(Bucket<E> from) {
        var bucket = from;
        while (bucket != null && bucket.isEmpty()) {
            bucket = bucket.previous;
        }
        return bucket;
    }

    private Bucket<E> appendBucket() {
        if (bucketCount >= configuration.maxBuckets()) {
            throw new BucketAllocationException("Bucket limit reached for '" + configuration.name()
                    + "' (maxBuckets=" + configuration.maxBuckets() + ")");
        }
        var sequence = nextSequence;
        if (sequence > SlotPosition.MAX_SEQUENCE) {
            throw new BucketAllocationException("Bucket sequence space exhausted for '" + configuration.name() + "'");
        }
        Bucket<E> bucket;
        try {
            bucket = new Bucket<>(sequence, blockCapacity);
        } catch (OutOfMemoryError oom) {
            log.warn("Failed to allocate bucket for '{}' (capacity={}, buckets={})",
                    configuration.name(), blockCapacity, bucketCount);
            throw new BucketAllocationException("Failed to allocate bucket (capacity=" + blockCapacity
                    + ", buckets=" + bucketCount + ")", oom);
        }
        nextSequence++;
        bucket.previous = tail;
        if (tail == null) {
            head = bucket;
        } else {
            tail.next = bucket;
        }
        tail = bucket;
        bucketCount++;
        log.debug("Allocated bucket #{} for '{}' ({} slots, {} bucket(s) total)",
                sequence, configuration.name(), blockCapacity, bucketCount);
        return bucket;
    }

    private void unlink(Bucket<E> bucket) {
        if (bucket.previous == null) {
            head = bucket.next;
        } else {
            bucket.previous.next = bucket.next;
        }
        if (bucket.next == null) {
            tail = bucket.previous;
        } else {
            bucket.next.previous = bucket.previous;
        }
        bucketCount--;
    }
}
