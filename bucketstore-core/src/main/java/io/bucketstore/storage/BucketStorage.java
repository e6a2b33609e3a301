package io.bucketstore.storage;

import io.bucketstore.core.BucketAllocationException;
import io.bucketstore.core.BucketStoreConfiguration;

import java.util.AbstractCollection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Position-stable container that stores elements in fixed-size buckets.
 * <p>
 * Provides:
 * <ul>
 *   <li>O(1) amortized {@link #insert(Object)} and {@link #erase(ReadOnlyCursor)}</li>
 *   <li>Stable cursors: an element never moves while it is live</li>
 *   <li>Traversal in position order (bucket creation order, then slot index)</li>
 *   <li>Skip-advance over fully packed buckets via {@link #getToDistance(Cursor, long)}</li>
 * </ul>
 * <p>
 * Position order equals insertion order only as long as nothing was erased
 * and reinserted: an insert reuses the first bucket with a free slot, and
 * the most recently freed slot within it.
 * <p>
 * <b>Thread-safety:</b> none. Concurrent access must be serialized by the
 * caller. The {@link #iterator()} is fail-fast; cursors are not checked.
 * <p>
 * Precondition violations (erasing a freed or foreign cursor, stepping past
 * either end) are checked with {@code assert} only. With assertions disabled
 * they are not detected: erasing the same cursor twice pushes its slot onto
 * the bucket's free list twice, and two later inserts then share that slot.
 *
 * @param <E> element type
 */
public class BucketStorage<E> extends AbstractCollection<E> implements BucketView<E> {

    private BucketChain<E> chain;

    /**
     * Create an empty storage with the default block capacity.
     */
    public BucketStorage() {
        this(BucketStoreConfiguration.defaults());
    }

    /**
     * Create an empty storage.
     *
     * @param blockCapacity slots per bucket (must be positive)
     * @throws IllegalArgumentException if blockCapacity is not positive
     */
    public BucketStorage(int blockCapacity) {
        this(BucketStoreConfiguration.defaults().withBlockCapacity(blockCapacity));
    }

    /**
     * Create an empty storage.
     *
     * @param configuration storage configuration
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public BucketStorage(BucketStoreConfiguration configuration) {
        this(new BucketChain<>(configuration));
    }

    /**
     * Copy constructor. Copies element references in position order into a
     * compacted chain with the same configuration.
     *
     * @param source storage to copy
     */
    public BucketStorage(BucketStorage<? extends E> source) {
        this(copyOf(source, UnaryOperator.identity()));
    }

    /**
     * Deep-copy constructor.
     *
     * @param source        storage to copy
     * @param elementCopier produces the copy of each element
     */
    public BucketStorage(BucketStorage<? extends E> source, UnaryOperator<E> elementCopier) {
        this(copyOf(source, elementCopier));
    }

    private BucketStorage(BucketChain<E> chain) {
        this.chain = chain;
    }

    /**
     * Take over the buckets of {@code source} in O(1). The source is left
     * empty with zero capacity; cursors obtained from it now belong to the
     * returned storage.
     *
     * @param source storage to move from
     * @return a storage owning the source's elements
     */
    public static <E> BucketStorage<E> moved(BucketStorage<E> source) {
        var taken = new BucketStorage<>(source.chain);
        source.chain = new BucketChain<>(taken.chain.configuration());
        return taken;
    }

    private static <E> BucketChain<E> copyOf(BucketStorage<? extends E> source, UnaryOperator<E> elementCopier) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(elementCopier, "elementCopier");
        var copy = new BucketChain<E>(source.configuration());
        for (E element : source) {
            copy.store(elementCopier.apply(element));
        }
        return copy;
    }

    public BucketStoreConfiguration configuration() {
        return chain.configuration();
    }

    @Override
    public int blockCapacity() {
        return chain.blockCapacity();
    }

    /**
     * Get the number of allocated buckets, including emptied ones kept for reuse.
     *
     * @return bucket count
     */
    public int bucketCount() {
        return chain.bucketCount();
    }

    /**
     * Insert an element.
     *
     * @param element the element to insert (may be null)
     * @return cursor to the inserted element
     * @throws BucketAllocationException if a new bucket was needed and could not be allocated
     */
    public Cursor<E> insert(E element) {
        return chain.store(element);
    }

    @Override
    public boolean add(E element) {
        chain.store(element);
        return true;
    }

    /**
     * Erase the element a cursor refers to. No other element moves and no
     * other cursor is invalidated.
     *
     * @param position cursor to a live element of this storage
     * @return cursor to the next live element, or {@link #end()}
     */
    public Cursor<E> erase(ReadOnlyCursor<E> position) {
        assert position.chain == chain : "cursor does not belong to this storage";
        assert position.bucket != null && position.bucket.isOccupied(position.slot)
                : "cursor does not refer to a live element";
        chain.release(position.bucket, position.slot);
        return new Cursor<>(chain, position.bucket, position.slot).next();
    }

    @Override
    public Cursor<E> begin() {
        return (Cursor<E>) endCursor().firstFrom(chain.head());
    }

    @Override
    public Cursor<E> end() {
        return endCursor();
    }

    @Override
    public ReadOnlyCursor<E> cbegin() {
        return begin().readOnly();
    }

    @Override
    public ReadOnlyCursor<E> cend() {
        return new ReadOnlyCursor<>(chain, null, 0);
    }

    private Cursor<E> endCursor() {
        return new Cursor<>(chain, null, 0);
    }

    @Override
    public int size() {
        return (int) Math.min(chain.size(), Integer.MAX_VALUE);
    }

    @Override
    public long capacity() {
        return chain.capacity();
    }

    @Override
    public boolean isEmpty() {
        return chain.size() == 0;
    }

    /**
     * Drop every element and release every bucket. Capacity becomes 0.
     */
    @Override
    public void clear() {
        chain.clear();
    }

    /**
     * Release buckets that hold no live element. Cursors to surviving
     * elements stay valid and keep their order.
     *
     * @return the number of buckets released
     */
    public int shrinkToFit() {
        return chain.shrinkToFit();
    }

    /**
     * Exchange contents with another storage in O(1). Cursors follow their
     * elements into the other storage.
     *
     * @param other storage to swap with
     */
    public void swap(BucketStorage<E> other) {
        var mine = chain;
        chain = other.chain;
        other.chain = mine;
    }

    /**
     * Replace the contents with a compacted copy of {@code source}, including
     * its configuration. A no-op when {@code source} is this storage.
     *
     * @param source storage to copy
     */
    public void copyFrom(BucketStorage<? extends E> source) {
        copyFrom(source, UnaryOperator.identity());
    }

    /**
     * Replace the contents with a deep copy of {@code source}. If the copier
     * throws, this storage is left unchanged.
     *
     * @param source        storage to copy
     * @param elementCopier produces the copy of each element
     */
    public void copyFrom(BucketStorage<? extends E> source, UnaryOperator<E> elementCopier) {
        if (source == this) {
            return;
        }
        var copy = copyOf(source, elementCopier);
        var previous = chain;
        chain = copy;
        previous.clear();
    }

    /**
     * Take over the buckets of {@code source} in O(1), dropping the current
     * contents. The source is left empty with zero capacity. A no-op when
     * {@code source} is this storage.
     *
     * @param source storage to move from
     */
    public void moveFrom(BucketStorage<E> source) {
        if (source == this) {
            return;
        }
        var previous = chain;
        chain = source.chain;
        source.chain = new BucketChain<>(chain.configuration());
        previous.clear();
    }

    /**
     * Cursor {@code distance} live elements after {@code from}; the same as
     * calling {@link Cursor#next()} that many times, but crosses fully packed
     * buckets in O(1).
     *
     * @param from     start cursor
     * @param distance non-negative number of steps, not passing {@link #end()}
     * @return the resulting cursor
     * @throws IllegalArgumentException if distance is negative
     */
    public Cursor<E> getToDistance(Cursor<E> from, long distance) {
        return (Cursor<E>) SkipAdvance.advance(from, distance);
    }

    @Override
    public ReadOnlyCursor<E> getToDistance(ReadOnlyCursor<E> from, long distance) {
        return SkipAdvance.advance(from, distance);
    }

    @Override
    public long distance(ReadOnlyCursor<E> first, ReadOnlyCursor<E> last) {
        return SkipAdvance.distance(first, last);
    }

    /**
     * Fail-fast iterator in position order. {@link Iterator#remove()} erases
     * the last returned element.
     */
    @Override
    public Iterator<E> iterator() {
        return new Itr<>(chain, cbegin());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        var other = (BucketStorage<?>) obj;
        if (chain.size() != other.chain.size()) {
            return false;
        }
        var theirs = other.iterator();
        for (E element : this) {
            if (!Objects.equals(element, theirs.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        var hash = 1;
        for (E element : this) {
            hash = 31 * hash + Objects.hashCode(element);
        }
        return hash;
    }

    private static final class Itr<E> implements Iterator<E> {
        private final BucketChain<E> chain;
        private ReadOnlyCursor<E> cursor;
        private ReadOnlyCursor<E> lastReturned;
        private int expectedModCount;

        private Itr(BucketChain<E> chain, ReadOnlyCursor<E> start) {
            this.chain = chain;
            this.cursor = start;
            this.expectedModCount = chain.modCount();
        }

        @Override
        public boolean hasNext() {
            return !cursor.isEnd();
        }

        @Override
        public E next() {
            checkForComodification();
            if (cursor.isEnd()) {
                throw new NoSuchElementException();
            }
            lastReturned = cursor;
            cursor = cursor.next();
            return lastReturned.get();
        }

        @Override
        public void remove() {
            if (lastReturned == null) {
                throw new IllegalStateException("next() has not been called since the last remove()");
            }
            checkForComodification();
            chain.release(lastReturned.bucket, lastReturned.slot);
            lastReturned = null;
            expectedModCount = chain.modCount();
        }

        private void checkForComodification() {
            if (chain.modCount() != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }
    }
}
