package io.bucketstore.storage;

/**
 * Read-only view of a bucket storage.
 * <p>
 * Seen through this interface, {@link #begin()} and {@link #end()} yield
 * {@link ReadOnlyCursor}s; {@link BucketStorage} narrows them to mutable
 * {@link Cursor}s.
 *
 * @param <E> element type
 */
public interface BucketView<E> extends Iterable<E> {

    ReadOnlyCursor<E> begin();

    ReadOnlyCursor<E> end();

    ReadOnlyCursor<E> cbegin();

    ReadOnlyCursor<E> cend();

    /**
     * Number of live elements, clamped to {@link Integer#MAX_VALUE}.
     */
    int size();

    /**
     * Total slots across all allocated buckets; always a multiple of
     * {@link #blockCapacity()}.
     */
    long capacity();

    boolean isEmpty();

    int blockCapacity();

    /**
     * Cursor {@code distance} live elements after {@code from}.
     */
    ReadOnlyCursor<E> getToDistance(ReadOnlyCursor<E> from, long distance);

    /**
     * Number of steps from {@code first} to {@code last}.
     */
    long distance(ReadOnlyCursor<E> first, ReadOnlyCursor<E> last);
}
