package io.bucketstore.storage;

/**
 * Mutable cursor: a {@link ReadOnlyCursor} that can also replace the element
 * it refers to.
 * <p>
 * Widening to {@code ReadOnlyCursor} is implicit; there is no way back.
 *
 * @param <E> element type
 */
public final class Cursor<E> extends ReadOnlyCursor<E> {

    Cursor(BucketChain<E> chain, Bucket<E> bucket, int slot) {
        super(chain, bucket, slot);
    }

    @Override
    Cursor<E> at(Bucket<E> bucket, int slot) {
        return new Cursor<>(chain, bucket, slot);
    }

    /**
     * Replace the element at this position in place.
     * Not a structural change: cursors and iterators stay valid.
     *
     * @param element the new element
     * @return the element previously stored here
     */
    public E set(E element) {
        var previous = get();
        bucket.set(slot, element);
        return previous;
    }

    @Override
    public Cursor<E> next() {
        return (Cursor<E>) super.next();
    }

    @Override
    public Cursor<E> previous() {
        return (Cursor<E>) super.previous();
    }

    /**
     * Read-only cursor at the same position.
     */
    public ReadOnlyCursor<E> readOnly() {
        return new ReadOnlyCursor<>(chain, bucket, slot);
    }
}
