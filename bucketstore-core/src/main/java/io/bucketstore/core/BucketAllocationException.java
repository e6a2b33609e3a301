package io.bucketstore.core;

/**
 * Thrown when a new bucket cannot be allocated.
 * <p>
 * Either wraps the low-level {@link OutOfMemoryError} or reports that the
 * configured bucket limit was reached. The container that raised it is left
 * exactly as it was before the failed insert.
 */
public class BucketAllocationException extends BucketStoreException {

    public BucketAllocationException(String message) {
        super(message);
    }

    public BucketAllocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
