package io.bucketstore.core;

public class BucketStoreException extends RuntimeException {

    public BucketStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public BucketStoreException(String message) {
        super(message);
    }

}
