package io.bucketstore.core;

/**
 * Immutable configuration for a bucket storage container.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * BucketStoreConfiguration config = BucketStoreConfiguration.builder()
 *     .blockCapacity(256)
 *     .maxBuckets(1024)
 *     .name("sessions")
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built. Values are validated when a
 * container is created from the configuration, not by the builder.
 *
 * @see io.bucketstore.storage.BucketStorage
 */
public final class BucketStoreConfiguration {

    /**
     * Block capacity used when none is given.
     */
    public static final int DEFAULT_BLOCK_CAPACITY = 64;

    /**
     * Largest block capacity a slot position can address.
     */
    public static final int MAX_BLOCK_CAPACITY = 1 << 24;

    private static final BucketStoreConfiguration DEFAULTS = builder().build();

    // Bucket sizing
    private final int blockCapacity;
    private final int maxBuckets;

    // Label used in log lines
    private final String name;

    private BucketStoreConfiguration(Builder builder) {
        this.blockCapacity = builder.blockCapacity;
        this.maxBuckets = builder.maxBuckets;
        this.name = builder.name;
    }

    /**
     * Create a new builder for BucketStoreConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every value at its default.
     *
     * @return the shared default configuration
     */
    public static BucketStoreConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the number of slots per bucket.
     *
     * @return block capacity
     */
    public int blockCapacity() {
        return blockCapacity;
    }

    /**
     * Get the maximum number of buckets a container may hold at once.
     *
     * @return max buckets (default: {@link Integer#MAX_VALUE})
     */
    public int maxBuckets() {
        return maxBuckets;
    }

    public String name() {
        return name;
    }

    /**
     * Copy of this configuration with a different block capacity.
     *
     * @param blockCapacity the new block capacity
     * @return a new configuration
     */
    public BucketStoreConfiguration withBlockCapacity(int blockCapacity) {
        return builder()
                .blockCapacity(blockCapacity)
                .maxBuckets(maxBuckets)
                .name(name)
                .build();
    }

    @Override
    public String toString() {
        return "BucketStoreConfiguration{name=" + name
                + ", blockCapacity=" + blockCapacity
                + ", maxBuckets=" + maxBuckets + "}";
    }

    /**
     * Builder for BucketStoreConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private int blockCapacity = DEFAULT_BLOCK_CAPACITY;
        private int maxBuckets = Integer.MAX_VALUE;
        private String name = "buckets";

        private Builder() {
        }

        /**
         * Set the number of slots per bucket.
         *
         * @param blockCapacity slots per bucket (must be positive)
         * @return this builder for method chaining
         */
        public Builder blockCapacity(int blockCapacity) {
            this.blockCapacity = blockCapacity;
            return this;
        }

        /**
         * Set the maximum number of buckets held at once.
         * Inserting past this limit fails with a
         * {@link BucketAllocationException}.
         *
         * @param maxBuckets the bucket limit (must be positive)
         * @return this builder for method chaining
         */
        public Builder maxBuckets(int maxBuckets) {
            this.maxBuckets = maxBuckets;
            return this;
        }

        /**
         * Set the label used in log messages.
         *
         * @param name container label
         * @return this builder for method chaining
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Build the immutable BucketStoreConfiguration.
         *
         * @return a new BucketStoreConfiguration instance
         */
        public BucketStoreConfiguration build() {
            return new BucketStoreConfiguration(this);
        }
    }
}
