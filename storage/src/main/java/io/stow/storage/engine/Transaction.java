package io.stow.storage.engine;

/**
 * Handle to an open engine transaction.
 */
public interface Transaction {

    /** @return the named bucket, or null if it does not exist */
    Bucket bucket(String name);

    /** Open the named bucket, creating it first if needed. Read/write transactions only. */
    Bucket createBucketIfNotExists(String name);

    /**
     * Drop the named bucket together with any buckets nested under it.
     *
     * @return false if the bucket did not exist
     */
    boolean deleteBucket(String name);

    boolean writable();
}
