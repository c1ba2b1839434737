package io.stow.storage;

/** Key, or the whole bucket, is absent. */
public final class NotFoundException extends StowException {
    private final String bucket;

    public NotFoundException(String bucket, byte[] key) {
        super("not found: " + Keys.describe(key) + " in bucket '" + bucket + "'");
        this.bucket = bucket;
    }

    public String bucket() {
        return bucket;
    }
}
