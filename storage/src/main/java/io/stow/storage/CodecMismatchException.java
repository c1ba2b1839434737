package io.stow.storage;

/**
 * The bucket holds data written with a codec whose primed state differs from the store's,
 * so reading it would misdecode.
 */
public final class CodecMismatchException extends StowException {

    public CodecMismatchException(String bucket, String stored, String current) {
        super("bucket '" + bucket + "' was written with codec " + stored + " but this store uses " + current);
    }
}
