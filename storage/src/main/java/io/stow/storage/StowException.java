package io.stow.storage;

/**
 * Root of the errors a Store reports. Unchecked; callers catch the subtype they can act on:
 *  - {@link NotFoundException}: key or bucket absent,
 *  - {@link MarshalException} / {@link UnmarshalException}: value could not be encoded / decoded,
 *  - {@link CodecMismatchException}: bucket was written with an incompatible codec,
 *  - {@link InvalidCallbackException}: iteration callback has the wrong shape,
 *  - {@link StorageException}: the engine itself failed.
 */
public abstract class StowException extends RuntimeException {

    protected StowException(String message) {
        super(message);
    }

    protected StowException(String message, Throwable cause) {
        super(message, cause);
    }
}
