package io.stow.storage;

/** The underlying engine failed: I/O, a closed engine, a broken file. */
public final class StorageException extends StowException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
