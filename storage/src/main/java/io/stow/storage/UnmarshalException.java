package io.stow.storage;

/** Stored bytes could not be decoded: malformed data, type mismatch or unknown type. */
public final class UnmarshalException extends StowException {

    public UnmarshalException(String message, Throwable cause) {
        super(message, cause);
    }
}
