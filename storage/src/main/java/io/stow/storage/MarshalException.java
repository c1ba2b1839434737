package io.stow.storage;

/** A value could not be encoded, typically a class the codec does not know. */
public final class MarshalException extends StowException {

    public MarshalException(String message, Throwable cause) {
        super(message, cause);
    }
}
