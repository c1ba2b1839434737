package io.stow.storage;

/** An iteration callback is missing, not invocable, or takes neither one nor two parameters. */
public final class InvalidCallbackException extends StowException {

    public InvalidCallbackException(String message) {
        super(message);
    }

    public InvalidCallbackException(String message, Throwable cause) {
        super(message, cause);
    }
}
