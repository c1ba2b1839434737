package io.stow.core;

import java.io.IOException;

/**
 * Reads values from the source it was created for.
 */
public interface Decoder {

    /**
     * Decode the next value as {@code type}.
     *
     * @param type expected type; primitives are not accepted, pass the boxed class
     * @return the decoded value, possibly null if null was encoded
     * @throws IOException if the bytes are malformed, name an unknown type, or do not fit {@code type}
     */
    <T> T decode(Class<T> type) throws IOException;

    /** Record the current format state as the state a recycled instance must be in. */
    default void markBaseline() {
    }

    /** @return true if type metadata was read after {@link #markBaseline()} */
    default boolean drifted() {
        return false;
    }
}
