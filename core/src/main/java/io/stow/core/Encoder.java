package io.stow.core;

import java.io.IOException;

/**
 * Writes values to the sink it was created for.
 * Implementations flush after every value so the sink holds complete records.
 */
public interface Encoder {

    void encode(Object value) throws IOException;

    /** Record the current format state as the state a recycled instance must be in. */
    default void markBaseline() {
    }

    /**
     * @return true if type metadata was learned after {@link #markBaseline()}; such an instance
     *         writes output a fresh instance cannot read and must not be reused
     */
    default boolean drifted() {
        return false;
    }
}
