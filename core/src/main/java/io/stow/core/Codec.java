// file: core/src/main/java/io/stow/core/Codec.java
package io.stow.core;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.OptionalLong;

/**
 * Factory for the Encoder/Decoder pair of one wire format.
 * <p>
 * A Codec has no identity beyond its configuration. Encoders and decoders it produces are
 * stateful and may accumulate format metadata across calls on the same instance:
 *  - a plain codec hands out fresh, single-use instances,
 *  - a {@link PrimedCodec} hands out instances that start from a shared primed baseline,
 *  - a {@link PooledCodec} recycles instances between logically independent uses.
 */
public interface Codec {

    /** Create an encoder writing to {@code sink}. */
    Encoder newEncoder(OutputStream sink);

    /** Create a decoder reading from {@code source}. */
    Decoder newDecoder(InputStream source);

    /**
     * Hand an encoder back once the caller is done with it.
     * Only pooling codecs keep it; everyone else drops it.
     */
    default void release(Encoder encoder) {
    }

    /** Decoder counterpart of {@link #release(Encoder)}. */
    default void release(Decoder decoder) {
    }

    /**
     * Identity of the format state every new encoder/decoder starts from.
     * Empty for codecs whose instances always start from scratch.
     */
    default OptionalLong fingerprint() {
        return OptionalLong.empty();
    }
}
