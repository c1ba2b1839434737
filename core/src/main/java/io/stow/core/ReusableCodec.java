package io.stow.core;

/**
 * A codec whose encoders and decoders can be reused verbatim across unrelated calls.
 * <p>
 * Holds for stateless text formats and for primed codecs. Plain metadata-carrying codecs are not
 * reusable: an instance that has seen a type behaves differently from a fresh one, so they do not
 * implement this interface and cannot be handed to {@link PooledCodec}.
 */
public interface ReusableCodec extends Codec {
}
