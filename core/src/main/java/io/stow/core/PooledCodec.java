// file: core/src/main/java/io/stow/core/PooledCodec.java
package io.stow.core;

import com.esotericsoftware.kryo.util.Pool;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Codec that recycles encoder/decoder instances instead of building new ones.
 * <p>
 * Keeps two unbounded thread-safe free lists of wrappers. Each wrapper owns one delegate
 * encoder (or decoder) bound to a switchable sink (or source):
 *  - newEncoder/newDecoder take a free wrapper, or create one, and point it at the caller's
 *    stream;
 *  - release puts the wrapper back without touching the delegate's accumulated format state,
 *    unless the delegate reports it {@linkplain Encoder#drifted() drifted} from its baseline;
 *    such wrappers are discarded.
 * <p>
 * Only a {@link ReusableCodec} can be pooled, so an unprimed metadata-carrying codec is rejected
 * at compile time. A primed instance that met a type outside its primed set carries that type's
 * id from then on; it reports drift and is never handed out again. Whoever holds an instance is
 * its only user until it is released.
 */
public final class PooledCodec implements ReusableCodec {
    private static final Logger log = Logger.getLogger(PooledCodec.class.getName());

    private final ReusableCodec codec;
    private final Pool<PooledEncoder> encoders;
    private final Pool<PooledDecoder> decoders;
    private final AtomicInteger created = new AtomicInteger();
    private final AtomicInteger dropped = new AtomicInteger();

    public PooledCodec(ReusableCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.encoders = new Pool<>(true, false) {
            @Override
            protected PooledEncoder create() {
                log.fine(() -> "pool growth: encoder #" + created.incrementAndGet());
                return new PooledEncoder(PooledCodec.this);
            }
        };
        this.decoders = new Pool<>(true, false) {
            @Override
            protected PooledDecoder create() {
                log.fine(() -> "pool growth: decoder #" + created.incrementAndGet());
                return new PooledDecoder(PooledCodec.this);
            }
        };
    }

    @Override
    public Encoder newEncoder(OutputStream sink) {
        Objects.requireNonNull(sink, "sink");
        PooledEncoder encoder = encoders.obtain();
        encoder.sink.switchTo(sink);
        return encoder;
    }

    @Override
    public Decoder newDecoder(InputStream source) {
        Objects.requireNonNull(source, "source");
        PooledDecoder decoder = decoders.obtain();
        decoder.source.switchTo(source);
        return decoder;
    }

    @Override
    public void release(Encoder encoder) {
        if (!(encoder instanceof PooledEncoder) || ((PooledEncoder) encoder).owner != this) {
            throw new IllegalArgumentException("encoder was not created by this pool");
        }
        PooledEncoder pooled = (PooledEncoder) encoder;
        // Drop the caller's stream, keep the format state.
        pooled.sink.switchTo(OutputStream.nullOutputStream());
        if (pooled.delegate.drifted()) {
            log.fine("dropping encoder that learned types outside its baseline");
            dropped.incrementAndGet();
            return;
        }
        encoders.free(pooled);
    }

    @Override
    public void release(Decoder decoder) {
        if (!(decoder instanceof PooledDecoder) || ((PooledDecoder) decoder).owner != this) {
            throw new IllegalArgumentException("decoder was not created by this pool");
        }
        PooledDecoder pooled = (PooledDecoder) decoder;
        pooled.source.switchTo(InputStream.nullInputStream());
        if (pooled.delegate.drifted()) {
            log.fine("dropping decoder that learned types outside its baseline");
            dropped.incrementAndGet();
            return;
        }
        decoders.free(pooled);
    }

    @Override
    public OptionalLong fingerprint() {
        return codec.fingerprint();
    }

    /** Encoders currently waiting in the pool. */
    public int idleEncoders() {
        return encoders.getFree();
    }

    /** Decoders currently waiting in the pool. */
    public int idleDecoders() {
        return decoders.getFree();
    }

    /** Released instances discarded because their format state drifted. */
    public int droppedInstances() {
        return dropped.get();
    }

    private static final class PooledEncoder implements Encoder {
        final PooledCodec owner;
        final SwitchingOutputStream sink = new SwitchingOutputStream(OutputStream.nullOutputStream());
        final Encoder delegate;

        PooledEncoder(PooledCodec owner) {
            this.owner = owner;
            this.delegate = owner.codec.newEncoder(sink);
        }

        @Override
        public void encode(Object value) throws IOException {
            delegate.encode(value);
        }

        @Override
        public boolean drifted() {
            return delegate.drifted();
        }
    }

    private static final class PooledDecoder implements Decoder {
        final PooledCodec owner;
        final SwitchingInputStream source = new SwitchingInputStream(InputStream.nullInputStream());
        final Decoder delegate;

        PooledDecoder(PooledCodec owner) {
            this.owner = owner;
            this.delegate = owner.codec.newDecoder(source);
        }

        @Override
        public <T> T decode(Class<T> type) throws IOException {
            return delegate.decode(type);
        }

        @Override
        public boolean drifted() {
            return delegate.drifted();
        }
    }
}
