// file: core/src/main/java/io/stow/core/PrimedCodec.java
package io.stow.core;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.CRC32;

/**
 * Codec whose encoders and decoders start from a shared, precomputed type-metadata baseline.
 * <p>
 * Formats like Kryo with auto-reset disabled write a type's description the first time an
 * encoder meets it and refer to it by id afterwards. Without priming every fresh encoder pays
 * that preamble again. Priming pays it once:
 *  1) {@link #prime} encodes the sample list with a throwaway encoder and keeps the bytes as an
 *     immutable snapshot, after checking that a throwaway decoder can read them back.
 *  2) {@link #newEncoder} replays the sample encode into a discard sink, then switches to the
 *     caller's sink.
 *  3) {@link #newDecoder} replays a decode of the snapshot, then switches to the caller's source.
 * <p>
 * Every instance therefore starts from identical state and the metadata for primed types never
 * reaches the caller's stream.
 * <p>
 * Constraints:
 *  - the sample types and their order must stay the same across restarts that read the same
 *    persisted data, since ids are assigned by encounter order;
 *  - data written through a primed codec cannot be read by an unprimed decoder of the same
 *    format, and the other way around.
 * {@link #fingerprint()} identifies the sample classes and their order so stores can refuse
 * mismatched data.
 * <p>
 * Priming a stateless text codec is allowed but only costs the replay.
 */
public final class PrimedCodec implements ReusableCodec {
    private static final Logger log = Logger.getLogger(PrimedCodec.class.getName());

    private final Codec codec;
    private final ArrayList<Object> samples;
    private final byte[] snapshot;
    private final long fingerprint;

    private PrimedCodec(Codec codec, ArrayList<Object> samples, byte[] snapshot) {
        this.codec = codec;
        this.samples = samples;
        this.snapshot = snapshot;
        this.fingerprint = fingerprintOf(codec, samples);
    }

    /** CRC32 over the base codec and the sample classes in order; sample values do not count. */
    private static long fingerprintOf(Codec codec, List<Object> samples) {
        StringBuilder sb = new StringBuilder(codec.getClass().getName());
        for (Object sample : samples) {
            sb.append('\n').append(sample == null ? "null" : sample.getClass().getName());
        }
        CRC32 crc = new CRC32();
        crc.update(sb.toString().getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }

    /**
     * Prime {@code codec} with one sample value per type that will be stored.
     *
     * @throws IOException if the samples do not survive an encode/decode round trip; this is the
     *                     only point where priming can fail
     */
    public static PrimedCodec prime(Codec codec, Object... samples) throws IOException {
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(samples, "samples");
        ArrayList<Object> sampleList = new ArrayList<>(Arrays.asList(samples));

        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        codec.newEncoder(buf).encode(sampleList);
        byte[] snapshot = buf.toByteArray();

        codec.newDecoder(new ByteArrayInputStream(snapshot)).decode(List.class);

        PrimedCodec primed = new PrimedCodec(codec, sampleList, snapshot);
        if (log.isLoggable(Level.FINE)) {
            log.fine(String.format("primed %s with %d samples (%d byte snapshot, fingerprint %08x)",
                    codec.getClass().getSimpleName(), sampleList.size(), snapshot.length, primed.fingerprint));
        }
        return primed;
    }

    @Override
    public Encoder newEncoder(OutputStream sink) {
        Objects.requireNonNull(sink, "sink");
        SwitchingOutputStream out = new SwitchingOutputStream(OutputStream.nullOutputStream());
        Encoder encoder = codec.newEncoder(out);
        try {
            encoder.encode(samples);
        } catch (IOException e) {
            // Same input succeeded in prime().
            throw new IllegalStateException("replaying primed samples failed", e);
        }
        encoder.markBaseline();
        out.switchTo(sink);
        return encoder;
    }

    @Override
    public Decoder newDecoder(InputStream source) {
        Objects.requireNonNull(source, "source");
        SwitchingInputStream in = new SwitchingInputStream(new ByteArrayInputStream(snapshot));
        Decoder decoder = codec.newDecoder(in);
        try {
            decoder.decode(List.class);
        } catch (IOException e) {
            throw new IllegalStateException("replaying primed snapshot failed", e);
        }
        decoder.markBaseline();
        in.switchTo(source);
        return decoder;
    }

    /**
     * Fingerprint of the sample classes when priming changes the wire format. A reusable base codec writes
     * no per-instance metadata, so priming it changes nothing and its own fingerprint is kept.
     */
    @Override
    public OptionalLong fingerprint() {
        if (codec instanceof ReusableCodec) {
            return codec.fingerprint();
        }
        return OptionalLong.of(fingerprint);
    }

    public List<Object> samples() {
        return Collections.unmodifiableList(samples);
    }

    /** Size of the metadata preamble that primed instances no longer write. */
    public int snapshotSize() {
        return snapshot.length;
    }
}
