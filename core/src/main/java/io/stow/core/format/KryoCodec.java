// file: core/src/main/java/io/stow/core/format/KryoCodec.java
package io.stow.core.format;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.Registration;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.DefaultClassResolver;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import io.stow.core.Codec;
import io.stow.core.Decoder;
import io.stow.core.Encoder;
import io.stow.core.TypeRegistry;
import org.objenesis.strategy.StdInstantiatorStrategy;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Self-describing binary format backed by Kryo.
 * <p>
 * Each value is written with {@code writeClassAndObject}, so the concrete class travels with the
 * data and values held through interfaces or abstract types come back as their real class.
 * <p>
 * Type metadata:
 *  - classes in the {@link TypeRegistry} get numeric ids in registration order;
 *  - other classes are written by name the first time an encoder meets them and by a per-instance
 *    id afterwards (auto-reset is off, so the id table survives between values);
 *  - with registration required, unregistered classes fail to encode.
 * <p>
 * Because of that per-instance table an encoder that has written a class is not equivalent to a
 * fresh one. This codec is therefore not reusable on its own; wrap it in a PrimedCodec first.
 * Instances report {@linkplain Encoder#drifted() drift} when they meet a class by name after
 * their baseline was marked, so a pool can discard them.
 * <p>
 * Kryo instances are not thread safe; every encoder and decoder owns one.
 */
public final class KryoCodec implements Codec {
    private static final int BUFFER_SIZE = 4096;

    private final TypeRegistry registry;
    private final boolean registrationRequired;

    /** Lenient codec over the process-wide registry. */
    public KryoCodec() {
        this(TypeRegistry.global(), false);
    }

    public KryoCodec(TypeRegistry registry, boolean registrationRequired) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.registrationRequired = registrationRequired;
    }

    /** Codec that refuses any class missing from {@code registry}. */
    public static KryoCodec strict(TypeRegistry registry) {
        return new KryoCodec(registry, true);
    }

    @Override
    public Encoder newEncoder(OutputStream sink) {
        NameTracker names = new NameTracker();
        return new KryoEncoder(newKryo(names), names, new Output(Objects.requireNonNull(sink, "sink"), BUFFER_SIZE));
    }

    @Override
    public Decoder newDecoder(InputStream source) {
        NameTracker names = new NameTracker();
        return new KryoDecoder(newKryo(names), names, new Input(Objects.requireNonNull(source, "source"), BUFFER_SIZE));
    }

    private Kryo newKryo(NameTracker names) {
        Kryo kryo = new Kryo(names, null);
        kryo.setReferences(false);
        kryo.setRegistrationRequired(registrationRequired);
        kryo.setAutoReset(false);
        // Use a zero-arg constructor when there is one, otherwise instantiate without one.
        kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
        // Sample lists used for priming.
        kryo.register(ArrayList.class);
        for (Class<?> type : registry.types()) {
            kryo.register(type);
        }
        return kryo;
    }

    /**
     * Class resolver that notices classes written or read by name. Once a baseline is marked,
     * the first such class seen after it sets the drift flag.
     */
    private static final class NameTracker extends DefaultClassResolver {
        private final Set<Class<?>> named = new HashSet<>();
        private boolean baselineMarked;
        private boolean drifted;

        @Override
        protected void writeName(Output output, Class type, Registration registration) {
            note(type);
            super.writeName(output, type, registration);
        }

        @Override
        protected Registration readName(Input input) {
            Registration registration = super.readName(input);
            if (registration != null) note(registration.getType());
            return registration;
        }

        private void note(Class<?> type) {
            if (named.add(type) && baselineMarked) drifted = true;
        }

        void markBaseline() {
            baselineMarked = true;
        }

        boolean drifted() {
            return drifted;
        }
    }

    private static final class KryoEncoder implements Encoder {
        private final Kryo kryo;
        private final NameTracker names;
        private final Output output;

        KryoEncoder(Kryo kryo, NameTracker names, Output output) {
            this.kryo = kryo;
            this.names = names;
            this.output = output;
        }

        @Override
        public void markBaseline() {
            names.markBaseline();
        }

        @Override
        public boolean drifted() {
            return names.drifted();
        }

        @Override
        public void encode(Object value) throws IOException {
            try {
                kryo.writeClassAndObject(output, value);
                output.flush();
            } catch (KryoException | IllegalArgumentException e) {
                throw new IOException("kryo encode failed: " + e.getMessage(), e);
            }
        }
    }

    private static final class KryoDecoder implements Decoder {
        private final Kryo kryo;
        private final NameTracker names;
        private final Input input;

        KryoDecoder(Kryo kryo, NameTracker names, Input input) {
            this.kryo = kryo;
            this.names = names;
            this.input = input;
        }

        @Override
        public void markBaseline() {
            names.markBaseline();
        }

        @Override
        public boolean drifted() {
            return names.drifted();
        }

        @Override
        public <T> T decode(Class<T> type) throws IOException {
            Object value;
            try {
                value = kryo.readClassAndObject(input);
            } catch (RuntimeException e) {
                // Garbage input can surface as any runtime exception, not just KryoException.
                throw new IOException("kryo decode failed: " + e.getMessage(), e);
            }
            if (value != null && !type.isInstance(value)) {
                throw new IOException("decoded " + value.getClass().getName() + " where " + type.getName() + " was expected");
            }
            return type.cast(value);
        }
    }
}
