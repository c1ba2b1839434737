package io.stow.core.format;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stow.core.Decoder;
import io.stow.core.Encoder;
import io.stow.core.ReusableCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Base for the Jackson text formats.
 * <p>
 * Text formats carry no type metadata, so encoders and decoders hold nothing but the mapper and
 * the stream and can be reused freely. The mapper is copied and adjusted so that:
 *  - sinks and sources are never closed by the codec (they belong to the caller),
 *  - unknown properties are skipped, letting a reader decode into a narrower type.
 */
public abstract class JacksonCodec implements ReusableCodec {
    private final ObjectMapper mapper;

    protected JacksonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
                .configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    protected ObjectMapper mapper() {
        return mapper;
    }

    @Override
    public Encoder newEncoder(OutputStream sink) {
        Objects.requireNonNull(sink, "sink");
        return value -> {
            mapper.writeValue(sink, value);
            sink.flush();
        };
    }

    @Override
    public Decoder newDecoder(InputStream source) {
        Objects.requireNonNull(source, "source");
        return new Decoder() {
            @Override
            public <T> T decode(Class<T> type) throws IOException {
                return mapper.readValue(source, type);
            }
        };
    }
}
