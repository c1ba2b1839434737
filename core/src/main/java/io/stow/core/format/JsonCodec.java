package io.stow.core.format;

import com.fasterxml.jackson.databind.ObjectMapper;

/** JSON objects via Jackson databind. */
public final class JsonCodec extends JacksonCodec {

    public JsonCodec() {
        this(new ObjectMapper());
    }

    public JsonCodec(ObjectMapper mapper) {
        super(mapper);
    }
}
