package io.stow.core;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * InputStream whose source can be swapped between uses.
 */
final class SwitchingInputStream extends InputStream {
    private InputStream source;

    SwitchingInputStream(InputStream source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    void switchTo(InputStream next) {
        this.source = Objects.requireNonNull(next, "source");
    }

    @Override
    public int read() throws IOException {
        return source.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        return source.read(b, off, len);
    }

    @Override
    public int available() throws IOException {
        return source.available();
    }

    // The source belongs to the caller.
    @Override
    public void close() {
    }
}
