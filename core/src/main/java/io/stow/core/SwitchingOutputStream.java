package io.stow.core;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * OutputStream whose target can be swapped between uses.
 * Lets a long-lived encoder be pointed at a new sink without being rebuilt.
 */
final class SwitchingOutputStream extends OutputStream {
    private OutputStream target;

    SwitchingOutputStream(OutputStream target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    void switchTo(OutputStream next) {
        this.target = Objects.requireNonNull(next, "sink");
    }

    @Override
    public void write(int b) throws IOException {
        target.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        target.write(b, off, len);
    }

    @Override
    public void flush() throws IOException {
        target.flush();
    }

    // The target belongs to the caller.
    @Override
    public void close() throws IOException {
        target.flush();
    }
}
