package io.stow.storage;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/** Rendering of raw keys for messages. */
final class Keys {

    private Keys() {
        // utility
    }

    /** Printable ASCII keys as quoted text, anything else as hex. */
    static String describe(byte[] key) {
        if (key == null) return "<null>";
        for (byte b : key) {
            if (b < 0x20 || b > 0x7e) {
                return "0x" + HexFormat.of().formatHex(key);
            }
        }
        return "\"" + new String(key, StandardCharsets.US_ASCII) + "\"";
    }
}
