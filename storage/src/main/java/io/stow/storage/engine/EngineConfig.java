// file: storage/src/main/java/io/stow/storage/engine/EngineConfig.java
package io.stow.storage.engine;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Settings for opening an embedded engine.
 * <p>
 * Supports:
 *  - path:        database file; null keeps everything in memory
 *  - cacheSizeMb: page cache size in MB
 *  - compress:    compress pages on disk
 *  - readOnly:    open an existing file without write access
 * <p>
 * Properties keys: {@code stow.path}, {@code stow.cache-size-mb}, {@code stow.compress},
 * {@code stow.read-only}. All are optional; a missing path means in-memory.
 */
public record EngineConfig(
        Path path,
        int cacheSizeMb,
        boolean compress,
        boolean readOnly
) {
    public static final int DEFAULT_CACHE_SIZE_MB = 16;

    public EngineConfig {
        if (cacheSizeMb <= 0) throw new IllegalArgumentException("cacheSizeMb must be > 0");
        if (readOnly && path == null) throw new IllegalArgumentException("an in-memory engine cannot be read-only");
    }

    public static EngineConfig inMemory() {
        return new EngineConfig(null, DEFAULT_CACHE_SIZE_MB, false, false);
    }

    public static EngineConfig file(Path path) {
        return new EngineConfig(path, DEFAULT_CACHE_SIZE_MB, false, false);
    }

    public boolean isInMemory() {
        return path == null;
    }

    public static EngineConfig fromProperties(Properties props) {
        String path = props.getProperty("stow.path");
        return new EngineConfig(
                path == null || path.isBlank() ? null : Path.of(path.trim()),
                intVal(props, "stow.cache-size-mb", DEFAULT_CACHE_SIZE_MB),
                boolVal(props, "stow.compress", false),
                boolVal(props, "stow.read-only", false)
        );
    }

    public static EngineConfig load(Path propertiesFile) {
        try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(reader);
            return fromProperties(props);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load engine config from " + propertiesFile, e);
        }
    }

    private static int intVal(Properties props, String key, int fallback) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return fallback;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new IllegalArgumentException(message, e);
        }
    }

    private static boolean boolVal(Properties props, String key, boolean fallback) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return fallback;
        val = val.trim();
        if (val.equalsIgnoreCase("true") || val.equalsIgnoreCase("yes")) return true;
        if (val.equalsIgnoreCase("false") || val.equalsIgnoreCase("no")) return false;
        var message = String.format("Boolean value '%s' for configuration key '%s' must be true/false/yes/no.", val, key);
        throw new IllegalArgumentException(message);
    }
}
