package org.gudu0.videogate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.gudu0.videogate.util.ConsoleLog;

import java.io.IOException;
import java.nio.file.*;
import java.util.function.Supplier;

/**
 * Loads a JSON config into a typed object; falls back to defaults when missing or broken.
 */
public class TypedConfigStore<T> {
    private final Path path;
    private final ObjectMapper om;
    private final Class<T> type;

    private final T cfg;
    private final boolean loadedFromDisk;

    public TypedConfigStore(Path path, Class<T> type, Supplier<T> defaults) {
        this.path = path;
        this.type = type;
        this.om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

        T loaded = tryLoad();
        this.loadedFromDisk = loaded != null;
        this.cfg = loaded != null ? loaded : defaults.get();
    }

    public T cfg() { return cfg; }

    public Path path() { return path; }

    /** False when defaults are in use (file missing or unreadable). */
    public boolean loadedFromDisk() { return loadedFromDisk; }

    public synchronized void save() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        om.writeValue(tmp.toFile(), cfg);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        ConsoleLog.debug("TypedConfigStore", "Saved config to " + path);
    }

    /** Writes the defaults out so operators have a file to edit. Never overwrites. */
    public void writeDefaultsIfMissing() {
        if (Files.exists(path)) return;
        try {
            save();
            ConsoleLog.warn("TypedConfigStore", "Config missing; wrote " + type.getSimpleName() + " defaults to " + path);
        } catch (Exception e) {
            ConsoleLog.error("TypedConfigStore", "Failed writing default config to " + path + ": " + e.getMessage(), e);
        }
    }

    private T tryLoad() {
        try {
            if (Files.exists(path)) {
                T value = om.readValue(path.toFile(), type);
                ConsoleLog.info("TypedConfigStore", "Loaded config from " + path);
                return value;
            }
        } catch (Exception e) {
            ConsoleLog.error("TypedConfigStore", "Failed to load " + path + ", using defaults: " + e.getMessage(), e);
            return null;
        }
        ConsoleLog.warn("TypedConfigStore", "Config missing: " + path + " (using defaults)");
        return null;
    }
}
