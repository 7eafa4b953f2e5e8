package com.kconfig.semantics.loader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves in-memory text for files that have unsaved edits and falls back to another provider for
 * everything else.
 */
public final class OverlaySourceProvider implements SourceProvider {
    private final SourceProvider fallback;
    private final Map<Path, String> overlays = new ConcurrentHashMap<>();

    public OverlaySourceProvider(SourceProvider fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public void put(Path file, String text) {
        overlays.put(normalize(file), Objects.requireNonNull(text, "text"));
    }

    public void remove(Path file) {
        overlays.remove(normalize(file));
    }

    @Override
    public String read(Path file) throws IOException {
        String text = overlays.get(normalize(file));
        return text != null ? text : fallback.read(file);
    }

    @Override
    public boolean exists(Path file) {
        return overlays.containsKey(normalize(file)) || fallback.exists(file);
    }

    private static Path normalize(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
