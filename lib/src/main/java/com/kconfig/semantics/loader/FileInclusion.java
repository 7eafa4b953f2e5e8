package com.kconfig.semantics.loader;

import java.nio.file.Path;
import java.util.Map;

/**
 * A file pulled in by a {@code source} directive, together with the context it inherits: the
 * environment at the point of inclusion and the enclosing scope.
 */
public record FileInclusion(Path path, Map<String, String> environment, int scopeId, int line) {

    public FileInclusion {
        environment = Map.copyOf(environment);
    }
}
