package com.kconfig.semantics.loader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/** Turns the path of a {@code source} directive into the files it names, expanding globs. */
final class IncludeResolver {
    private static final Logger LOGGER = Logger.getLogger(IncludeResolver.class.getName());

    private final SourceProvider sources;

    IncludeResolver(SourceProvider sources) {
        this.sources = sources;
    }

    /**
     * @param baseDir Directory relative paths are resolved against.
     * @param rawPath Path as written, after environment substitution.
     * @return Matching files in a stable order; empty when nothing matches.
     */
    List<Path> resolve(Path baseDir, String rawPath) {
        String normalized = rawPath.replace('\\', '/');
        int globIndex = firstGlobIndex(normalized);
        if (globIndex < 0) {
            Path path = convertToPath(baseDir, normalized);
            return path != null && sources.exists(path) ? List.of(path) : List.of();
        }
        int split = normalized.lastIndexOf('/', globIndex);
        String prefix = split < 0 ? "" : normalized.substring(0, split + 1);
        String pattern = normalized.substring(split + 1);
        Path searchRoot = convertToPath(baseDir, prefix);
        if (searchRoot == null || !Files.isDirectory(searchRoot)) {
            return List.of();
        }
        PathMatcher matcher = searchRoot.getFileSystem().getPathMatcher("glob:" + convertSeparators(pattern));
        List<Path> matches = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(searchRoot)) {
            stream.filter(Files::isRegularFile)
                    .filter(candidate -> matcher.matches(searchRoot.relativize(candidate)))
                    .map(Path::normalize)
                    .sorted()
                    .forEach(matches::add);
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.log(Level.WARNING, "Unable to expand " + rawPath + " under " + searchRoot, ex);
        }
        return matches;
    }

    private static int firstGlobIndex(String value) {
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '*' || ch == '?' || ch == '{' || ch == '[') {
                return i;
            }
        }
        return -1;
    }

    private static Path convertToPath(Path baseDir, String raw) {
        String system = convertSeparators(raw);
        try {
            if (system.isEmpty()) {
                return baseDir;
            }
            Path path = Path.of(system);
            if (!path.isAbsolute()) {
                path = baseDir.resolve(path);
            }
            return path.toAbsolutePath().normalize();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.FINE, "Not a usable path: " + raw, ex);
            return null;
        }
    }

    private static String convertSeparators(String path) {
        String separator = FileSystems.getDefault().getSeparator();
        if ("/".equals(separator)) {
            return path;
        }
        return path.replace("/", separator);
    }
}
