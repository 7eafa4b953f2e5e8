package com.kconfig.semantics.loader;

import com.kconfig.semantics.Version;
import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.model.Repository;
import com.kconfig.semantics.model.ScopeTable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Entry point for loading a Kconfig tree into a fresh {@link Repository}. */
public final class KconfigLoader {
    private static final Logger LOGGER = Logger.getLogger(KconfigLoader.class.getName());

    private final SourceProvider sources;

    public KconfigLoader() {
        this(SourceProvider.filesystem());
    }

    public KconfigLoader(SourceProvider sources) {
        this.sources = Objects.requireNonNull(sources, "sources");
    }

    public LoaderResult load(Path rootFile) throws LoaderException {
        return load(rootFile, Map.of());
    }

    /**
     * Parses {@code rootFile} and everything it sources.
     *
     * @param environment Variables for {@code $(NAME)} substitution; references between them are
     *     expanded first.
     * @throws LoaderException when the root file cannot be read or the environment is circular
     */
    public LoaderResult load(Path rootFile, Map<String, String> environment) throws LoaderException {
        Objects.requireNonNull(rootFile, "rootFile");
        Map<String, String> resolved;
        try {
            resolved = Environment.resolve(environment);
        } catch (IllegalArgumentException ex) {
            throw new LoaderException(ex.getMessage(), ex);
        }
        long start = System.nanoTime();
        Repository repository = new Repository();
        ParsedFile root = new ParsedFile(repository, rootFile, resolved, ScopeTable.ROOT_ID, null, sources);
        repository.setRoot(root);
        try {
            root.parse(true);
        } catch (IOException ex) {
            throw new LoaderException(
                    "[Version " + Version.RUNTIME + "] Unable to read Kconfig file: " + root.getPath(), ex);
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ParsedFile file : repository.getFiles()) {
            diagnostics.addAll(file.getDiagnostics());
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format(
                    "Loaded %s: %d files, %d symbols in %d ms",
                    root.getPath(),
                    repository.getFiles().size(),
                    repository.getSymbols().size(),
                    (System.nanoTime() - start) / 1_000_000));
        }
        return new LoaderResult(repository, diagnostics);
    }
}
