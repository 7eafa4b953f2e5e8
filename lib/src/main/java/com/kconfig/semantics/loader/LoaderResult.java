package com.kconfig.semantics.loader;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.model.Repository;
import java.util.List;

/** The repository built from a Kconfig tree plus the diagnostics of every parsed file. */
public final class LoaderResult {
    private final Repository repository;
    private final List<Diagnostic> diagnostics;

    public LoaderResult(Repository repository, List<Diagnostic> diagnostics) {
        this.repository = repository;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Repository getRepository() {
        return repository;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
