package com.kconfig.semantics.loader;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.model.Entry;
import com.kconfig.semantics.model.Repository;
import com.kconfig.semantics.model.SourceRange;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One Kconfig file as seen from a particular inclusion site. The same path included twice under
 * different environments or scopes yields two parsed files. The path, environment, scope and parent
 * identify a file across re-parses; entries, inclusions and diagnostics are rebuilt by every parse.
 */
public final class ParsedFile {
    private static final Logger LOGGER = Logger.getLogger(ParsedFile.class.getName());

    private final Path path;
    private final Repository repository;
    private final ParsedFile parent;
    private final Map<String, String> environment;
    private final int scopeId;
    private final SourceProvider sources;

    private int version;
    private final List<FileInclusion> inclusions = new ArrayList<>();
    private final List<ParsedFile> includedFiles = new ArrayList<>();
    private final List<Entry> entries = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public ParsedFile(
            Repository repository,
            Path path,
            Map<String, String> environment,
            int scopeId,
            ParsedFile parent,
            SourceProvider sources) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.path = path.toAbsolutePath().normalize();
        this.environment = Map.copyOf(environment);
        this.scopeId = scopeId;
        this.parent = parent;
        this.sources = Objects.requireNonNull(sources, "sources");
    }

    public Path getPath() {
        return path;
    }

    public Repository getRepository() {
        return repository;
    }

    public ParsedFile getParent() {
        return parent;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public int getScopeId() {
        return scopeId;
    }

    public int getVersion() {
        return version;
    }

    SourceProvider getSources() {
        return sources;
    }

    public List<FileInclusion> getInclusions() {
        return Collections.unmodifiableList(inclusions);
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /** Files included directly by this one, in inclusion order. */
    public List<ParsedFile> getIncludedFiles() {
        return Collections.unmodifiableList(includedFiles);
    }

    /** Every file included by this one, directly or not, depth first. */
    public List<ParsedFile> children() {
        List<ParsedFile> files = new ArrayList<>();
        for (ParsedFile child : includedFiles) {
            files.add(child);
            files.addAll(child.children());
        }
        return files;
    }

    /** Whether this file was parsed from the same inclusion site as {@code inclusion}. */
    public boolean matches(FileInclusion inclusion) {
        return path.equals(inclusion.path().toAbsolutePath().normalize())
                && environment.equals(inclusion.environment())
                && scopeKey(scopeId).equals(scopeKey(inclusion.scopeId()));
    }

    private String scopeKey(int id) {
        return repository.getScopes().get(id).getKey();
    }

    /**
     * Reads and parses this file, then its inclusions when {@code recursive} is set.
     *
     * @throws IOException when this file cannot be read; unreadable inclusions become diagnostics
     */
    public void parse(boolean recursive) throws IOException {
        String text = sources.read(path);
        Lock write = repository.writeLock();
        write.lock();
        try {
            wipeEntries();
            includedFiles.forEach(ParsedFile::delete);
            includedFiles.clear();
            scan(text);
            for (FileInclusion inclusion : inclusions) {
                ParsedFile child = new ParsedFile(repository, inclusion.path(), inclusion.environment(), inclusion.scopeId(), this, sources);
                includedFiles.add(child);
                if (recursive) {
                    parseChild(child, inclusion);
                }
            }
            repository.invalidate();
        } finally {
            write.unlock();
        }
    }

    /**
     * Re-parses this file from {@code text}. Included files whose inclusion site is unchanged are
     * kept as they are, new ones are parsed and the ones no longer included are deleted.
     *
     * @return {@code false} when {@code version} was already applied
     */
    public boolean update(String text, int version) {
        Lock write = repository.writeLock();
        write.lock();
        try {
            if (version == this.version) {
                LOGGER.log(Level.FINE, "Ignoring duplicate version {0} of {1}", new Object[] {version, path});
                return false;
            }
            this.version = version;
            List<ParsedFile> previous = new ArrayList<>(includedFiles);
            includedFiles.clear();
            wipeEntries();
            scan(text);
            for (FileInclusion inclusion : inclusions) {
                ParsedFile reused = null;
                for (ParsedFile candidate : previous) {
                    if (candidate.matches(inclusion)) {
                        reused = candidate;
                        break;
                    }
                }
                if (reused != null) {
                    previous.remove(reused);
                    includedFiles.add(reused);
                } else {
                    ParsedFile child = new ParsedFile(repository, inclusion.path(), inclusion.environment(), inclusion.scopeId(), this, sources);
                    includedFiles.add(child);
                    parseChild(child, inclusion);
                }
            }
            previous.forEach(ParsedFile::delete);
            repository.invalidateAfterEdit();
            return true;
        } finally {
            write.unlock();
        }
    }

    /** Removes this file's entries, and those of every file it includes, from the repository. */
    public void delete() {
        Lock write = repository.writeLock();
        write.lock();
        try {
            wipeEntries();
            includedFiles.forEach(ParsedFile::delete);
            includedFiles.clear();
            repository.invalidateAfterEdit();
        } finally {
            write.unlock();
        }
    }

    private void parseChild(ParsedFile child, FileInclusion inclusion) {
        try {
            child.parse(true);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Unable to read included file " + child.getPath(), ex);
            diagnostics.add(Diagnostic.warning("Unable to read " + child.getPath(), SourceRange.line(path, inclusion.line())));
        }
    }

    private void scan(String text) {
        inclusions.clear();
        diagnostics.clear();
        new DocumentParser(this).parse(text);
    }

    private void wipeEntries() {
        for (Entry entry : entries) {
            repository.removeEntry(entry);
        }
        entries.clear();
    }

    void addEntry(Entry entry) {
        entries.add(entry);
    }

    void addInclusion(FileInclusion inclusion) {
        inclusions.add(inclusion);
    }

    void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /** Whether {@code file} is this file or one of the files that (transitively) include it. */
    boolean isIncludedFrom(Path file) {
        for (ParsedFile current = this; current != null; current = current.parent) {
            if (current.path.equals(file)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
