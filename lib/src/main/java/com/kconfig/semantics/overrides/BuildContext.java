package com.kconfig.semantics.overrides;

import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Repository;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The override files that together configure one build, in precedence order, followed by a fixed
 * list of base overrides (board defaults and the like).
 */
public final class BuildContext {
    private final Repository repository;
    private final List<OverrideFile> files = new CopyOnWriteArrayList<>();
    private final List<ConfigOverride> baseOverrides;

    public BuildContext(Repository repository) {
        this(repository, List.of());
    }

    public BuildContext(Repository repository, List<ConfigOverride> baseOverrides) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.baseOverrides = List.copyOf(baseOverrides);
    }

    public Repository getRepository() {
        return repository;
    }

    /** Reads {@code path} and appends it to the build. */
    public OverrideFile open(Path path) throws IOException {
        OverrideFile file = new OverrideFile(path, repository);
        file.read();
        files.add(file);
        return file;
    }

    public void addFile(OverrideFile file) {
        files.add(Objects.requireNonNull(file, "file"));
    }

    public boolean removeFile(OverrideFile file) {
        return files.remove(file);
    }

    public List<OverrideFile> getFiles() {
        return List.copyOf(files);
    }

    public Optional<OverrideFile> find(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return files.stream().filter(file -> file.getPath().equals(normalized)).findFirst();
    }

    public List<ConfigOverride> getBaseOverrides() {
        return baseOverrides;
    }

    /** Every file's current overrides in file order, then the base overrides. */
    public List<ConfigOverride> overrides() {
        List<ConfigOverride> all = new ArrayList<>();
        for (OverrideFile file : files) {
            all.addAll(file.getOverrides());
        }
        all.addAll(baseOverrides);
        return all;
    }
}
