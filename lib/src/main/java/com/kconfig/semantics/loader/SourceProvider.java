package com.kconfig.semantics.loader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Supplies the text of Kconfig files. */
public interface SourceProvider {

    /**
     * @param file Absolute, normalized path.
     * @return The file's full text.
     * @throws IOException when the file cannot be read
     */
    String read(Path file) throws IOException;

    boolean exists(Path file);

    /** Reads straight from the default file system. */
    static SourceProvider filesystem() {
        return new SourceProvider() {
            @Override
            public String read(Path file) throws IOException {
                return Files.readString(file, StandardCharsets.UTF_8);
            }

            @Override
            public boolean exists(Path file) {
                return Files.isRegularFile(file);
            }
        };
    }
}
