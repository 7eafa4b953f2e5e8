package com.kconfig.semantics.overrides;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.diagnostic.SuggestedFix;
import com.kconfig.semantics.diagnostic.TextEdit;
import com.kconfig.semantics.expr.ConfigValue;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Repository;
import com.kconfig.semantics.model.SourceRange;
import com.kconfig.semantics.model.Symbol;
import com.kconfig.semantics.model.SymbolType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code CONFIG_NAME=value} override file. Each {@link #parse(String)} publishes a new immutable
 * {@link Snapshot}; readers on other threads always see a complete one.
 */
public final class OverrideFile {
    private static final Logger LOGGER = Logger.getLogger(OverrideFile.class.getName());

    private static final Pattern ASSIGNMENT = Pattern.compile(
            "^\\s*CONFIG_([^\\s=]+)\\s*(?:=\\s*(\"(?:\\\\.|[^\"\\\\])*\"|[ynm]\\b|0[xX][0-9a-fA-F]+\\b|[-+]?\\d+\\b))?");
    private static final Pattern IGNORED = Pattern.compile("^\\s*(#.*)?$");
    private static final Pattern TRAILING = Pattern.compile("^\\s*([^#\\s][^#]*)");

    /** Overrides and parse diagnostics of one version of the file. */
    public record Snapshot(int version, List<ConfigOverride> overrides, List<Diagnostic> diagnostics) {
        public Snapshot {
            overrides = List.copyOf(overrides);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    private final Path path;
    private final Repository repository;
    private volatile Snapshot snapshot;

    public OverrideFile(Path path, Repository repository) {
        this.path = path.toAbsolutePath().normalize();
        this.repository = Objects.requireNonNull(repository, "repository");
        this.snapshot = new Snapshot(0, List.of(), List.of());
    }

    public Path getPath() {
        return path;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public int getVersion() {
        return snapshot.version();
    }

    public List<ConfigOverride> getOverrides() {
        return snapshot.overrides();
    }

    public List<Diagnostic> getParseDiagnostics() {
        return snapshot.diagnostics();
    }

    /** Re-reads the file from disk. */
    public Snapshot read() throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /** Parses {@code text} as the next version of this file. */
    public synchronized Snapshot parse(String text) {
        List<ConfigOverride> overrides = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        String[] lines = text.split("\\r?\\n", -1);
        Lock read = repository.readLock();
        read.lock();
        try {
            for (int i = 0; i < lines.length; i++) {
                ConfigOverride override = parseLine(lines[i], i + 1, diagnostics);
                if (override != null) {
                    overrides.add(override);
                }
            }
        } finally {
            read.unlock();
        }
        Snapshot next = new Snapshot(snapshot.version() + 1, overrides, diagnostics);
        snapshot = next;
        LOGGER.log(Level.FINE, "Parsed {0} version {1}: {2} overrides", new Object[] {path, next.version(), overrides.size()});
        return next;
    }

    /**
     * Parses one line.
     *
     * @return The override, or {@code null} for blank, comment and invalid lines; invalid lines add
     *     a diagnostic to {@code diagnostics}.
     */
    ConfigOverride parseLine(String line, int lineNumber, List<Diagnostic> diagnostics) {
        SourceRange range = SourceRange.line(path, lineNumber);
        Matcher match = ASSIGNMENT.matcher(line);
        if (!match.find()) {
            if (!IGNORED.matcher(line).matches()) {
                diagnostics.add(Diagnostic.error(
                        "Syntax error: All lines must either be comments or config entries with values.", range));
            }
            return null;
        }
        String name = match.group(1);
        String raw = match.group(2);
        if (raw == null) {
            diagnostics.add(Diagnostic.error("Missing value for config " + name, range));
            return null;
        }
        Symbol symbol = repository.get(name);
        if (symbol == null) {
            diagnostics.add(Diagnostic.error("Unknown entry " + name, range));
            return null;
        }
        if (!symbol.isValidOverride(raw)) {
            SymbolType type = symbol.getType();
            Diagnostic diagnostic = Diagnostic.error(
                    "Invalid value. Entry " + name + " is " + (type == null ? "untyped" : type.keyword()) + ".", range);
            SuggestedFix conversion = conversionFix(symbol, raw, line, match, lineNumber);
            if (conversion != null) {
                diagnostic.addFix(conversion);
            }
            diagnostics.add(diagnostic);
            return null;
        }
        Matcher trailing = TRAILING.matcher(line.substring(match.end()));
        if (trailing.find()) {
            int start = match.end() + trailing.start(1) + 1;
            int end = start + trailing.group(1).stripTrailing().length();
            diagnostics.add(Diagnostic.error(
                    "Unexpected trailing characters", new SourceRange(path, lineNumber, start, lineNumber, end)));
            return null;
        }
        String value = raw.length() >= 2 && raw.startsWith("\"") ? raw.substring(1, raw.length() - 1) : raw;
        return new ConfigOverride(symbol, value, range);
    }

    /** Offers decimal/hex conversion when a number was written in the other base. */
    private SuggestedFix conversionFix(Symbol symbol, String raw, String line, Matcher match, int lineNumber) {
        SymbolType type = symbol.getType();
        if (!(type == SymbolType.HEX && SymbolType.INT.isValidLiteral(raw))
                && !(type == SymbolType.INT && SymbolType.HEX.isValidLiteral(raw))) {
            return null;
        }
        String converted = type.format(ConfigValue.of(ConfigValue.parseNumber(raw).getAsLong()));
        int start = match.start(2) + 1;
        SourceRange valueRange = new SourceRange(path, lineNumber, start, lineNumber, start + raw.length());
        return new SuggestedFix(
                "Convert to " + type.keyword() + " (" + converted + ")",
                true,
                List.of(TextEdit.replace(valueRange, converted)));
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
