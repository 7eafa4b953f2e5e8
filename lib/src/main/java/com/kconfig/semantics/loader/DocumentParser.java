package com.kconfig.semantics.loader;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.expr.CompiledExpression;
import com.kconfig.semantics.model.ChoiceScope;
import com.kconfig.semantics.model.DefaultClause;
import com.kconfig.semantics.model.Entry;
import com.kconfig.semantics.model.IfScope;
import com.kconfig.semantics.model.MenuScope;
import com.kconfig.semantics.model.RangeClause;
import com.kconfig.semantics.model.Repository;
import com.kconfig.semantics.model.Scope;
import com.kconfig.semantics.model.ScopeTable;
import com.kconfig.semantics.model.SelectClause;
import com.kconfig.semantics.model.SourceRange;
import com.kconfig.semantics.model.Symbol;
import com.kconfig.semantics.model.SymbolKind;
import com.kconfig.semantics.model.SymbolType;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented scanner for one Kconfig file. Each logical line is matched against the directive
 * patterns in priority order; the first match wins. Problems are recorded as diagnostics on the
 * file and never stop the scan.
 */
final class DocumentParser {
    private static final Logger LOGGER = Logger.getLogger(DocumentParser.class.getName());

    private static final String QUOTED = "\"((?:.*?[^\\\\])?)\"";
    private static final String CONDITION = "(?:\\s+if\\s+([^#]+))?";

    private static final Pattern COMMENT_LINE = Pattern.compile("^\\s*#");
    private static final Pattern CONFIG = Pattern.compile("^\\s*(menuconfig|config)\\s+(\\w+)");
    private static final Pattern SOURCE = Pattern.compile("^\\s*(source|rsource|osource)\\s+" + QUOTED);
    private static final Pattern CHOICE = Pattern.compile("^\\s*choice\\b(?:\\s+(\\w+))?");
    private static final Pattern END_CHOICE = Pattern.compile("^\\s*endchoice\\b");
    private static final Pattern IF = Pattern.compile("^\\s*if\\s+([^#]+)");
    private static final Pattern END_IF = Pattern.compile("^\\s*endif\\b");
    private static final Pattern MENU = Pattern.compile("^\\s*(mainmenu|menu)\\s+" + QUOTED);
    private static final Pattern END_MENU = Pattern.compile("^\\s*endmenu\\b");
    private static final Pattern DEPENDS_ON = Pattern.compile("^\\s*depends\\s+on\\s+([^#]+)");
    private static final Pattern VISIBLE_IF = Pattern.compile("^\\s*visible\\s+if\\s+([^#]+)");
    private static final Pattern ASSIGNMENT = Pattern.compile("^\\s*([\\w\\-]+)\\s*=\\s*([^#]+)");
    private static final Pattern COMMENT = Pattern.compile("^\\s*comment\\s+\".*\"");
    private static final Pattern OPTIONAL = Pattern.compile("^\\s*optional\\b");
    private static final Pattern TYPE =
            Pattern.compile("^\\s*(bool|tristate|string|hex|int)\\b(?:\\s+" + QUOTED + ")?" + CONDITION);
    private static final Pattern SELECT = Pattern.compile("^\\s*(select|imply)\\s+(\\w+)" + CONDITION);
    private static final Pattern PROMPT = Pattern.compile("^\\s*prompt\\s+" + QUOTED + CONDITION);
    private static final Pattern HELP = Pattern.compile("^\\s*(?:---help---|help\\b)");
    private static final Pattern DEFAULT = Pattern.compile("^\\s*default\\s+([^#]+)");
    private static final Pattern DEF_TYPED = Pattern.compile("^\\s*def_(bool|tristate|int|hex)\\s+([^#]+)");
    private static final Pattern DEF_STRING = Pattern.compile("^\\s*def_string\\s+" + QUOTED + CONDITION);
    private static final Pattern RANGE = Pattern.compile("^\\s*range\\s+([-+]?\\w+)\\s+([-+]?\\w+)" + CONDITION);
    private static final Pattern CONDITIONAL = Pattern.compile("^(.*?)\\s+if\\s+(.+)$");

    private static final int TAB_WIDTH = 8;

    private final ParsedFile file;
    private final Path path;
    private final Repository repository;
    private final ScopeTable scopes;
    private final IncludeResolver includes;
    private final Map<String, String> environment;
    private final Deque<Integer> openScopes = new ArrayDeque<>();
    private final Map<String, Integer> ordinals = new HashMap<>();

    private Entry entry;
    private Entry choice;
    private boolean inComment;
    private boolean inHelp;
    private int helpLineIndent;
    private int helpIndent;
    private StringBuilder helpText;
    private int reportedLine;

    DocumentParser(ParsedFile file) {
        this.file = file;
        this.path = file.getPath();
        this.repository = file.getRepository();
        this.scopes = repository.getScopes();
        this.includes = new IncludeResolver(file.getSources());
        this.environment = new LinkedHashMap<>(file.getEnvironment());
    }

    void parse(String text) {
        long start = System.nanoTime();
        String[] lines = text.split("\\r?\\n", -1);
        for (int index = 0; index < lines.length; index++) {
            int startLine = index + 1;
            String line = Environment.substitute(lines[index], environment);
            while (line.endsWith("\\") && index < lines.length - 1) {
                index++;
                line = line.substring(0, line.length() - 1) + Environment.substitute(lines[index], environment);
            }
            int endLine = index + 1;
            if (line.isBlank() || COMMENT_LINE.matcher(line).find()) {
                continue;
            }
            if (inHelp && consumeHelp(line, endLine)) {
                continue;
            }
            handle(line, SourceRange.lines(path, startLine, endLine));
        }
        finishHelp();
        while (!openScopes.isEmpty()) {
            Scope scope = scopes.get(openScopes.pop());
            String keyword = scope.getKind().name().toLowerCase(Locale.ROOT);
            file.addDiagnostic(Diagnostic.error("Unterminated " + keyword, SourceRange.line(path, scope.getLocation().getStartLine())));
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format(
                    "Parsed %s: %d entries, %d diagnostics in %d ms",
                    path,
                    file.getEntries().size(),
                    file.getDiagnostics().size(),
                    (System.nanoTime() - start) / 1_000_000));
        }
    }

    private void handle(String line, SourceRange range) {
        int startLine = range.getStartLine();
        int endLine = range.getEndLine();

        Matcher match = CONFIG.matcher(line);
        if (match.find()) {
            inComment = false;
            declareConfig(SymbolKind.fromKeyword(match.group(1)), match.group(2), startLine);
            return;
        }
        match = SOURCE.matcher(line);
        if (match.find()) {
            inComment = false;
            entry = null;
            include(match.group(1), match.group(2), range);
            return;
        }
        match = CHOICE.matcher(line);
        if (match.find()) {
            inComment = false;
            openChoice(match.group(1), startLine);
            return;
        }
        if (END_CHOICE.matcher(line).find()) {
            inComment = false;
            entry = null;
            choice = null;
            close(Scope.Kind.CHOICE, "endchoice", range);
            return;
        }
        match = IF.matcher(line);
        if (match.find()) {
            inComment = false;
            entry = null;
            String condition = normalize(match.group(1));
            checkExpressions(range, condition);
            int parent = currentScope();
            open(new IfScope(childKey("if", condition), parent, path, startLine, condition));
            return;
        }
        if (END_IF.matcher(line).find()) {
            inComment = false;
            entry = null;
            close(Scope.Kind.IF, "endif", range);
            return;
        }
        match = MENU.matcher(line);
        if (match.find()) {
            inComment = false;
            entry = null;
            if ("mainmenu".equals(match.group(1))) {
                repository.setTitle(match.group(2));
                return;
            }
            int parent = currentScope();
            open(new MenuScope(childKey("menu", match.group(2)), parent, path, startLine, match.group(2)));
            return;
        }
        if (END_MENU.matcher(line).find()) {
            inComment = false;
            entry = null;
            close(Scope.Kind.MENU, "endmenu", range);
            return;
        }
        match = DEPENDS_ON.matcher(line);
        if (match.find()) {
            dependsOn(normalize(match.group(1)), range);
            return;
        }
        match = VISIBLE_IF.matcher(line);
        if (match.find()) {
            // menu visibility only affects presentation
            checkExpressions(range, normalize(match.group(1)));
            return;
        }
        match = ASSIGNMENT.matcher(line);
        if (match.find()) {
            environment.put(match.group(1), match.group(2).trim());
            return;
        }
        if (COMMENT.matcher(line).find()) {
            entry = null;
            inComment = true;
            return;
        }
        if (OPTIONAL.matcher(line).find()) {
            return;
        }
        if (!isEntryProperty(line)) {
            file.addDiagnostic(Diagnostic.error("Invalid token", range));
            return;
        }
        if (entry == null) {
            file.addDiagnostic(Diagnostic.warning("Token is only valid in an entry context", range));
            return;
        }
        entry.extend(endLine);
        property(line, range);
    }

    private static boolean isEntryProperty(String line) {
        return TYPE.matcher(line).find()
                || SELECT.matcher(line).find()
                || PROMPT.matcher(line).find()
                || HELP.matcher(line).find()
                || DEFAULT.matcher(line).find()
                || DEF_TYPED.matcher(line).find()
                || DEF_STRING.matcher(line).find()
                || RANGE.matcher(line).find();
    }

    private void property(String line, SourceRange range) {
        Matcher match = TYPE.matcher(line);
        if (match.find()) {
            entry.setType(SymbolType.fromKeyword(match.group(1)));
            if (match.group(2) != null) {
                entry.setPrompt(match.group(2));
            }
            checkExpressions(range, condition(match.group(3)));
            return;
        }
        match = SELECT.matcher(line);
        if (match.find()) {
            String condition = condition(match.group(3));
            checkExpressions(range, condition);
            SelectClause clause = new SelectClause(match.group(2), condition);
            if ("select".equals(match.group(1))) {
                entry.addSelect(clause);
            } else {
                entry.addImply(clause);
            }
            return;
        }
        match = PROMPT.matcher(line);
        if (match.find()) {
            entry.setPrompt(match.group(1));
            checkExpressions(range, condition(match.group(2)));
            return;
        }
        match = HELP.matcher(line);
        if (match.find()) {
            inHelp = true;
            helpLineIndent = indentWidth(line);
            helpIndent = -1;
            helpText = new StringBuilder();
            return;
        }
        match = DEFAULT.matcher(line);
        if (match.find()) {
            addDefault(match.group(1), range);
            return;
        }
        match = DEF_TYPED.matcher(line);
        if (match.find()) {
            entry.setType(SymbolType.fromKeyword(match.group(1)));
            addDefault(match.group(2), range);
            return;
        }
        match = DEF_STRING.matcher(line);
        if (match.find()) {
            entry.setType(SymbolType.STRING);
            String condition = condition(match.group(2));
            checkExpressions(range, condition);
            entry.addDefault(new DefaultClause("\"" + match.group(1) + "\"", condition));
            return;
        }
        match = RANGE.matcher(line);
        if (match.find()) {
            String condition = condition(match.group(3));
            checkExpressions(range, condition);
            entry.addRange(new RangeClause(match.group(1), match.group(2), condition));
        }
    }

    private void declareConfig(SymbolKind kind, String name, int line) {
        Symbol symbol = repository.declare(name, kind);
        entry = repository.addEntry(symbol, path, line, currentScope());
        file.addEntry(entry);
        if (choice != null) {
            for (DefaultClause clause : choice.getDefaults()) {
                if (clause.value().equals(name)) {
                    entry.addDefault(new DefaultClause("y", clause.condition()));
                    break;
                }
            }
        }
    }

    private void openChoice(String name, int line) {
        Symbol symbol;
        if (name != null) {
            symbol = repository.declare(name, SymbolKind.CHOICE);
        } else {
            symbol = repository.detached("<choice @ " + displayPath() + ":" + line + ">", SymbolKind.CHOICE);
        }
        int parent = currentScope();
        Entry choiceEntry = repository.addEntry(symbol, path, line, parent);
        file.addEntry(choiceEntry);
        entry = choiceEntry;
        choice = choiceEntry;
        open(new ChoiceScope(childKey("choice", symbol.getName()), parent, path, line, choiceEntry));
    }

    private void include(String keyword, String rawPath, SourceRange range) {
        Path base = "rsource".equals(keyword) ? path.getParent() : repository.getRootDirectory();
        List<Path> targets = includes.resolve(base, rawPath);
        if (targets.isEmpty()) {
            if (!"osource".equals(keyword)) {
                file.addDiagnostic(Diagnostic.warning("Unable to resolve " + rawPath, range));
            }
            return;
        }
        for (Path target : targets) {
            if (file.isIncludedFrom(target)) {
                file.addDiagnostic(Diagnostic.error("Recursive inclusion of " + target, range));
                continue;
            }
            file.addInclusion(new FileInclusion(target, environment, currentScope(), range.getStartLine()));
        }
    }

    private void dependsOn(String dependency, SourceRange range) {
        checkExpressions(range, dependency);
        if (entry != null) {
            entry.extend(range.getEndLine());
            if (entry.getDependencies().contains(dependency)) {
                file.addDiagnostic(Diagnostic.warning("Duplicate dependency", range));
            }
            // kept even when duplicated, so removing either copy leaves the other in effect
            entry.addDependency(dependency);
            return;
        }
        if (inComment) {
            return;
        }
        Scope scope = scopes.get(currentScope());
        if (scope instanceof MenuScope) {
            MenuScope menu = (MenuScope) scope;
            if (menu.getDependencies().contains(dependency)) {
                file.addDiagnostic(Diagnostic.warning("Duplicate dependency", range));
            }
            menu.addDependency(dependency);
            return;
        }
        file.addDiagnostic(Diagnostic.error("Unexpected depends on", range));
    }

    private void addDefault(String text, SourceRange range) {
        String value = text.trim();
        String condition = null;
        Matcher conditional = CONDITIONAL.matcher(value);
        if (conditional.matches()) {
            value = conditional.group(1).trim();
            condition = normalize(conditional.group(2));
        }
        checkExpressions(range, value, condition);
        entry.addDefault(new DefaultClause(value, condition));
    }

    private boolean consumeHelp(String line, int lineNumber) {
        int width = indentWidth(line);
        if (helpIndent < 0) {
            if (width <= helpLineIndent) {
                finishHelp();
                return false;
            }
            helpIndent = width;
        }
        if (width < helpIndent) {
            finishHelp();
            return false;
        }
        if (helpText.length() > 0) {
            helpText.append('\n');
        }
        helpText.append(line.trim());
        if (entry != null) {
            entry.extend(lineNumber);
        }
        return true;
    }

    private void finishHelp() {
        if (inHelp && entry != null) {
            entry.setHelp(helpText.toString().trim());
        }
        inHelp = false;
        helpText = null;
    }

    private static int indentWidth(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '\t') {
                width += TAB_WIDTH;
            } else if (ch == ' ') {
                width++;
            } else {
                break;
            }
        }
        return width;
    }

    /** Reports the first source that does not compile; at most one such diagnostic per line. */
    private void checkExpressions(SourceRange range, String... sources) {
        if (reportedLine == range.getStartLine()) {
            return;
        }
        for (String source : sources) {
            if (source == null) {
                continue;
            }
            CompiledExpression compiled = repository.getExpressions().get(source);
            if (!compiled.isValid()) {
                reportedLine = range.getStartLine();
                file.addDiagnostic(Diagnostic.error(compiled.getError().getMessage(), range));
                return;
            }
        }
    }

    private int currentScope() {
        Integer top = openScopes.peek();
        return top != null ? top : file.getScopeId();
    }

    private String childKey(String type, String name) {
        int parent = currentScope();
        String sibling = parent + "|" + type + "|" + name;
        int ordinal = ordinals.merge(sibling, 1, Integer::sum) - 1;
        return scopes.childKey(parent, type, name, path, ordinal);
    }

    private void open(Scope scope) {
        openScopes.push(scopes.register(scope));
    }

    private void close(Scope.Kind kind, String keyword, SourceRange range) {
        Integer top = openScopes.peek();
        if (top == null || scopes.get(top).getKind() != kind) {
            file.addDiagnostic(Diagnostic.error("Unexpected " + keyword, range));
            return;
        }
        scopes.get(openScopes.pop()).close(range.getEndLine());
    }

    private String displayPath() {
        Path root = repository.getRootDirectory();
        return path.startsWith(root) ? root.relativize(path).toString() : path.toString();
    }

    private static String condition(String text) {
        return text == null ? null : normalize(text);
    }

    private static String normalize(String expression) {
        return expression.trim().replaceAll("\\s+", " ");
    }
}
