package com.kconfig.semantics.loader;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** {@code $(NAME)} and {@code ${NAME}} substitution against an explicit variable map. */
public final class Environment {
    private static final Pattern REFERENCE = Pattern.compile("\\$(?:\\(([^()]+?)\\)|\\{([^{}]+?)\\})");
    private static final Pattern BRACED = Pattern.compile("\\$\\{([^{}]+?)\\}");

    private Environment() {}

    /** Replaces every known reference in {@code text}; unknown references are left as written. */
    public static String substitute(String text, Map<String, String> variables) {
        if (text.indexOf('$') < 0) {
            return text;
        }
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            String value = variables.get(name);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Expands {@code ${NAME}} references between the variables themselves.
     *
     * @throws IllegalArgumentException when a variable refers to itself, directly or indirectly
     */
    public static Map<String, String> resolve(Map<String, String> variables) {
        Map<String, String> resolved = new LinkedHashMap<>(variables);
        for (String key : variables.keySet()) {
            String value = resolved.get(key);
            // each round replaces at least one reference, so more rounds than variables means a loop
            for (int round = 0; value != null && BRACED.matcher(value).find(); round++) {
                if (round > variables.size()) {
                    throw new IllegalArgumentException("Kconfig environment is circular: " + key);
                }
                Matcher matcher = BRACED.matcher(value);
                StringBuilder out = new StringBuilder();
                boolean replaced = false;
                while (matcher.find()) {
                    String name = matcher.group(1);
                    if (name.equals(key)) {
                        throw new IllegalArgumentException("Kconfig environment is circular: variable " + key + " references itself");
                    }
                    String replacement = resolved.get(name);
                    replaced |= replacement != null;
                    matcher.appendReplacement(out, Matcher.quoteReplacement(replacement != null ? replacement : matcher.group()));
                }
                matcher.appendTail(out);
                value = out.toString();
                if (!replaced) {
                    break;
                }
            }
            resolved.put(key, value);
        }
        return resolved;
    }
}
