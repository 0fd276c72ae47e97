package com.gateway.service.impl;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generates tool names for one API description and keeps them unique.
 * <p>
 * A new instance must be used per description: uniqueness is tracked across the calls to
 * {@link #claim(String)} on the same instance.
 */
final class ToolNamer {

    private static final Pattern SEPARATOR = Pattern.compile("[-_/](.)");
    private static final Pattern DISALLOWED = Pattern.compile("[^a-zA-Z0-9_-]");

    private final Set<String> usedNames = new HashSet<>();

    /**
     * Synthesizes an operation id from method and path, e.g. {@code GET /users/{id}} becomes
     * {@code getUsersById}. Only a trailing path parameter contributes a {@code By<Param>} suffix;
     * parameter segments elsewhere in the path do not contribute to the name.
     */
    static String synthesize(String method, String path) {
        String[] parts = path.split("/");
        StringBuilder name = new StringBuilder(method.toLowerCase());
        int last = parts.length - 1;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty()) {
                continue;
            }
            if (part.startsWith("{") && part.endsWith("}")) {
                if (i == last) {
                    name.append("By").append(titleCase(part));
                }
            } else {
                name.append(titleCase(part));
            }
        }
        return name.toString();
    }

    /**
     * Converts snake_case, kebab-case or a {@code {param}} segment to TitleCase.
     */
    static String titleCase(String value) {
        Matcher matcher = SEPARATOR.matcher(value.toLowerCase());
        StringBuilder converted = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(converted, Matcher.quoteReplacement(matcher.group(1).toUpperCase()));
        }
        matcher.appendTail(converted);

        String result = converted.toString();
        if (result.startsWith("{")) {
            result = result.substring(1);
        }
        if (result.endsWith("}")) {
            result = result.substring(0, result.length() - 1);
        }
        if (result.isEmpty()) {
            return result;
        }
        return Character.toUpperCase(result.charAt(0)) + result.substring(1);
    }

    /**
     * Restricts a name to letters, digits, {@code _} and {@code -}.
     */
    static String sanitize(String name) {
        return DISALLOWED.matcher(name.replace('.', '_')).replaceAll("_");
    }

    /**
     * Sanitizes a base name and reserves it, appending {@code _1}, {@code _2}, ... when the
     * sanitized name is already taken.
     */
    String claim(String baseName) {
        String sanitized = sanitize(baseName);
        String candidate = sanitized;
        int counter = 1;
        while (usedNames.contains(candidate)) {
            candidate = sanitized + "_" + counter++;
        }
        usedNames.add(candidate);
        return candidate;
    }
}
