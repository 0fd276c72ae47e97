package com.gateway.service.impl;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether an operation becomes a tool, based on the {@code x-mcp} extension.
 * <p>
 * The flag may be set on the operation, its path item or the document root. Each level is
 * decided by its own method; {@link #resolve} takes the first level that yields a value and
 * otherwise returns the default. A flag that is present but not boolean-like is logged and
 * treated as absent.
 */
@Slf4j
final class InclusionPolicy {

    static final String EXTENSION = "x-mcp";

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no", "off");

    private InclusionPolicy() {
    }

    /**
     * Normalizes a raw extension value to a boolean when it looks like one.
     */
    static Optional<Boolean> normalize(Object value) {
        if (value instanceof Boolean flag) {
            return Optional.of(flag);
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase();
            if (TRUE_VALUES.contains(normalized)) {
                return Optional.of(true);
            }
            if (FALSE_VALUES.contains(normalized)) {
                return Optional.of(false);
            }
        }
        return Optional.empty();
    }

    static Optional<Boolean> operationLevel(Map<String, Object> extensions, String operationLabel) {
        return decide(extensions, "operation '" + operationLabel + "'", "path/root/default");
    }

    static Optional<Boolean> pathLevel(Map<String, Object> extensions, String path) {
        return decide(extensions, "path item '" + path + "'", "root/default");
    }

    static Optional<Boolean> documentLevel(Map<String, Object> extensions) {
        return decide(extensions, "API root", "default");
    }

    /**
     * Applies the precedence operation, then path item, then document, then {@code defaultInclude}.
     */
    static boolean resolve(Map<String, Object> operationExtensions,
                           Map<String, Object> pathExtensions,
                           Map<String, Object> documentExtensions,
                           String operationLabel,
                           String path,
                           boolean defaultInclude) {
        return operationLevel(operationExtensions, operationLabel)
                .or(() -> pathLevel(pathExtensions, path))
                .or(() -> documentLevel(documentExtensions))
                .orElse(defaultInclude);
    }

    private static Optional<Boolean> decide(Map<String, Object> extensions, String location, String fallback) {
        if (extensions == null || !extensions.containsKey(EXTENSION)) {
            return Optional.empty();
        }
        Object raw = extensions.get(EXTENSION);
        Optional<Boolean> value = normalize(raw);
        if (value.isEmpty()) {
            log.warn("Invalid {} value on {}: {} -> expected boolean or 'true'/'false'. Falling back to {}.",
                    EXTENSION, location, raw, fallback);
        }
        return value;
    }
}
