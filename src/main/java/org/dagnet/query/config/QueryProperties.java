package org.dagnet.query.config;

import lombok.experimental.UtilityClass;

/**
 * System-property backed defaults for compilation bounds.
 *
 * <p>Each bound is read on every call so tests and embedding services can override it.
 * Missing, blank, malformed or non-positive values fall back to the built-in default.</p>
 */
@UtilityClass
public final class QueryProperties {
    public static final String PROP_MAX_CHECKS = "dagnet.query.maxChecks";
    public static final String PROP_MAX_ITERATIONS = "dagnet.query.maxIterations";
    public static final String PROP_TERM_BUDGET = "dagnet.query.termBudget";
    public static final String PROP_MAX_SIMPLE_PATHS = "dagnet.query.maxSimplePaths";

    public static final int DEFAULT_MAX_CHECKS = 200;
    public static final int DEFAULT_MAX_ITERATIONS = 64;
    public static final int DEFAULT_TERM_BUDGET = 4096;
    public static final int DEFAULT_MAX_SIMPLE_PATHS = 10_000;

    public static int maxChecks() {
        return readBound(PROP_MAX_CHECKS, DEFAULT_MAX_CHECKS);
    }

    public static int maxIterations() {
        return readBound(PROP_MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS);
    }

    public static int termBudget() {
        return readBound(PROP_TERM_BUDGET, DEFAULT_TERM_BUDGET);
    }

    public static int maxSimplePaths() {
        return readBound(PROP_MAX_SIMPLE_PATHS, DEFAULT_MAX_SIMPLE_PATHS);
    }

    static int readBound(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
