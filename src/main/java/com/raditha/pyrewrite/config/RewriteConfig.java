package com.raditha.pyrewrite.config;

import java.util.Set;

/**
 * Configuration for a rewrite run.
 *
 * @param namingRule           which top-level names are converted
 * @param excludedDirectories  directory names never scanned for consuming files
 * @param parallelism          worker threads for per-file usage analysis
 */
public record RewriteConfig(
        NamingRule namingRule,
        Set<String> excludedDirectories,
        int parallelism) {

    public static final String SOURCE_EXTENSION = ".py";
    public static final String PACKAGE_MARKER = "__init__.py";
    private static final int MAX_DEFAULT_THREADS = 8;

    /**
     * Validate configuration.
     */
    public RewriteConfig {
        if (namingRule == null) {
            throw new IllegalArgumentException("namingRule cannot be null");
        }
        excludedDirectories = excludedDirectories == null ? Set.of() : Set.copyOf(excludedDirectories);
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
    }

    /**
     * Snake case names, the usual tooling directories excluded, one thread per processor.
     */
    public static RewriteConfig defaults() {
        return new RewriteConfig(
                NamingRule.snakeCase(),
                defaultExcludedDirectories(),
                Math.min(Runtime.getRuntime().availableProcessors(), MAX_DEFAULT_THREADS));
    }

    public static Set<String> defaultExcludedDirectories() {
        return Set.of("__pycache__", ".git", ".venv", "venv", "node_modules", ".pytest_cache");
    }

    public RewriteConfig withParallelism(int threads) {
        return new RewriteConfig(namingRule, excludedDirectories, threads);
    }
}
