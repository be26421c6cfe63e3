package com.raditha.pyrewrite.scanner;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds the version-control root enclosing a directory. Used only as an upper bound when climbing
 * the package chain; absence is never an error.
 */
@FunctionalInterface
public interface VcsRootLocator {

    Optional<Path> findRoot(Path directory);

    static VcsRootLocator none() {
        return directory -> Optional.empty();
    }
}
