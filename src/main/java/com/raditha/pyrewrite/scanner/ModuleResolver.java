package com.raditha.pyrewrite.scanner;

import com.raditha.pyrewrite.config.RewriteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the module root enclosing a target file and enumerates the source files beneath it.
 * <p>
 * The module root is the highest directory reachable from the target's directory through parents
 * that all contain a package marker, bounded by the version-control root.
 */
public class ModuleResolver {

    private static final Logger logger = LoggerFactory.getLogger(ModuleResolver.class);

    private final VcsRootLocator vcsRootLocator;
    private final Set<String> excludedDirectories;

    public ModuleResolver(VcsRootLocator vcsRootLocator, RewriteConfig config) {
        this.vcsRootLocator = vcsRootLocator;
        this.excludedDirectories = config.excludedDirectories();
    }

    public ModuleScope resolve(Path targetFile) throws IOException {
        Path root = findModuleRoot(targetFile);
        List<Path> files = findSourceFiles(root);
        logger.debug("Module root {} holds {} source file(s)", root, files.size());
        return new ModuleScope(root, files);
    }

    /**
     * Climb from the target's directory while the parent is still part of the package.
     */
    public Path findModuleRoot(Path targetFile) throws IOException {
        Path target = targetFile.toRealPath();
        Path current = target.getParent();
        Optional<Path> vcsRoot = vcsRootLocator.findRoot(current).map(ModuleResolver::real);

        while (true) {
            if (vcsRoot.isPresent() && current.equals(vcsRoot.get())) {
                break;
            }
            Path parent = current.getParent();
            if (parent == null || !Files.isRegularFile(parent.resolve(RewriteConfig.PACKAGE_MARKER))) {
                break;
            }
            current = parent;
        }
        return current;
    }

    /**
     * Every source file under the root, skipping excluded directories, sorted.
     */
    public List<Path> findSourceFiles(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && excludedDirectories.contains(String.valueOf(dir.getFileName()))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.getFileName().toString().endsWith(RewriteConfig.SOURCE_EXTENSION)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.warn("Cannot read {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }

    private static Path real(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }
}
