package com.raditha.pyrewrite.usage;

import com.raditha.pyrewrite.config.RewriteConfig;
import org.jspecify.annotations.Nullable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The dotted names under which consuming files can import the target module.
 *
 * @param relativeName  dotted path relative to the module root, e.g. {@code sub.config}; empty for the
 *                      root package's own {@code __init__.py}
 * @param rootPackage   name of the module root when it is itself a package, e.g. {@code pkg}
 */
public record TargetModule(String relativeName, @Nullable String rootPackage) {

    /**
     * Name the target relative to the module root.
     *
     * @return empty when the target is not under the root or has no importable name
     */
    public static Optional<TargetModule> of(Path targetFile, Path moduleRoot) {
        Optional<List<String>> parts = relativeParts(targetFile, moduleRoot);
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        List<String> components = new ArrayList<>(parts.get());
        String fileName = components.remove(components.size() - 1);
        String stem = fileName.endsWith(RewriteConfig.SOURCE_EXTENSION)
                ? fileName.substring(0, fileName.length() - RewriteConfig.SOURCE_EXTENSION.length())
                : fileName;
        if (!"__init__".equals(stem)) {
            components.add(stem);
        }
        String relative = String.join(".", components);
        String rootPackage = null;
        if (Files.isRegularFile(moduleRoot.resolve(RewriteConfig.PACKAGE_MARKER)) && moduleRoot.getFileName() != null) {
            rootPackage = moduleRoot.getFileName().toString();
        }
        if (relative.isEmpty() && rootPackage == null) {
            return Optional.empty();
        }
        return Optional.of(new TargetModule(relative, rootPackage));
    }

    /**
     * Path components of a file relative to the module root, or empty when it lies outside.
     */
    public static Optional<List<String>> relativeParts(Path file, Path moduleRoot) {
        Path absoluteRoot = moduleRoot.toAbsolutePath().normalize();
        Path absoluteFile = file.toAbsolutePath().normalize();
        if (!absoluteFile.startsWith(absoluteRoot) || absoluteFile.equals(absoluteRoot)) {
            return Optional.empty();
        }
        List<String> parts = new ArrayList<>();
        for (Path part : absoluteRoot.relativize(absoluteFile)) {
            parts.add(part.toString());
        }
        return Optional.of(parts);
    }

    /**
     * Name including the module root package, e.g. {@code pkg.sub.config}; null when the module root
     * is not a package.
     */
    public @Nullable String qualifiedName() {
        if (rootPackage == null) {
            return null;
        }
        return relativeName.isEmpty() ? rootPackage : rootPackage + "." + relativeName;
    }

    /**
     * The non-empty names of this module.
     */
    public List<String> forms() {
        List<String> forms = new ArrayList<>(2);
        if (!relativeName.isEmpty()) {
            forms.add(relativeName);
        }
        String qualified = qualifiedName();
        if (qualified != null) {
            forms.add(qualified);
        }
        return forms;
    }

    /**
     * Whether an absolute module name written in an import refers to this module: equal to one of
     * its names, or a dotted suffix of one ({@code config} for {@code pkg.config}).
     * <p>
     * The suffix rule also accepts a sibling package sharing the leaf name.
     */
    public boolean matches(@Nullable String module) {
        if (module == null || module.isEmpty()) {
            return false;
        }
        for (String form : forms()) {
            if (form.equals(module) || form.endsWith("." + module)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a fully resolved module name is exactly this module.
     */
    public boolean isExactly(@Nullable String module) {
        return module != null && !module.isEmpty() && forms().contains(module);
    }

    /**
     * For {@code import pkg} when this module is {@code pkg.sub.config}: the remaining path
     * {@code .sub.config}.
     */
    public Optional<String> suffixBelow(String module) {
        for (String form : forms()) {
            if (form.startsWith(module + ".")) {
                return Optional.of(form.substring(module.length()));
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a relative import as seen from a consuming file.
     *
     * @param level           number of leading dots
     * @param module          dotted name after the dots, may be null
     * @param consumerPackage directories from the module root down to the consuming file
     * @return the absolute dotted name, empty when it climbs above the module root
     */
    public Optional<String> resolveRelative(int level, @Nullable String module, List<String> consumerPackage) {
        List<String> base = new ArrayList<>();
        if (rootPackage != null) {
            base.add(rootPackage);
        }
        base.addAll(consumerPackage);
        int drop = level - 1;
        if (drop > base.size()) {
            return Optional.empty();
        }
        List<String> parts = new ArrayList<>(base.subList(0, base.size() - drop));
        if (module != null && !module.isEmpty()) {
            parts.add(module);
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join(".", parts));
    }

    public String displayName() {
        String qualified = qualifiedName();
        return qualified != null ? qualified : relativeName;
    }
}
