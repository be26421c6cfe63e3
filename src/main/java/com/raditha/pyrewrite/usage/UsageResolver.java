package com.raditha.pyrewrite.usage;

import com.raditha.pyrewrite.model.FileAnalysis;
import com.raditha.pyrewrite.model.ImportBinding;
import com.raditha.pyrewrite.model.UsageRewrite;
import com.raditha.pyrewrite.model.WildcardImportWarning;
import com.raditha.pyrewrite.syntax.AttributeReference;
import com.raditha.pyrewrite.syntax.ImportStatement;
import com.raditha.pyrewrite.syntax.ModuleTree;
import com.raditha.pyrewrite.syntax.NameBinding;
import com.raditha.pyrewrite.syntax.NameReference;
import com.raditha.pyrewrite.syntax.ParseOutcome;
import com.raditha.pyrewrite.syntax.PythonSyntax;
import com.raditha.pyrewrite.syntax.Statement;
import com.raditha.pyrewrite.syntax.SymbolReference;
import com.raditha.pyrewrite.syntax.TreeRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Rewrites the usages of converted names in one consuming file into invocations.
 * <p>
 * Only references whose root name is bound, at the point of the read, by an import that an
 * {@link ImportBinding} resolves to the target module are rewritten. Imports inside a function or
 * class only count for reads in that scope. Names reachable only through a wildcard import are
 * reported instead.
 */
public class UsageResolver {

    private static final Logger logger = LoggerFactory.getLogger(UsageResolver.class);

    private final PythonSyntax syntax;
    private final ImportResolver importResolver;

    public UsageResolver(PythonSyntax syntax) {
        this(syntax, new ImportResolver());
    }

    public UsageResolver(PythonSyntax syntax, ImportResolver importResolver) {
        this.syntax = syntax;
        this.importResolver = importResolver;
    }

    /**
     * Analyse one consuming file. Never throws: failures are reported through the result status.
     *
     * @param file           the consuming file
     * @param target         names of the target module
     * @param moduleRoot     root both files live under
     * @param convertedNames names that became functions
     */
    public FileAnalysis analyze(Path file, TargetModule target, Path moduleRoot, Set<String> convertedNames) {
        Optional<List<String>> parts = TargetModule.relativeParts(file, moduleRoot);
        if (parts.isEmpty()) {
            return FileAnalysis.unrelated(file);
        }
        List<String> consumerPackage = parts.get().subList(0, parts.get().size() - 1);

        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            logger.warn("Cannot read {}: {}", file, e.getMessage());
            return FileAnalysis.unreadable(file, String.valueOf(e.getMessage()));
        }
        return analyze(file, text, target, consumerPackage, convertedNames);
    }

    /**
     * Analyse already loaded text.
     */
    public FileAnalysis analyze(Path file, String text, TargetModule target, List<String> consumerPackage,
                                Set<String> convertedNames) {
        ParseOutcome outcome = syntax.parse(text);
        ImportTable moduleImports = importResolver.resolve(outcome.tree(), target, consumerPackage, convertedNames);

        if (outcome instanceof ParseOutcome.ParseFailed failed) {
            logger.warn("Skipping {}: {}", file, failed.reason());
            return FileAnalysis.parseFailed(file, failed.reason(), importWarnings(moduleImports));
        }

        ModuleTree tree = outcome.tree();
        Map<Statement, ImportTable> resolved = new HashMap<>();
        Function<Statement, ImportTable> tableOf = statement -> resolved.computeIfAbsent(statement,
                s -> importResolver.resolve(s, target, consumerPackage, convertedNames));
        List<UsageRewrite> rewrites = new ArrayList<>();
        List<WildcardImportWarning> warnings = new ArrayList<>();
        Set<SymbolReference> invoked = new HashSet<>();

        for (SymbolReference reference : tree.references()) {
            NameBinding binding = reference.binding();
            if (reference instanceof NameReference name) {
                if (binding == null) {
                    if (!moduleImports.wildcards().isEmpty() && convertedNames.contains(name.name())) {
                        warnings.add(new WildcardImportWarning(
                                name.range(), moduleImports.wildcards().get(0).moduleName(), name.name()));
                    }
                } else if (binding.byImport()) {
                    ImportBinding importBinding = tableOf.apply(binding.importStatement()).qualified().get(name.name());
                    if (importBinding != null) {
                        invoked.add(reference);
                        rewrites.add(rewrite(text, reference, importBinding));
                    }
                }
            } else if (reference instanceof AttributeReference attribute
                    && convertedNames.contains(attribute.attribute())
                    && binding != null && binding.byImport()) {
                ImportBinding importBinding = tableOf.apply(binding.importStatement()).direct()
                        .get(attribute.objectPath());
                if (importBinding == null && binding.importStatement() instanceof ImportStatement) {
                    // `import pkg` after `import pkg.config` still reaches pkg.config
                    importBinding = moduleImports.direct().get(attribute.objectPath());
                }
                if (importBinding != null) {
                    invoked.add(reference);
                    rewrites.add(rewrite(text, reference, importBinding));
                }
            }
        }
        if (warnings.isEmpty()) {
            warnings.addAll(importWarnings(moduleImports));
        }
        rewrites.sort(Comparator.comparingInt(r -> r.location().startOffset()));
        warnings.sort(Comparator.comparingInt(w -> w.location().startOffset()));

        if (rewrites.isEmpty()) {
            return FileAnalysis.unchanged(file, warnings);
        }
        String rewritten = syntax.render(TreeRewriter.invokeReferences(tree, invoked::contains));
        logger.debug("{}: {} usage(s) rewritten", file, rewrites.size());
        return FileAnalysis.rewritten(file, rewrites, warnings, rewritten);
    }

    private static UsageRewrite rewrite(String text, SymbolReference reference, ImportBinding binding) {
        String original = text.substring(reference.range().startOffset(), reference.range().endOffset());
        return new UsageRewrite(reference.range(), original, original + "()", binding);
    }

    /**
     * One warning per wildcard import of the target, placed on the import.
     */
    private static List<WildcardImportWarning> importWarnings(ImportTable imports) {
        return imports.wildcards().stream()
                .map(w -> new WildcardImportWarning(w.location(), w.moduleName(), null))
                .toList();
    }
}
