package com.raditha.pyrewrite.usage;

import com.raditha.pyrewrite.model.ImportBinding;
import com.raditha.pyrewrite.model.ImportKind;
import com.raditha.pyrewrite.syntax.ImportFromStatement;
import com.raditha.pyrewrite.syntax.ImportStatement;
import com.raditha.pyrewrite.syntax.ModuleTree;
import com.raditha.pyrewrite.syntax.Statement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves import statements of a consuming file against the target module into an
 * {@link ImportTable}. Later imports of the same local name replace earlier ones.
 */
public class ImportResolver {

    /**
     * Table of the imports the file executes at module level.
     *
     * @param tree            the consuming file
     * @param target          names of the target module
     * @param consumerPackage directories from the module root down to the consuming file
     * @param convertedNames  names that became functions
     */
    public ImportTable resolve(ModuleTree tree, TargetModule target, List<String> consumerPackage,
                               Set<String> convertedNames) {
        return resolve(tree.imports(), target, consumerPackage, convertedNames);
    }

    /**
     * Table of a single import statement, wherever it sits in the file.
     */
    public ImportTable resolve(Statement statement, TargetModule target, List<String> consumerPackage,
                               Set<String> convertedNames) {
        return resolve(List.of(statement), target, consumerPackage, convertedNames);
    }

    private ImportTable resolve(List<Statement> statements, TargetModule target, List<String> consumerPackage,
                                Set<String> convertedNames) {
        Map<String, ImportBinding> qualified = new HashMap<>();
        Map<String, ImportBinding> direct = new HashMap<>();
        List<ImportTable.WildcardImport> wildcards = new ArrayList<>();

        for (Statement statement : statements) {
            if (statement instanceof ImportFromStatement from) {
                resolveFrom(from, target, consumerPackage, convertedNames, qualified, direct, wildcards);
            } else if (statement instanceof ImportStatement imported) {
                resolveImport(imported, target, direct);
            }
        }
        return new ImportTable(qualified, direct, wildcards);
    }

    private void resolveFrom(ImportFromStatement from, TargetModule target, List<String> consumerPackage,
                             Set<String> convertedNames, Map<String, ImportBinding> qualified,
                             Map<String, ImportBinding> direct, List<ImportTable.WildcardImport> wildcards) {
        String moduleName = from.displayModule();
        boolean fromTarget = namesTarget(from, from.module(), target, consumerPackage);

        if (from.wildcard()) {
            if (fromTarget) {
                wildcards.add(new ImportTable.WildcardImport(moduleName, from.range()));
            }
            return;
        }
        for (ImportFromStatement.ImportedName name : from.names()) {
            if (fromTarget && convertedNames.contains(name.name())) {
                qualified.put(name.localName(), new ImportBinding(
                        name.name(), name.localName(), ImportKind.QUALIFIED, moduleName, name.range()));
            } else if (importsTargetItself(from, name.name(), target, consumerPackage)) {
                direct.put(name.localName(), new ImportBinding(
                        name.name(), name.localName(), ImportKind.DIRECT, moduleName, name.range()));
            }
        }
    }

    private void resolveImport(ImportStatement imported, TargetModule target, Map<String, ImportBinding> direct) {
        for (ImportStatement.ImportedModule module : imported.modules()) {
            String visibleAs = module.alias() != null ? module.alias() : module.module();
            if (target.matches(module.module())) {
                direct.put(visibleAs, new ImportBinding(
                        module.module(), visibleAs, ImportKind.DIRECT, module.module(), module.range()));
                continue;
            }
            Optional<String> below = target.suffixBelow(module.module());
            if (below.isPresent()) {
                String accessPath = visibleAs + below.get();
                direct.put(accessPath, new ImportBinding(
                        module.module(), accessPath, ImportKind.DIRECT, module.module(), module.range()));
            }
        }
    }

    /**
     * Whether the {@code from} clause names the target module.
     */
    private static boolean namesTarget(ImportFromStatement from, String module, TargetModule target,
                                       List<String> consumerPackage) {
        if (from.level() == 0) {
            return target.matches(module);
        }
        return target.resolveRelative(from.level(), module, consumerPackage).filter(target::isExactly).isPresent();
    }

    /**
     * Whether {@code from P import name} imports the target module itself.
     */
    private static boolean importsTargetItself(ImportFromStatement from, String name, TargetModule target,
                                               List<String> consumerPackage) {
        if (from.level() == 0) {
            return from.module() != null && target.isExactly(from.module() + "." + name);
        }
        String module = from.module() == null ? name : from.module() + "." + name;
        return target.resolveRelative(from.level(), module, consumerPackage).filter(target::isExactly).isPresent();
    }
}
