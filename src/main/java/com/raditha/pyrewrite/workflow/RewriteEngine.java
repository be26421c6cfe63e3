package com.raditha.pyrewrite.workflow;

import com.raditha.pyrewrite.analyzer.BindingClassifier;
import com.raditha.pyrewrite.analyzer.ClassificationResult;
import com.raditha.pyrewrite.config.RewriteConfig;
import com.raditha.pyrewrite.model.FileAnalysis;
import com.raditha.pyrewrite.model.RewriteOutcome;
import com.raditha.pyrewrite.refactoring.ChangeApplier;
import com.raditha.pyrewrite.refactoring.DeclarationRewriter;
import com.raditha.pyrewrite.scanner.GitRootLocator;
import com.raditha.pyrewrite.scanner.ModuleResolver;
import com.raditha.pyrewrite.scanner.ModuleScope;
import com.raditha.pyrewrite.syntax.ModuleTree;
import com.raditha.pyrewrite.syntax.ParseException;
import com.raditha.pyrewrite.syntax.ParseOutcome;
import com.raditha.pyrewrite.syntax.PythonSyntax;
import com.raditha.pyrewrite.syntax.TreeSitterPythonSyntax;
import com.raditha.pyrewrite.usage.TargetModule;
import com.raditha.pyrewrite.usage.UsageResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a whole rewrite: classify the target's bindings, resolve the module scope, analyse every
 * consuming file and, when asked, write all changes at once.
 * <p>
 * The converted names and the module root are fixed before any consuming file is analysed.
 * Consuming files are analysed in parallel on a bounded pool; a failure in one never stops the
 * others. Nothing is written until every file has been analysed.
 */
public class RewriteEngine {

    private static final Logger logger = LoggerFactory.getLogger(RewriteEngine.class);

    private final PythonSyntax syntax;
    private final ModuleResolver moduleResolver;
    private final BindingClassifier classifier;
    private final DeclarationRewriter declarationRewriter;
    private final UsageResolver usageResolver;
    private final ChangeApplier changeApplier;
    private final int parallelism;

    public RewriteEngine(RewriteConfig config) {
        this(config, new TreeSitterPythonSyntax(), new ModuleResolver(new GitRootLocator(), config),
                ChangeApplier.VerificationLevel.PARSE);
    }

    public RewriteEngine(RewriteConfig config, PythonSyntax syntax, ModuleResolver moduleResolver,
                         ChangeApplier.VerificationLevel verificationLevel) {
        this.syntax = syntax;
        this.moduleResolver = moduleResolver;
        this.classifier = new BindingClassifier(config.namingRule());
        this.declarationRewriter = new DeclarationRewriter();
        this.usageResolver = new UsageResolver(syntax);
        this.changeApplier = new ChangeApplier(syntax, verificationLevel);
        this.parallelism = config.parallelism();
    }

    /**
     * Analyse the target and its consumers and optionally write the result.
     *
     * @throws IOException          if the target is missing or unreadable, or a write fails
     * @throws ParseException       if the target, or a rewritten text, does not parse
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public RewriteOutcome analyzeAndRewrite(Path targetFile, boolean apply)
            throws IOException, ParseException, InterruptedException {
        RewriteOutcome outcome = analyze(targetFile);
        return apply ? apply(outcome) : outcome;
    }

    /**
     * Work out every change without writing anything.
     */
    public RewriteOutcome analyze(Path targetFile) throws IOException, ParseException, InterruptedException {
        // Step 1: read and parse the target; any failure here is fatal
        if (!Files.exists(targetFile)) {
            throw new NoSuchFileException(targetFile.toString(), null, "File not found");
        }
        if (!Files.isRegularFile(targetFile)) {
            throw new IOException("Not a file: " + targetFile);
        }
        Path target = targetFile.toRealPath();
        String source = Files.readString(target);
        ParseOutcome parsed = syntax.parse(source);
        if (parsed instanceof ParseOutcome.ParseFailed failed) {
            throw new ParseException(target, failed.line(), failed.reason());
        }
        ModuleTree tree = parsed.tree();

        // Step 2: classify top-level bindings
        ClassificationResult classification = classifier.classify(tree);
        if (classification.isEmpty()) {
            return new RewriteOutcome(target, null, List.of(), classification.skipped(), Map.of(),
                    source, source, false);
        }
        Set<String> names = Set.copyOf(classification.names());

        // Step 3: module scope
        ModuleScope scope = moduleResolver.resolve(target);
        logger.debug("Module root for {} is {}", target, scope.root());

        // Step 4: consuming files
        Map<Path, FileAnalysis> results = analyzeConsumers(target, scope, names);

        // Step 5: the target's own declarations
        String rewritten = syntax.render(declarationRewriter.rewrite(tree, names));

        return new RewriteOutcome(target, scope.root(), classification.bindings(), classification.skipped(),
                results, source, rewritten, false);
    }

    /**
     * Write the target and every consumer with at least one rewritten usage.
     */
    public RewriteOutcome apply(RewriteOutcome outcome) throws IOException, ParseException {
        Map<Path, String> changes = new LinkedHashMap<>();
        if (outcome.targetChanged()) {
            changes.put(outcome.targetFile(), outcome.rewrittenTarget());
        }
        for (FileAnalysis analysis : outcome.updatedFiles()) {
            changes.put(analysis.file(), analysis.rewrittenText());
        }
        if (changes.isEmpty()) {
            return outcome;
        }
        changeApplier.apply(changes);
        logger.info("Modified {} file(s)", changes.size());
        return outcome.withApplied(true);
    }

    private Map<Path, FileAnalysis> analyzeConsumers(Path target, ModuleScope scope, Set<String> names)
            throws InterruptedException {
        List<Path> consumers = scope.filesExcept(target);
        Map<Path, FileAnalysis> results = new TreeMap<>();
        if (consumers.isEmpty()) {
            return results;
        }
        Optional<TargetModule> targetModule = TargetModule.of(target, scope.root());
        if (targetModule.isEmpty()) {
            consumers.forEach(file -> results.put(file, FileAnalysis.unrelated(file)));
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, consumers.size()));
        try {
            List<Future<FileAnalysis>> futures = new ArrayList<>(consumers.size());
            for (Path file : consumers) {
                futures.add(pool.submit(() -> usageResolver.analyze(file, targetModule.get(), scope.root(), names)));
            }
            for (int i = 0; i < consumers.size(); i++) {
                Path file = consumers.get(i);
                try {
                    results.put(file, futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.warn("Analysis of {} failed: {}", file, e.getCause().toString());
                    results.put(file, FileAnalysis.failed(file, String.valueOf(e.getCause().getMessage())));
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return results;
    }
}
