package com.raditha.pyrewrite.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.pyrewrite.model.Binding;
import com.raditha.pyrewrite.model.FileAnalysis;
import com.raditha.pyrewrite.model.RewriteOutcome;
import com.raditha.pyrewrite.model.SkippedPattern;
import com.raditha.pyrewrite.model.UsageRewrite;
import com.raditha.pyrewrite.model.WildcardImportWarning;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Writes the outcome of a run as one JSON document.
 * <p>
 * DTO records keep the syntax tree out of the serialized form.
 */
public class JsonReporter implements RewriteReporter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public record ReportDTO(
            String target,
            String moduleRoot,
            boolean applied,
            List<BindingDTO> bindings,
            List<SkippedDTO> skipped,
            List<FileDTO> files,
            SummaryDTO summary,
            Instant generatedAt) {}

    public record BindingDTO(String name, int line, String value, String preview) {}

    public record SkippedDTO(int line, String reason, String text) {}

    public record FileDTO(String path, String status, List<RewriteDTO> rewrites, List<WarningDTO> warnings,
                          String error) {}

    public record RewriteDTO(int line, int column, String original, String rewritten, String importedAs) {}

    public record WarningDTO(int line, String module, String name) {}

    public record SummaryDTO(int converted, int filesUpdated, int usagesRewritten, int warnings) {}

    private final PrintStream out;
    private final PrintStream err;

    public JsonReporter(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void reportPatternCheck(Path target, String pattern, boolean matches) {
        if (!matches) {
            err.println("Pattern check: ✗ " + target.getFileName() + " does not match '" + pattern + "'");
        }
    }

    @Override
    public void reportOutcome(RewriteOutcome outcome, boolean dryRun) {
        try {
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDTO(outcome)));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void reportApplied(RewriteOutcome outcome) {
        // the document already carries the applied flag
    }

    static ReportDTO toDTO(RewriteOutcome outcome) {
        List<BindingDTO> bindings = outcome.bindings().stream()
                .map(JsonReporter::toBindingDTO)
                .toList();
        List<SkippedDTO> skipped = outcome.skipped().stream()
                .map(JsonReporter::toSkippedDTO)
                .toList();
        List<FileDTO> files = outcome.fileResults().values().stream()
                .filter(FileAnalysis::isNoteworthy)
                .map(JsonReporter::toFileDTO)
                .toList();
        SummaryDTO summary = new SummaryDTO(
                outcome.bindings().size(),
                outcome.updatedFiles().size(),
                outcome.usageRewriteCount(),
                outcome.warningCount());
        return new ReportDTO(
                outcome.targetFile().toString(),
                outcome.moduleRoot() == null ? null : outcome.moduleRoot().toString(),
                outcome.applied(),
                bindings,
                skipped,
                files,
                summary,
                Instant.now());
    }

    private static BindingDTO toBindingDTO(Binding binding) {
        return new BindingDTO(binding.name(), binding.line(), binding.valueSource(),
                ConsoleReporter.functionPreview(binding));
    }

    private static SkippedDTO toSkippedDTO(SkippedPattern skipped) {
        return new SkippedDTO(skipped.line(), skipped.reason().label(), skipped.rawText());
    }

    private static FileDTO toFileDTO(FileAnalysis analysis) {
        List<RewriteDTO> rewrites = analysis.rewrites().stream()
                .map(JsonReporter::toRewriteDTO)
                .toList();
        List<WarningDTO> warnings = analysis.warnings().stream()
                .map(JsonReporter::toWarningDTO)
                .toList();
        return new FileDTO(analysis.file().toString(), analysis.status().name(), rewrites, warnings,
                analysis.failureReason());
    }

    private static RewriteDTO toRewriteDTO(UsageRewrite rewrite) {
        return new RewriteDTO(rewrite.line(), rewrite.location().startColumn(), rewrite.originalText(),
                rewrite.rewrittenText(), rewrite.importBinding().describe());
    }

    private static WarningDTO toWarningDTO(WildcardImportWarning warning) {
        return new WarningDTO(warning.line(), warning.moduleName(), warning.name());
    }
}
