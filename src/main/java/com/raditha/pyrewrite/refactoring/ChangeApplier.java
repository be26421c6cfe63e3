package com.raditha.pyrewrite.refactoring;

import com.raditha.pyrewrite.syntax.ParseOutcome;
import com.raditha.pyrewrite.syntax.ParseException;
import com.raditha.pyrewrite.syntax.PythonSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a set of rewritten files as one unit.
 * <p>
 * Every new text is verified before the first write; every file is backed up before it is
 * overwritten, and a failed write restores the files already written.
 */
public class ChangeApplier {

    private static final Logger logger = LoggerFactory.getLogger(ChangeApplier.class);

    private final PythonSyntax syntax;
    private final VerificationLevel verificationLevel;
    private final Map<Path, String> backups = new LinkedHashMap<>();

    public ChangeApplier(PythonSyntax syntax) {
        this(syntax, VerificationLevel.PARSE);
    }

    public ChangeApplier(PythonSyntax syntax, VerificationLevel level) {
        this.syntax = syntax;
        this.verificationLevel = level;
    }

    /**
     * Verify and write all changes.
     *
     * @param changes new text per file, written in iteration order
     * @return the files written
     * @throws ParseException if a new text does not parse; nothing is written
     * @throws IOException    if a write fails; files already written are restored
     */
    public List<Path> apply(Map<Path, String> changes) throws IOException, ParseException {
        verify(changes);
        try {
            for (Map.Entry<Path, String> change : changes.entrySet()) {
                createBackup(change.getKey());
                Files.writeString(change.getKey(), change.getValue());
                logger.info("Wrote {}", change.getKey());
            }
        } catch (IOException e) {
            logger.warn("Write failed, restoring {} file(s): {}", backups.size(), e.getMessage());
            rollback();
            throw e;
        } finally {
            clearBackups();
        }
        return List.copyOf(changes.keySet());
    }

    /**
     * Check every new text parses.
     */
    public void verify(Map<Path, String> changes) throws ParseException {
        if (verificationLevel == VerificationLevel.NONE) {
            return;
        }
        for (Map.Entry<Path, String> change : changes.entrySet()) {
            ParseOutcome outcome = syntax.parse(change.getValue());
            if (outcome instanceof ParseOutcome.ParseFailed failed) {
                throw new ParseException(change.getKey(), failed.line(),
                        "rewritten text does not parse: " + failed.reason());
            }
        }
    }

    /**
     * Create a backup of a file before modification.
     */
    void createBackup(Path file) throws IOException {
        backups.put(file, Files.readString(file));
    }

    /**
     * Restore all backed up files.
     */
    void rollback() {
        for (Map.Entry<Path, String> entry : backups.entrySet()) {
            try {
                Files.writeString(entry.getKey(), entry.getValue());
                logger.info("Restored {}", entry.getKey());
            } catch (IOException e) {
                logger.error("Failed to restore {}: {}", entry.getKey(), e.getMessage());
            }
        }
    }

    void clearBackups() {
        backups.clear();
    }

    /**
     * How much checking happens before files are written.
     */
    public enum VerificationLevel {
        NONE,
        PARSE
    }
}
