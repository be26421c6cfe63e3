package com.raditha.pyrewrite.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Asks git for the top level of the working tree containing a directory.
 */
public class GitRootLocator implements VcsRootLocator {

    private static final Logger logger = LoggerFactory.getLogger(GitRootLocator.class);

    private final long timeoutSeconds;

    public GitRootLocator() {
        this(10);
    }

    public GitRootLocator(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public Optional<Path> findRoot(Path directory) {
        try {
            ProcessBuilder pb = new ProcessBuilder("git", "rev-parse", "--show-toplevel");
            pb.directory(directory.toFile());
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);

            Process process = pb.start();
            String output = readFirstLine(process);

            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                logger.debug("git rev-parse timed out in {}", directory);
                return Optional.empty();
            }
            if (process.exitValue() != 0 || output == null || output.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(Path.of(output.trim()).toAbsolutePath().normalize());
        } catch (IOException e) {
            logger.debug("git is not available: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private static String readFirstLine(Process process) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String first = reader.readLine();
            while (reader.readLine() != null) {
                // drain
            }
            return first;
        }
    }
}
