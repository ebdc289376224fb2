package com.bountyscope.tools;

import com.bountyscope.core.engine.RunCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external tool via {@link ProcessBuilder}, capturing stdout and enforcing a timeout.
 */
@Component
public class ToolRunner {

    private static final Logger log = LoggerFactory.getLogger(ToolRunner.class);

    /**
     * @param exitCode process exit code, -1 when the process was killed on timeout
     * @param stdout   captured standard output
     * @param timedOut whether the timeout elapsed before the process exited
     */
    public record ToolResult(int exitCode, String stdout, boolean timedOut) {

        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }

        public List<String> lines() {
            return stdout.lines().map(String::trim).filter(l -> !l.isEmpty()).toList();
        }
    }

    /**
     * @throws ToolUnavailableException if the binary cannot be started
     * @throws RunCancelledException    if the calling thread is interrupted while waiting
     */
    public ToolResult run(List<String> command, Duration timeout) {
        log.debug("Running: {}", String.join(" ", command));
        Path output = null;
        Process process = null;
        try {
            output = Files.createTempFile("bountyscope-tool-", ".out");
            try {
                process = new ProcessBuilder(command)
                        .redirectOutput(output.toFile())
                        .redirectError(ProcessBuilder.Redirect.DISCARD)
                        .start();
            } catch (IOException e) {
                throw new ToolUnavailableException("Cannot start " + command.get(0) + ": " + e.getMessage(), e);
            }

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("{} timed out after {}s", command.get(0), timeout.toSeconds());
            }
            String stdout = Files.readString(output, StandardCharsets.UTF_8);
            int exitCode = finished ? process.exitValue() : -1;
            if (finished && exitCode != 0) {
                log.debug("{} exited with code {}", command.get(0), exitCode);
            }
            return new ToolResult(exitCode, stdout, !finished);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new RunCancelledException("interrupted");
        } catch (IOException e) {
            log.warn("Failed to capture output of {}: {}", command.get(0), e.getMessage());
            return new ToolResult(-1, "", false);
        } finally {
            if (output != null) {
                try {
                    Files.deleteIfExists(output);
                } catch (IOException e) {
                    log.debug("Could not delete temp file {}", output);
                }
            }
        }
    }

    /** Resolves a binary name against {@code PATH}; absolute or relative paths are checked directly. */
    public Optional<Path> locate(String binary) {
        if (binary == null || binary.isBlank()) {
            return Optional.empty();
        }
        if (binary.contains(File.separator)) {
            Path path = Path.of(binary);
            return Files.isExecutable(path) ? Optional.of(path) : Optional.empty();
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return Optional.empty();
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, binary);
            if (Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
