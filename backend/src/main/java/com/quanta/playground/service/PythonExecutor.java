package com.quanta.playground.service;

import com.quanta.playground.config.QuantaCompilerProperties;
import com.quanta.playground.exception.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hands generated Python text to the configured interpreter and captures what it prints.
 */
@Component
public class PythonExecutor implements DisposableBean {

    private static final Logger logger = LoggerFactory.getLogger(PythonExecutor.class);

    static final String TRUNCATION_NOTICE = "\n... (output truncated)";

    private final QuantaCompilerProperties properties;

    // Every running interpreter needs its own reader thread to keep its pipe drained.
    private final ExecutorService outputReaders = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "python-output-reader");
        thread.setDaemon(true);
        return thread;
    });

    public PythonExecutor(QuantaCompilerProperties properties) {
        this.properties = properties;
    }

    @Override
    public void destroy() {
        logger.info("Shutting down Python output readers");
        outputReaders.shutdownNow();
    }

    public ExecutionResult execute(String pythonCode) throws ExecutionException {
        String sessionId = UUID.randomUUID().toString().substring(0, 8);
        Path tempDir = Path.of(properties.tempDirectory());
        Path scriptFile = tempDir.resolve("quanta_" + sessionId + ".py");

        try {
            Files.createDirectories(tempDir);
            Files.writeString(scriptFile, pythonCode, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
            logger.debug("Created temporary script file: {}", scriptFile);

            return runScript(scriptFile);

        } catch (IOException e) {
            throw new ExecutionException("Failed to prepare Python script: " + e.getMessage(), e);
        } finally {
            cleanupFile(scriptFile);
        }
    }

    private ExecutionResult runScript(Path scriptFile) throws ExecutionException {
        Process process;
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(
                properties.pythonPath(),
                scriptFile.getFileName().toString()
            );
            processBuilder.directory(scriptFile.getParent().toFile());
            processBuilder.redirectErrorStream(true);
            processBuilder.environment().put("PYTHONIOENCODING", "utf-8");

            logger.info("Executing program: {} {}", properties.pythonPath(), scriptFile);
            process = processBuilder.start();
        } catch (IOException e) {
            throw new ExecutionException("Failed to start Python interpreter '" + properties.pythonPath()
                    + "': " + e.getMessage(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readProcessOutput(process), outputReaders);

        try {
            boolean finished = process.waitFor(properties.executionTimeoutMs(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                logger.warn("Program execution timeout exceeded after {} ms", properties.executionTimeoutMs());
                return ExecutionResult.timeout("Program execution timeout exceeded");
            }

            String text = output.get(5, TimeUnit.SECONDS);
            int exitCode = process.exitValue();
            logger.info("Program execution finished with exit code: {}", exitCode);
            return new ExecutionResult(exitCode == 0, false, exitCode, text);

        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExecutionException("Interrupted while executing program", e);
        } catch (java.util.concurrent.ExecutionException | TimeoutException e) {
            throw new ExecutionException("Failed to read program output: " + e.getMessage(), e);
        }
    }

    private String readProcessOutput(Process process) {
        try {
            BoundedOutput output = readBounded(process.getInputStream(), properties.maxOutputLength());
            String text = output.text().trim();
            return output.truncated() ? text + TRUNCATION_NOTICE : text;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads {@code in} to the end but keeps at most {@code limit} characters of it.
     */
    static BoundedOutput readBounded(InputStream in, int limit) throws IOException {
        StringBuilder kept = new StringBuilder(Math.min(limit, 8192));
        boolean truncated = false;
        char[] buffer = new char[8192];

        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buffer)) != -1) {
                int room = limit - kept.length();
                if (n > room) {
                    truncated = true;
                }
                if (room > 0) {
                    kept.append(buffer, 0, Math.min(n, room));
                }
            }
        }

        return new BoundedOutput(kept.toString(), truncated);
    }

    record BoundedOutput(String text, boolean truncated) {}

    private void cleanupFile(Path file) {
        try {
            Files.deleteIfExists(file);
            logger.debug("Cleaned up temporary file: {}", file);
        } catch (IOException e) {
            logger.warn("Failed to clean up temporary file {}: {}", file, e.getMessage());
        }
    }

    /**
     * Outcome of one interpreter run. A non-zero exit is a result, not an exception.
     */
    public record ExecutionResult(boolean success, boolean timedOut, int exitCode, String output) {

        static ExecutionResult timeout(String message) {
            return new ExecutionResult(false, true, -1, message);
        }
    }
}
