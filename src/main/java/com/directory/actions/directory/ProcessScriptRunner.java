package com.directory.actions.directory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs scripts in a local {@code powershell} process.
 * The script is passed as a single argument, never through a shell.
 */
public class ProcessScriptRunner implements ScriptRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessScriptRunner.class);

    private final String executable;
    private final Duration timeout;

    public ProcessScriptRunner(Duration timeout) {
        this("powershell", timeout);
    }

    public ProcessScriptRunner(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    @Override
    public String run(String script) throws DirectoryException {
        ProcessBuilder builder = new ProcessBuilder(List.of(
                executable, "-NoProfile", "-NonInteractive", "-Command", script));
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new DirectoryException("Failed to start " + executable, e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DirectoryException("PowerShell did not finish within " + timeout.toSeconds() + "s");
            }
            String out = stdout.get(5, TimeUnit.SECONDS);
            if (process.exitValue() != 0) {
                String err = stderr.get(5, TimeUnit.SECONDS);
                log.error("powershell.failed exitCode={} stderr={}", process.exitValue(), err.strip());
                throw new DirectoryException("PowerShell exited with code " + process.exitValue());
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new DirectoryException("Interrupted while waiting for PowerShell", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new DirectoryException("Failed to read PowerShell output", e);
        }
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read process stream", e);
        }
    }
}
