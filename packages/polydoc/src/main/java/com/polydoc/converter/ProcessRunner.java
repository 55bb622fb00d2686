package com.polydoc.converter;

import com.polydoc.exception.ExecutionException;
import com.polydoc.exception.IoException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs an external command synchronously, feeding {@code stdin} and collecting stdout and stderr.
 *
 * <p>The calling thread blocks until the process exits; there is no timeout.
 */
public class ProcessRunner {
  private static final org.slf4j.Logger log =
      com.polydoc.logging.LoggingService.getLogger(ProcessRunner.class);

  public ProcessResult run(List<String> command, byte[] stdin) {
    long start = System.currentTimeMillis();
    Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException e) {
      throw new IoException("Failed to launch '" + String.join(" ", command) + "'", e);
    }

    // stdin and stderr on their own threads so a full pipe cannot stall the process
    CompletableFuture<Void> writer =
        CompletableFuture.runAsync(() -> writeAndClose(process.getOutputStream(), stdin));
    CompletableFuture<String> stderr =
        CompletableFuture.supplyAsync(
            () -> new String(readAll(process.getErrorStream()), StandardCharsets.UTF_8));

    try {
      byte[] stdout = readAll(process.getInputStream());
      int exitCode = process.waitFor();
      writer.join();
      ProcessResult result = new ProcessResult(exitCode, stdout, stderr.join());
      log.debug(
          "'{}' exited with {} in ({}ms)",
          command.get(0),
          exitCode,
          System.currentTimeMillis() - start);
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new ExecutionException("Interrupted while waiting for '" + command.get(0) + "'", e);
    } catch (UncheckedIOException | CompletionException e) {
      process.destroyForcibly();
      throw new IoException("I/O failure talking to '" + command.get(0) + "'", e);
    }
  }

  private static void writeAndClose(OutputStream out, byte[] data) {
    try (out) {
      out.write(data);
    } catch (IOException e) {
      // the process may exit without reading its input; its exit code reports the problem
      log.debug("Could not write process stdin: {}", e.getMessage());
    }
  }

  private static byte[] readAll(InputStream in) {
    try (in) {
      return in.readAllBytes();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
