package com.scholary.precip.overlay.toolchain;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>stdout and stderr are kept apart because gdalinfo prints its JSON on stdout and warnings on
 * stderr. stderr is drained on a separate thread so a chatty tool cannot fill the pipe buffer and
 * block while we read stdout. A process whose output cannot be collected is destroyed.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);

  private static final ExecutorService STDERR_DRAINERS =
      Executors.newCachedThreadPool(
          runnable -> {
            Thread thread = new Thread(runnable, "stderr-drainer");
            thread.setDaemon(true);
            return thread;
          });

  @Override
  public CommandResult run(List<String> command) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));
    long startedAt = System.currentTimeMillis();

    Process process = new ProcessBuilder(command).start();
    CommandResult result = collect(process, command);
    LOGGER.debug(
        "{} exited with code {} in {}ms",
        command.get(0),
        result.exitCode(),
        System.currentTimeMillis() - startedAt);
    return result;
  }

  CommandResult collect(Process process, List<String> command) throws IOException {
    boolean completed = false;
    try {
      process.getOutputStream().close();

      CompletableFuture<String> stderr =
          CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), STDERR_DRAINERS);
      String stdout = readAll(process.getInputStream());

      int exitCode = process.waitFor();
      CommandResult result = new CommandResult(List.copyOf(command), exitCode, stdout, stderr.get());
      completed = true;
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException(command.get(0) + " interrupted", e);
    } catch (ExecutionException e) {
      throw new IOException("Failed to read stderr of " + command.get(0), e.getCause());
    } finally {
      if (!completed) {
        LOGGER.warn("Destroying {} after failing to collect its output", command.get(0));
        process.destroy();
      }
    }
  }

  private static String drain(InputStream in) {
    try {
      return readAll(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static String readAll(InputStream in) throws IOException {
    try (InputStream stream = in) {
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
