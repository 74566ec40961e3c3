package com.scholary.precip.overlay.toolchain;

import java.io.IOException;
import java.util.List;

/**
 * Runs external executables.
 *
 * <p>This abstraction keeps the conversion pipeline independent of process handling, and lets
 * tests stand in for wgrib2 and GDAL without having them installed.
 */
public interface CommandRunner {

  /**
   * Run a command to completion.
   *
   * <p>A non-zero exit code is not an error at this level; it is reported in the result.
   *
   * @param command the executable followed by its arguments
   * @return exit code and captured output
   * @throws IOException if the process cannot be started or is interrupted
   */
  CommandResult run(List<String> command) throws IOException;

  /**
   * Run a command and fail unless it exits with 0.
   *
   * @throws ToolchainException if the command exits with a non-zero code
   */
  default CommandResult runChecked(List<String> command) throws IOException {
    CommandResult result = run(command);
    if (!result.succeeded()) {
      throw new ToolchainException(result);
    }
    return result;
  }
}
