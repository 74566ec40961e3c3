package com.scholary.precip.overlay.toolchain;

/**
 * Exception thrown when an external tool exits with a non-zero code.
 *
 * <p>Carries the captured output because the tools report the useful part of their failure
 * (unknown field, unreadable file) on stderr, sometimes on stdout.
 */
public class ToolchainException extends RuntimeException {

  private final CommandResult result;

  public ToolchainException(CommandResult result) {
    super(
        String.format(
            "%s exited with code %d", result.command().get(0), result.exitCode()));
    this.result = result;
  }

  /** The most informative text about the failure: stderr, then stdout, then the message. */
  public String details() {
    if (result.stderr() != null && !result.stderr().isBlank()) {
      return result.stderr();
    }
    if (result.stdout() != null && !result.stdout().isBlank()) {
      return result.stdout();
    }
    return getMessage();
  }
}
