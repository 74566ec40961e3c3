package com.scholary.precip.overlay.toolchain;

import java.util.List;

/** Exit code and captured output of one external command. */
public record CommandResult(List<String> command, int exitCode, String stdout, String stderr) {

  public boolean succeeded() {
    return exitCode == 0;
  }
}
