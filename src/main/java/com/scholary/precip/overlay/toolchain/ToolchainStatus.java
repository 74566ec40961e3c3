package com.scholary.precip.overlay.toolchain;

import java.util.List;

/**
 * Result of one availability probe.
 *
 * @param missing labels of the executables that could not be found, in probe order
 */
public record ToolchainStatus(List<String> missing) {

  public ToolchainStatus {
    missing = List.copyOf(missing);
  }

  public boolean available() {
    return missing.isEmpty();
  }
}
