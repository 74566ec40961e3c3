package com.scholary.precip.overlay.cache;

import com.fasterxml.jackson.annotation.JsonValue;

/** Provenance of the overlay currently on disk. */
public enum OverlaySource {
  TOOLCHAIN("toolchain"),
  SYNTHETIC("synthetic");

  private final String label;

  OverlaySource(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
