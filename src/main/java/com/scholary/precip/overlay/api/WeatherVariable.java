package com.scholary.precip.overlay.api;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Grid fields an overlay can be rendered for.
 *
 * <p>Each variable carries the wgrib2 {@code -match} expressions tried in order. The same quantity
 * is labelled differently across models and model versions (radar precipitation rate may come as
 * RPRATE, PRATE or only as accumulated APCP), so the first one that extracts wins.
 */
public enum WeatherVariable {
  CAPE(":CAPE:"),
  RPRATE(":RPRATE:", ":PRATE:", ":APCP:"),
  SPRATE(":SPRATE:"),
  GPRATE(":GPRATE:"),
  LCDC(":LCDC:"),
  PRES(":PRES:");

  private final List<String> matchExpressions;

  WeatherVariable(String... matchExpressions) {
    this.matchExpressions = List.of(matchExpressions);
  }

  public List<String> matchExpressions() {
    return matchExpressions;
  }

  /**
   * Parse a query value, ignoring case and surrounding whitespace.
   *
   * @return the variable, or empty for blank or unknown values
   */
  public static Optional<WeatherVariable> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (WeatherVariable variable : values()) {
      if (variable.name().equals(normalized)) {
        return Optional.of(variable);
      }
    }
    return Optional.empty();
  }
}
