package com.scholary.precip.overlay.cache;

import com.scholary.precip.overlay.api.WeatherVariable;
import java.util.Objects;

/**
 * Identifies one regenerable overlay: a variable at an hour, or at the default grid file.
 *
 * @param timeSlot {@code "08H"} style hour label, or {@link #DEFAULT_SLOT}
 */
public record CacheKey(WeatherVariable variable, String timeSlot) {

  public static final String DEFAULT_SLOT = "default";

  public CacheKey {
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(timeSlot, "timeSlot");
  }

  /**
   * Key for a zero-padded hour, or for the default grid file when {@code hour} is null.
   *
   * @param hour two-digit hour such as {@code "08"}
   */
  public static CacheKey of(WeatherVariable variable, String hour) {
    return new CacheKey(variable, hour == null ? DEFAULT_SLOT : hour + "H");
  }

  /** Filesystem-safe token, e.g. {@code RPRATE_08H}. */
  public String token() {
    return sanitize(variable.name() + "_" + timeSlot);
  }

  /** Keep only ASCII letters, digits, underscores and dashes. */
  public static String sanitize(String value) {
    return value.replaceAll("[^A-Za-z0-9_-]", "");
  }

  @Override
  public String toString() {
    return token();
  }
}
