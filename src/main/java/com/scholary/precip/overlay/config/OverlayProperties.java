package com.scholary.precip.overlay.config;

import com.scholary.precip.overlay.geo.GeoBounds;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.nio.file.Path;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for overlay generation and caching.
 *
 * <p>Defaults live in application.yml; every value can be overridden through the environment
 * (e.g. {@code OVERLAY_RETRY_INTERVAL_MS}).
 */
@ConfigurationProperties(prefix = "overlay")
@Validated
public record OverlayProperties(
    @NotNull Path dataDir,
    @NotNull Path cacheDir,
    @NotNull Path defaultGribFile,
    @NotNull Path paletteFile,
    @NotBlank String defaultVariable,
    @NotEmpty List<String> fallbackMatches,
    @Min(0) @Max(23) int minHour,
    @Min(0) @Max(23) int maxHour,
    @Positive long refreshIntervalMs,
    @Positive long retryIntervalMs,
    @PositiveOrZero int borderColorTolerance,
    @Min(0) @Max(255) int cropAlphaThreshold,
    @Positive int pngReadRetries,
    @PositiveOrZero long pngReadRetryDelayMs,
    @Positive int diagnosticMaxLength,
    @NotNull GeoBounds defaultBounds) {

  public OverlayProperties {
    // "a,,b" or a trailing comma in the env var must not produce blank match expressions
    fallbackMatches =
        fallbackMatches == null
            ? List.of()
            : fallbackMatches.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}
