package com.scholary.precip.overlay.service;

import com.scholary.precip.overlay.api.OverlayMetaResponse;
import com.scholary.precip.overlay.api.OverlayStatusResponse;
import com.scholary.precip.overlay.api.WeatherVariable;
import com.scholary.precip.overlay.cache.ArtifactPaths;
import com.scholary.precip.overlay.cache.CacheKey;
import com.scholary.precip.overlay.cache.CacheSnapshot;
import com.scholary.precip.overlay.cache.OverlayCacheStore;
import com.scholary.precip.overlay.config.OverlayProperties;
import com.scholary.precip.overlay.raster.ArtifactFiles;
import com.scholary.precip.overlay.toolchain.ToolchainProbe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns raw {@code hour} and {@code var} query values into an overlay, refreshing it first.
 *
 * <p>An hour outside the configured range, or one that does not parse, is treated as absent and
 * selects the default grid file. An unknown variable selects the configured default variable.
 */
@Service
public class OverlayQueryService {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverlayQueryService.class);
  private static final Pattern HOUR_PATTERN = Pattern.compile("^(\\d{1,2})H?$");

  private final OverlayRefreshOrchestrator orchestrator;
  private final OverlayCacheStore cacheStore;
  private final ToolchainProbe toolchainProbe;
  private final ArtifactFiles artifactFiles;
  private final OverlayProperties properties;
  private final WeatherVariable defaultVariable;

  public OverlayQueryService(
      OverlayRefreshOrchestrator orchestrator,
      OverlayCacheStore cacheStore,
      ToolchainProbe toolchainProbe,
      ArtifactFiles artifactFiles,
      OverlayProperties properties) {
    this.orchestrator = orchestrator;
    this.cacheStore = cacheStore;
    this.toolchainProbe = toolchainProbe;
    this.artifactFiles = artifactFiles;
    this.properties = properties;
    this.defaultVariable =
        WeatherVariable.parse(properties.defaultVariable())
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Unknown default variable: " + properties.defaultVariable()));

    try {
      Files.createDirectories(properties.cacheDir());
    } catch (IOException e) {
      throw new RuntimeException("Failed to create cache directory: " + properties.cacheDir(), e);
    }
    LOGGER.info(
        "Overlay cache at {}, grid files from {}, default variable {}",
        properties.cacheDir().toAbsolutePath(),
        properties.dataDir().toAbsolutePath(),
        defaultVariable);
  }

  /** Resolve query values to a key, its artifact paths and its grid file. */
  public OverlayTarget resolve(String variableParam, String hourParam) {
    WeatherVariable variable = WeatherVariable.parse(variableParam).orElse(defaultVariable);
    String hour = normalizeHour(hourParam);
    CacheKey key = CacheKey.of(variable, hour);
    Path gribFile =
        hour == null
            ? properties.defaultGribFile()
            : properties.dataDir().resolve(hour + "H.grib2");
    List<String> matchExpressions =
        variable.matchExpressions().isEmpty()
            ? properties.fallbackMatches()
            : variable.matchExpressions();
    return new OverlayTarget(
        variable,
        hour,
        key,
        gribFile,
        ArtifactPaths.forKey(properties.cacheDir(), key),
        matchExpressions);
  }

  /**
   * Refresh the overlay and describe it.
   *
   * @throws IOException if a synthetic overlay could not be written
   */
  public OverlayMetaResponse meta(OverlayTarget target) throws IOException {
    CacheSnapshot snapshot = refresh(target);
    return new OverlayMetaResponse(
        target.hour(),
        target.variable().name(),
        target.gribFile().getFileName().toString(),
        snapshot.updatedAt(),
        snapshot.bounds(),
        snapshot.source(),
        snapshot.message());
  }

  /**
   * Refresh the overlay and read its PNG bytes.
   *
   * @throws IOException if the overlay could not be written or read
   */
  public byte[] overlayPng(OverlayTarget target) throws IOException {
    refresh(target);
    return artifactFiles.readStableBytes(target.paths().overlayPng());
  }

  /** Current entries and the latest toolchain probe, without refreshing anything. */
  public OverlayStatusResponse status() {
    return new OverlayStatusResponse(
        cacheStore.snapshotAll(),
        toolchainProbe.lastStatus().map(s -> s.available()).orElse(null),
        toolchainProbe.lastStatus().map(s -> s.missing()).orElse(List.of()));
  }

  private CacheSnapshot refresh(OverlayTarget target) throws IOException {
    return orchestrator.refresh(
        target.key(), target.gribFile(), target.paths(), target.matchExpressions());
  }

  /**
   * Normalize an hour query value to two digits.
   *
   * <p>Accepts {@code 8}, {@code 08}, {@code 08H} and {@code 8h}.
   *
   * @return the zero-padded hour, or null when absent, malformed or out of range
   */
  String normalizeHour(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    Matcher matcher = HOUR_PATTERN.matcher(value.trim().toUpperCase(Locale.ROOT));
    if (!matcher.matches()) {
      return null;
    }
    int hour = Integer.parseInt(matcher.group(1));
    if (hour < properties.minHour() || hour > properties.maxHour()) {
      return null;
    }
    return String.format("%02d", hour);
  }
}
