package com.scholary.precip.overlay.service;

import com.scholary.precip.overlay.api.WeatherVariable;
import com.scholary.precip.overlay.cache.ArtifactPaths;
import com.scholary.precip.overlay.cache.CacheEntry;
import com.scholary.precip.overlay.cache.CacheKey;
import com.scholary.precip.overlay.cache.CacheSnapshot;
import com.scholary.precip.overlay.cache.ConversionRegistry;
import com.scholary.precip.overlay.cache.OverlayCacheStore;
import com.scholary.precip.overlay.cache.OverlaySource;
import com.scholary.precip.overlay.config.OverlayProperties;
import com.scholary.precip.overlay.config.ToolchainProperties;
import com.scholary.precip.overlay.logging.StructuredLogger;
import com.scholary.precip.overlay.pipeline.ConversionException;
import com.scholary.precip.overlay.pipeline.ConversionResult;
import com.scholary.precip.overlay.pipeline.Diagnostics;
import com.scholary.precip.overlay.pipeline.GribConversionPipeline;
import com.scholary.precip.overlay.synthetic.SyntheticOverlayGenerator;
import com.scholary.precip.overlay.toolchain.ToolchainProbe;
import com.scholary.precip.overlay.toolchain.ToolchainStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides, on each request, whether an overlay must be regenerated, and makes sure the overlay on
 * disk is servable when the request returns.
 *
 * <p>Decision per request:
 *
 * <ol>
 *   <li>Probe the toolchain and note whether it just came back after being unavailable
 *   <li>Stat the grid file
 *   <li>Convert when the file exists, the tools are there, and the file changed, or the last
 *       attempt failed more than the retry interval ago, or the tools just came back
 *   <li>Otherwise, if the overlay is stale or missing, write a synthetic one explaining why (no
 *       grid file, or tools unavailable)
 * </ol>
 *
 * <p>Concurrency: the decision and the registration of a conversion run under the entry's
 * monitor, so only one thread per key ever starts a conversion. Others arriving while it runs wait
 * for its handle. The conversion itself runs outside the monitor, on the thread that claimed it,
 * and always runs to completion.
 *
 * <p>Failed conversions are retried every retry interval for as long as the grid file stays
 * unchanged and broken; there is no attempt cap.
 */
@Service
public class OverlayRefreshOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverlayRefreshOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final OverlayCacheStore cacheStore;
  private final ConversionRegistry conversionRegistry;
  private final ToolchainProbe toolchainProbe;
  private final GribConversionPipeline pipeline;
  private final SyntheticOverlayGenerator syntheticGenerator;
  private final OverlayProperties properties;
  private final ToolchainProperties toolchainProperties;
  private final Clock clock;

  public OverlayRefreshOrchestrator(
      OverlayCacheStore cacheStore,
      ConversionRegistry conversionRegistry,
      ToolchainProbe toolchainProbe,
      GribConversionPipeline pipeline,
      SyntheticOverlayGenerator syntheticGenerator,
      OverlayProperties properties,
      ToolchainProperties toolchainProperties,
      Clock clock) {
    this.cacheStore = cacheStore;
    this.conversionRegistry = conversionRegistry;
    this.toolchainProbe = toolchainProbe;
    this.pipeline = pipeline;
    this.syntheticGenerator = syntheticGenerator;
    this.properties = properties;
    this.toolchainProperties = toolchainProperties;
    this.clock = clock;
  }

  /**
   * Bring the overlay for a key up to date and return the resulting entry state.
   *
   * <p>Conversion failures never escape: they end in a synthetic overlay and a diagnostic
   * message. Only unexpected filesystem errors are thrown.
   *
   * @param key the overlay to refresh
   * @param gribFile its source grid file, which may not exist
   * @param paths its artifact files
   * @param matchExpressions wgrib2 match candidates in priority order
   * @return the entry after the refresh
   * @throws IOException if a synthetic overlay cannot be written
   */
  public CacheSnapshot refresh(
      CacheKey key, Path gribFile, ArtifactPaths paths, List<String> matchExpressions)
      throws IOException {
    CacheEntry entry = cacheStore.entryFor(key);
    ToolchainStatus toolchain = toolchainProbe.probe();
    Long sourceMtime = readMtime(gribFile);

    CompletableFuture<Void> handle;
    boolean owner;

    synchronized (entry) {
      long now = clock.millis();
      boolean justBecameAvailable = entry.recordProbe(toolchain.available());

      boolean warranted =
          sourceMtime != null
              && toolchain.available()
              && (!sourceMtime.equals(entry.getSourceMtime())
                  || retryDue(entry, now)
                  || justBecameAvailable);

      if (!warranted) {
        refreshSyntheticIfStale(entry, key, gribFile, paths, sourceMtime, toolchain, now);
        return entry.snapshot();
      }

      Optional<CompletableFuture<Void>> existing = conversionRegistry.find(key);
      if (existing.isPresent()) {
        handle = existing.get();
        owner = false;
      } else {
        handle = conversionRegistry.register(key);
        owner = true;
        if (justBecameAvailable) {
          LOGGER.info("Toolchain became available, converting {}", key);
        }
      }
    }

    if (owner) {
      convert(entry, key, gribFile, paths, matchExpressions, sourceMtime, handle);
    } else {
      LOGGER.debug("Conversion already in flight for {}, waiting", key);
      await(handle);
    }
    return entry.snapshot();
  }

  private boolean retryDue(CacheEntry entry, long now) {
    long lastErrorAt = entry.getLastErrorAt();
    return entry.getSource() != OverlaySource.TOOLCHAIN
        && lastErrorAt != 0
        && now - lastErrorAt >= properties.retryIntervalMs();
  }

  private boolean isStale(CacheEntry entry, ArtifactPaths paths, long now) {
    long updatedAt = entry.getUpdatedAt();
    return updatedAt == 0
        || now - updatedAt > properties.refreshIntervalMs()
        || !Files.exists(paths.overlayPng());
  }

  private void refreshSyntheticIfStale(
      CacheEntry entry,
      CacheKey key,
      Path gribFile,
      ArtifactPaths paths,
      Long sourceMtime,
      ToolchainStatus toolchain,
      long now)
      throws IOException {
    if (!isStale(entry, paths, now)) {
      return;
    }

    String message;
    if (sourceMtime == null) {
      message = "Grid file missing: place a file at " + gribFile;
    } else if (!toolchain.available()) {
      message =
          String.format(
              "Grid file found but tools unavailable (%s). Synthetic fallback.",
              String.join(", ", toolchain.missing()));
    } else {
      // Grid file and tools present but nothing to redo: backing off after a failure
      return;
    }

    entry.markSynthetic(now, properties.defaultBounds(), message, sourceMtime);
    syntheticGenerator.write(paths, now);
    structuredLogger.logSyntheticWritten(key.token(), message);
  }

  private void convert(
      CacheEntry entry,
      CacheKey key,
      Path gribFile,
      ArtifactPaths paths,
      List<String> matchExpressions,
      Long sourceMtime,
      CompletableFuture<Void> handle)
      throws IOException {
    long startedAt = clock.millis();
    Throwable unexpected = null;
    structuredLogger.logConversionStarted(key.token(), gribFile.toString(), matchExpressions);

    try {
      try {
        ConversionResult result = pipeline.convert(gribFile, matchExpressions, paths);
        long now = clock.millis();
        entry.markConverted(
            now, result.bounds(), successMessage(key.variable(), result), sourceMtime);
        structuredLogger.logConversionSucceeded(
            key.token(), result.matchExpression(), now - startedAt, result.bounds().toString());
      } catch (ConversionException e) {
        long now = clock.millis();
        String detail = Diagnostics.summarize(e, properties.diagnosticMaxLength());
        entry.markConversionFailed(
            now, properties.defaultBounds(), "Pipeline error: " + detail, sourceMtime);
        structuredLogger.logConversionFailed(key.token(), now - startedAt, detail);
        syntheticGenerator.write(paths, now);
      }
    } catch (IOException | RuntimeException e) {
      unexpected = e;
      throw e;
    } finally {
      conversionRegistry.complete(key, handle, unexpected);
    }
  }

  private String successMessage(WeatherVariable variable, ConversionResult result) {
    return String.format(
        "OK: %s wgrib2 (%s) -> gdalwarp %s -> gdaldem color-relief",
        variable, result.matchExpression(), toolchainProperties.targetSrs());
  }

  private static void await(CompletableFuture<Void> handle) throws IOException {
    try {
      handle.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw e;
    }
  }

  private static Long readMtime(Path file) {
    try {
      return Files.getLastModifiedTime(file).toMillis();
    } catch (NoSuchFileException e) {
      return null;
    } catch (IOException e) {
      LOGGER.warn("Cannot stat grid file {}, treating it as missing: {}", file, e.toString());
      return null;
    }
  }
}
