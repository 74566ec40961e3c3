package com.scholary.precip.overlay.cache;

import com.scholary.precip.overlay.geo.GeoBounds;

/**
 * Mutable state of one overlay.
 *
 * <p>Created on first access and kept for the life of the process. All access is synchronized on
 * the entry itself; the orchestrator also holds this monitor across its decide-and-register step
 * so that deciding to regenerate and claiming the key happen atomically.
 *
 * <p>Timestamps are epoch milliseconds. {@code updatedAt == 0} means nothing was ever written and
 * {@code lastErrorAt == 0} means the last attempt did not fail.
 */
public class CacheEntry {

  private long updatedAt;
  private GeoBounds bounds;
  private OverlaySource source;
  private String message;
  private Long sourceMtime;
  private Boolean pipelineAvailable;
  private long lastErrorAt;

  private CacheEntry(GeoBounds defaultBounds) {
    this.updatedAt = 0;
    this.bounds = defaultBounds;
    this.source = OverlaySource.SYNTHETIC;
    this.message = "synthetic";
    this.sourceMtime = null;
    this.pipelineAvailable = null;
    this.lastErrorAt = 0;
  }

  public static CacheEntry empty(GeoBounds defaultBounds) {
    return new CacheEntry(defaultBounds);
  }

  /**
   * Record a probe result.
   *
   * @return true when the toolchain was unavailable at the previous probe and is available now
   */
  public synchronized boolean recordProbe(boolean available) {
    boolean justBecameAvailable = available && Boolean.FALSE.equals(pipelineAvailable);
    pipelineAvailable = available;
    return justBecameAvailable;
  }

  public synchronized void markConverted(
      long now, GeoBounds bounds, String message, Long sourceMtime) {
    this.updatedAt = now;
    this.bounds = bounds;
    this.source = OverlaySource.TOOLCHAIN;
    this.message = message;
    this.sourceMtime = sourceMtime;
    this.lastErrorAt = 0;
  }

  /** A conversion attempt failed and a synthetic overlay replaced the artifact. */
  public synchronized void markConversionFailed(
      long now, GeoBounds defaultBounds, String message, Long sourceMtime) {
    this.updatedAt = now;
    this.bounds = defaultBounds;
    this.source = OverlaySource.SYNTHETIC;
    this.message = message;
    this.sourceMtime = sourceMtime;
    this.lastErrorAt = now;
  }

  /** A synthetic overlay was written without attempting a conversion. */
  public synchronized void markSynthetic(
      long now, GeoBounds defaultBounds, String message, Long sourceMtime) {
    this.updatedAt = now;
    this.bounds = defaultBounds;
    this.source = OverlaySource.SYNTHETIC;
    this.message = message;
    this.sourceMtime = sourceMtime;
  }

  public synchronized long getUpdatedAt() {
    return updatedAt;
  }

  public synchronized OverlaySource getSource() {
    return source;
  }

  public synchronized Long getSourceMtime() {
    return sourceMtime;
  }

  public synchronized long getLastErrorAt() {
    return lastErrorAt;
  }

  public synchronized CacheSnapshot snapshot() {
    return new CacheSnapshot(
        updatedAt, bounds, source, message, sourceMtime, pipelineAvailable, lastErrorAt);
  }
}
