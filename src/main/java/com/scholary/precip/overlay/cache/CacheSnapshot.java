package com.scholary.precip.overlay.cache;

import com.scholary.precip.overlay.geo.GeoBounds;

/** Immutable copy of a {@link CacheEntry}, taken under its lock. */
public record CacheSnapshot(
    long updatedAt,
    GeoBounds bounds,
    OverlaySource source,
    String message,
    Long sourceMtime,
    Boolean pipelineAvailable,
    long lastErrorAt) {}
