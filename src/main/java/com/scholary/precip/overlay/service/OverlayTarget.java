package com.scholary.precip.overlay.service;

import com.scholary.precip.overlay.api.WeatherVariable;
import com.scholary.precip.overlay.cache.ArtifactPaths;
import com.scholary.precip.overlay.cache.CacheKey;
import java.nio.file.Path;
import java.util.List;

/**
 * Everything one request resolves to before the orchestrator runs.
 *
 * @param hour zero-padded hour such as {@code "08"}, or null for the default grid file
 * @param gribFile source grid file, which may not exist yet
 * @param matchExpressions wgrib2 match candidates in priority order
 */
public record OverlayTarget(
    WeatherVariable variable,
    String hour,
    CacheKey key,
    Path gribFile,
    ArtifactPaths paths,
    List<String> matchExpressions) {}
