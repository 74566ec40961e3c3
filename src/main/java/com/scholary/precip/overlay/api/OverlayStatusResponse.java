package com.scholary.precip.overlay.api;

import com.scholary.precip.overlay.cache.CacheSnapshot;
import java.util.List;
import java.util.Map;

/**
 * Response for the cache status query.
 *
 * @param entries cache entries keyed by token, e.g. {@code RPRATE_08H}
 * @param toolchainAvailable latest probe result, null before the first request
 */
public record OverlayStatusResponse(
    Map<String, CacheSnapshot> entries, Boolean toolchainAvailable, List<String> missingTools) {}
