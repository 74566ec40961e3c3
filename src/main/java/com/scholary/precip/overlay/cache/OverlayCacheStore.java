package com.scholary.precip.overlay.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.precip.overlay.config.OverlayProperties;
import com.scholary.precip.overlay.geo.GeoBounds;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-wide store of overlay cache entries, backed by Caffeine.
 *
 * <p>No size or time bound: keys come from the small fixed variable x hour domain and an entry
 * holds only a few fields, so every entry lives for the whole process. Tests build their own
 * store instance.
 */
@Component
public class OverlayCacheStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(OverlayCacheStore.class);

  private final Cache<CacheKey, CacheEntry> cache;
  private final GeoBounds defaultBounds;

  @Autowired
  public OverlayCacheStore(OverlayProperties properties) {
    this(properties.defaultBounds());
  }

  public OverlayCacheStore(GeoBounds defaultBounds) {
    this.defaultBounds = defaultBounds;
    this.cache = Caffeine.newBuilder().build();
  }

  /** Get the entry for a key, creating an empty one on first access. */
  public CacheEntry entryFor(CacheKey key) {
    return cache.get(
        key,
        k -> {
          LOGGER.debug("Created cache entry: key={}", k);
          return CacheEntry.empty(defaultBounds);
        });
  }

  /** Snapshots of every entry, ordered by key token. */
  public Map<String, CacheSnapshot> snapshotAll() {
    Map<String, CacheSnapshot> snapshots = new TreeMap<>();
    cache.asMap().forEach((key, entry) -> snapshots.put(key.token(), entry.snapshot()));
    return snapshots;
  }
}
