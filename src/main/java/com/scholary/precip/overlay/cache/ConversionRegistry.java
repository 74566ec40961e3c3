package com.scholary.precip.overlay.cache;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * Single-flight registry of running conversions, one handle per cache key.
 *
 * <p>A caller that finds a handle waits on it instead of starting a second conversion. The
 * handle completes after the owner has updated the cache entry, so waiters read the outcome of
 * that conversion and nothing older.
 */
@Component
public class ConversionRegistry {

  private final ConcurrentMap<CacheKey, CompletableFuture<Void>> inFlight =
      new ConcurrentHashMap<>();

  public Optional<CompletableFuture<Void>> find(CacheKey key) {
    return Optional.ofNullable(inFlight.get(key));
  }

  /**
   * Claim a key.
   *
   * @return the new handle, to be passed back to {@link #complete}
   * @throws IllegalStateException if a conversion is already registered for the key
   */
  public CompletableFuture<Void> register(CacheKey key) {
    CompletableFuture<Void> handle = new CompletableFuture<>();
    CompletableFuture<Void> existing = inFlight.putIfAbsent(key, handle);
    if (existing != null) {
      throw new IllegalStateException("Conversion already in flight for " + key);
    }
    return handle;
  }

  /**
   * Release a key and wake up its waiters.
   *
   * @param error the unexpected failure of the owner, or null when it finished normally
   */
  public void complete(CacheKey key, CompletableFuture<Void> handle, Throwable error) {
    inFlight.remove(key, handle);
    if (error == null) {
      handle.complete(null);
    } else {
      handle.completeExceptionally(error);
    }
  }

  public int inFlightCount() {
    return inFlight.size();
  }
}
