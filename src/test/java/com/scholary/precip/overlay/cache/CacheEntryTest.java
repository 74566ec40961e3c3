package com.scholary.precip.overlay.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.precip.overlay.api.WeatherVariable;
import com.scholary.precip.overlay.geo.GeoBounds;
import com.scholary.precip.overlay.support.TestProperties;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class CacheEntryTest {

  @Test
  void empty_shouldStartAsNeverWrittenSynthetic() {
    CacheSnapshot snapshot = CacheEntry.empty(TestProperties.DEFAULT_BOUNDS).snapshot();

    assertThat(snapshot.updatedAt()).isZero();
    assertThat(snapshot.source()).isEqualTo(OverlaySource.SYNTHETIC);
    assertThat(snapshot.message()).isEqualTo("synthetic");
    assertThat(snapshot.sourceMtime()).isNull();
    assertThat(snapshot.pipelineAvailable()).isNull();
    assertThat(snapshot.lastErrorAt()).isZero();
    assertThat(snapshot.bounds()).isEqualTo(TestProperties.DEFAULT_BOUNDS);
  }

  @Test
  void recordProbe_shouldOnlyFlagTransitionFromUnavailable() {
    CacheEntry entry = CacheEntry.empty(TestProperties.DEFAULT_BOUNDS);

    assertThat(entry.recordProbe(true)).isFalse();
    assertThat(entry.recordProbe(false)).isFalse();
    assertThat(entry.recordProbe(true)).isTrue();
    assertThat(entry.recordProbe(true)).isFalse();
  }

  @Test
  void markConverted_shouldClearPreviousError() {
    CacheEntry entry = CacheEntry.empty(TestProperties.DEFAULT_BOUNDS);
    GeoBounds bounds = new GeoBounds(49, -4.5, 51, -2.5);

    entry.markConversionFailed(1_000, TestProperties.DEFAULT_BOUNDS, "Pipeline error: x", 5L);
    assertThat(entry.getLastErrorAt()).isEqualTo(1_000);

    entry.markConverted(2_000, bounds, "OK", 5L);
    CacheSnapshot snapshot = entry.snapshot();
    assertThat(snapshot.lastErrorAt()).isZero();
    assertThat(snapshot.source()).isEqualTo(OverlaySource.TOOLCHAIN);
    assertThat(snapshot.bounds()).isEqualTo(bounds);
  }

  @Test
  void store_shouldReturnSameEntryPerKey() {
    OverlayCacheStore store = new OverlayCacheStore(TestProperties.DEFAULT_BOUNDS);
    CacheKey key = CacheKey.of(WeatherVariable.RPRATE, "08");

    assertThat(store.entryFor(key)).isSameAs(store.entryFor(key));
    assertThat(store.entryFor(CacheKey.of(WeatherVariable.RPRATE, "09")))
        .isNotSameAs(store.entryFor(key));
    assertThat(store.snapshotAll()).containsOnlyKeys("RPRATE_08H", "RPRATE_09H");
  }

  @Test
  void registry_shouldRejectSecondRegistrationAndReleaseOnCompletion() {
    ConversionRegistry registry = new ConversionRegistry();
    CacheKey key = CacheKey.of(WeatherVariable.CAPE, null);

    CompletableFuture<Void> handle = registry.register(key);
    assertThat(registry.find(key)).contains(handle);
    assertThatThrownBy(() -> registry.register(key))
        .isInstanceOf(IllegalStateException.class);

    registry.complete(key, handle, null);
    assertThat(handle).isCompleted();
    assertThat(registry.find(key)).isEmpty();
    assertThat(registry.inFlightCount()).isZero();
  }
}
