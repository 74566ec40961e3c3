package com.scholary.precip.overlay.cache;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Files produced for one cache key.
 *
 * <p>The netCDF and GeoTIFF intermediates are working files, overwritten on each attempt. Only
 * {@code overlayPng} is served; {@code overlayTmpPng} is where gdaldem renders before the result
 * is moved over it. Synthetic overlays are staged in {@code syntheticTmpPng} so a placeholder
 * written while a conversion is running never touches the conversion's render.
 */
public record ArtifactPaths(
    Path extractedGrid,
    Path reprojectedRaster,
    Path overlayPng,
    Path overlayTmpPng,
    Path syntheticTmpPng) {

  public static ArtifactPaths forKey(Path cacheDir, CacheKey key) {
    String v = CacheKey.sanitize(key.variable().name().toLowerCase(Locale.ROOT));
    String k = CacheKey.sanitize(key.timeSlot());
    String base = v + "_" + k;
    return new ArtifactPaths(
        cacheDir.resolve(base + ".nc"),
        cacheDir.resolve(base + "_3857.tif"),
        cacheDir.resolve(base + "_color.png"),
        cacheDir.resolve(base + "_color.tmp.png"),
        cacheDir.resolve(base + "_color.synthetic.tmp.png"));
  }
}
