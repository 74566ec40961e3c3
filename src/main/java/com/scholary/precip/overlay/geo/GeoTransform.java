package com.scholary.precip.overlay.geo;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * GDAL-style affine geotransform: {@code X = originX + col * pixelWidth + row * rowRotation} and
 * {@code Y = originY + col * columnRotation + row * pixelHeight}.
 *
 * <p>Pixel height is negative for north-up rasters.
 */
public record GeoTransform(
    double originX,
    double pixelWidth,
    double rowRotation,
    double originY,
    double columnRotation,
    double pixelHeight) {

  /**
   * Read the {@code geoTransform} array from {@code gdalinfo -json} output.
   *
   * @return the transform, or empty when the array is missing, short, or not numeric
   */
  public static Optional<GeoTransform> fromGdalInfo(JsonNode info) {
    JsonNode gt = info == null ? null : info.get("geoTransform");
    if (gt == null || !gt.isArray() || gt.size() < 6) {
      return Optional.empty();
    }
    for (int i = 0; i < 6; i++) {
      if (!gt.get(i).isNumber()) {
        return Optional.empty();
      }
    }
    return Optional.of(
        new GeoTransform(
            gt.get(0).asDouble(),
            gt.get(1).asDouble(),
            gt.get(2).asDouble(),
            gt.get(3).asDouble(),
            gt.get(4).asDouble(),
            gt.get(5).asDouble()));
  }
}
