package com.scholary.precip.overlay.geo;

import org.springframework.stereotype.Component;

/**
 * Turns a pixel crop rectangle into a latitude/longitude bounding box.
 *
 * <p>The reprojection target is configurable, so the raster may come back in degrees (EPSG:4326)
 * or in Web Mercator metres (EPSG:3857). gdalinfo's CRS reporting proved unreliable for the
 * netCDF intermediates, so we classify by magnitude instead:
 *
 * <ul>
 *   <li>geographic when {@code |originX| <= 360}, {@code |originY| <= 180} and both pixel sizes
 *       are non-zero and at most 5 in absolute value
 *   <li>spherical Mercator otherwise, inverted with R = 6378137
 * </ul>
 *
 * <p>Rotation terms are ignored; gdalwarp output is north-up.
 */
@Component
public class GeoBoundsResolver {

  static final double EARTH_RADIUS_METERS = 6378137.0;

  /**
   * Resolve the bounds of an inclusive pixel rectangle.
   *
   * @param transform the raster's affine transform
   * @param minCol leftmost column kept
   * @param minRow top row kept
   * @param maxCol rightmost column kept
   * @param maxRow bottom row kept
   */
  public GeoBounds resolve(
      GeoTransform transform, int minCol, int minRow, int maxCol, int maxRow) {
    double x0 = transform.originX();
    double y0 = transform.originY();
    double pxW = transform.pixelWidth();
    double pxH = transform.pixelHeight();

    double minX = x0 + minCol * pxW;
    double maxX = x0 + (maxCol + 1) * pxW;
    // pxH < 0 for north-up rasters, so the top row gives the larger Y
    double maxY = y0 + minRow * pxH;
    double minY = y0 + (maxRow + 1) * pxH;

    if (looksGeographic(transform)) {
      return new GeoBounds(
          Math.min(minY, maxY), Math.min(minX, maxX), Math.max(minY, maxY), Math.max(minX, maxX));
    }

    double[] lowerLeft = mercatorToLonLat(minX, minY);
    double[] upperRight = mercatorToLonLat(maxX, maxY);
    return new GeoBounds(
        Math.min(lowerLeft[1], upperRight[1]),
        Math.min(lowerLeft[0], upperRight[0]),
        Math.max(lowerLeft[1], upperRight[1]),
        Math.max(lowerLeft[0], upperRight[0]));
  }

  /** Magnitude heuristic separating degree grids from metre grids. */
  public static boolean looksGeographic(GeoTransform transform) {
    double pxW = Math.abs(transform.pixelWidth());
    double pxH = Math.abs(transform.pixelHeight());
    return Math.abs(transform.originX()) <= 360
        && Math.abs(transform.originY()) <= 180
        && pxW > 0
        && pxW <= 5
        && pxH > 0
        && pxH <= 5;
  }

  /**
   * Inverse spherical Mercator.
   *
   * @return {@code [lon, lat]} in degrees
   */
  static double[] mercatorToLonLat(double x, double y) {
    double lon = Math.toDegrees(x / EARTH_RADIUS_METERS);
    double lat = Math.toDegrees(2 * Math.atan(Math.exp(y / EARTH_RADIUS_METERS)) - Math.PI / 2);
    return new double[] {lon, lat};
  }
}
