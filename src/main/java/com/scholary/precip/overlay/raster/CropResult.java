package com.scholary.precip.overlay.raster;

import java.awt.image.BufferedImage;

/**
 * Outcome of a content crop.
 *
 * <p>The rectangle is inclusive and expressed in the pixel space of the original raster, whose
 * full dimensions are kept alongside so the caller can map the rectangle back to coordinates.
 *
 * @param image the cropped raster, or the original one when {@code cropped} is false
 * @param cropped whether the rectangle is smaller than the full raster
 */
public record CropResult(
    BufferedImage image,
    int minX,
    int minY,
    int maxX,
    int maxY,
    int width,
    int height,
    boolean cropped) {

  public int cropWidth() {
    return maxX - minX + 1;
  }

  public int cropHeight() {
    return maxY - minY + 1;
  }
}
