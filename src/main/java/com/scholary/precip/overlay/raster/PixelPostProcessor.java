package com.scholary.precip.overlay.raster;

import com.scholary.precip.overlay.config.OverlayProperties;
import java.awt.image.BufferedImage;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Pure raster operations applied to a colour-relief render before it is published.
 *
 * <p>Reprojection fills the area outside the source grid with a flat colour. gdaldem then paints
 * that fill with whatever palette entry it maps to, so the map would show a solid frame around the
 * data. We detect that colour on the edges of the raster and make every pixel close to it
 * transparent, then crop away the transparent margin so the overlay bounds hug the actual data.
 *
 * <p>All operations expect non-premultiplied ARGB images; use {@link #toArgb(BufferedImage)} on
 * anything decoded from disk.
 */
@Component
public class PixelPostProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(PixelPostProcessor.class);

  private final int colorTolerance;
  private final int alphaThreshold;

  @Autowired
  public PixelPostProcessor(OverlayProperties properties) {
    this(properties.borderColorTolerance(), properties.cropAlphaThreshold());
  }

  public PixelPostProcessor(int colorTolerance, int alphaThreshold) {
    this.colorTolerance = colorTolerance;
    this.alphaThreshold = alphaThreshold;
  }

  /**
   * Return an ARGB copy of the image, or the image itself when it already is one.
   *
   * <p>PNGs without an alpha channel decode to RGB rasters where alpha cannot be cleared.
   */
  public static BufferedImage toArgb(BufferedImage source) {
    if (source.getType() == BufferedImage.TYPE_INT_ARGB) {
      return source;
    }
    BufferedImage argb =
        new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
    for (int y = 0; y < source.getHeight(); y++) {
      for (int x = 0; x < source.getWidth(); x++) {
        argb.setRGB(x, y, source.getRGB(x, y));
      }
    }
    return argb;
  }

  /**
   * Find the dominant opaque border colour and make every pixel within tolerance of it
   * transparent, wherever it sits in the raster.
   *
   * <p>Edge pixels are sampled row by row (top, bottom) then column by column (left, right); the
   * most frequent exact RGB wins, ties going to the colour seen first.
   *
   * @param image ARGB raster, modified in place
   * @return the number of pixels made transparent
   */
  public int makeDominantBorderColorTransparent(BufferedImage image) {
    int width = image.getWidth();
    int height = image.getHeight();
    if (width == 0 || height == 0) {
      return 0;
    }

    // Insertion order gives first-seen tie breaking
    Map<Integer, Integer> counts = new LinkedHashMap<>();
    for (int x = 0; x < width; x++) {
      sampleEdgePixel(image, x, 0, counts);
      sampleEdgePixel(image, x, height - 1, counts);
    }
    for (int y = 0; y < height; y++) {
      sampleEdgePixel(image, 0, y, counts);
      sampleEdgePixel(image, width - 1, y, counts);
    }

    Integer background = null;
    int backgroundCount = -1;
    for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > backgroundCount) {
        background = entry.getKey();
        backgroundCount = entry.getValue();
      }
    }
    if (background == null) {
      LOGGER.debug("No opaque border pixel, nothing to clear");
      return 0;
    }

    int bgR = (background >> 16) & 0xFF;
    int bgG = (background >> 8) & 0xFF;
    int bgB = background & 0xFF;

    int cleared = 0;
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int argb = image.getRGB(x, y);
        if ((argb >>> 24) == 0) {
          continue;
        }
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;
        if (Math.abs(r - bgR) <= colorTolerance
            && Math.abs(g - bgG) <= colorTolerance
            && Math.abs(b - bgB) <= colorTolerance) {
          image.setRGB(x, y, argb & 0x00FFFFFF);
          cleared++;
        }
      }
    }

    LOGGER.debug(
        "Border colour #{} ({} edge samples), cleared {} pixels",
        String.format("%06x", background),
        backgroundCount,
        cleared);
    return cleared;
  }

  private static void sampleEdgePixel(
      BufferedImage image, int x, int y, Map<Integer, Integer> counts) {
    int argb = image.getRGB(x, y);
    if ((argb >>> 24) == 0) {
      return;
    }
    counts.merge(argb & 0x00FFFFFF, 1, Integer::sum);
  }

  /**
   * Crop the raster to the smallest rectangle holding every pixel whose alpha reaches the
   * threshold.
   *
   * @param image ARGB raster, left untouched
   * @return the crop, or empty when no pixel qualifies
   */
  public Optional<CropResult> cropToContent(BufferedImage image) {
    int width = image.getWidth();
    int height = image.getHeight();

    int minX = width;
    int minY = height;
    int maxX = -1;
    int maxY = -1;

    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int alpha = image.getRGB(x, y) >>> 24;
        if (alpha >= alphaThreshold) {
          minX = Math.min(minX, x);
          minY = Math.min(minY, y);
          maxX = Math.max(maxX, x);
          maxY = Math.max(maxY, y);
        }
      }
    }

    if (maxX < minX || maxY < minY) {
      return Optional.empty();
    }

    int cropWidth = maxX - minX + 1;
    int cropHeight = maxY - minY + 1;
    if (cropWidth == width && cropHeight == height) {
      return Optional.of(new CropResult(image, minX, minY, maxX, maxY, width, height, false));
    }

    BufferedImage cropped = new BufferedImage(cropWidth, cropHeight, BufferedImage.TYPE_INT_ARGB);
    for (int y = 0; y < cropHeight; y++) {
      for (int x = 0; x < cropWidth; x++) {
        cropped.setRGB(x, y, image.getRGB(minX + x, minY + y));
      }
    }

    LOGGER.debug(
        "Cropped {}x{} to [{},{}]-[{},{}]", width, height, minX, minY, maxX, maxY);
    return Optional.of(new CropResult(cropped, minX, minY, maxX, maxY, width, height, true));
  }
}
