package com.scholary.precip.overlay.synthetic;

import com.scholary.precip.overlay.cache.ArtifactPaths;
import com.scholary.precip.overlay.raster.ArtifactFiles;
import java.awt.image.BufferedImage;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Procedural placeholder overlay used when no real render is possible.
 *
 * <p>Three Gaussian cells at fixed positions plus a sinusoidal ripple whose phase follows the
 * seed, coloured with a black-red-yellow-white ramp. The same seed always gives the same pixels.
 * The result makes it obvious on the map that something is being drawn without pretending to be
 * data, and it is always placed on the default region bounds.
 */
@Component
public class SyntheticOverlayGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyntheticOverlayGenerator.class);

  static final int SIZE = 512;

  private final ArtifactFiles artifactFiles;

  public SyntheticOverlayGenerator(ArtifactFiles artifactFiles) {
    this.artifactFiles = artifactFiles;
  }

  /**
   * Render and atomically publish a synthetic overlay.
   *
   * @param seed phase of the ripple, normally the entry's new {@code updatedAt}
   */
  public void write(ArtifactPaths paths, long seed) throws IOException {
    artifactFiles.writeAndPublish(render(seed), paths.syntheticTmpPng(), paths.overlayPng());
    LOGGER.debug("Wrote synthetic overlay {} (seed={})", paths.overlayPng(), seed);
  }

  public BufferedImage render(long seed) {
    BufferedImage image = new BufferedImage(SIZE, SIZE, BufferedImage.TYPE_INT_ARGB);
    double phase = seed * 0.001;

    for (int y = 0; y < SIZE; y++) {
      for (int x = 0; x < SIZE; x++) {
        double nx = x / (double) (SIZE - 1);
        double ny = y / (double) (SIZE - 1);

        double cells =
            clamp(
                1.2 * gaussian(nx, ny, 0.55, 0.45, 0.02)
                    + 0.8 * gaussian(nx, ny, 0.25, 0.7, 0.015)
                    + 0.6 * gaussian(nx, ny, 0.8, 0.2, 0.01));
        double wave = 0.15 * Math.sin(10 * nx + phase) * Math.cos(8 * ny - phase);
        double intensity = clamp(cells + wave);

        int r = channel(intensity * 1.2);
        int g = channel(Math.max(0, intensity - 0.25) * 1.3);
        int b = channel(Math.max(0, intensity - 0.55) * 1.5);
        int a = (int) Math.round(220 * intensity);

        image.setRGB(x, y, (a << 24) | (r << 16) | (g << 8) | b);
      }
    }
    return image;
  }

  private static double gaussian(double nx, double ny, double cx, double cy, double spread) {
    double dx = nx - cx;
    double dy = ny - cy;
    return Math.exp(-(dx * dx + dy * dy) / spread);
  }

  private static int channel(double value) {
    return (int) Math.round(255 * clamp(value));
  }

  private static double clamp(double value) {
    return Math.max(0, Math.min(1, value));
  }
}
