package com.scholary.precip.overlay.raster;

import com.scholary.precip.overlay.config.OverlayProperties;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads and publishes PNG artifacts on the local filesystem.
 *
 * <p>Publishing always goes through a temporary file followed by an atomic rename, so readers only
 * ever see a complete old or complete new artifact. Reads still use a stability check (two size
 * samples a few milliseconds apart) because external tools such as gdaldem write their output in
 * place and we read those files straight after the process exits.
 */
@Component
public class ArtifactFiles {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactFiles.class);

  private static final long SETTLE_MILLIS = 25;

  private final int readAttempts;
  private final long retryDelayMillis;

  @Autowired
  public ArtifactFiles(OverlayProperties properties) {
    this(properties.pngReadRetries(), properties.pngReadRetryDelayMs());
  }

  public ArtifactFiles(int readAttempts, long retryDelayMillis) {
    this.readAttempts = Math.max(1, readAttempts);
    this.retryDelayMillis = retryDelayMillis;
  }

  /**
   * Read the raw bytes of an artifact once its size has stopped changing.
   *
   * @throws IOException if the file does not exist or cannot be read
   * @throws ArtifactReadException if the file kept changing or stayed empty
   */
  public byte[] readStableBytes(Path path) throws IOException {
    for (int attempt = 1; attempt <= readAttempts; attempt++) {
      byte[] bytes = readIfSettled(path, attempt);
      if (bytes != null) {
        return bytes;
      }
      pause(retryDelayMillis);
    }
    throw new ArtifactReadException(
        "Could not read a stable PNG after " + readAttempts + " attempts: " + path);
  }

  /**
   * Read and decode a PNG, retrying while it looks truncated or still being written.
   *
   * <p>Each attempt does a single size check, so a file that never settles costs {@code
   * readAttempts} pauses in total.
   *
   * @return an ARGB image
   */
  public BufferedImage readImage(Path path) throws IOException {
    Exception lastError = null;
    for (int attempt = 1; attempt <= readAttempts; attempt++) {
      byte[] bytes = readIfSettled(path, attempt);
      if (bytes == null) {
        lastError = new ArtifactReadException("PNG empty or still changing: " + path);
      } else {
        try {
          BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
          if (image != null) {
            return PixelPostProcessor.toArgb(image);
          }
          lastError = new ArtifactReadException("Unrecognised PNG content: " + path);
        } catch (IIOException e) {
          // Truncated stream, most likely caught mid-write
          lastError = e;
        }
        LOGGER.debug("Attempt {}/{}: could not decode {}", attempt, readAttempts, path);
      }
      pause(retryDelayMillis);
    }
    throw new ArtifactReadException(
        "Could not decode PNG after " + readAttempts + " attempts: " + path, lastError);
  }

  /** The file's bytes if it is non-empty and its size held across the settle pause, else null. */
  private byte[] readIfSettled(Path path, int attempt) throws IOException {
    long before = Files.size(path);
    if (before == 0) {
      LOGGER.debug("Attempt {}/{}: {} is empty", attempt, readAttempts, path);
      return null;
    }
    pause(SETTLE_MILLIS);
    long after = Files.size(path);
    if (before != after) {
      LOGGER.debug(
          "Attempt {}/{}: {} changed size ({} -> {})", attempt, readAttempts, path, before, after);
      return null;
    }
    return Files.readAllBytes(path);
  }

  /** Encode an image as PNG at the given path, replacing any existing file. */
  public void writePng(BufferedImage image, Path path) throws IOException {
    Files.createDirectories(path.toAbsolutePath().getParent());
    if (!ImageIO.write(image, "png", path.toFile())) {
      throw new IOException("No PNG writer available for " + path);
    }
  }

  /** Write the image to {@code tmpPath}, then atomically move it over {@code finalPath}. */
  public void writeAndPublish(BufferedImage image, Path tmpPath, Path finalPath)
      throws IOException {
    writePng(image, tmpPath);
    publish(tmpPath, finalPath);
  }

  /**
   * Replace {@code finalPath} with {@code tmpPath}.
   *
   * <p>Uses an atomic replacing move. Filesystems that refuse it get a delete followed by a plain
   * rename, which leaves a short window where the artifact is missing but never partial.
   */
  public void publish(Path tmpPath, Path finalPath) throws IOException {
    try {
      Files.move(
          tmpPath, finalPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      LOGGER.warn("Atomic move not supported for {}, falling back to delete and rename", finalPath);
      Files.deleteIfExists(finalPath);
      Files.move(tmpPath, finalPath);
    }
    LOGGER.debug("Published {}", finalPath);
  }

  private static void pause(long millis) throws IOException {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while waiting for artifact to settle", e);
    }
  }
}
