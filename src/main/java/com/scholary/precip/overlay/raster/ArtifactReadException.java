package com.scholary.precip.overlay.raster;

/**
 * Thrown when an artifact could not be read in a stable state after all retries.
 *
 * <p>Usually means another writer kept replacing the file while we were reading it, or the file
 * on disk is not a decodable PNG.
 */
public class ArtifactReadException extends RuntimeException {

  public ArtifactReadException(String message) {
    super(message);
  }

  public ArtifactReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
