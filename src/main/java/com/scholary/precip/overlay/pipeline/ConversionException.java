package com.scholary.precip.overlay.pipeline;

/**
 * Exception thrown when a grid file could not be turned into an overlay.
 *
 * <p>This is a runtime exception because the orchestrator is the only caller that can do
 * anything about it, and what it does is degrade to a synthetic overlay and back off.
 */
public class ConversionException extends RuntimeException {

  public ConversionException(String message) {
    super(message);
  }

  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
