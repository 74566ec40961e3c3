package com.scholary.precip.overlay.pipeline;

import com.scholary.precip.overlay.toolchain.ToolchainException;

/** Turns failures into one-line status messages short enough for the UI. */
public final class Diagnostics {

  private Diagnostics() {}

  /**
   * Summarize a failure: tool stderr or stdout when there is some, else the message, with
   * whitespace runs collapsed and the result cut to {@code maxLength} characters.
   */
  public static String summarize(Throwable error, int maxLength) {
    String text;
    if (error == null) {
      text = "Unknown error";
    } else if (error instanceof ToolchainException) {
      text = ((ToolchainException) error).details();
    } else if (error.getMessage() != null && !error.getMessage().isBlank()) {
      text = error.getMessage();
    } else {
      text = error.toString();
    }
    return truncate(text.replaceAll("\\s+", " ").trim(), maxLength);
  }

  static String truncate(String text, int maxLength) {
    return text.length() <= maxLength ? text : text.substring(0, maxLength);
  }
}
