package com.scholary.precip.overlay.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log conversion lifecycle events with structured fields that the log
 * pipeline can index.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log conversion started event. */
  public void logConversionStarted(String cacheKey, String gribFile, List<String> candidates) {
    try {
      MDC.put("event_type", "conversion_started");
      MDC.put("cache_key", cacheKey);
      MDC.put("gribFile", gribFile);
      MDC.put("candidates", String.join(",", candidates));

      logger.info(
          "Conversion started: key={}, gribFile={}, candidates={}", cacheKey, gribFile, candidates);
    } finally {
      clearEventFields();
    }
  }

  /** Log match-expression candidate failure. */
  public void logCandidateFailed(
      String matchExpr, int attempt, int totalCandidates, String errorType, String message) {
    try {
      MDC.put("event_type", "candidate_failed");
      MDC.put("match_expr", matchExpr);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("totalCandidates", String.valueOf(totalCandidates));
      MDC.put("errorType", errorType);

      logger.warn(
          "Candidate failed: match={}, attempt={}/{}, error={}, message={}",
          matchExpr,
          attempt,
          totalCandidates,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log conversion success event. */
  public void logConversionSucceeded(
      String cacheKey, String matchExpr, long durationMs, String bounds) {
    try {
      MDC.put("event_type", "conversion_succeeded");
      MDC.put("cache_key", cacheKey);
      MDC.put("match_expr", matchExpr);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Conversion succeeded: key={}, match={}, duration={}ms, bounds={}",
          cacheKey,
          matchExpr,
          durationMs,
          bounds);
    } finally {
      clearEventFields();
    }
  }

  /** Log conversion failure event. */
  public void logConversionFailed(String cacheKey, long durationMs, String message) {
    try {
      MDC.put("event_type", "conversion_failed");
      MDC.put("cache_key", cacheKey);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.error(
          "Conversion failed: key={}, duration={}ms, message={}", cacheKey, durationMs, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log synthetic artifact written. */
  public void logSyntheticWritten(String cacheKey, String reason) {
    try {
      MDC.put("event_type", "synthetic_written");
      MDC.put("cache_key", cacheKey);
      MDC.put("reason", reason);

      logger.info("Synthetic overlay written: key={}, reason={}", cacheKey, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String cacheKey, String variable, String hour) {
    MDC.put("cacheKey", cacheKey);
    MDC.put("variable", variable);
    MDC.put("hour", hour == null ? "default" : hour);
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("cacheKey");
    MDC.remove("variable");
    MDC.remove("hour");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("cache_key");
    MDC.remove("gribFile");
    MDC.remove("candidates");
    MDC.remove("match_expr");
    MDC.remove("attempt");
    MDC.remove("totalCandidates");
    MDC.remove("errorType");
    MDC.remove("durationMs");
    MDC.remove("reason");
  }
}
