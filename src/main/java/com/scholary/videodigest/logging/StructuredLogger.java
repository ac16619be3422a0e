package com.scholary.videodigest.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts the event's fields into the MDC for the duration of one log call, so they
 * show up as separate fields in the log pattern or a JSON encoder.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a cache hit for a stored result. */
  public void logCacheHit(String videoId, String category, String language) {
    try {
      MDC.put("event_type", "cache_hit");
      MDC.put("category", category);

      logger.debug("Cache hit: video={}, category={}, language={}", videoId, category, language);
    } finally {
      clearEventFields();
    }
  }

  /** Log a cache miss that will trigger a fetch or a generation call. */
  public void logCacheMiss(String videoId, String category, String language) {
    try {
      MDC.put("event_type", "cache_miss");
      MDC.put("category", category);

      logger.info("Cache miss: video={}, category={}, language={}", videoId, category, language);
    } finally {
      clearEventFields();
    }
  }

  /** Log a streamed result written to the store. */
  public void logResultCommitted(List<String> keyPath, int characters) {
    try {
      MDC.put("event_type", "result_committed");
      MDC.put("keyPath", String.join("/", keyPath));
      MDC.put("characters", String.valueOf(characters));

      logger.info("Result committed: keyPath={}, characters={}", keyPath, characters);
    } finally {
      clearEventFields();
    }
  }

  /** Log a streamed result that was intentionally not stored. */
  public void logCommitSkipped(List<String> keyPath, int characters) {
    try {
      MDC.put("event_type", "commit_skipped");
      MDC.put("keyPath", String.join("/", keyPath));
      MDC.put("characters", String.valueOf(characters));

      logger.debug("Commit skipped: keyPath={}, characters={}", keyPath, characters);
    } finally {
      clearEventFields();
    }
  }

  /** Log one attempt of the structured output repair pipeline. */
  public void logRepairAttempt(String step, int attempt, boolean success) {
    try {
      MDC.put("event_type", "repair_attempt");
      MDC.put("step", step);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("success", String.valueOf(success));

      logger.debug("Repair attempt: step={}, attempt={}, success={}", step, attempt, success);
    } finally {
      clearEventFields();
    }
  }

  /** Log a monitored source that was polled. */
  public void logSourceChecked(String sourceId, int latestItems, int newItems) {
    try {
      MDC.put("event_type", "source_checked");
      MDC.put("sourceId", sourceId);
      MDC.put("latestItems", String.valueOf(latestItems));
      MDC.put("newItems", String.valueOf(newItems));

      logger.info(
          "Source checked: source={}, latest={}, new={}", sourceId, latestItems, newItems);
    } finally {
      clearEventFields();
    }
  }

  /** Log an item the monitor could not process. */
  public void logItemSkipped(String sourceId, String videoId, String errorType, String message) {
    try {
      MDC.put("event_type", "item_skipped");
      MDC.put("sourceId", sourceId);
      MDC.put("itemId", videoId);
      MDC.put("errorType", errorType);

      logger.warn(
          "Item skipped: source={}, video={}, error={}, message={}",
          sourceId,
          videoId,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log an item the monitor analyzed. */
  public void logItemProcessed(String sourceId, String videoId, boolean ratingStored) {
    try {
      MDC.put("event_type", "item_processed");
      MDC.put("sourceId", sourceId);
      MDC.put("itemId", videoId);
      MDC.put("ratingStored", String.valueOf(ratingStored));

      logger.info(
          "Item processed: source={}, video={}, ratingStored={}", sourceId, videoId, ratingStored);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setVideoContext(String videoId, String language) {
    MDC.put("videoId", videoId);
    if (language != null) {
      MDC.put("language", language);
    }
  }

  /** Clear request context from MDC. */
  public static void clearVideoContext() {
    MDC.remove("videoId");
    MDC.remove("language");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("category");
    MDC.remove("keyPath");
    MDC.remove("characters");
    MDC.remove("step");
    MDC.remove("attempt");
    MDC.remove("success");
    MDC.remove("sourceId");
    MDC.remove("latestItems");
    MDC.remove("newItems");
    MDC.remove("errorType");
    MDC.remove("itemId");
    MDC.remove("ratingStored");
  }
}
