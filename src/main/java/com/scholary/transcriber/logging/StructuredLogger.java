package com.scholary.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Puts event fields into the MDC for the duration of one log call so they can be queried in a
 * log search tool. The task id is set once per task with {@link #setTaskContext(String)}.
 */
public class StructuredLogger {

  public static final String TASK_ID = "taskId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a stage transition. */
  public void logStageEntered(String stage) {
    try {
      MDC.put("event_type", "stage_entered");
      MDC.put("stage", stage);

      logger.info("Stage entered: {}", stage);
    } finally {
      clearEventFields();
    }
  }

  /** Log segment started event. */
  public void logSegmentStarted(int segmentIndex, int totalSegments, int startSecond, int durationSeconds) {
    try {
      MDC.put("event_type", "segment_started");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("startSecond", String.valueOf(startSecond));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));

      logger.info(
          "Segment started: index={}/{}, start={}s, duration={}s",
          segmentIndex + 1,
          totalSegments,
          startSecond,
          durationSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log segment finished event. */
  public void logSegmentFinished(int segmentIndex, int totalSegments, long transcribeMs) {
    try {
      MDC.put("event_type", "segment_finished");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.info(
          "Segment finished: index={}/{}, transcribe={}ms",
          segmentIndex + 1,
          totalSegments,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log task completion. */
  public void logTaskCompleted(int segments, int transcriptChars, long elapsedMs) {
    try {
      MDC.put("event_type", "task_completed");

      logger.info(
          "Task completed: segments={}, chars={}, elapsed={}ms",
          segments,
          transcriptChars,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log task failure. */
  public void logTaskFailed(String stage, String errorType, String message) {
    try {
      MDC.put("event_type", "task_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", errorType);

      logger.error("Task failed: stage={}, error={}, message={}", stage, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set task context in MDC. */
  public static void setTaskContext(String taskId) {
    MDC.put(TASK_ID, taskId);
  }

  /** Clear task context from MDC. */
  public static void clearTaskContext() {
    MDC.remove(TASK_ID);
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("segment_index");
    MDC.remove("startSecond");
    MDC.remove("durationSeconds");
    MDC.remove("transcribeMs");
    MDC.remove("errorType");
  }
}
