package com.scholary.transcriber.service;

/**
 * Stages a task moves through, in order.
 *
 * <p>EXTRACTING_SEGMENT and TRANSCRIBING repeat once per segment. ARCHIVING and PERSISTING are
 * skipped when their collaborator is not configured. Any stage can end in FAILED.
 */
public enum PipelineStage {
  PENDING,
  DOWNLOADING,
  RESAMPLING,
  CHUNKING,
  EXTRACTING_SEGMENT,
  TRANSCRIBING,
  AGGREGATING,
  ARCHIVING,
  PERSISTING,
  NOTIFYING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
