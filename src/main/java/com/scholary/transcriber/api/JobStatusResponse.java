package com.scholary.transcriber.api;

import com.scholary.transcriber.service.PipelineStage;
import com.scholary.transcriber.transcript.AggregatedTranscription;

/**
 * Response for job status query.
 *
 * <p>Shows the current state and pipeline stage of an async job, the result once completed and
 * the error message once failed.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    PipelineStage stage,
    AggregatedTranscription result,
    String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
