package com.scholary.transcriber.job;

import com.scholary.transcriber.api.JobStatusResponse.Status;
import com.scholary.transcriber.service.PipelineStage;
import com.scholary.transcriber.service.TranscriptionTaskHandle;
import com.scholary.transcriber.transcript.AggregatedTranscription;
import java.time.Instant;

/**
 * Represents an async transcription job.
 *
 * <p>Tracks the job's state and result. The current pipeline stage is read live from the task
 * handle. Stored in memory using Caffeine cache.
 */
public class TranscriptionJob {

  private final String jobId;
  private final TranscriptionTaskHandle handle;
  private final Instant createdAt;

  private volatile Status status;
  private volatile AggregatedTranscription result;
  private volatile String error;

  public TranscriptionJob(String jobId, TranscriptionTaskHandle handle, Instant createdAt) {
    this.jobId = jobId;
    this.handle = handle;
    this.createdAt = createdAt;
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public TranscriptionTaskHandle getHandle() {
    return handle;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public PipelineStage getStage() {
    return handle.stage();
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public boolean isFinished() {
    return status == Status.COMPLETED || status == Status.FAILED;
  }

  public AggregatedTranscription getResult() {
    return result;
  }

  public void setResult(AggregatedTranscription result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
