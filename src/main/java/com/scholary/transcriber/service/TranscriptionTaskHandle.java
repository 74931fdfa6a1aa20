package com.scholary.transcriber.service;

import com.scholary.transcriber.transcript.AggregatedTranscription;
import java.util.List;

/**
 * A transcription waiting for its id.
 *
 * <p>{@link #run(String)} executes the whole pipeline on the calling thread. When it throws, the
 * caller is expected to hand the error message to {@link #onFailure(String, String)} once.
 */
public class TranscriptionTaskHandle {

  private final TranscriptionPipeline pipeline;
  private final String audioUrl;
  private final List<String> recipients;
  private final List<String> keywords;
  private final CancellationToken token = new CancellationToken();

  private volatile PipelineStage stage = PipelineStage.PENDING;

  TranscriptionTaskHandle(
      TranscriptionPipeline pipeline,
      String audioUrl,
      List<String> recipients,
      List<String> keywords) {
    this.pipeline = pipeline;
    this.audioUrl = audioUrl;
    this.recipients = recipients == null ? List.of() : List.copyOf(recipients);
    this.keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }

  /**
   * @throws TaskFailedException if any stage fails
   */
  public AggregatedTranscription run(String taskId) {
    return pipeline.execute(task(taskId), token, next -> stage = next);
  }

  /** Best-effort failure email. Never throws. */
  public void onFailure(String taskId, String errorMessage) {
    pipeline.reportFailure(task(taskId), errorMessage);
  }

  /** Ask the task to stop at its next stage boundary. */
  public void cancel() {
    token.cancel();
  }

  public boolean isCancelled() {
    return token.isCancelled();
  }

  public PipelineStage stage() {
    return stage;
  }

  public String audioUrl() {
    return audioUrl;
  }

  private TranscriptionTask task(String taskId) {
    return new TranscriptionTask(taskId, audioUrl, recipients, keywords);
  }
}
