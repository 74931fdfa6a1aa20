package com.scholary.transcriber.service;

import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds runnable task handles for callers that assign their own task ids.
 *
 * <p>The job API goes through here, so does anything else that wants to run a transcription
 * and report failure on its own schedule.
 */
@Component
public class TranscriptionTaskFactory {

  private final TranscriptionPipeline pipeline;

  public TranscriptionTaskFactory(TranscriptionPipeline pipeline) {
    this.pipeline = pipeline;
  }

  public TranscriptionTaskHandle create(
      String audioUrl, List<String> recipientEmails, List<String> keywords) {
    return new TranscriptionTaskHandle(pipeline, audioUrl, recipientEmails, keywords);
  }
}
