package com.scholary.transcriber.service;

import java.util.List;

/**
 * One transcription request: the audio to fetch and who to tell about the result.
 *
 * @param id opaque task id, also used to namespace the task's temporary files
 * @param audioUrl where to download the audio from
 * @param recipients email addresses for the success or failure message
 * @param keywords words the speech service should spot
 */
public record TranscriptionTask(
    String id, String audioUrl, List<String> recipients, List<String> keywords) {

  public TranscriptionTask {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Task id is required");
    }
    if (audioUrl == null || audioUrl.isBlank()) {
      throw new IllegalArgumentException("Audio URL is required");
    }
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }
}
