package com.scholary.transcriber.transcript;

import java.time.Instant;
import java.util.List;

/**
 * The transcription of a whole source file.
 *
 * <p>Word timestamps and keyword times keep each segment's own clock; they are not shifted onto
 * the source file's time axis. {@code audioUrl} is null unless the source audio was archived.
 */
public record AggregatedTranscription(
    String transcript,
    String audioUrl,
    Instant completedAt,
    List<WordTimestamp> timestamps,
    List<WordConfidence> confidences,
    List<KeywordSpot> keywords) {

  public AggregatedTranscription {
    timestamps = List.copyOf(timestamps);
    confidences = List.copyOf(confidences);
    keywords = List.copyOf(keywords);
  }

  /** Copy of this transcription pointing at the archived audio. */
  public AggregatedTranscription withAudioUrl(String url) {
    return new AggregatedTranscription(
        transcript, url, completedAt, timestamps, confidences, keywords);
  }
}
