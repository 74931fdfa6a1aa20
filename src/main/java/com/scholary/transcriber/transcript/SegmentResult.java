package com.scholary.transcriber.transcript;

import java.util.List;

/**
 * What the speech service returned for one segment.
 *
 * <p>Immutable: the lists are copied on construction.
 */
public record SegmentResult(
    String transcript,
    List<WordTimestamp> wordTimestamps,
    List<WordConfidence> wordConfidences,
    List<KeywordSpot> keywordSpots) {

  public SegmentResult {
    transcript = transcript == null ? "" : transcript;
    wordTimestamps = wordTimestamps == null ? List.of() : List.copyOf(wordTimestamps);
    wordConfidences = wordConfidences == null ? List.of() : List.copyOf(wordConfidences);
    keywordSpots = keywordSpots == null ? List.of() : List.copyOf(keywordSpots);
  }

  public static SegmentResult empty() {
    return new SegmentResult("", List.of(), List.of(), List.of());
  }
}
