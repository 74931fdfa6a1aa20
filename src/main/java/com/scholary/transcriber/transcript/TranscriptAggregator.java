package com.scholary.transcriber.transcript;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges per-segment results into one transcription.
 *
 * <p>Plain concatenation in segment order:
 *
 * <ul>
 *   <li>transcripts are joined with no separator; each piece already ends the way the service
 *       returned it
 *   <li>words repeated in the overlap window are kept
 *   <li>timestamps stay relative to their own segment
 * </ul>
 */
public class TranscriptAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptAggregator.class);

  private final Clock clock;

  public TranscriptAggregator(Clock clock) {
    this.clock = clock;
  }

  /**
   * Merge results that are already in ascending segment order.
   *
   * @param results one result per segment, index 0 first
   * @return the merged transcription, stamped with the current time
   */
  public AggregatedTranscription merge(List<SegmentResult> results) {
    StringBuilder transcript = new StringBuilder();
    List<WordTimestamp> timestamps = new ArrayList<>();
    List<WordConfidence> confidences = new ArrayList<>();
    List<KeywordSpot> keywords = new ArrayList<>();

    for (SegmentResult result : results) {
      transcript.append(result.transcript());
      timestamps.addAll(result.wordTimestamps());
      confidences.addAll(result.wordConfidences());
      keywords.addAll(result.keywordSpots());
    }

    LOGGER.debug(
        "Merged {} segment results: {} chars, {} words, {} keyword hits",
        results.size(),
        transcript.length(),
        timestamps.size(),
        keywords.size());

    return new AggregatedTranscription(
        transcript.toString(), null, clock.instant(), timestamps, confidences, keywords);
  }
}
