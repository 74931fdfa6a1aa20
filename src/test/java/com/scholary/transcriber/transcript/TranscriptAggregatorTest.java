package com.scholary.transcriber.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class TranscriptAggregatorTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final TranscriptAggregator aggregator =
      new TranscriptAggregator(Clock.fixed(NOW, ZoneOffset.UTC));

  private static SegmentResult segment(String text, String word, double start) {
    return new SegmentResult(
        text,
        List.of(new WordTimestamp(word, start, start + 0.4)),
        List.of(new WordConfidence(word, 0.9)),
        List.of());
  }

  @Test
  void merge_concatenatesInSegmentOrderWithoutSeparator() {
    AggregatedTranscription merged =
        aggregator.merge(
            List.of(segment("first part ", "first", 0.1), segment("second part ", "second", 0.2)));

    assertThat(merged.transcript()).isEqualTo("first part second part ");
    assertThat(merged.timestamps())
        .extracting(WordTimestamp::word)
        .containsExactly("first", "second");
    assertThat(merged.confidences()).hasSize(2);
    assertThat(merged.completedAt()).isEqualTo(NOW);
    assertThat(merged.audioUrl()).isNull();
  }

  @Test
  void merge_keepsSegmentRelativeTimestampsAndOverlapWords() {
    AggregatedTranscription merged =
        aggregator.merge(List.of(segment("seam ", "seam", 2967.5), segment("seam ", "seam", 0.5)));

    assertThat(merged.transcript()).isEqualTo("seam seam ");
    assertThat(merged.timestamps())
        .extracting(WordTimestamp::startTime)
        .containsExactly(2967.5, 0.5);
  }

  @Test
  void merge_collectsKeywordSpotsFromEverySegment() {
    SegmentResult a =
        new SegmentResult(
            "budget ", List.of(), List.of(), List.of(new KeywordSpot("budget", "budget", 1, 2, 0.8)));
    SegmentResult b =
        new SegmentResult(
            "risk ", List.of(), List.of(), List.of(new KeywordSpot("risk", "risk", 3, 4, 0.7)));

    assertThat(aggregator.merge(List.of(a, b)).keywords())
        .extracting(KeywordSpot::keyword)
        .containsExactly("budget", "risk");
  }

  @Test
  void merge_ofEmptyResultsIsEmpty() {
    AggregatedTranscription merged =
        aggregator.merge(List.of(SegmentResult.empty(), SegmentResult.empty()));

    assertThat(merged.transcript()).isEmpty();
    assertThat(merged.timestamps()).isEmpty();
  }

  @Test
  void withAudioUrl_keepsEverythingElse() {
    AggregatedTranscription merged = aggregator.merge(List.of(segment("a ", "a", 0)));

    AggregatedTranscription archived = merged.withAudioUrl("http://store/audio/a.mp3");

    assertThat(archived.audioUrl()).isEqualTo("http://store/audio/a.mp3");
    assertThat(archived.transcript()).isEqualTo(merged.transcript());
    assertThat(archived.completedAt()).isEqualTo(merged.completedAt());
  }
}
