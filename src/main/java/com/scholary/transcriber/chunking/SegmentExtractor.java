package com.scholary.transcriber.chunking;

import com.scholary.transcriber.ffmpeg.AudioContainer;
import com.scholary.transcriber.ffmpeg.AudioTranscoder;
import com.scholary.transcriber.ffmpeg.TranscodeException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns segment plans into files, delegating the actual cut to the transcoder. */
public class SegmentExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentExtractor.class);

  private final AudioTranscoder transcoder;

  public SegmentExtractor(AudioTranscoder transcoder) {
    this.transcoder = transcoder;
  }

  /**
   * Materialize one segment of the resampled file.
   *
   * <p>A whole-asset plan is returned as-is pointing at {@code resampled}; nothing is extracted.
   *
   * @param resampled the resampled source file
   * @param plan the segment to cut
   * @return the segment and the file holding it
   * @throws ExtractionException if the transcoder fails
   */
  public AudioSegment extract(Path resampled, SegmentPlan plan) {
    if (!plan.requiresExtraction()) {
      return new AudioSegment(plan, resampled);
    }

    try {
      Path path = transcoder.extract(resampled, plan.startSecond(), plan.durationSeconds());
      LOGGER.debug(
          "Extracted segment {}: {}s+{}s to {}",
          plan.index(),
          plan.startSecond(),
          plan.durationSeconds(),
          path.getFileName());
      return new AudioSegment(plan, path);
    } catch (TranscodeException e) {
      throw new ExtractionException(
          String.format(
              "Failed to extract segment %d (%ds+%ds) from %s: %s",
              plan.index(),
              plan.startSecond(),
              plan.durationSeconds(),
              resampled.getFileName(),
              e.getMessage()),
          e);
    }
  }

  /**
   * Re-encode a segment into the container the speech service receives.
   *
   * @return the encoded copy, owned by the caller
   * @throws ExtractionException if the transcoder fails
   */
  public Path encodeForUpload(AudioSegment segment, AudioContainer container) {
    try {
      return transcoder.resample(segment.path(), container);
    } catch (TranscodeException e) {
      throw new ExtractionException(
          String.format(
              "Failed to encode segment %d as %s: %s",
              segment.index(), container, e.getMessage()),
          e);
    }
  }
}
