package com.scholary.transcriber.config;

import com.scholary.transcriber.chunking.AudioFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the transcription pipeline.
 *
 * <p>Bound once at startup and handed to the orchestrator through its constructor. The audio
 * block fixes the resample parameters and the service's per-request byte ceiling; the chunk
 * duration is derived from them in {@link AudioFormat}.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String tempDir,
    @Positive int segmentWorkers,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Valid @NotNull AudioProperties audio) {

  public record AudioProperties(
      @Positive int sampleRate,
      @Positive int channels,
      @Positive int bitDepth,
      @Positive long maxChunkBytes,
      @PositiveOrZero int overlapSeconds) {}

  /** The fixed format every downloaded file is resampled to. */
  public AudioFormat audioFormat() {
    return new AudioFormat(audio.sampleRate(), audio.channels(), audio.bitDepth());
  }
}
