package com.scholary.transcriber.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.chunking.ChunkPlanner;
import com.scholary.transcriber.chunking.SegmentExtractor;
import com.scholary.transcriber.download.AudioDownloader;
import com.scholary.transcriber.download.DownloaderProperties;
import com.scholary.transcriber.download.HttpAudioDownloader;
import com.scholary.transcriber.ffmpeg.AudioTranscoder;
import com.scholary.transcriber.ffmpeg.FfmpegProperties;
import com.scholary.transcriber.ffmpeg.FfmpegTranscoder;
import com.scholary.transcriber.notification.TranscriptNotifier;
import com.scholary.transcriber.objectstore.AudioArchiver;
import com.scholary.transcriber.persistence.TranscriptionStore;
import com.scholary.transcriber.service.TranscriptionPipeline;
import com.scholary.transcriber.speech.SpeechProperties;
import com.scholary.transcriber.speech.SpeechToTextService;
import com.scholary.transcriber.speech.WatsonSpeechClient;
import com.scholary.transcriber.transcript.TranscriptAggregator;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the pipeline and its always-present collaborators.
 *
 * <p>Archive, persistence and mail are optional; their configurations only contribute a bean
 * when enabled, and the pipeline skips the matching stage otherwise.
 */
@Configuration
@EnableConfigurationProperties({
  PipelineProperties.class,
  FfmpegProperties.class,
  DownloaderProperties.class,
  SpeechProperties.class
})
public class PipelineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ChunkPlanner chunkPlanner(PipelineProperties properties) {
    return new ChunkPlanner(
        properties.audioFormat(),
        properties.audio().maxChunkBytes(),
        properties.audio().overlapSeconds());
  }

  @Bean
  public AudioTranscoder audioTranscoder(
      FfmpegProperties ffmpegProperties, PipelineProperties pipelineProperties) {
    return new FfmpegTranscoder(ffmpegProperties, pipelineProperties.audioFormat());
  }

  @Bean
  public SegmentExtractor segmentExtractor(AudioTranscoder audioTranscoder) {
    return new SegmentExtractor(audioTranscoder);
  }

  @Bean
  public AudioDownloader audioDownloader(DownloaderProperties properties) {
    return new HttpAudioDownloader(properties);
  }

  @Bean
  public SpeechToTextService speechToTextService(
      SpeechProperties properties, ObjectMapper objectMapper) {
    return new WatsonSpeechClient(properties, objectMapper);
  }

  @Bean
  public TranscriptAggregator transcriptAggregator(Clock clock) {
    return new TranscriptAggregator(clock);
  }

  @Bean
  public TranscriptionPipeline transcriptionPipeline(
      PipelineProperties properties,
      AudioDownloader audioDownloader,
      AudioTranscoder audioTranscoder,
      ChunkPlanner chunkPlanner,
      SegmentExtractor segmentExtractor,
      SpeechToTextService speechToTextService,
      TranscriptAggregator transcriptAggregator,
      Optional<AudioArchiver> audioArchiver,
      Optional<TranscriptionStore> transcriptionStore,
      Optional<TranscriptNotifier> transcriptNotifier,
      @Qualifier("segmentExecutor") Executor segmentExecutor) {
    return new TranscriptionPipeline(
        properties,
        audioDownloader,
        audioTranscoder,
        chunkPlanner,
        segmentExtractor,
        speechToTextService,
        transcriptAggregator,
        audioArchiver,
        transcriptionStore,
        transcriptNotifier,
        segmentExecutor);
  }
}
