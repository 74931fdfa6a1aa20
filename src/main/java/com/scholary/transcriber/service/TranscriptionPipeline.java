package com.scholary.transcriber.service;

import com.scholary.transcriber.chunking.AudioSegment;
import com.scholary.transcriber.chunking.ChunkPlanner;
import com.scholary.transcriber.chunking.SegmentExtractor;
import com.scholary.transcriber.chunking.SegmentPlan;
import com.scholary.transcriber.config.PipelineProperties;
import com.scholary.transcriber.download.AudioDownloader;
import com.scholary.transcriber.ffmpeg.AudioContainer;
import com.scholary.transcriber.ffmpeg.AudioTranscoder;
import com.scholary.transcriber.logging.StructuredLogger;
import com.scholary.transcriber.notification.TranscriptNotifier;
import com.scholary.transcriber.objectstore.AudioArchiver;
import com.scholary.transcriber.persistence.TranscriptionStore;
import com.scholary.transcriber.speech.SpeechToTextService;
import com.scholary.transcriber.transcript.AggregatedTranscription;
import com.scholary.transcriber.transcript.SegmentResult;
import com.scholary.transcriber.transcript.TranscriptAggregator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one transcription task from URL to notification.
 *
 * <p>Stages, strictly in order:
 *
 * <ol>
 *   <li>DOWNLOADING the source audio into the task's working directory
 *   <li>RESAMPLING it to the fixed speech format (WAV)
 *   <li>CHUNKING the resampled file by byte size
 *   <li>EXTRACTING_SEGMENT then TRANSCRIBING, once per segment
 *   <li>AGGREGATING the segment results in index order
 *   <li>ARCHIVING the source audio and PERSISTING the result, when configured
 *   <li>NOTIFYING recipients
 * </ol>
 *
 * <p>Every file a stage creates is registered with an {@link ArtifactScope} as soon as it exists.
 * The task scope is closed before the outcome is reported, so a finished task, successful or
 * not, leaves nothing on disk. Segment files live in a child scope that is released as soon as
 * the segment's transcription call returns.
 *
 * <p>A file small enough for one request skips EXTRACTING_SEGMENT entirely: it is only
 * re-encoded for upload, as part of TRANSCRIBING.
 *
 * <p>With one segment worker the segments run inline, strictly by index. With more, they run
 * on the segment executor; a failure stops segments that have not started yet, and results are
 * slotted by index so completion order never affects the transcript.
 *
 * <p>Archive, persistence and success-notification failures fail the task even though the
 * transcription itself succeeded.
 */
public class TranscriptionPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionPipeline.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final Path tempDir;
  private final int segmentWorkers;
  private final AudioDownloader downloader;
  private final AudioTranscoder transcoder;
  private final ChunkPlanner chunkPlanner;
  private final SegmentExtractor segmentExtractor;
  private final SpeechToTextService speechService;
  private final TranscriptAggregator aggregator;
  private final Optional<AudioArchiver> archiver;
  private final Optional<TranscriptionStore> store;
  private final Optional<TranscriptNotifier> notifier;
  private final Executor segmentExecutor;

  public TranscriptionPipeline(
      PipelineProperties properties,
      AudioDownloader downloader,
      AudioTranscoder transcoder,
      ChunkPlanner chunkPlanner,
      SegmentExtractor segmentExtractor,
      SpeechToTextService speechService,
      TranscriptAggregator aggregator,
      Optional<AudioArchiver> archiver,
      Optional<TranscriptionStore> store,
      Optional<TranscriptNotifier> notifier,
      Executor segmentExecutor) {

    this.tempDir = Paths.get(properties.tempDir());
    this.segmentWorkers = properties.segmentWorkers();
    this.downloader = downloader;
    this.transcoder = transcoder;
    this.chunkPlanner = chunkPlanner;
    this.segmentExtractor = segmentExtractor;
    this.speechService = speechService;
    this.aggregator = aggregator;
    this.archiver = archiver;
    this.store = store;
    this.notifier = notifier;
    this.segmentExecutor = segmentExecutor;

    LOGGER.info(
        "Pipeline ready: tempDir={}, segmentWorkers={}, archive={}, persistence={}, mail={}",
        tempDir,
        segmentWorkers,
        archiver.isPresent(),
        store.isPresent(),
        notifier.isPresent());
  }

  /**
   * Run a task to completion.
   *
   * @param task the request
   * @param token checked at each stage boundary
   * @param listener told about every stage transition
   * @return the aggregated transcription, with its audio URL if archived
   * @throws TaskFailedException if any stage fails or the task is cancelled
   */
  public AggregatedTranscription execute(
      TranscriptionTask task, CancellationToken token, StageListener listener) {
    StructuredLogger.setTaskContext(task.id());
    long startTime = System.currentTimeMillis();
    StageTracker tracker = new StageTracker(listener);

    try {
      LOGGER.info(
          "Starting task: url={}, recipients={}, keywords={}",
          task.audioUrl(),
          task.recipients().size(),
          task.keywords().size());

      AggregatedTranscription transcription;
      int segmentCount;

      try (ArtifactScope scope = ArtifactScope.open(tempDir, workingDirectoryName(task.id()))) {
        tracker.enter(PipelineStage.DOWNLOADING, token);
        Path source = scope.track(downloader.fetch(task.audioUrl(), scope.directory()));
        LOGGER.debug("Downloaded {} to {}", task.audioUrl(), source);

        tracker.enter(PipelineStage.RESAMPLING, token);
        Path resampled = scope.track(transcoder.resample(source, AudioContainer.WAV));
        LOGGER.debug("Converted {} to {}", source.getFileName(), resampled.getFileName());

        tracker.enter(PipelineStage.CHUNKING, token);
        long byteSize = Files.size(resampled);
        List<SegmentPlan> plans = chunkPlanner.plan(byteSize);
        segmentCount = plans.size();
        LOGGER.info("Split {} ({} bytes) into {} segment(s)", resampled.getFileName(), byteSize, plans.size());

        List<SegmentResult> results = transcribeSegments(task, scope, resampled, plans, token, tracker);

        tracker.enter(PipelineStage.AGGREGATING, token);
        transcription = aggregator.merge(results);

        if (archiver.isPresent()) {
          tracker.enter(PipelineStage.ARCHIVING, token);
          transcription = transcription.withAudioUrl(archiver.get().archive(source));
        }

        if (store.isPresent()) {
          tracker.enter(PipelineStage.PERSISTING, token);
          store.get().persist(transcription);
        }

        tracker.enter(PipelineStage.NOTIFYING, token);
        if (notifier.isPresent()) {
          notifier.get().notifySuccess(task.id(), task.recipients(), transcription);
          LOGGER.debug("Sent email to {}", task.recipients());
        } else {
          LOGGER.info("No mail channel configured, skipping success email");
        }
      }

      tracker.finish(PipelineStage.COMPLETED);
      structuredLogger.logTaskCompleted(
          segmentCount, transcription.transcript().length(), System.currentTimeMillis() - startTime);
      return transcription;

    } catch (TaskFailedException e) {
      tracker.finish(PipelineStage.FAILED);
      structuredLogger.logTaskFailed(
          e.getStage().name(), e.getCause().getClass().getSimpleName(), e.getMessage());
      throw e;

    } catch (IOException | RuntimeException e) {
      PipelineStage failedStage = tracker.current();
      tracker.finish(PipelineStage.FAILED);
      TaskFailedException failure = new TaskFailedException(task.id(), failedStage, e);
      structuredLogger.logTaskFailed(
          failedStage.name(), e.getClass().getSimpleName(), failure.getMessage());
      throw failure;

    } finally {
      StructuredLogger.clearTaskContext();
    }
  }

  /**
   * Tell the task's recipients that it failed.
   *
   * <p>Best effort: a send failure is logged and swallowed.
   */
  public void reportFailure(TranscriptionTask task, String errorMessage) {
    StructuredLogger.setTaskContext(task.id());
    try {
      if (notifier.isEmpty()) {
        LOGGER.warn("No mail channel configured, task failure not emailed: {}", errorMessage);
        return;
      }
      notifier.get().notifyFailure(task.id(), task.recipients(), errorMessage);
      LOGGER.info("Sent failure email to {}", task.recipients());
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Could not send failure email to {} because of the error {}",
          task.recipients(),
          e.getMessage());
    } finally {
      StructuredLogger.clearTaskContext();
    }
  }

  private List<SegmentResult> transcribeSegments(
      TranscriptionTask task,
      ArtifactScope scope,
      Path resampled,
      List<SegmentPlan> plans,
      CancellationToken token,
      StageTracker tracker) {

    SegmentResult[] slots = new SegmentResult[plans.size()];

    if (segmentWorkers == 1 || plans.size() == 1) {
      for (SegmentPlan plan : plans) {
        slots[plan.index()] = processSegment(task, scope, resampled, plan, plans.size(), token, tracker);
      }
      return Arrays.asList(slots);
    }

    AtomicBoolean failed = new AtomicBoolean();
    Map<Integer, TaskFailedException> failures = new ConcurrentSkipListMap<>();
    List<CompletableFuture<Void>> inFlight = new ArrayList<>(plans.size());

    for (SegmentPlan plan : plans) {
      inFlight.add(
          CompletableFuture.runAsync(
              () -> {
                if (failed.get()) {
                  return;
                }
                StructuredLogger.setTaskContext(task.id());
                try {
                  slots[plan.index()] =
                      processSegment(task, scope, resampled, plan, plans.size(), token, tracker);
                } catch (TaskFailedException e) {
                  failed.set(true);
                  failures.put(plan.index(), e);
                } finally {
                  StructuredLogger.clearTaskContext();
                }
              },
              segmentExecutor));
    }

    // wait for every in-flight segment so its files are gone before the task scope closes
    CompletableFuture.allOf(inFlight.toArray(CompletableFuture[]::new)).join();

    if (!failures.isEmpty()) {
      throw failures.values().iterator().next();
    }
    return Arrays.asList(slots);
  }

  private SegmentResult processSegment(
      TranscriptionTask task,
      ArtifactScope scope,
      Path resampled,
      SegmentPlan plan,
      int totalSegments,
      CancellationToken token,
      StageTracker tracker) {

    PipelineStage stage =
        plan.requiresExtraction() ? PipelineStage.EXTRACTING_SEGMENT : PipelineStage.TRANSCRIBING;
    try (ArtifactScope segmentScope = scope.child()) {
      tracker.enter(stage, token);
      structuredLogger.logSegmentStarted(
          plan.index(), totalSegments, plan.startSecond(), plan.durationSeconds());

      AudioSegment segment = segmentExtractor.extract(resampled, plan);
      if (plan.requiresExtraction()) {
        segmentScope.track(segment.path());
      }
      Path upload =
          segmentScope.track(segmentExtractor.encodeForUpload(segment, AudioContainer.FLAC));

      if (stage != PipelineStage.TRANSCRIBING) {
        stage = PipelineStage.TRANSCRIBING;
        tracker.enter(stage, token);
      }
      long transcribeStart = System.currentTimeMillis();
      SegmentResult result = speechService.transcribe(upload, task.keywords());
      structuredLogger.logSegmentFinished(
          plan.index(), totalSegments, System.currentTimeMillis() - transcribeStart);
      return result;

    } catch (RuntimeException e) {
      throw new TaskFailedException(task.id(), stage, plan.index(), e);
    }
  }

  private static String workingDirectoryName(String taskId) {
    return taskId.replaceAll("[^A-Za-z0-9._-]", "_") + "-" + System.nanoTime();
  }

  /** Current stage of one task, shared by its segment workers. */
  private final class StageTracker {

    private final StageListener listener;
    private volatile PipelineStage current = PipelineStage.PENDING;

    private StageTracker(StageListener listener) {
      this.listener = listener;
      listener.onStage(current);
    }

    void enter(PipelineStage stage, CancellationToken token) {
      current = stage;
      token.throwIfCancelled(stage);
      listener.onStage(stage);
      structuredLogger.logStageEntered(stage.name());
    }

    void finish(PipelineStage terminal) {
      current = terminal;
      listener.onStage(terminal);
    }

    PipelineStage current() {
      return current;
    }
  }
}
