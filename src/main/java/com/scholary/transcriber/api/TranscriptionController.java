package com.scholary.transcriber.api;

import com.scholary.transcriber.chunking.ChunkPlanner;
import com.scholary.transcriber.job.JobRunner;
import com.scholary.transcriber.job.TranscriptionJob;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for long-form transcription.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting an asynchronous transcription (returns job ID immediately)
 *   <li>Job status polling and cancellation
 *   <li>Previewing the segment plan for a given file size
 * </ul>
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Transcription", description = "Long-form audio transcription API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final JobRunner jobRunner;
  private final ChunkPlanner chunkPlanner;

  public TranscriptionController(JobRunner jobRunner, ChunkPlanner chunkPlanner) {
    this.jobRunner = jobRunner;
    this.chunkPlanner = chunkPlanner;
  }

  @PostMapping("/transcriptions")
  @Operation(
      summary = "Start transcription",
      description = "Start asynchronous transcription job and return job ID for status polling")
  public ResponseEntity<AsyncJobResponse> transcribe(
      @Valid @RequestBody TranscriptionRequest request) {
    LOGGER.info(
        "Transcription request: url={}, recipients={}", request.audioUrl(), request.emails().size());
    try {
      TranscriptionJob job =
          jobRunner.submit(request.audioUrl(), request.emails(), request.keywords());
      return ResponseEntity.accepted().body(new AsyncJobResponse(job.getJobId()));
    } catch (RejectedExecutionException e) {
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
  }

  /**
   * Get job status.
   *
   * <p>If the job is completed, includes the full transcription result.
   */
  @GetMapping("/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRunner
        .find(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getStage(),
                        job.getResult(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/jobs/{id}")
  @Operation(
      summary = "Cancel job",
      description = "Stop a running job at its next stage boundary")
  public ResponseEntity<Void> cancelJob(@PathVariable String id) {
    JobRunner.CancelOutcome outcome = jobRunner.cancel(id);
    if (outcome == JobRunner.CancelOutcome.NOT_FOUND) {
      return ResponseEntity.notFound().build();
    }
    if (outcome == JobRunner.CancelOutcome.ALREADY_FINISHED) {
      return ResponseEntity.status(HttpStatus.CONFLICT).build();
    }
    return ResponseEntity.accepted().build();
  }

  @PostMapping("/chunks/preview")
  @Operation(
      summary = "Preview segments",
      description = "Show how a resampled file of the given size would be split")
  public ResponseEntity<ChunkPreviewResponse> previewChunks(
      @Valid @RequestBody ChunkPreviewRequest request) {
    if (request.byteSize() > chunkPlanner.maxPlannableBytes()) {
      LOGGER.info(
          "Preview rejected: {} bytes exceeds planner limit {}",
          request.byteSize(),
          chunkPlanner.maxPlannableBytes());
      return ResponseEntity.badRequest().build();
    }
    List<ChunkPreviewResponse.Segment> segments =
        chunkPlanner.plan(request.byteSize()).stream()
            .map(ChunkPreviewResponse.Segment::from)
            .toList();
    return ResponseEntity.ok(
        new ChunkPreviewResponse(
            segments.size(),
            chunkPlanner.chunkDurationSeconds(),
            chunkPlanner.overlapSeconds(),
            segments));
  }
}
