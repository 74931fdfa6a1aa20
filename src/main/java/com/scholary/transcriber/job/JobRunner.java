package com.scholary.transcriber.job;

import com.scholary.transcriber.api.JobStatusResponse.Status;
import com.scholary.transcriber.service.TranscriptionTaskFactory;
import com.scholary.transcriber.service.TranscriptionTaskHandle;
import com.scholary.transcriber.transcript.AggregatedTranscription;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs transcription tasks in the background and keeps their status.
 *
 * <p>Each submission gets a fresh id and a job record, then runs on the task executor. If the
 * run fails, the task's failure notification is sent exactly once with the error message.
 */
@Service
public class JobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRunner.class);

  /** Result of a cancellation request. */
  public enum CancelOutcome {
    NOT_FOUND,
    CANCELLATION_REQUESTED,
    ALREADY_FINISHED
  }

  private final TranscriptionTaskFactory taskFactory;
  private final JobRepository jobRepository;
  private final Executor taskExecutor;
  private final Clock clock;

  public JobRunner(
      TranscriptionTaskFactory taskFactory,
      JobRepository jobRepository,
      @Qualifier("taskExecutor") Executor taskExecutor,
      Clock clock) {
    this.taskFactory = taskFactory;
    this.jobRepository = jobRepository;
    this.taskExecutor = taskExecutor;
    this.clock = clock;
  }

  /**
   * Queue a transcription.
   *
   * @return the stored job, still {@code PENDING}
   * @throws RejectedExecutionException if the task queue is full
   */
  public TranscriptionJob submit(String audioUrl, List<String> emails, List<String> keywords) {
    String jobId = UUID.randomUUID().toString();
    TranscriptionTaskHandle handle = taskFactory.create(audioUrl, emails, keywords);
    TranscriptionJob job = new TranscriptionJob(jobId, handle, clock.instant());
    jobRepository.save(job);

    try {
      taskExecutor.execute(() -> runJob(job));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Task queue full, rejecting job {}", jobId);
      jobRepository.delete(jobId);
      throw e;
    }

    LOGGER.info("Created async transcription job: {} for {}", jobId, audioUrl);
    return job;
  }

  public Optional<TranscriptionJob> find(String jobId) {
    return jobRepository.findById(jobId);
  }

  public CancelOutcome cancel(String jobId) {
    Optional<TranscriptionJob> found = jobRepository.findById(jobId);
    if (found.isEmpty()) {
      return CancelOutcome.NOT_FOUND;
    }
    TranscriptionJob job = found.get();
    if (job.isFinished()) {
      return CancelOutcome.ALREADY_FINISHED;
    }
    job.getHandle().cancel();
    LOGGER.info("Cancellation requested for job {} at stage {}", jobId, job.getStage());
    return CancelOutcome.CANCELLATION_REQUESTED;
  }

  void runJob(TranscriptionJob job) {
    String jobId = job.getJobId();
    LOGGER.info("Starting async processing for job: {}", jobId);
    job.setStatus(Status.PROCESSING);

    AggregatedTranscription result;
    try {
      result = job.getHandle().run(jobId);
    } catch (RuntimeException | Error e) {
      String message = e.getMessage() != null ? e.getMessage() : e.toString();
      job.setError(message);
      job.setStatus(Status.FAILED);
      jobRepository.save(job);
      try {
        job.getHandle().onFailure(jobId, message);
      } finally {
        if (e instanceof Error) {
          LOGGER.error("Job {} aborted by {}", jobId, e.getClass().getName());
          throw (Error) e;
        }
      }
      return;
    }

    job.setResult(result);
    job.setStatus(Status.COMPLETED);
    jobRepository.save(job);
    LOGGER.info("Completed async processing for job: {}", jobId);
  }
}
