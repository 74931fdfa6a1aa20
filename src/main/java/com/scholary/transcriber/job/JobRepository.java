package com.scholary.transcriber.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for transcription jobs.
 *
 * <p>Finished and abandoned jobs are evicted by size and age, so a long-running service does not
 * accumulate them. A job evicted while still running keeps running; only its status is lost.
 */
@Repository
public class JobRepository {

  private final Cache<String, TranscriptionJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(TranscriptionJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<TranscriptionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
