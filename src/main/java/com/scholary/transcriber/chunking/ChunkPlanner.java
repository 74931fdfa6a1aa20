package com.scholary.transcriber.chunking;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a resampled audio file into segments the speech service will accept.
 *
 * <p>The service rejects requests above a fixed byte ceiling. The planner works purely from the
 * file's byte size:
 *
 * <ol>
 *   <li>{@code numChunks = byteSize / maxChunkBytes + 1} (integer division). An empty file still
 *       gets one chunk, and a file that is an exact multiple of the ceiling gets one extra,
 *       nearly empty chunk. Both are accepted.
 *   <li>One chunk means the whole file is sent as is.
 *   <li>Otherwise every chunk lasts {@code chunkDurationSeconds}. Chunk 0 starts at 0 and chunk
 *       {@code i} starts at {@code i * chunkDurationSeconds - overlapSeconds}. Every segment after
 *       the first therefore begins {@code overlapSeconds} before its nominal slot. Since all
 *       segments share that shift, only the seam between segments 0 and 1 is actually covered
 *       twice; later segments meet end to start.
 * </ol>
 *
 * <p>{@code chunkDurationSeconds} comes from the resample format, not from the file. Changing the
 * sample rate, bit depth or channel count changes it automatically.
 *
 * <p>A plan holds at most {@link #MAX_SEGMENTS} segments, and every start second must fit in an
 * {@code int}. {@link #maxPlannableBytes()} is the largest size that satisfies both.
 */
public class ChunkPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkPlanner.class);

  /** Upper bound on segments per file, about 340 days of audio at the default format. */
  public static final int MAX_SEGMENTS = 10_000;

  private final long maxChunkBytes;
  private final int overlapSeconds;
  private final int chunkDurationSeconds;
  private final long maxPlannableBytes;

  public ChunkPlanner(AudioFormat format, long maxChunkBytes, int overlapSeconds) {
    if (maxChunkBytes <= 0) {
      throw new IllegalArgumentException("maxChunkBytes must be positive");
    }
    this.maxChunkBytes = maxChunkBytes;
    this.overlapSeconds = overlapSeconds;
    this.chunkDurationSeconds = format.secondsFor(maxChunkBytes);

    if (overlapSeconds < 0 || overlapSeconds >= chunkDurationSeconds) {
      throw new IllegalArgumentException(
          String.format(
              "Overlap (%ds) must be between 0 and the chunk duration (%ds)",
              overlapSeconds, chunkDurationSeconds));
    }

    long maxSegments = Math.min(MAX_SEGMENTS, Integer.MAX_VALUE / chunkDurationSeconds + 1L);
    this.maxPlannableBytes =
        maxSegments > Long.MAX_VALUE / maxChunkBytes
            ? Long.MAX_VALUE
            : maxSegments * maxChunkBytes - 1;

    LOGGER.info(
        "Chunk planner ready: maxChunkBytes={}, chunkDuration={}s, overlap={}s, format={}",
        maxChunkBytes,
        chunkDurationSeconds,
        overlapSeconds,
        format);
  }

  public long numChunks(long byteSize) {
    if (byteSize < 0) {
      throw new IllegalArgumentException("byteSize cannot be negative: " + byteSize);
    }
    return byteSize / maxChunkBytes + 1;
  }

  /**
   * Plan the segments for a resampled file of the given size.
   *
   * @param byteSize size of the resampled file in bytes
   * @return segments in ascending index order
   * @throws IllegalArgumentException if the size is negative or above {@link #maxPlannableBytes()}
   */
  public List<SegmentPlan> plan(long byteSize) {
    long chunks = numChunks(byteSize);
    if (byteSize > maxPlannableBytes) {
      throw new IllegalArgumentException(
          String.format(
              "byteSize %d needs %d segments, above the limit of %d bytes",
              byteSize, chunks, maxPlannableBytes));
    }
    int numChunks = (int) chunks;
    if (numChunks == 1) {
      LOGGER.debug("File of {} bytes fits in one request", byteSize);
      return List.of(SegmentPlan.whole());
    }

    List<SegmentPlan> plans = new ArrayList<>(numChunks);
    for (int i = 0; i < numChunks; i++) {
      long start = Math.multiplyExact((long) i, chunkDurationSeconds);
      if (i > 0) {
        start -= overlapSeconds;
      }
      plans.add(SegmentPlan.slice(i, Math.toIntExact(start), chunkDurationSeconds));
    }

    LOGGER.debug("Planned {} segments for {} bytes", plans.size(), byteSize);
    return List.copyOf(plans);
  }

  public int chunkDurationSeconds() {
    return chunkDurationSeconds;
  }

  public int overlapSeconds() {
    return overlapSeconds;
  }

  /** Largest byte size {@link #plan(long)} accepts. */
  public long maxPlannableBytes() {
    return maxPlannableBytes;
  }

  public long maxChunkBytes() {
    return maxChunkBytes;
  }
}
