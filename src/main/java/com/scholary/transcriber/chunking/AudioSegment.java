package com.scholary.transcriber.chunking;

import java.nio.file.Path;

/**
 * A planned segment materialized as a file on disk.
 *
 * <p>For a whole-asset plan the path is the resampled file itself, which belongs to the task and
 * must not be released together with the segment.
 */
public record AudioSegment(SegmentPlan plan, Path path) {

  public int index() {
    return plan.index();
  }
}
