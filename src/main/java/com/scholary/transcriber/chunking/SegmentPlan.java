package com.scholary.transcriber.chunking;

/**
 * One planned slice of the resampled audio.
 *
 * <p>A plan marked {@code wholeAsset} covers the entire file: no trimming happens and the
 * resampled file is transcribed directly. Its start and duration are both zero.
 *
 * @param index 0-based position, determines aggregation order
 * @param startSecond offset into the resampled file
 * @param durationSeconds length of the slice
 * @param wholeAsset true when the file fits in a single request
 */
public record SegmentPlan(int index, int startSecond, int durationSeconds, boolean wholeAsset) {

  public SegmentPlan {
    if (index < 0) {
      throw new IllegalArgumentException("Segment index cannot be negative: " + index);
    }
    if (startSecond < 0) {
      throw new IllegalArgumentException("Segment start cannot be negative: " + startSecond);
    }
  }

  public static SegmentPlan whole() {
    return new SegmentPlan(0, 0, 0, true);
  }

  public static SegmentPlan slice(int index, int startSecond, int durationSeconds) {
    return new SegmentPlan(index, startSecond, durationSeconds, false);
  }

  public boolean requiresExtraction() {
    return !wholeAsset;
  }
}
