package com.scholary.transcriber.api;

import com.scholary.transcriber.chunking.SegmentPlan;
import java.util.List;

/** Shows how a file of the given size will be split. */
public record ChunkPreviewResponse(
    int numChunks, int chunkDurationSeconds, int overlapSeconds, List<Segment> segments) {

  public record Segment(int index, int startSecond, int durationSeconds, boolean wholeAsset) {

    static Segment from(SegmentPlan plan) {
      return new Segment(
          plan.index(), plan.startSecond(), plan.durationSeconds(), plan.wholeAsset());
    }
  }
}
