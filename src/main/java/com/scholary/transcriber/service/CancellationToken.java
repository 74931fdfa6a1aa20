package com.scholary.transcriber.service;

/**
 * Cooperative cancellation flag for one task.
 *
 * <p>The pipeline checks it at every stage boundary and before each segment. A call that is
 * already in flight (a download, an ffmpeg run, a service request) is not interrupted.
 */
public class CancellationToken {

  private volatile boolean cancelled;

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public void throwIfCancelled(PipelineStage next) {
    if (cancelled) {
      throw new TaskCancelledException("Task cancelled before " + next);
    }
  }
}
