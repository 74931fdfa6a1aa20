package com.scholary.transcriber.service;

/**
 * A stage failure wrapped with the task and stage it happened in.
 *
 * <p>The message is what recipients get in the failure email.
 */
public class TaskFailedException extends RuntimeException {

  private final String taskId;
  private final PipelineStage stage;
  private final Integer segmentIndex;

  public TaskFailedException(String taskId, PipelineStage stage, Throwable cause) {
    this(taskId, stage, null, cause);
  }

  public TaskFailedException(
      String taskId, PipelineStage stage, Integer segmentIndex, Throwable cause) {
    super(describe(taskId, stage, segmentIndex, cause), cause);
    this.taskId = taskId;
    this.stage = stage;
    this.segmentIndex = segmentIndex;
  }

  private static String describe(
      String taskId, PipelineStage stage, Integer segmentIndex, Throwable cause) {
    String where = segmentIndex == null ? stage.name() : stage + " (segment " + segmentIndex + ")";
    return String.format(
        "Task %s failed during %s: %s: %s",
        taskId, where, cause.getClass().getSimpleName(), cause.getMessage());
  }

  public String getTaskId() {
    return taskId;
  }

  public PipelineStage getStage() {
    return stage;
  }

  public Integer getSegmentIndex() {
    return segmentIndex;
  }
}
