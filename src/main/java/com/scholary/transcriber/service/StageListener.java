package com.scholary.transcriber.service;

/** Receives stage transitions of a running task. */
@FunctionalInterface
public interface StageListener {

  StageListener NONE = stage -> {};

  void onStage(PipelineStage stage);
}
