package com.scholary.transcriber.service;

/** Exception thrown at a stage boundary once a task has been asked to stop. */
public class TaskCancelledException extends RuntimeException {

  public TaskCancelledException(String message) {
    super(message);
  }
}
