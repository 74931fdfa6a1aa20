package com.scholary.transcriber.chunking;

/**
 * Exception thrown when a planned segment cannot be cut from its source file.
 *
 * <p>A task cannot use a partial set of segments, so this is always fatal for the task.
 */
public class ExtractionException extends RuntimeException {

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
