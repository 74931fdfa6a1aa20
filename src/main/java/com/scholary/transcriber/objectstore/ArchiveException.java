package com.scholary.transcriber.objectstore;

/** Exception thrown when source audio cannot be archived. */
public class ArchiveException extends RuntimeException {

  public ArchiveException(String message, Throwable cause) {
    super(message, cause);
  }
}
