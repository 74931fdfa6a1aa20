package com.scholary.transcriber.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Runtime, because the caller can do nothing useful about a missing bucket or wrong
 * credentials except fail the task.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
