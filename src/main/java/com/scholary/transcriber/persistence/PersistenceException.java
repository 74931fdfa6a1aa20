package com.scholary.transcriber.persistence;

/** Exception thrown when a finished transcription cannot be stored. */
public class PersistenceException extends RuntimeException {

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
