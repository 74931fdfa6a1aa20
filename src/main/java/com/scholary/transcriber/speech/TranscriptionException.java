package com.scholary.transcriber.speech;

/**
 * Exception thrown when the speech service cannot transcribe a segment.
 *
 * <p>This could be due to network issues, service unavailability, bad credentials or an invalid
 * response.
 */
public class TranscriptionException extends RuntimeException {

  public TranscriptionException(String message) {
    super(message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
