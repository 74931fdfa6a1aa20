package com.scholary.transcriber.ffmpeg;

/**
 * Exception thrown when the external transcoder fails.
 *
 * <p>Carries whatever the tool printed, since ffmpeg's exit codes say very little on their own.
 */
public class TranscodeException extends RuntimeException {

  private final String toolOutput;

  public TranscodeException(String message, String toolOutput) {
    super(message + "\nCommand output:\n" + toolOutput);
    this.toolOutput = toolOutput;
  }

  public TranscodeException(String message, Throwable cause) {
    super(message, cause);
    this.toolOutput = "";
  }

  public String getToolOutput() {
    return toolOutput;
  }
}
