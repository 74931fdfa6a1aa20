package com.scholary.transcriber.download;

/** Exception thrown when source audio cannot be fetched or written to disk. */
public class DownloadException extends RuntimeException {

  public DownloadException(String message) {
    super(message);
  }

  public DownloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
