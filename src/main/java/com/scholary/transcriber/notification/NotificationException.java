package com.scholary.transcriber.notification;

/** Exception thrown when an email cannot be handed to the mail server. */
public class NotificationException extends RuntimeException {

  public NotificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
