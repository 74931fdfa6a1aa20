package com.scholary.transcriber.notification;

import com.scholary.transcriber.transcript.AggregatedTranscription;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

/** Sends plain-text result emails through the configured SMTP server. */
public class EmailNotifier implements TranscriptNotifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(EmailNotifier.class);

  private final JavaMailSender mailSender;
  private final NotificationProperties properties;
  private final boolean persisted;

  /**
   * @param persisted whether transcriptions are also written to the document store, which the
   *     success email mentions
   */
  public EmailNotifier(
      JavaMailSender mailSender, NotificationProperties properties, boolean persisted) {
    this.mailSender = mailSender;
    this.properties = properties;
    this.persisted = persisted;
  }

  @Override
  public void notifySuccess(
      String taskId, List<String> recipients, AggregatedTranscription transcription) {
    StringBuilder body = new StringBuilder("The transcript is below.");
    if (persisted) {
      body.append(" It can also be found in the database.");
    }
    if (transcription.audioUrl() != null) {
      body.append("\nThe audio is archived at ").append(transcription.audioUrl());
    }
    body.append("\n\n").append(transcription.transcript());

    send(recipients, String.format(properties.successSubject(), taskId), body.toString());
  }

  @Override
  public void notifyFailure(String taskId, List<String> recipients, String errorMessage) {
    send(recipients, String.format(properties.failureSubject(), taskId), errorMessage);
  }

  private void send(List<String> recipients, String subject, String body) {
    if (recipients.isEmpty()) {
      LOGGER.info("No recipients for '{}', nothing sent", subject);
      return;
    }
    SimpleMailMessage message = new SimpleMailMessage();
    message.setFrom(properties.from());
    message.setTo(recipients.toArray(String[]::new));
    message.setSubject(subject);
    message.setText(body);

    try {
      mailSender.send(message);
      LOGGER.debug("Sent '{}' to {}", subject, recipients);
    } catch (MailException e) {
      throw new NotificationException(
          String.format("Failed to send '%s' to %s: %s", subject, recipients, e.getMessage()), e);
    }
  }
}
