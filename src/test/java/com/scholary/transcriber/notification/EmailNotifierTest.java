package com.scholary.transcriber.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.scholary.transcriber.transcript.AggregatedTranscription;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class EmailNotifierTest {

  private static final NotificationProperties PROPERTIES =
      new NotificationProperties(
          "transcriber@example.com", "Transcription %s Complete", "Transcription %s Failed");

  @Mock private JavaMailSender mailSender;

  private final AggregatedTranscription transcription =
      new AggregatedTranscription(
          "hello world ", null, Instant.parse("2024-05-01T12:00:00Z"), List.of(), List.of(),
          List.of());

  private SimpleMailMessage sent() {
    ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
    verify(mailSender).send(captor.capture());
    return captor.getValue();
  }

  @Test
  void notifySuccess_sendsTranscriptBelowHeader() {
    new EmailNotifier(mailSender, PROPERTIES, true)
        .notifySuccess("task-1", List.of("a@example.com", "b@example.com"), transcription);

    SimpleMailMessage message = sent();
    assertThat(message.getFrom()).isEqualTo("transcriber@example.com");
    assertThat(message.getTo()).containsExactly("a@example.com", "b@example.com");
    assertThat(message.getSubject()).isEqualTo("Transcription task-1 Complete");
    assertThat(message.getText())
        .isEqualTo(
            "The transcript is below. It can also be found in the database.\n\nhello world ");
  }

  @Test
  void notifySuccess_mentionsArchiveOnlyWhenPresent() {
    new EmailNotifier(mailSender, PROPERTIES, false)
        .notifySuccess(
            "task-2",
            List.of("a@example.com"),
            transcription.withAudioUrl("http://store/audio-archive/talk.mp3"));

    assertThat(sent().getText())
        .isEqualTo(
            "The transcript is below.\nThe audio is archived at "
                + "http://store/audio-archive/talk.mp3\n\nhello world ");
  }

  @Test
  void notifyFailure_sendsErrorAsBody() {
    new EmailNotifier(mailSender, PROPERTIES, false)
        .notifyFailure("task-3", List.of("a@example.com"), "Task task-3 failed during DOWNLOADING");

    SimpleMailMessage message = sent();
    assertThat(message.getSubject()).isEqualTo("Transcription task-3 Failed");
    assertThat(message.getText()).isEqualTo("Task task-3 failed during DOWNLOADING");
  }

  @Test
  void send_wrapsMailErrors() {
    doThrow(new MailSendException("smtp down")).when(mailSender).send(any(SimpleMailMessage.class));
    EmailNotifier notifier = new EmailNotifier(mailSender, PROPERTIES, false);

    assertThatThrownBy(() -> notifier.notifyFailure("task-4", List.of("a@example.com"), "boom"))
        .isInstanceOf(NotificationException.class)
        .hasMessageContaining("smtp down");
  }

  @Test
  void noRecipients_sendsNothing() {
    new EmailNotifier(mailSender, PROPERTIES, false).notifySuccess("task-5", List.of(), transcription);

    verifyNoInteractions(mailSender);
  }
}
