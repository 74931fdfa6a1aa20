package com.scholary.transcriber.notification;

import com.scholary.transcriber.transcript.AggregatedTranscription;
import java.util.List;

/** Tells recipients how a task ended. Both outcomes go through the same channel. */
public interface TranscriptNotifier {

  /**
   * Send the finished transcript.
   *
   * @throws NotificationException if sending fails
   */
  void notifySuccess(String taskId, List<String> recipients, AggregatedTranscription transcription);

  /**
   * Send the error that ended a task.
   *
   * @throws NotificationException if sending fails
   */
  void notifyFailure(String taskId, List<String> recipients, String errorMessage);
}
