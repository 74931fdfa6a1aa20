package com.scholary.transcriber.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/**
 * Request for transcribing a remote audio file.
 *
 * <p>All transcriptions are asynchronous: the response carries a job id and the client polls
 * /api/jobs/{id}. Recipients get the transcript, or the error, by email.
 */
public record TranscriptionRequest(
    @NotBlank @Pattern(regexp = "(?i)^https?://.+", message = "must be an http(s) URL")
        String audioUrl,
    List<@NotBlank @Email String> emails,
    List<@NotBlank String> keywords) {

  public TranscriptionRequest {
    if (emails == null) {
      emails = List.of();
    }
    if (keywords == null) {
      keywords = List.of();
    }
  }
}
