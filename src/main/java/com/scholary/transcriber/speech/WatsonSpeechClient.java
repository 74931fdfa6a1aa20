package com.scholary.transcriber.speech;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.ffmpeg.AudioContainer;
import com.scholary.transcriber.transcript.KeywordSpot;
import com.scholary.transcriber.transcript.SegmentResult;
import com.scholary.transcriber.transcript.WordConfidence;
import com.scholary.transcriber.transcript.WordTimestamp;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for a Watson-style {@code /v1/recognize} speech endpoint.
 *
 * <p>Posts the FLAC file as the request body and asks for word timestamps, word confidences
 * and, when keywords are given, keyword spotting. The JSON answer holds one entry per
 * recognized utterance:
 *
 * <pre>
 * {"results": [{
 *    "alternatives": [{"transcript": "so we ", "timestamps": [["so", 0.1, 0.3], ...],
 *                      "word_confidence": [["so", 0.97], ...]}],
 *    "keywords_result": {"budget": [{"normalized_text": "budget", "start_time": 4.2,
 *                                    "end_time": 4.7, "confidence": 0.91}]}}]}
 * </pre>
 *
 * <p>Only the first alternative of each utterance is used.
 */
public class WatsonSpeechClient implements SpeechToTextService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WatsonSpeechClient.class);

  private final HttpClient httpClient;
  private final SpeechProperties properties;
  private final ObjectMapper objectMapper;

  public WatsonSpeechClient(SpeechProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized speech client: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public SegmentResult transcribe(Path audioFile, List<String> keywords) {
    LOGGER.info(
        "Transcribing segment: file={}, keywords={}", audioFile.getFileName(), keywords.size());

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranscribe(audioFile, keywords);
      } catch (IOException | InterruptedException e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
          throw new TranscriptionException("Transcription interrupted", e);
        }
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException("Transcription interrupted", ie);
          }
        }
      }
    }

    throw new TranscriptionException(
        String.format(
            "Transcription of %s failed after %d attempt(s): %s",
            audioFile.getFileName(),
            properties.maxRetries(),
            lastException == null ? "unknown error" : lastException.getMessage()),
        lastException);
  }

  private SegmentResult attemptTranscribe(Path audioFile, List<String> keywords)
      throws IOException, InterruptedException {

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(recognizeUri(keywords))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Authorization", basicAuth())
            .header("Content-Type", AudioContainer.FLAC.mimeType())
            .POST(BodyPublishers.ofFile(audioFile))
            .build();

    LOGGER.debug("Sending recognize request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() == 401 || response.statusCode() == 403) {
      // retrying will not fix credentials
      throw new TranscriptionException(
          String.format("Speech service rejected credentials (status %d)", response.statusCode()));
    }
    int status = response.statusCode();
    if (status >= 400 && status < 500 && status != 429) {
      // the same request will be rejected again
      throw new TranscriptionException(
          String.format("Speech service rejected request (status %d): %s", status, response.body()));
    }
    if (status != 200) {
      throw new IOException(
          String.format(
              "Speech service returned status %d: %s", response.statusCode(), response.body()));
    }

    SegmentResult result = parseResponse(response.body());
    LOGGER.info(
        "Transcription successful: {} words, {} keyword hits",
        result.wordTimestamps().size(),
        result.keywordSpots().size());
    return result;
  }

  URI recognizeUri(List<String> keywords) {
    StringBuilder uri =
        new StringBuilder(properties.baseUrl())
            .append("/v1/recognize?timestamps=true&word_confidence=true&model=")
            .append(encode(properties.model()));
    if (!keywords.isEmpty()) {
      uri.append("&keywords=")
          .append(encode(String.join(",", keywords)))
          .append("&keywords_threshold=")
          .append(properties.keywordsThreshold());
    }
    return URI.create(uri.toString());
  }

  /**
   * Convert a recognize response body into a segment result.
   *
   * @throws TranscriptionException if the body is not the expected JSON
   */
  SegmentResult parseResponse(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new TranscriptionException("Speech service returned invalid JSON", e);
    }
    if (root == null || !root.path("results").isArray()) {
      throw new TranscriptionException("Speech service response has no results array");
    }

    StringBuilder transcript = new StringBuilder();
    List<WordTimestamp> timestamps = new ArrayList<>();
    List<WordConfidence> confidences = new ArrayList<>();
    List<KeywordSpot> keywords = new ArrayList<>();

    for (JsonNode result : root.path("results")) {
      JsonNode best = result.path("alternatives").path(0);
      transcript.append(best.path("transcript").asText(""));

      for (JsonNode ts : best.path("timestamps")) {
        timestamps.add(new WordTimestamp(ts.path(0).asText(), ts.path(1).asDouble(), ts.path(2).asDouble()));
      }
      for (JsonNode wc : best.path("word_confidence")) {
        confidences.add(new WordConfidence(wc.path(0).asText(), wc.path(1).asDouble()));
      }

      Iterator<Map.Entry<String, JsonNode>> spotted = result.path("keywords_result").fields();
      while (spotted.hasNext()) {
        Map.Entry<String, JsonNode> entry = spotted.next();
        for (JsonNode match : entry.getValue()) {
          keywords.add(
              new KeywordSpot(
                  entry.getKey(),
                  match.path("normalized_text").asText(),
                  match.path("start_time").asDouble(),
                  match.path("end_time").asDouble(),
                  match.path("confidence").asDouble()));
        }
      }
    }

    return new SegmentResult(transcript.toString(), timestamps, confidences, keywords);
  }

  private String basicAuth() {
    String token = properties.username() + ":" + properties.password();
    return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
