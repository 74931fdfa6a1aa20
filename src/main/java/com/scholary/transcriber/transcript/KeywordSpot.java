package com.scholary.transcriber.transcript;

/**
 * One match of a requested keyword, as reported by the speech service.
 *
 * @param keyword the keyword as requested
 * @param normalizedText the spoken text the service matched
 * @param startTime start of the match, segment-relative seconds
 * @param endTime end of the match, segment-relative seconds
 * @param confidence match confidence
 */
public record KeywordSpot(
    String keyword, String normalizedText, double startTime, double endTime, double confidence) {}
