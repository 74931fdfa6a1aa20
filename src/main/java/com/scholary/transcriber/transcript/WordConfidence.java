package com.scholary.transcriber.transcript;

/** A recognized word with the service's confidence score (0.0 to 1.0). */
public record WordConfidence(String word, double score) {}
