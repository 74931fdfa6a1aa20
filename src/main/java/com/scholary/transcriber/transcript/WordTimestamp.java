package com.scholary.transcriber.transcript;

/** A recognized word with its start and end time, in seconds from the start of its segment. */
public record WordTimestamp(String word, double startTime, double endTime) {}
