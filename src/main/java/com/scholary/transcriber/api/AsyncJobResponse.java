package com.scholary.transcriber.api;

/** Response for async transcription request. Poll /api/jobs/{jobId} for status. */
public record AsyncJobResponse(String jobId) {}
