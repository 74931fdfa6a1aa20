package com.scholary.transcriber.persistence;

import com.scholary.transcriber.transcript.AggregatedTranscription;

/** Durable storage for finished transcriptions. */
public interface TranscriptionStore {

  /**
   * Store a transcription.
   *
   * @throws PersistenceException if the write fails
   */
  void persist(AggregatedTranscription transcription);
}
