package com.scholary.transcriber.persistence;

import com.mongodb.MongoException;
import com.scholary.transcriber.transcript.AggregatedTranscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoOperations;

/** Writes each transcription as one document into a MongoDB collection. */
public class MongoTranscriptionStore implements TranscriptionStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(MongoTranscriptionStore.class);

  private final MongoOperations mongoOperations;
  private final String collection;

  public MongoTranscriptionStore(MongoOperations mongoOperations, String collection) {
    this.mongoOperations = mongoOperations;
    this.collection = collection;
  }

  @Override
  public void persist(AggregatedTranscription transcription) {
    try {
      mongoOperations.insert(transcription, collection);
      LOGGER.info(
          "Stored transcription in {} ({} chars)", collection, transcription.transcript().length());
    } catch (DataAccessException | MongoException e) {
      throw new PersistenceException(
          String.format("Failed to store transcription in %s: %s", collection, e.getMessage()), e);
    }
  }
}
