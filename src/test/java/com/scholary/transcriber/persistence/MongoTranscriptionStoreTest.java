package com.scholary.transcriber.persistence;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.transcriber.transcript.AggregatedTranscription;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoOperations;

@ExtendWith(MockitoExtension.class)
class MongoTranscriptionStoreTest {

  @Mock private MongoOperations mongoOperations;

  private final AggregatedTranscription transcription =
      new AggregatedTranscription(
          "hello world ", null, Instant.parse("2024-05-01T12:00:00Z"), List.of(), List.of(),
          List.of());

  @Test
  void persist_insertsIntoConfiguredCollection() {
    new MongoTranscriptionStore(mongoOperations, "transcriptions").persist(transcription);

    verify(mongoOperations).insert(transcription, "transcriptions");
  }

  @Test
  void persist_wrapsDataAccessFailure() {
    when(mongoOperations.insert(any(AggregatedTranscription.class), anyString()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(
            () ->
                new MongoTranscriptionStore(mongoOperations, "transcriptions")
                    .persist(transcription))
        .isInstanceOf(PersistenceException.class)
        .hasMessageContaining("transcriptions")
        .hasMessageContaining("connection refused");
  }
}
