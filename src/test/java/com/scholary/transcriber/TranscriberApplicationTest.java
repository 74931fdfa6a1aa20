package com.scholary.transcriber;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.transcriber.chunking.ChunkPlanner;
import com.scholary.transcriber.notification.TranscriptNotifier;
import com.scholary.transcriber.objectstore.AudioArchiver;
import com.scholary.transcriber.persistence.TranscriptionStore;
import com.scholary.transcriber.service.TranscriptionPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Default configuration: archive, persistence and mail are all off. */
@SpringBootTest
class TranscriberApplicationTest {

  @Autowired private ApplicationContext context;

  @Test
  void contextLoadsWithOptionalStagesDisabled() {
    assertThat(context.getBean(TranscriptionPipeline.class)).isNotNull();
    assertThat(context.getBean(ChunkPlanner.class).chunkDurationSeconds()).isEqualTo(2968);
    assertThat(context.getBeanNamesForType(AudioArchiver.class)).isEmpty();
    assertThat(context.getBeanNamesForType(TranscriptionStore.class)).isEmpty();
    assertThat(context.getBeanNamesForType(TranscriptNotifier.class)).isEmpty();
  }
}
