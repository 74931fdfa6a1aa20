package com.scholary.transcriber.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.scholary.transcriber.persistence.MongoTranscriptionStore;
import com.scholary.transcriber.persistence.PersistenceProperties;
import com.scholary.transcriber.persistence.TranscriptionStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Configuration for the transcription document store.
 *
 * <p>Only active with {@code persistence.enabled=true}. Spring Boot's own Mongo
 * auto-configuration is excluded in application.yml so nothing connects when it is off.
 */
@Configuration
@ConditionalOnProperty(prefix = "persistence", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(PersistenceProperties.class)
public class PersistenceConfig {

  @Bean(destroyMethod = "close")
  public MongoClient mongoClient(PersistenceProperties properties) {
    return MongoClients.create(properties.uri());
  }

  @Bean
  public MongoTemplate mongoTemplate(MongoClient mongoClient, PersistenceProperties properties) {
    return new MongoTemplate(mongoClient, properties.database());
  }

  @Bean
  public TranscriptionStore transcriptionStore(
      MongoTemplate mongoTemplate, PersistenceProperties properties) {
    return new MongoTranscriptionStore(mongoTemplate, properties.collection());
  }
}
