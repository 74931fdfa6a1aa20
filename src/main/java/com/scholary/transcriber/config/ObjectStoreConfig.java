package com.scholary.transcriber.config;

import com.scholary.transcriber.objectstore.AudioArchiver;
import com.scholary.transcriber.objectstore.ObjectStoreClient;
import com.scholary.transcriber.objectstore.ObjectStoreProperties;
import com.scholary.transcriber.objectstore.S3ObjectStoreClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the audio archive.
 *
 * <p>Only active with {@code archive.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(prefix = "archive", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public AudioArchiver audioArchiver(
      ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    return new AudioArchiver(objectStoreClient, properties.bucket());
  }
}
