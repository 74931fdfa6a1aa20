package com.scholary.transcriber.config;

import com.scholary.transcriber.notification.EmailNotifier;
import com.scholary.transcriber.notification.NotificationProperties;
import com.scholary.transcriber.notification.TranscriptNotifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

/**
 * Configuration for result emails.
 *
 * <p>Only active when {@code spring.mail.host} is set, which is also what makes Spring Boot
 * create the {@link JavaMailSender}.
 */
@Configuration
@ConditionalOnProperty(prefix = "spring.mail", name = "host")
@EnableConfigurationProperties(NotificationProperties.class)
public class NotificationConfig {

  @Bean
  public TranscriptNotifier transcriptNotifier(
      JavaMailSender mailSender,
      NotificationProperties properties,
      @Value("${persistence.enabled:false}") boolean persistenceEnabled) {
    return new EmailNotifier(mailSender, properties, persistenceEnabled);
  }
}
