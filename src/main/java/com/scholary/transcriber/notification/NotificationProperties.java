package com.scholary.transcriber.notification;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for result emails.
 *
 * <p>Subjects are format strings taking the task id. The SMTP server itself is configured with
 * Spring Boot's {@code spring.mail.*} keys; without {@code spring.mail.host} no mail is sent.
 */
@ConfigurationProperties(prefix = "notification")
@Validated
public record NotificationProperties(
    @NotBlank String from, @NotBlank String successSubject, @NotBlank String failureSubject) {}
