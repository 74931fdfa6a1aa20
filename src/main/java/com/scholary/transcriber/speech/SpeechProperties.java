package com.scholary.transcriber.speech;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech service client.
 *
 * <p>Credentials are sent as HTTP basic auth. {@code maxRetries} counts attempts, so 1 means a
 * single try.
 */
@ConfigurationProperties(prefix = "speech")
@Validated
public record SpeechProperties(
    @NotBlank String baseUrl,
    @NotBlank String username,
    @NotBlank String password,
    @NotBlank String model,
    @DecimalMin("0.0") @DecimalMax("1.0") double keywordsThreshold,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
