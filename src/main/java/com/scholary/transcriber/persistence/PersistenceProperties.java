package com.scholary.transcriber.persistence;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the transcription document store.
 *
 * <p>The persist stage only runs when {@code enabled} is true.
 */
@ConfigurationProperties(prefix = "persistence")
@Validated
public record PersistenceProperties(
    boolean enabled, @NotBlank String uri, @NotBlank String database, @NotBlank String collection) {}
