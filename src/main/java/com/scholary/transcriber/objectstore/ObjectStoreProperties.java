package com.scholary.transcriber.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the audio archive.
 *
 * <p>These map to the "archive.*" keys in application.yml. The archive stage only runs when
 * {@code enabled} is true.
 */
@ConfigurationProperties(prefix = "archive")
@Validated
public record ObjectStoreProperties(
    boolean enabled,
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess) {}
