package com.scholary.transcriber.download;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for fetching source audio. Timeouts are in seconds. */
@ConfigurationProperties(prefix = "downloader")
@Validated
public record DownloaderProperties(
    @Positive int connectTimeout, @Positive int readTimeout, @NotBlank String userAgent) {}
