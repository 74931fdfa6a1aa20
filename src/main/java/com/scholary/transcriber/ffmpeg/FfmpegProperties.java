package com.scholary.transcriber.ffmpeg;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg invocations.
 *
 * <p>{@code timeoutMinutes} bounds a single invocation; a multi-hour file can take a while to
 * resample, so the default is generous.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(@NotBlank String binary, @Positive long timeoutMinutes) {}
