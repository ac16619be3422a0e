package com.scholary.videodigest.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the upload monitor.
 *
 * <p>Controls where the tracker state lives, how many ids each source remembers and how many
 * items a poll fetches.
 */
@ConfigurationProperties(prefix = "monitor")
@Validated
public record MonitorProperties(
    @NotBlank String statePath,
    @Positive int windowSize,
    @Positive int fetchLimit,
    @NotBlank String language) {}
