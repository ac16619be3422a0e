package com.scholary.videodigest.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the result store.
 *
 * <p>{@code storePath} defaults to {@code VIDEO_JSON_PATH}.
 */
@ConfigurationProperties(prefix = "digest")
@Validated
public record DigestProperties(@NotBlank String storePath) {}
