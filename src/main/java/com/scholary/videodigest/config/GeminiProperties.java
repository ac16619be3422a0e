package com.scholary.videodigest.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Gemini generation backend.
 *
 * <p>The API key is optional at startup; requests that need the backend fail until it is set.
 */
@ConfigurationProperties(prefix = "gemini")
@Validated
public record GeminiProperties(
    String apiKey,
    @NotBlank String summaryModel,
    @NotBlank String ratingModel,
    Double temperature,
    @Positive int timeoutSeconds) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
