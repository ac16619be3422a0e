package com.scholary.videodigest.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the YouTube endpoints: caption tracks, channel feeds and the Data
 * API used for playlists.
 */
@ConfigurationProperties(prefix = "youtube")
@Validated
public record YoutubeProperties(
    @NotBlank String timedTextUrl,
    @NotBlank String feedUrl,
    String apiKey,
    @NotBlank String applicationName,
    List<String> preferredLanguages,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {

  public YoutubeProperties {
    if (preferredLanguages == null) {
      preferredLanguages = List.of();
    }
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
