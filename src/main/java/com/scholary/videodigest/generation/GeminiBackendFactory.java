package com.scholary.videodigest.generation;

import com.google.genai.Client;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.HttpOptions;
import com.scholary.videodigest.config.GeminiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link GeminiGenerationBackend}s.
 *
 * <p>The backend for the configured key is created on first use and reused.
 */
public class GeminiBackendFactory implements GenerationBackendFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiBackendFactory.class);

  private final GeminiProperties properties;
  private GenerationBackend defaultBackend;

  public GeminiBackendFactory(GeminiProperties properties) {
    this.properties = properties;
  }

  @Override
  public GenerationBackend create(String apiKey) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException("A Gemini API key is required (set API_KEY)");
    }

    Client client =
        Client.builder()
            .apiKey(apiKey)
            .httpOptions(HttpOptions.builder().timeout(properties.timeoutSeconds() * 1000).build())
            .build();

    GenerateContentConfig.Builder config = GenerateContentConfig.builder();
    if (properties.temperature() != null) {
      config.temperature(properties.temperature().floatValue());
    }

    LOGGER.info(
        "Initialized Gemini backend: summaryModel={}, ratingModel={}",
        properties.summaryModel(),
        properties.ratingModel());
    return new GeminiGenerationBackend(
        client, properties.summaryModel(), properties.ratingModel(), config.build());
  }

  @Override
  public synchronized GenerationBackend defaultBackend() {
    if (!properties.hasApiKey()) {
      throw new BackendException("Gemini API key is not configured");
    }
    if (defaultBackend == null) {
      defaultBackend = create(properties.apiKey());
    }
    return defaultBackend;
  }
}
