package com.scholary.videodigest.config;

import com.scholary.videodigest.generation.GeminiBackendFactory;
import com.scholary.videodigest.generation.GenerationBackendFactory;
import com.scholary.videodigest.generation.PromptTemplates;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the generation backend and its prompts.
 *
 * <p>No Gemini client is created here; the factory builds one on first use so the application
 * starts without an API key.
 */
@Configuration
@EnableConfigurationProperties({GeminiProperties.class, PromptProperties.class})
public class GenerationConfig {

  @Bean
  public GenerationBackendFactory generationBackendFactory(GeminiProperties properties) {
    return new GeminiBackendFactory(properties);
  }

  @Bean
  public PromptTemplates promptTemplates(PromptProperties properties) {
    return new PromptTemplates(properties);
  }
}
