package com.scholary.videodigest.generation;

import com.scholary.videodigest.config.PromptProperties;

/** Fills prompt templates and tells default templates from customized ones. */
public class PromptTemplates {

  private static final String LANGUAGE = "{language}";
  private static final String TRANSCRIPT = "{transcript}";

  private final PromptProperties properties;

  public PromptTemplates(PromptProperties properties) {
    this.properties = properties;
  }

  public String defaultSummaryTemplate() {
    return properties.summary();
  }

  public String defaultRatingTemplate() {
    return properties.rating();
  }

  /** True if {@code template} is absent or identical to the configured summary template. */
  public boolean isDefaultSummary(String template) {
    return template == null || template.isBlank() || template.equals(properties.summary());
  }

  public String render(String template, OutputLanguage language, String transcript) {
    return template.replace(LANGUAGE, language.displayName()).replace(TRANSCRIPT, transcript);
  }
}
