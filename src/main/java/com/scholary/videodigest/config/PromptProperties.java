package com.scholary.videodigest.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Default prompt templates.
 *
 * <p>Templates use the {@code {language}} and {@code {transcript}} placeholders. Results generated
 * from these defaults are cached; results of caller-supplied templates are not.
 */
@ConfigurationProperties(prefix = "prompts")
@Validated
public record PromptProperties(@NotBlank String summary, @NotBlank String rating) {}
