package com.scholary.videodigest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videodigest.generation.GenerationBackendFactory;
import com.scholary.videodigest.generation.PromptTemplates;
import com.scholary.videodigest.repair.ResultRepair;
import com.scholary.videodigest.service.DigestService;
import com.scholary.videodigest.store.ResultStore;
import com.scholary.videodigest.store.ResultStoreFile;
import com.scholary.videodigest.stream.StreamTee;
import com.scholary.videodigest.transcript.TranscriptProvider;
import java.nio.file.Path;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the interactive transcript, summary and rating flow. */
@Configuration
public class DigestConfig {

  @Bean
  public DigestService digestService(
      ResultStore resultStore,
      DigestProperties digestProperties,
      ResultStoreFile resultStoreFile,
      TranscriptProvider transcriptProvider,
      GenerationBackendFactory generationBackendFactory,
      PromptTemplates promptTemplates,
      StreamTee streamTee,
      ResultRepair resultRepair,
      ObjectMapper objectMapper) {
    return new DigestService(
        resultStore,
        Path.of(digestProperties.storePath()),
        resultStoreFile,
        transcriptProvider,
        generationBackendFactory,
        promptTemplates,
        streamTee,
        resultRepair,
        objectMapper);
  }
}
