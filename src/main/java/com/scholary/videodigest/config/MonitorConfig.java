package com.scholary.videodigest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videodigest.catalog.CatalogService;
import com.scholary.videodigest.generation.OutputLanguage;
import com.scholary.videodigest.generation.PromptTemplates;
import com.scholary.videodigest.monitor.DedupTracker;
import com.scholary.videodigest.monitor.MonitorStateFile;
import com.scholary.videodigest.repair.ResultRepair;
import com.scholary.videodigest.service.MonitorService;
import com.scholary.videodigest.store.DocumentWriter;
import com.scholary.videodigest.store.ResultStore;
import com.scholary.videodigest.store.ResultStoreFile;
import com.scholary.videodigest.transcript.TranscriptProvider;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the upload monitor. */
@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class MonitorConfig {

  @Bean
  public DedupTracker dedupTracker(MonitorProperties properties) {
    return new DedupTracker(properties.windowSize());
  }

  @Bean
  public MonitorStateFile monitorStateFile(
      ObjectMapper objectMapper, DocumentWriter documentWriter) {
    return new MonitorStateFile(objectMapper, documentWriter);
  }

  @Bean
  public MonitorService monitorService(
      ResultStore resultStore,
      ResultStoreFile resultStoreFile,
      DigestProperties digestProperties,
      MonitorStateFile monitorStateFile,
      MonitorProperties properties,
      DedupTracker dedupTracker,
      CatalogService catalogService,
      TranscriptProvider transcriptProvider,
      PromptTemplates promptTemplates,
      ResultRepair resultRepair,
      Clock clock) {
    return new MonitorService(
        resultStore,
        Path.of(digestProperties.storePath()),
        resultStoreFile,
        monitorStateFile,
        Path.of(properties.statePath()),
        dedupTracker,
        catalogService,
        transcriptProvider,
        promptTemplates,
        resultRepair,
        OutputLanguage.fromValue(properties.language()),
        properties.fetchLimit(),
        clock);
  }
}
