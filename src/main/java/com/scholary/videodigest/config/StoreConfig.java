package com.scholary.videodigest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videodigest.repair.ResultRepair;
import com.scholary.videodigest.store.DocumentWriter;
import com.scholary.videodigest.store.ResultStore;
import com.scholary.videodigest.store.ResultStoreFile;
import com.scholary.videodigest.stream.StreamTee;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the result store and the components that write to it.
 *
 * <p>The store document is loaded once at startup. A document that cannot be read or created
 * fails the context.
 */
@Configuration
@EnableConfigurationProperties(DigestProperties.class)
public class StoreConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public DocumentWriter documentWriter(Clock clock) {
    return new DocumentWriter(clock);
  }

  @Bean
  public ResultStoreFile resultStoreFile(ObjectMapper objectMapper, DocumentWriter documentWriter) {
    return new ResultStoreFile(objectMapper, documentWriter);
  }

  @Bean
  public ResultStore resultStore(ResultStoreFile resultStoreFile, DigestProperties properties) {
    return resultStoreFile.load(Path.of(properties.storePath()));
  }

  @Bean
  public StreamTee streamTee(ResultStoreFile resultStoreFile) {
    return new StreamTee(resultStoreFile);
  }

  @Bean
  public ResultRepair resultRepair(ObjectMapper objectMapper) {
    return new ResultRepair(objectMapper);
  }
}
