package com.scholary.videodigest.monitor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scholary.videodigest.catalog.SourceType;
import com.scholary.videodigest.store.DocumentWriter;
import com.scholary.videodigest.store.MalformedStoreException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and persists {@link MonitorState} as a JSON document.
 *
 * <p>Timestamps are written as ISO-8601 strings whatever the injected mapper is configured with.
 * Sources saved without an id or type get the map key as id and a type inferred from it.
 */
public class MonitorStateFile {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonitorStateFile.class);

  private final ObjectMapper objectMapper;
  private final DocumentWriter documentWriter;

  public MonitorStateFile(ObjectMapper objectMapper, DocumentWriter documentWriter) {
    this.objectMapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.documentWriter = documentWriter;
  }

  /**
   * Load the state at {@code path}; a missing file yields an empty state.
   *
   * @throws MalformedStoreException if the file exists but cannot be read
   */
  public MonitorState load(Path path) {
    if (!Files.exists(path)) {
      LOGGER.info("No monitor state at {}, starting empty", path);
      return new MonitorState();
    }
    try {
      MonitorState state = objectMapper.readValue(path.toFile(), MonitorState.class);
      if (state == null) {
        throw new MalformedStoreException("Monitor state document is empty: " + path);
      }
      fillMissingFields(state);
      return state;
    } catch (IOException e) {
      throw new MalformedStoreException("Cannot read monitor state " + path, e);
    }
  }

  private static void fillMissingFields(MonitorState state) {
    state.getSources().values().removeIf(source -> source == null);
    for (Map.Entry<String, TrackedSource> entry : state.getSources().entrySet()) {
      TrackedSource source = entry.getValue();
      if (source.getId() == null || source.getId().isBlank()) {
        source.setId(entry.getKey());
      }
      if (source.getType() == null) {
        source.setType(SourceType.infer(source.getId()));
        LOGGER.info("Source {} has no type, inferred {}", source.getId(), source.getType());
      }
    }
  }

  /** Write the state to {@code path}, backing up the previous document on failure. */
  public void persist(MonitorState state, Path path) {
    documentWriter.write(
        path, () -> objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state));
  }
}
