package com.scholary.videodigest.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and persists a {@link ResultStore} as one pretty-printed JSON document.
 *
 * <p>Format:
 *
 * <pre>
 * {
 *   "dQw4w9WgXcQ": {
 *     "transcript": "...",
 *     "summary": {"English": "...", "German": "..."},
 *     "rating": {"English": [{"ticker": "AAPL", "sentiment": "positive"}]},
 *     "metadata": {"title": "...", "url": "..."}
 *   }
 * }
 * </pre>
 *
 * <p>Every commit rewrites the whole document. Non-ASCII text is written as-is.
 */
public class ResultStoreFile {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResultStoreFile.class);

  private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final DocumentWriter documentWriter;

  public ResultStoreFile(ObjectMapper objectMapper, DocumentWriter documentWriter) {
    this.objectMapper = objectMapper;
    this.documentWriter = documentWriter;
  }

  /**
   * Load the store at {@code path}, creating an empty document if none exists.
   *
   * @throws MalformedStoreException if the file exists but is not a JSON object
   * @throws StorePersistenceException if the empty document cannot be created
   */
  public ResultStore load(Path path) {
    if (!Files.exists(path)) {
      LOGGER.info("No store at {}, creating an empty one", path);
      ResultStore store = new ResultStore();
      persist(store, path);
      return store;
    }

    try {
      Map<String, Object> document = objectMapper.readValue(path.toFile(), DOCUMENT_TYPE);
      if (document == null) {
        throw new MalformedStoreException("Store document is empty: " + path);
      }
      LOGGER.info("Loaded store from {}: {} entries", path, document.size());
      return new ResultStore(document);
    } catch (IOException e) {
      throw new MalformedStoreException("Cannot read store document " + path, e);
    }
  }

  /**
   * Write the whole store to {@code path}.
   *
   * @throws StorePersistenceException if the write fails; a backup of the previous document has
   *     been taken at that point
   */
  public void persist(ResultStore store, Path path) {
    documentWriter.write(
        path,
        () -> {
          synchronized (store) {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(store.asMap());
          }
        });
    LOGGER.debug("Persisted store to {}: {} entries", path, store.size());
  }
}
