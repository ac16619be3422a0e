package com.scholary.videodigest.stream;

import com.scholary.videodigest.store.ResultStore;
import java.nio.file.Path;
import java.util.List;

/**
 * Where a teed result goes once its stream is exhausted.
 *
 * @param resultStore the store to commit into
 * @param path the document the store is persisted to
 * @param keyPath the slot to assign, e.g. {@code [videoId, "summary", "English"]}
 * @param store whether to commit at all; false discards the accumulated text
 */
public record StoreSink(ResultStore resultStore, Path path, List<String> keyPath, boolean store) {

  public StoreSink {
    keyPath = List.copyOf(keyPath);
  }

  /** A sink that accumulates but never commits. */
  public static StoreSink discarding(ResultStore resultStore, Path path, List<String> keyPath) {
    return new StoreSink(resultStore, path, keyPath, false);
  }
}
