package com.scholary.videodigest.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Nested result cache: entity id -> category -> language -> value.
 *
 * <p>Values are addressed by a key path (an ordered list of keys). Intermediate levels are plain
 * maps; leaves are whatever was committed (a transcript string, a summary, a structured rating).
 * A later {@link #set} on the same path replaces the previous value.
 *
 * <p>The store is an explicit object handed to every caller; it is loaded and persisted by {@link
 * ResultStoreFile}. Operations synchronize on the instance so web request threads see a consistent
 * map. There is no cross-process protection: two processes persisting the same document race and
 * the last writer wins.
 */
public class ResultStore {

  private final Map<String, Object> root;

  public ResultStore() {
    this(new LinkedHashMap<>());
  }

  public ResultStore(Map<String, Object> root) {
    this.root = root;
  }

  /**
   * Check whether a value exists at the key path.
   *
   * <p>Never throws for a missing path: returns false as soon as a key is absent or an
   * intermediate value is not a map.
   */
  public synchronized boolean exists(List<String> keyPath) {
    return lookup(keyPath).isPresent();
  }

  /**
   * Get the value at the key path.
   *
   * @return the value, or empty if the path does not resolve
   */
  public synchronized Optional<Object> get(List<String> keyPath) {
    return lookup(keyPath);
  }

  /** Get a text value at the key path; non-text values are reported as absent. */
  public synchronized Optional<String> getText(List<String> keyPath) {
    return lookup(keyPath).filter(String.class::isInstance).map(String.class::cast);
  }

  /**
   * Assign a value, creating intermediate maps along the key path as needed.
   *
   * <p>A non-map intermediate value is replaced by a new map.
   */
  @SuppressWarnings("unchecked")
  public synchronized void set(List<String> keyPath, Object value) {
    if (keyPath == null || keyPath.isEmpty()) {
      throw new IllegalArgumentException("Key path must not be empty");
    }

    Map<String, Object> current = root;
    for (String key : keyPath.subList(0, keyPath.size() - 1)) {
      Object next = current.get(key);
      if (!(next instanceof Map)) {
        next = new LinkedHashMap<String, Object>();
        current.put(key, next);
      }
      current = (Map<String, Object>) next;
    }
    current.put(keyPath.get(keyPath.size() - 1), value);
  }

  /** Number of top-level entities. */
  public synchronized int size() {
    return root.size();
  }

  /** Read-only view of the whole document, used for serialization. */
  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(root);
  }

  private Optional<Object> lookup(List<String> keyPath) {
    if (keyPath == null || keyPath.isEmpty()) {
      return Optional.empty();
    }

    Object current = root;
    for (String key : keyPath) {
      if (!(current instanceof Map)) {
        return Optional.empty();
      }
      Map<?, ?> map = (Map<?, ?>) current;
      if (!map.containsKey(key)) {
        return Optional.empty();
      }
      current = map.get(key);
    }
    return Optional.ofNullable(current);
  }
}
