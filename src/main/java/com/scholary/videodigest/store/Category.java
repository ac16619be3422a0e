package com.scholary.videodigest.store;

import java.util.List;

/**
 * Kinds of derived results kept per video.
 *
 * <p>{@link #TRANSCRIPT} holds a scalar string; {@link #SUMMARY} and {@link #RATING} hold one value
 * per output language; {@link #METADATA} holds the source-provided fields of the video.
 */
public enum Category {
  TRANSCRIPT("transcript"),
  SUMMARY("summary"),
  RATING("rating"),
  METADATA("metadata");

  private final String key;

  Category(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  /** Key path of a per-video value: {@code [videoId, category]}. */
  public List<String> keyPath(String videoId) {
    return List.of(videoId, key);
  }

  /** Key path of a per-language value: {@code [videoId, category, language]}. */
  public List<String> keyPath(String videoId, String language) {
    return List.of(videoId, key, language);
  }
}
