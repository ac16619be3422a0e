package com.scholary.videodigest.catalog;

import java.util.Locale;

/** Kind of monitored YouTube source. */
public enum SourceType {
  CHANNEL,
  PLAYLIST;

  /**
   * Parse a user-supplied source type, case-insensitive.
   *
   * @throws IllegalArgumentException for unknown values
   */
  public static SourceType fromValue(String value) {
    try {
      return SourceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown source type: " + value, e);
    }
  }

  /** Infer the type from a YouTube id: playlist ids start with "PL", "UU", "OL" or "FL". */
  public static SourceType infer(String sourceId) {
    if (sourceId.startsWith("PL")
        || sourceId.startsWith("UU")
        || sourceId.startsWith("OL")
        || sourceId.startsWith("FL")) {
      return PLAYLIST;
    }
    return CHANNEL;
  }
}
