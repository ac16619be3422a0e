package com.scholary.videodigest.generation;

import java.util.Locale;

/** Languages results can be generated in. The display name is the cache key. */
public enum OutputLanguage {
  ENGLISH("English", "EN"),
  GERMAN("German", "DE"),
  SPANISH("Spanish", "ES"),
  FRENCH("French", "FR"),
  PORTUGUESE("Portuguese", "PT"),
  ITALIAN("Italian", "IT"),
  CHINESE("Chinese", "CN"),
  JAPANESE("Japanese", "JA"),
  ARABIC("Arabic", "AR");

  private final String displayName;
  private final String isoCode;

  OutputLanguage(String displayName, String isoCode) {
    this.displayName = displayName;
    this.isoCode = isoCode;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Resolve a display name or ISO code, case-insensitive.
   *
   * @throws IllegalArgumentException for unsupported languages
   */
  public static OutputLanguage fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Output language must not be blank");
    }
    String normalized = value.trim();
    for (OutputLanguage language : values()) {
      if (language.displayName.equalsIgnoreCase(normalized)
          || language.isoCode.equalsIgnoreCase(normalized)
          || language.name().equals(normalized.toUpperCase(Locale.ROOT))) {
        return language;
      }
    }
    if ("ZH".equalsIgnoreCase(normalized)) {
      return CHINESE;
    }
    throw new IllegalArgumentException("Unsupported output language: " + value);
  }
}
