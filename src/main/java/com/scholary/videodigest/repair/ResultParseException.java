package com.scholary.videodigest.repair;

/**
 * Exception thrown when no repair step produced a parseable JSON object or array.
 *
 * <p>Carries the unmodified backend reply for diagnostics.
 */
public class ResultParseException extends RuntimeException {

  private final String rawText;

  public ResultParseException(String message, String rawText) {
    super(message);
    this.rawText = rawText;
  }

  public ResultParseException(String message, String rawText, Throwable cause) {
    super(message, cause);
    this.rawText = rawText;
  }

  public String getRawText() {
    return rawText;
  }
}
