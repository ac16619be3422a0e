package com.scholary.videodigest.transcript;

/**
 * Exception thrown when a transcript or a catalog listing is unavailable.
 *
 * <p>Interactive callers stop processing the item; the monitor logs it and moves on to the next
 * item.
 */
public class FetchException extends RuntimeException {

  private final TranscriptErrorKind kind;

  public FetchException(TranscriptErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public FetchException(TranscriptErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public TranscriptErrorKind getKind() {
    return kind;
  }
}
