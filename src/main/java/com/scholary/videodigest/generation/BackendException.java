package com.scholary.videodigest.generation;

/**
 * Exception thrown when the generation backend rejects or fails a request.
 *
 * <p>This covers authentication, quota and transport failures. The core does not retry; the caller
 * decides.
 */
public class BackendException extends RuntimeException {

  private final int statusCode;

  public BackendException(String message) {
    this(message, 0, null);
  }

  public BackendException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status reported by the backend, or 0 if there was none. */
  public int getStatusCode() {
    return statusCode;
  }
}
