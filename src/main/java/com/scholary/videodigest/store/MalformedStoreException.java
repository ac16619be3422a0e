package com.scholary.videodigest.store;

/**
 * Exception thrown when a store document exists but cannot be deserialized.
 *
 * <p>The file is left untouched so it can be inspected or restored by hand.
 */
public class MalformedStoreException extends RuntimeException {

  public MalformedStoreException(String message) {
    super(message);
  }

  public MalformedStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
