package com.scholary.videodigest.store;

/**
 * Exception thrown when a store document cannot be written.
 *
 * <p>By the time this is thrown, the previous document (if any) has been copied to a timestamped
 * backup next to it.
 */
public class StorePersistenceException extends RuntimeException {

  public StorePersistenceException(String message) {
    super(message);
  }

  public StorePersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
