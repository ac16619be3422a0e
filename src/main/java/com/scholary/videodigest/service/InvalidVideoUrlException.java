package com.scholary.videodigest.service;

/** Exception thrown when a URL does not point to a YouTube video. */
public class InvalidVideoUrlException extends RuntimeException {

  public InvalidVideoUrlException(String message) {
    super(message);
  }
}
