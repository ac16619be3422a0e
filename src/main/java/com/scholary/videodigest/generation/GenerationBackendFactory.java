package com.scholary.videodigest.generation;

/** Creates generation backends bound to an API key. */
public interface GenerationBackendFactory {

  /**
   * Backend for an explicit API key.
   *
   * @throws IllegalStateException if the key is blank
   */
  GenerationBackend create(String apiKey);

  /**
   * Backend for the configured API key.
   *
   * @throws BackendException if no key is configured
   */
  GenerationBackend defaultBackend();
}
