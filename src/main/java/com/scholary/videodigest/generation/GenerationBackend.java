package com.scholary.videodigest.generation;

import com.scholary.videodigest.stream.CloseableIterator;

/** Generative text backend. */
public interface GenerationBackend {

  /**
   * Start a streaming generation.
   *
   * <p>The request is sent eagerly; fragments are pulled from the returned iterator as the caller
   * consumes them. The iterator holds the open response; closing it before exhaustion releases the
   * connection.
   *
   * @param prompt the full prompt
   * @return text fragments in the order the backend produced them
   * @throws BackendException if the backend rejects the request or cannot be reached
   */
  CloseableIterator<String> generateStream(String prompt);

  /**
   * Generate a complete reply in one call.
   *
   * @throws BackendException if the backend rejects the request or cannot be reached
   */
  String generate(String prompt);
}
