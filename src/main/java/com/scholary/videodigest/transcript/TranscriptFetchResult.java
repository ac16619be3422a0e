package com.scholary.videodigest.transcript;

/**
 * Outcome of a transcript fetch: either the text or a tagged error.
 *
 * @param success whether {@code data} holds the transcript
 * @param data the transcript text, null on failure
 * @param errorKind the failure kind, null on success
 * @param message details for logs and users, null on success
 */
public record TranscriptFetchResult(
    boolean success, String data, TranscriptErrorKind errorKind, String message) {

  public static TranscriptFetchResult success(String data) {
    return new TranscriptFetchResult(true, data, null, null);
  }

  public static TranscriptFetchResult failure(TranscriptErrorKind kind, String message) {
    return new TranscriptFetchResult(false, null, kind, message);
  }

  /**
   * Return the transcript text.
   *
   * @throws FetchException carrying the error kind if the fetch failed
   */
  public String orElseThrow() {
    if (!success) {
      throw new FetchException(errorKind, message != null ? message : errorKind.description());
    }
    return data;
  }
}
