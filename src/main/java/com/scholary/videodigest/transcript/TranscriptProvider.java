package com.scholary.videodigest.transcript;

/** Source of video transcripts. */
public interface TranscriptProvider {

  /**
   * Fetch the transcript of part of a video.
   *
   * <p>Failures are reported through the result, not thrown.
   *
   * @param videoId the YouTube video id
   * @param window the time range to include
   * @return the transcript text or a tagged error
   */
  TranscriptFetchResult fetch(String videoId, TranscriptWindow window);

  /** Fetch the transcript of the whole video. */
  default TranscriptFetchResult fetch(String videoId) {
    return fetch(videoId, TranscriptWindow.FULL);
  }
}
