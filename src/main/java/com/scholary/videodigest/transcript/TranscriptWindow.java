package com.scholary.videodigest.transcript;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Time range of a video whose captions make up a transcript.
 *
 * <p>A snippet belongs to the window when its start lies within {@code [startSeconds,
 * endSeconds]}, both ends inclusive.
 */
public record TranscriptWindow(double startSeconds, double endSeconds) {

  public static final TranscriptWindow FULL = new TranscriptWindow(0, Double.POSITIVE_INFINITY);

  public TranscriptWindow {
    if (startSeconds < 0 || endSeconds < startSeconds) {
      throw new IllegalArgumentException(
          String.format("Invalid transcript window [%s, %s]", startSeconds, endSeconds));
    }
  }

  public boolean contains(TranscriptSnippet snippet) {
    return startSeconds <= snippet.start() && snippet.start() <= endSeconds;
  }

  /** Join the text of the snippets inside the window with single spaces. */
  public String join(List<TranscriptSnippet> snippets) {
    return snippets.stream()
        .filter(this::contains)
        .map(TranscriptSnippet::text)
        .collect(Collectors.joining(" "));
  }
}
