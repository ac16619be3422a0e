package com.scholary.videodigest.transcript;

/** Why a transcript could not be fetched. */
public enum TranscriptErrorKind {
  TRANSCRIPTS_DISABLED("Transcripts are disabled for this video."),
  NO_TRANSCRIPT_FOUND("No transcript was found for this video."),
  NOT_TRANSLATABLE("The transcript cannot be translated to the requested language."),
  VIDEO_UNAVAILABLE("The video is unavailable."),
  REQUEST_BLOCKED(
      "Requests are blocked or rate limited by YouTube. Not able to download the transcript."),
  RETRIEVAL_FAILED("The transcript could not be retrieved.");

  private final String description;

  TranscriptErrorKind(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
