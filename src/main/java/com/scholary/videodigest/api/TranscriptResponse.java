package com.scholary.videodigest.api;

/**
 * Transcript of a video.
 *
 * <p>{@code cached} is true when the transcript was served from the result store.
 */
public record TranscriptResponse(String videoId, String transcript, boolean cached) {}
