package com.scholary.videodigest.transcript;

/**
 * One timed caption line.
 *
 * @param start offset from the start of the video in seconds
 * @param duration display duration in seconds
 * @param text caption text
 */
public record TranscriptSnippet(double start, double duration, String text) {}
