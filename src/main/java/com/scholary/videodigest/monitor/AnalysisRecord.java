package com.scholary.videodigest.monitor;

import java.time.Instant;

/**
 * Metadata of the last monitor run that analyzed a video.
 *
 * @param sourceId the source the video was discovered through
 * @param analyzedAt when the analysis finished
 * @param title the video title at that time
 * @param transcriptStored whether a transcript is in the result store
 * @param ratingStored whether a structured rating is in the result store
 */
public record AnalysisRecord(
    String sourceId,
    Instant analyzedAt,
    String title,
    boolean transcriptStored,
    boolean ratingStored) {}
