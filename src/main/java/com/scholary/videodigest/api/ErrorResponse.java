package com.scholary.videodigest.api;

/**
 * Error body returned by every endpoint.
 *
 * @param error short error category
 * @param kind the transcript error kind, or null for other errors
 * @param message human readable detail
 */
public record ErrorResponse(String error, String kind, String message) {}
