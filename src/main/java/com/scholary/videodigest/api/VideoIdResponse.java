package com.scholary.videodigest.api;

/** A video id resolved from a URL. */
public record VideoIdResponse(String videoId) {}
