package com.scholary.videodigest.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videodigest.generation.OutputLanguage;
import com.scholary.videodigest.logging.StructuredLogger;
import com.scholary.videodigest.service.DigestService;
import com.scholary.videodigest.service.VideoUrls;
import com.scholary.videodigest.stream.CloseableIterator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * REST API for video digests.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Resolving a video URL to its id
 *   <li>Fetching a transcript
 *   <li>Streaming a summary as plain text
 *   <li>Rating a video as structured JSON
 * </ul>
 *
 * <p>Every result is cached in the result store; repeated requests are served without calling
 * YouTube or the generation backend.
 */
@RestController
@RequestMapping("/api/videos")
@Tag(name = "Video digest", description = "Transcripts, summaries and ratings of videos")
public class VideoDigestController {

  private static final Logger LOGGER = LoggerFactory.getLogger(VideoDigestController.class);

  private final DigestService digestService;

  public VideoDigestController(DigestService digestService) {
    this.digestService = digestService;
  }

  @GetMapping("/resolve")
  @Operation(summary = "Resolve URL", description = "Extract the video id from a video URL")
  public VideoIdResponse resolve(@RequestParam String url) {
    return new VideoIdResponse(VideoUrls.requireVideoId(url));
  }

  @GetMapping("/{videoId}/transcript")
  @Operation(
      summary = "Get transcript",
      description = "Fetch the transcript, or read it from the cache")
  public TranscriptResponse transcript(@PathVariable String videoId) {
    StructuredLogger.setVideoContext(videoId, null);
    try {
      DigestService.TranscriptResult result = digestService.transcript(videoId);
      return new TranscriptResponse(result.videoId(), result.transcript(), result.cached());
    } finally {
      StructuredLogger.clearVideoContext();
    }
  }

  /**
   * Stream a summary.
   *
   * <p>The transcript and backend are resolved before the response starts, so those failures are
   * reported with a proper status. A failure while streaming can only cut the body short.
   */
  @GetMapping(value = "/{videoId}/summary", produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(
      summary = "Stream summary",
      description =
          "Summarize the video in the requested language. Cached summaries are replayed; a custom"
              + " template bypasses the cache")
  public ResponseEntity<StreamingResponseBody> summary(
      @PathVariable String videoId,
      @RequestParam(defaultValue = "English") String language,
      @RequestParam(required = false) String template) {
    OutputLanguage outputLanguage = OutputLanguage.fromValue(language);

    CloseableIterator<String> fragments;
    StructuredLogger.setVideoContext(videoId, outputLanguage.displayName());
    try {
      fragments = digestService.summarize(videoId, outputLanguage, template);
    } finally {
      StructuredLogger.clearVideoContext();
    }

    StreamingResponseBody body =
        (OutputStream out) -> {
          StructuredLogger.setVideoContext(videoId, outputLanguage.displayName());
          try {
            while (fragments.hasNext()) {
              out.write(fragments.next().getBytes(StandardCharsets.UTF_8));
              out.flush();
            }
          } catch (RuntimeException e) {
            LOGGER.error("Summary stream failed: video={}", videoId, e);
            throw e;
          } finally {
            fragments.close();
            StructuredLogger.clearVideoContext();
          }
        };

    return ResponseEntity.ok()
        .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
        .body(body);
  }

  @PostMapping("/{videoId}/rating")
  @Operation(
      summary = "Rate video",
      description = "Generate a structured rating, or read it from the cache")
  public JsonNode rating(
      @PathVariable String videoId, @RequestParam(defaultValue = "English") String language) {
    OutputLanguage outputLanguage = OutputLanguage.fromValue(language);
    StructuredLogger.setVideoContext(videoId, outputLanguage.displayName());
    try {
      return digestService.rate(videoId, outputLanguage);
    } finally {
      StructuredLogger.clearVideoContext();
    }
  }
}
