package com.scholary.videodigest.transcript;

import com.scholary.videodigest.config.YoutubeProperties;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches transcripts from YouTube's timed-text caption endpoint.
 *
 * <p>Lists the caption tracks of a video, picks the first track in one of the preferred languages
 * (or simply the first track), downloads it and joins the snippets inside the requested window.
 *
 * <p>Transient I/O failures are retried with exponential backoff. HTTP status codes are mapped to
 * {@link TranscriptErrorKind}s instead of being thrown.
 */
public class TimedTextTranscriptProvider implements TranscriptProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimedTextTranscriptProvider.class);

  private final HttpClient httpClient;
  private final YoutubeProperties properties;
  private final TimedTextParser parser = new TimedTextParser();

  public TimedTextTranscriptProvider(YoutubeProperties properties) {
    this(
        properties,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
  }

  TimedTextTranscriptProvider(YoutubeProperties properties, HttpClient httpClient) {
    this.properties = properties;
    this.httpClient = httpClient;

    LOGGER.info(
        "Initialized timed-text transcript provider: baseUrl={}", properties.timedTextUrl());
  }

  @Override
  public TranscriptFetchResult fetch(String videoId, TranscriptWindow window) {
    LOGGER.info("Fetching transcript: video={}", videoId);

    try {
      HttpResponse<String> listResponse = get(trackListUri(videoId));
      TranscriptFetchResult failure = checkStatus(listResponse, videoId);
      if (failure != null) {
        return failure;
      }
      if (listResponse.body() == null || listResponse.body().isBlank()) {
        return TranscriptFetchResult.failure(
            TranscriptErrorKind.TRANSCRIPTS_DISABLED, "No caption tracks published for " + videoId);
      }

      List<TimedTextParser.Track> tracks = parser.parseTrackList(listResponse.body());
      if (tracks.isEmpty()) {
        return TranscriptFetchResult.failure(
            TranscriptErrorKind.NO_TRANSCRIPT_FOUND, "No caption track found for " + videoId);
      }

      TimedTextParser.Track track = selectTrack(tracks);
      HttpResponse<String> trackResponse = get(trackUri(videoId, track));
      failure = checkStatus(trackResponse, videoId);
      if (failure != null) {
        return failure;
      }

      List<TranscriptSnippet> snippets = parser.parseTrack(trackResponse.body());
      String transcript = window.join(snippets);
      if (transcript.isBlank()) {
        return TranscriptFetchResult.failure(
            TranscriptErrorKind.NO_TRANSCRIPT_FOUND,
            String.format("Caption track %s of %s is empty", track.languageCode(), videoId));
      }

      LOGGER.info(
          "Transcript fetched: video={}, language={}, snippets={}, characters={}",
          videoId,
          track.languageCode(),
          snippets.size(),
          transcript.length());
      return TranscriptFetchResult.success(transcript);

    } catch (IOException e) {
      LOGGER.warn("Transcript retrieval failed: video={}", videoId, e);
      return TranscriptFetchResult.failure(
          TranscriptErrorKind.RETRIEVAL_FAILED, "Transcript retrieval failed: " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return TranscriptFetchResult.failure(
          TranscriptErrorKind.RETRIEVAL_FAILED, "Transcript retrieval interrupted");
    }
  }

  private TimedTextParser.Track selectTrack(List<TimedTextParser.Track> tracks) {
    for (String language : properties.preferredLanguages()) {
      for (TimedTextParser.Track track : tracks) {
        if (track.languageCode().equalsIgnoreCase(language)) {
          return track;
        }
      }
    }
    return tracks.get(0);
  }

  private TranscriptFetchResult checkStatus(HttpResponse<String> response, String videoId) {
    int status = response.statusCode();
    if (status == 200) {
      return null;
    }
    if (status == 429) {
      return TranscriptFetchResult.failure(
          TranscriptErrorKind.REQUEST_BLOCKED, "YouTube rate limited the request for " + videoId);
    }
    if (status == 404 || status == 410) {
      return TranscriptFetchResult.failure(
          TranscriptErrorKind.VIDEO_UNAVAILABLE, "Video " + videoId + " is unavailable");
    }
    if (status == 403) {
      return TranscriptFetchResult.failure(
          TranscriptErrorKind.REQUEST_BLOCKED, "YouTube refused the request for " + videoId);
    }
    return TranscriptFetchResult.failure(
        TranscriptErrorKind.RETRIEVAL_FAILED,
        String.format("Caption endpoint returned status %d for %s", status, videoId));
  }

  /**
   * Send a GET request, retrying I/O failures with exponential backoff and jitter.
   *
   * @throws IOException if every attempt failed
   */
  private HttpResponse<String> get(URI uri) throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET()
            .build();

    int attempt = 0;
    IOException lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        LOGGER.debug("Sending caption request to {}", uri);
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Caption request attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          Thread.sleep(backoffMs);
        }
      }
    }

    throw new IOException(
        String.format("Caption request failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private URI trackListUri(String videoId) {
    return URI.create(properties.timedTextUrl() + "?type=list&v=" + encode(videoId));
  }

  private URI trackUri(String videoId, TimedTextParser.Track track) {
    StringBuilder uri =
        new StringBuilder(properties.timedTextUrl())
            .append("?v=")
            .append(encode(videoId))
            .append("&lang=")
            .append(encode(track.languageCode()));
    if (track.name() != null && !track.name().isEmpty()) {
      uri.append("&name=").append(encode(track.name()));
    }
    return URI.create(uri.toString());
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
