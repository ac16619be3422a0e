package com.scholary.videodigest.catalog;

import com.scholary.videodigest.config.YoutubeProperties;
import com.scholary.videodigest.transcript.FetchException;
import com.scholary.videodigest.transcript.TranscriptErrorKind;
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
 * Lists the latest uploads of a channel from its public Atom feed.
 *
 * <p>The feed needs no API key but only carries the 15 most recent uploads.
 */
public class ChannelFeedClient implements CatalogProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelFeedClient.class);

  private final HttpClient httpClient;
  private final YoutubeProperties properties;
  private final AtomFeedParser parser = new AtomFeedParser();

  public ChannelFeedClient(YoutubeProperties properties) {
    this(
        properties,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
  }

  ChannelFeedClient(YoutubeProperties properties, HttpClient httpClient) {
    this.properties = properties;
    this.httpClient = httpClient;
  }

  @Override
  public SourceType type() {
    return SourceType.CHANNEL;
  }

  @Override
  public List<VideoItem> latestItems(String channelId, int limit) {
    String query = "?channel_id=" + URLEncoder.encode(channelId, StandardCharsets.UTF_8);
    URI uri = URI.create(properties.feedUrl() + query);
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET()
            .build();

    try {
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      if (response.statusCode() == 404) {
        throw new FetchException(
            TranscriptErrorKind.VIDEO_UNAVAILABLE, "Channel feed not found: " + channelId);
      }
      if (response.statusCode() == 429) {
        throw new FetchException(
            TranscriptErrorKind.REQUEST_BLOCKED, "Channel feed rate limited: " + channelId);
      }
      if (response.statusCode() != 200) {
        throw new FetchException(
            TranscriptErrorKind.RETRIEVAL_FAILED,
            String.format(
                "Channel feed returned status %d for %s", response.statusCode(), channelId));
      }

      List<VideoItem> items = parser.parse(response.body(), limit);
      LOGGER.debug("Channel feed listed {} items: channel={}", items.size(), channelId);
      return items;

    } catch (IOException e) {
      throw new FetchException(
          TranscriptErrorKind.RETRIEVAL_FAILED, "Cannot read channel feed " + channelId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException(
          TranscriptErrorKind.RETRIEVAL_FAILED, "Channel feed request interrupted", e);
    }
  }
}
