package com.scholary.videodigest.catalog;

import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.services.youtube.YouTube;
import com.google.api.services.youtube.model.PlaylistItem;
import com.google.api.services.youtube.model.PlaylistItemListResponse;
import com.scholary.videodigest.config.YoutubeProperties;
import com.scholary.videodigest.transcript.FetchException;
import com.scholary.videodigest.transcript.TranscriptErrorKind;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the latest items of a playlist through the YouTube Data API v3.
 *
 * <p>Requires the {@code youtube.api-key} property ({@code GOOGLE_API}).
 */
public class PlaylistCatalogClient implements CatalogProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaylistCatalogClient.class);

  private static final long MAX_RESULTS = 50L;

  private final YouTube youtube;
  private final YoutubeProperties properties;

  public PlaylistCatalogClient(YouTube youtube, YoutubeProperties properties) {
    this.youtube = youtube;
    this.properties = properties;
  }

  @Override
  public SourceType type() {
    return SourceType.PLAYLIST;
  }

  @Override
  public List<VideoItem> latestItems(String playlistId, int limit) {
    if (!properties.hasApiKey()) {
      throw new FetchException(
          TranscriptErrorKind.RETRIEVAL_FAILED,
          "Listing playlist " + playlistId + " requires a YouTube Data API key");
    }

    try {
      YouTube.PlaylistItems.List request =
          youtube.playlistItems().list(List.of("snippet", "contentDetails"));
      request.setPlaylistId(playlistId);
      request.setMaxResults(Math.min(limit, MAX_RESULTS));
      request.setKey(properties.apiKey());
      PlaylistItemListResponse response = request.execute();

      List<VideoItem> items = new ArrayList<>();
      if (response.getItems() != null) {
        for (PlaylistItem item : response.getItems()) {
          if (item.getContentDetails() == null || item.getContentDetails().getVideoId() == null) {
            continue;
          }
          String videoId = item.getContentDetails().getVideoId();
          String publishedAt =
              item.getContentDetails().getVideoPublishedAt() != null
                  ? item.getContentDetails().getVideoPublishedAt().toStringRfc3339()
                  : "";
          String title = item.getSnippet() != null ? item.getSnippet().getTitle() : "";
          String description =
              item.getSnippet() != null ? item.getSnippet().getDescription() : null;
          items.add(
              new VideoItem(videoId, title, publishedAt, VideoItem.watchUrl(videoId), description));
        }
      }
      LOGGER.debug("Playlist listed {} items: playlist={}", items.size(), playlistId);
      return items;

    } catch (GoogleJsonResponseException e) {
      TranscriptErrorKind kind = TranscriptErrorKind.RETRIEVAL_FAILED;
      if (e.getStatusCode() == 403 || e.getStatusCode() == 429) {
        kind = TranscriptErrorKind.REQUEST_BLOCKED;
      } else if (e.getStatusCode() == 404) {
        kind = TranscriptErrorKind.VIDEO_UNAVAILABLE;
      }
      throw new FetchException(
          kind,
          String.format(
              "YouTube Data API returned status %d for playlist %s", e.getStatusCode(), playlistId),
          e);
    } catch (IOException e) {
      throw new FetchException(
          TranscriptErrorKind.RETRIEVAL_FAILED, "Cannot list playlist " + playlistId, e);
    }
  }
}
