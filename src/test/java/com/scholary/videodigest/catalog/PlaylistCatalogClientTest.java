package com.scholary.videodigest.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.api.client.util.DateTime;
import com.google.api.services.youtube.YouTube;
import com.google.api.services.youtube.model.PlaylistItem;
import com.google.api.services.youtube.model.PlaylistItemContentDetails;
import com.google.api.services.youtube.model.PlaylistItemListResponse;
import com.google.api.services.youtube.model.PlaylistItemSnippet;
import com.scholary.videodigest.config.YoutubeProperties;
import com.scholary.videodigest.transcript.FetchException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PlaylistCatalogClientTest {

  @Mock private YouTube youtube;
  @Mock private YouTube.PlaylistItems playlistItems;
  @Mock private YouTube.PlaylistItems.List request;

  @Test
  void latestItems_shouldMapPlaylistItems() throws Exception {
    PlaylistItem item =
        new PlaylistItem()
            .setSnippet(new PlaylistItemSnippet().setTitle("Episode 1").setDescription("Pilot"))
            .setContentDetails(
                new PlaylistItemContentDetails()
                    .setVideoId("vid001")
                    .setVideoPublishedAt(new DateTime("2024-02-03T04:05:06Z")));
    PlaylistItem deleted = new PlaylistItem().setSnippet(new PlaylistItemSnippet().setTitle("x"));
    when(youtube.playlistItems()).thenReturn(playlistItems);
    when(playlistItems.list(List.of("snippet", "contentDetails"))).thenReturn(request);
    when(request.execute())
        .thenReturn(new PlaylistItemListResponse().setItems(List.of(item, deleted)));

    PlaylistCatalogClient client = new PlaylistCatalogClient(youtube, properties("key-123"));
    List<VideoItem> items = client.latestItems("PLabc", 5);

    assertThat(items).hasSize(1);
    assertThat(items.get(0).id()).isEqualTo("vid001");
    assertThat(items.get(0).title()).isEqualTo("Episode 1");
    assertThat(items.get(0).description()).isEqualTo("Pilot");
    verify(request).setPlaylistId("PLabc");
    verify(request).setMaxResults(5L);
    verify(request).setKey("key-123");
  }

  @Test
  void latestItems_shouldRequireApiKey() {
    PlaylistCatalogClient client = new PlaylistCatalogClient(youtube, properties(null));

    assertThatThrownBy(() -> client.latestItems("PLabc", 5)).isInstanceOf(FetchException.class);
    verifyNoInteractions(youtube);
  }

  private static YoutubeProperties properties(String apiKey) {
    return new YoutubeProperties(
        "https://captions.test", "https://feeds.test", apiKey, "test", null, 5, 5, 1);
  }
}
