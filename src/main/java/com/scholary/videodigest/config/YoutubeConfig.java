package com.scholary.videodigest.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.youtube.YouTube;
import com.scholary.videodigest.catalog.CatalogProvider;
import com.scholary.videodigest.catalog.CatalogService;
import com.scholary.videodigest.catalog.ChannelFeedClient;
import com.scholary.videodigest.catalog.PlaylistCatalogClient;
import com.scholary.videodigest.transcript.TimedTextTranscriptProvider;
import com.scholary.videodigest.transcript.TranscriptProvider;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for everything that talks to YouTube: caption tracks, channel feeds and the Data
 * API.
 */
@Configuration
@EnableConfigurationProperties(YoutubeProperties.class)
public class YoutubeConfig {

  @Bean
  public TranscriptProvider transcriptProvider(YoutubeProperties properties) {
    return new TimedTextTranscriptProvider(properties);
  }

  @Bean
  public YouTube youtube(YoutubeProperties properties)
      throws GeneralSecurityException, IOException {
    return new YouTube.Builder(
            GoogleNetHttpTransport.newTrustedTransport(),
            GsonFactory.getDefaultInstance(),
            request -> {
              request.setConnectTimeout(properties.connectTimeout() * 1000);
              request.setReadTimeout(properties.readTimeout() * 1000);
            })
        .setApplicationName(properties.applicationName())
        .build();
  }

  @Bean
  public ChannelFeedClient channelFeedClient(YoutubeProperties properties) {
    return new ChannelFeedClient(properties);
  }

  @Bean
  public PlaylistCatalogClient playlistCatalogClient(
      YouTube youtube, YoutubeProperties properties) {
    return new PlaylistCatalogClient(youtube, properties);
  }

  @Bean
  public CatalogService catalogService(List<CatalogProvider> providers) {
    return new CatalogService(providers);
  }
}
