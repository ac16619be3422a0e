package com.scholary.videodigest.catalog;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Routes listing requests to the provider for the source's type. */
public class CatalogService {

  private final Map<SourceType, CatalogProvider> providers = new EnumMap<>(SourceType.class);

  public CatalogService(List<CatalogProvider> providers) {
    for (CatalogProvider provider : providers) {
      this.providers.put(provider.type(), provider);
    }
  }

  /**
   * Fetch the latest videos of a source, newest first.
   *
   * @throws IllegalStateException if no provider handles the type
   * @throws com.scholary.videodigest.transcript.FetchException if the listing is unavailable
   */
  public List<VideoItem> latestItems(SourceType type, String sourceId, int limit) {
    CatalogProvider provider = providers.get(type);
    if (provider == null) {
      throw new IllegalStateException("No catalog provider for source type " + type);
    }
    return provider.latestItems(sourceId, limit);
  }
}
