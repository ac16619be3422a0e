package com.scholary.videodigest.catalog;

import java.util.List;

/** Lists the latest videos of one kind of source. */
public interface CatalogProvider {

  /** The source type this provider understands. */
  SourceType type();

  /**
   * Fetch the most recent videos of a source.
   *
   * @param sourceId channel or playlist id
   * @param limit maximum number of items
   * @return items, newest first
   * @throws com.scholary.videodigest.transcript.FetchException if the listing is unavailable
   */
  List<VideoItem> latestItems(String sourceId, int limit);
}
