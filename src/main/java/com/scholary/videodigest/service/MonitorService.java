package com.scholary.videodigest.service;

import com.scholary.videodigest.catalog.CatalogService;
import com.scholary.videodigest.catalog.SourceType;
import com.scholary.videodigest.catalog.VideoItem;
import com.scholary.videodigest.generation.BackendException;
import com.scholary.videodigest.generation.GenerationBackend;
import com.scholary.videodigest.generation.OutputLanguage;
import com.scholary.videodigest.generation.PromptTemplates;
import com.scholary.videodigest.logging.StructuredLogger;
import com.scholary.videodigest.monitor.AnalysisRecord;
import com.scholary.videodigest.monitor.DedupTracker;
import com.scholary.videodigest.monitor.MonitorState;
import com.scholary.videodigest.monitor.MonitorStateFile;
import com.scholary.videodigest.monitor.TrackedSource;
import com.scholary.videodigest.repair.ResultParseException;
import com.scholary.videodigest.repair.ResultRepair;
import com.scholary.videodigest.store.Category;
import com.scholary.videodigest.store.ResultStore;
import com.scholary.videodigest.store.ResultStoreFile;
import com.scholary.videodigest.transcript.FetchException;
import com.scholary.videodigest.transcript.TranscriptFetchResult;
import com.scholary.videodigest.transcript.TranscriptProvider;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch flow: polls tracked channels and playlists and analyzes uploads not seen before.
 *
 * <p>For each source, the latest items are fetched (newest first) and compared against the
 * source's rolling window in {@link DedupTracker}. New items are processed oldest first: the
 * transcript is fetched and stored with the item's metadata, then a structured rating is generated,
 * repaired and stored. A failure on one item is logged and the item is skipped; it is left out of
 * the window so the next run retries it.
 */
public class MonitorService {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonitorService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final ResultStore store;
  private final Path storePath;
  private final ResultStoreFile storeFile;
  private final MonitorStateFile stateFile;
  private final Path statePath;
  private final DedupTracker tracker;
  private final CatalogService catalogService;
  private final TranscriptProvider transcriptProvider;
  private final PromptTemplates promptTemplates;
  private final ResultRepair resultRepair;
  private final OutputLanguage language;
  private final int defaultLimit;
  private final Clock clock;

  public MonitorService(
      ResultStore store,
      Path storePath,
      ResultStoreFile storeFile,
      MonitorStateFile stateFile,
      Path statePath,
      DedupTracker tracker,
      CatalogService catalogService,
      TranscriptProvider transcriptProvider,
      PromptTemplates promptTemplates,
      ResultRepair resultRepair,
      OutputLanguage language,
      int defaultLimit,
      Clock clock) {
    this.store = store;
    this.storePath = storePath;
    this.storeFile = storeFile;
    this.stateFile = stateFile;
    this.statePath = statePath;
    this.tracker = tracker;
    this.catalogService = catalogService;
    this.transcriptProvider = transcriptProvider;
    this.promptTemplates = promptTemplates;
    this.resultRepair = resultRepair;
    this.language = language;
    this.defaultLimit = defaultLimit;
    this.clock = clock;
  }

  /** Outcome of one {@link #check} run. */
  public record CheckReport(int sourcesChecked, int newItems, int processed, int skipped) {}

  /**
   * Start tracking a source, or update the name and limit of a tracked one.
   *
   * @param type the source type, or null to infer it from the id
   * @return the tracked source
   */
  public TrackedSource addSource(String sourceId, String name, SourceType type, Integer limit) {
    if (sourceId == null || sourceId.isBlank()) {
      throw new IllegalArgumentException("Source id must not be blank");
    }
    if (limit != null && limit <= 0) {
      throw new IllegalArgumentException("Limit must be positive: " + limit);
    }

    MonitorState state = stateFile.load(statePath);
    TrackedSource source = state.getSources().get(sourceId);
    if (source == null) {
      SourceType sourceType = type != null ? type : SourceType.infer(sourceId);
      source = new TrackedSource(sourceId, name, sourceType, limit);
      state.getSources().put(sourceId, source);
      LOGGER.info("Tracking new source: id={}, type={}", sourceId, source.getType());
    } else {
      if (name != null) {
        source.setName(name);
      }
      if (type != null) {
        source.setType(type);
      }
      if (limit != null) {
        source.setLimit(limit);
      }
      LOGGER.info("Updated tracked source: id={}", sourceId);
    }
    stateFile.persist(state, statePath);
    return source;
  }

  /** All tracked sources, in the order they were added. */
  public List<TrackedSource> listSources() {
    return new ArrayList<>(stateFile.load(statePath).getSources().values());
  }

  /**
   * Poll sources and analyze new uploads.
   *
   * @param sourceIds sources to check; empty checks every tracked source
   * @param limitOverride items to fetch per source, or null for each source's own limit
   * @param backend the generation backend for ratings
   * @return counts of what happened
   */
  public CheckReport check(
      List<String> sourceIds, Integer limitOverride, GenerationBackend backend) {
    MonitorState state = stateFile.load(statePath);
    List<TrackedSource> sources = selectSources(state, sourceIds);
    if (sources.isEmpty()) {
      LOGGER.warn("No sources to check; add one with the 'add' command");
      return new CheckReport(0, 0, 0, 0);
    }

    int newItems = 0;
    int processed = 0;
    int skipped = 0;
    int checked = 0;

    for (TrackedSource source : sources) {
      int limit = resolveLimit(source, limitOverride);
      List<VideoItem> latest;
      try {
        latest = catalogService.latestItems(source.getType(), source.getId(), limit);
      } catch (FetchException e) {
        STRUCTURED_LOGGER.logItemSkipped(source.getId(), "*", e.getKind().name(), e.getMessage());
        continue;
      }
      checked++;

      Map<String, VideoItem> byId = new LinkedHashMap<>();
      for (VideoItem item : latest) {
        byId.putIfAbsent(item.id(), item);
      }
      List<String> latestIds = new ArrayList<>(byId.keySet());
      List<String> fresh = tracker.newIds(state, source.getId(), latestIds);
      STRUCTURED_LOGGER.logSourceChecked(source.getId(), latestIds.size(), fresh.size());
      newItems += fresh.size();

      Set<String> failed = new LinkedHashSet<>();
      for (String videoId : fresh) {
        if (processItem(state, source, byId.get(videoId), backend)) {
          processed++;
        } else {
          failed.add(videoId);
          skipped++;
        }
      }

      List<String> seen = new ArrayList<>(latestIds);
      seen.removeAll(failed);
      tracker.update(state, source.getId(), seen);
      stateFile.persist(state, statePath);
      LOGGER.info("Finished processing {}", source.displayName());
    }

    return new CheckReport(checked, newItems, processed, skipped);
  }

  /**
   * Fetch, store and rate one item.
   *
   * @return false if the item was skipped and should be retried on the next run
   */
  private boolean processItem(
      MonitorState state, TrackedSource source, VideoItem item, GenerationBackend backend) {
    String videoId = item.id();
    List<String> transcriptPath = Category.TRANSCRIPT.keyPath(videoId);

    String transcript = store.getText(transcriptPath).orElse(null);
    if (transcript == null) {
      TranscriptFetchResult result = transcriptProvider.fetch(videoId);
      if (!result.success()) {
        STRUCTURED_LOGGER.logItemSkipped(
            source.getId(), videoId, result.errorKind().name(), result.message());
        return false;
      }
      transcript = result.data();
      store.set(transcriptPath, transcript);
      store.set(Category.METADATA.keyPath(videoId), metadata(source, item));
      storeFile.persist(store, storePath);
    }

    boolean ratingStored = rate(source, videoId, transcript, backend);

    tracker.recordAnalysis(
        state,
        videoId,
        new AnalysisRecord(source.getId(), Instant.now(clock), item.title(), true, ratingStored));
    STRUCTURED_LOGGER.logItemProcessed(source.getId(), videoId, ratingStored);
    return true;
  }

  private boolean rate(
      TrackedSource source, String videoId, String transcript, GenerationBackend backend) {
    List<String> ratingPath = Category.RATING.keyPath(videoId, language.displayName());
    if (store.exists(ratingPath)) {
      return true;
    }

    String prompt =
        promptTemplates.render(promptTemplates.defaultRatingTemplate(), language, transcript);
    try {
      Object rating = resultRepair.parseToValue(backend.generate(prompt));
      store.set(ratingPath, rating);
      storeFile.persist(store, storePath);
      return true;
    } catch (BackendException e) {
      STRUCTURED_LOGGER.logItemSkipped(source.getId(), videoId, "BACKEND", e.getMessage());
    } catch (ResultParseException e) {
      STRUCTURED_LOGGER.logItemSkipped(source.getId(), videoId, "PARSE", e.getMessage());
      LOGGER.debug("Unparseable rating reply for {}: {}", videoId, e.getRawText());
    }
    return false;
  }

  private Map<String, Object> metadata(TrackedSource source, VideoItem item) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("source", source.displayName());
    metadata.put("title", item.title());
    metadata.put("publishedAt", item.publishedAt());
    metadata.put("url", item.url());
    metadata.put("description", item.description());
    metadata.put("processedOn", Instant.now(clock).toString());
    return metadata;
  }

  private List<TrackedSource> selectSources(MonitorState state, List<String> sourceIds) {
    if (sourceIds == null || sourceIds.isEmpty()) {
      return new ArrayList<>(state.getSources().values());
    }
    List<TrackedSource> selected = new ArrayList<>();
    for (String sourceId : sourceIds) {
      TrackedSource source = state.getSources().get(sourceId);
      if (source == null) {
        source = new TrackedSource(sourceId, null, SourceType.infer(sourceId), null);
        state.getSources().put(sourceId, source);
        LOGGER.info("Checking untracked source {}; it will be tracked from now on", sourceId);
      }
      selected.add(source);
    }
    return selected;
  }

  private int resolveLimit(TrackedSource source, Integer limitOverride) {
    if (limitOverride != null && limitOverride > 0) {
      return limitOverride;
    }
    if (source.getLimit() != null && source.getLimit() > 0) {
      return source.getLimit();
    }
    return defaultLimit;
  }
}
