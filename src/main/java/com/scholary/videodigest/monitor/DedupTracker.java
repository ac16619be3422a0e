package com.scholary.videodigest.monitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rolling-window deduplication of video ids per monitored source.
 *
 * <p>Each source keeps its most recent known ids, newest first, capped at the window size. A fetch
 * result is merged by putting the fetched ids in front and keeping the previously known ids that
 * were not re-fetched behind them; whatever falls off the end is forgotten.
 */
public class DedupTracker {

  public static final int DEFAULT_WINDOW = 50;

  private final int windowSize;

  public DedupTracker() {
    this(DEFAULT_WINDOW);
  }

  public DedupTracker(int windowSize) {
    if (windowSize <= 0) {
      throw new IllegalArgumentException("Window size must be positive: " + windowSize);
    }
    this.windowSize = windowSize;
  }

  /**
   * Merge freshly fetched ids into a source's known list.
   *
   * @param state the monitor state to update in place
   * @param sourceId the source the ids were fetched from; tracked on first sight
   * @param latestIds fetched ids, newest first
   * @return the same state
   */
  public MonitorState update(MonitorState state, String sourceId, List<String> latestIds) {
    TrackedSource source = state.getSources().computeIfAbsent(sourceId, this::newSource);

    Set<String> combined = new LinkedHashSet<>(latestIds);
    combined.addAll(source.getKnownIds());

    List<String> window = new ArrayList<>(combined);
    if (window.size() > windowSize) {
      window = window.subList(0, windowSize);
    }
    source.setKnownIds(window);
    return state;
  }

  /** True iff {@code videoId} is not in the source's known list. */
  public boolean isNew(MonitorState state, String sourceId, String videoId) {
    TrackedSource source = state.getSources().get(sourceId);
    return source == null || !source.getKnownIds().contains(videoId);
  }

  /**
   * Select the ids of a fetch that have not been seen yet.
   *
   * @param latestIds fetched ids, newest first
   * @return new ids in processing order: oldest first
   */
  public List<String> newIds(MonitorState state, String sourceId, List<String> latestIds) {
    List<String> fresh = new ArrayList<>();
    for (String id : new LinkedHashSet<>(latestIds)) {
      if (isNew(state, sourceId, id)) {
        fresh.add(id);
      }
    }
    Collections.reverse(fresh);
    return fresh;
  }

  /** Remember the outcome of analyzing a video; replaces any earlier record. */
  public void recordAnalysis(MonitorState state, String videoId, AnalysisRecord analysis) {
    state.getAnalyses().put(videoId, analysis);
  }

  private TrackedSource newSource(String sourceId) {
    TrackedSource source = new TrackedSource();
    source.setId(sourceId);
    return source;
  }
}
