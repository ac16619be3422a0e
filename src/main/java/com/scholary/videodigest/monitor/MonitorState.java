package com.scholary.videodigest.monitor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted state of the upload monitor: the tracked sources and the last analysis per video.
 *
 * <pre>
 * {
 *   "sources": {"UC...": {"id": "UC...", "name": "...", "type": "CHANNEL", "limit": 5,
 *                         "knownIds": ["newest", "...", "oldest"]}},
 *   "analyses": {"dQw4w9WgXcQ": {"sourceId": "UC...", "analyzedAt": "...", ...}}
 * }
 * </pre>
 */
public class MonitorState {

  private Map<String, TrackedSource> sources = new LinkedHashMap<>();
  private Map<String, AnalysisRecord> analyses = new LinkedHashMap<>();

  public Map<String, TrackedSource> getSources() {
    return sources;
  }

  public void setSources(Map<String, TrackedSource> sources) {
    this.sources = sources == null ? new LinkedHashMap<>() : new LinkedHashMap<>(sources);
  }

  public Map<String, AnalysisRecord> getAnalyses() {
    return analyses;
  }

  public void setAnalyses(Map<String, AnalysisRecord> analyses) {
    this.analyses = analyses == null ? new LinkedHashMap<>() : new LinkedHashMap<>(analyses);
  }
}
