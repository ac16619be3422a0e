package com.scholary.videodigest.monitor;

import com.scholary.videodigest.catalog.SourceType;
import java.util.ArrayList;
import java.util.List;

/**
 * A channel or playlist watched by the monitor, with its rolling window of known video ids.
 *
 * <p>{@code knownIds} is newest-first and never longer than the tracker's window.
 */
public class TrackedSource {

  private String id;
  private String name;
  private SourceType type;
  private Integer limit;
  private List<String> knownIds = new ArrayList<>();

  public TrackedSource() {}

  public TrackedSource(String id, String name, SourceType type, Integer limit) {
    this.id = id;
    this.name = name;
    this.type = type;
    this.limit = limit;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public SourceType getType() {
    return type;
  }

  public void setType(SourceType type) {
    this.type = type;
  }

  public Integer getLimit() {
    return limit;
  }

  public void setLimit(Integer limit) {
    this.limit = limit;
  }

  public List<String> getKnownIds() {
    return knownIds;
  }

  public void setKnownIds(List<String> knownIds) {
    this.knownIds = knownIds == null ? new ArrayList<>() : new ArrayList<>(knownIds);
  }

  /** Display name, falling back to the id. */
  public String displayName() {
    return name == null || name.isBlank() ? id : name;
  }
}
