package com.scholary.videodigest.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videodigest.catalog.SourceType;
import com.scholary.videodigest.store.DocumentWriter;
import com.scholary.videodigest.store.MalformedStoreException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MonitorStateFileTest {

  @TempDir Path tempDir;

  private MonitorStateFile stateFile;

  @BeforeEach
  void setUp() {
    stateFile = new MonitorStateFile(new ObjectMapper(), new DocumentWriter(Clock.systemUTC()));
  }

  @Test
  void load_shouldReturnEmptyStateWhenMissing() {
    MonitorState state = stateFile.load(tempDir.resolve("monitor-state.json"));

    assertThat(state.getSources()).isEmpty();
    assertThat(state.getAnalyses()).isEmpty();
  }

  @Test
  void persist_shouldRoundTripSourcesAndAnalyses() throws IOException {
    Path path = tempDir.resolve("monitor-state.json");
    MonitorState state = new MonitorState();
    TrackedSource source = new TrackedSource("PLabc", "Talks", SourceType.PLAYLIST, 3);
    source.setKnownIds(List.of("v2", "v1"));
    state.getSources().put("PLabc", source);
    Instant analyzedAt = Instant.parse("2024-05-06T07:08:09Z");
    state.getAnalyses().put("v2", new AnalysisRecord("PLabc", analyzedAt, "Title", true, false));

    stateFile.persist(state, path);
    MonitorState reloaded = stateFile.load(path);

    TrackedSource reloadedSource = reloaded.getSources().get("PLabc");
    assertThat(reloadedSource.getName()).isEqualTo("Talks");
    assertThat(reloadedSource.getType()).isEqualTo(SourceType.PLAYLIST);
    assertThat(reloadedSource.getLimit()).isEqualTo(3);
    assertThat(reloadedSource.getKnownIds()).containsExactly("v2", "v1");
    assertThat(reloaded.getAnalyses().get("v2").analyzedAt()).isEqualTo(analyzedAt);
    assertThat(Files.readString(path)).contains("\"2024-05-06T07:08:09Z\"");
  }

  @Test
  void load_shouldInferMissingSourceTypeAndId() throws IOException {
    Path path = tempDir.resolve("monitor-state.json");
    Files.writeString(
        path,
        "{\"sources\": {"
            + "\"PLabc\": {\"knownIds\": [\"v1\"]},"
            + "\"UC123\": {\"id\": \"UC123\", \"name\": \"Channel\"}}}");

    MonitorState state = stateFile.load(path);

    TrackedSource playlist = state.getSources().get("PLabc");
    assertThat(playlist.getId()).isEqualTo("PLabc");
    assertThat(playlist.getType()).isEqualTo(SourceType.PLAYLIST);
    assertThat(playlist.getKnownIds()).containsExactly("v1");
    assertThat(state.getSources().get("UC123").getType()).isEqualTo(SourceType.CHANNEL);
  }

  @Test
  void load_shouldRejectMalformedDocument() throws IOException {
    Path path = tempDir.resolve("monitor-state.json");
    Files.writeString(path, "not json");

    assertThatThrownBy(() -> stateFile.load(path)).isInstanceOf(MalformedStoreException.class);
  }
}
