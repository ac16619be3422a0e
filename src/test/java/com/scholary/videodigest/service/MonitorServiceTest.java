package com.scholary.videodigest.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.genai.Client;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.HttpOptions;
import com.scholary.videodigest.catalog.CatalogService;
import com.scholary.videodigest.catalog.SourceType;
import com.scholary.videodigest.catalog.VideoItem;
import com.scholary.videodigest.config.PromptProperties;
import com.scholary.videodigest.generation.BackendException;
import com.scholary.videodigest.generation.GeminiGenerationBackend;
import com.scholary.videodigest.generation.GenerationBackend;
import com.scholary.videodigest.generation.OutputLanguage;
import com.scholary.videodigest.generation.PromptTemplates;
import com.scholary.videodigest.monitor.DedupTracker;
import com.scholary.videodigest.monitor.MonitorState;
import com.scholary.videodigest.monitor.MonitorStateFile;
import com.scholary.videodigest.monitor.TrackedSource;
import com.scholary.videodigest.repair.ResultRepair;
import com.scholary.videodigest.service.MonitorService.CheckReport;
import com.scholary.videodigest.store.DocumentWriter;
import com.scholary.videodigest.store.ResultStore;
import com.scholary.videodigest.store.ResultStoreFile;
import com.scholary.videodigest.transcript.FetchException;
import com.scholary.videodigest.transcript.TranscriptErrorKind;
import com.scholary.videodigest.transcript.TranscriptFetchResult;
import com.scholary.videodigest.transcript.TranscriptProvider;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MonitorServiceTest {

  private static final Instant NOW = Instant.parse("2024-07-01T12:00:00Z");

  @Mock private ResultStoreFile storeFile;
  @Mock private CatalogService catalogService;
  @Mock private TranscriptProvider transcriptProvider;
  @Mock private GenerationBackend backend;

  @TempDir Path tempDir;

  private ResultStore store;
  private Path storePath;
  private Path statePath;
  private MonitorStateFile stateFile;
  private MonitorService service;

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = new ObjectMapper();
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    store = new ResultStore();
    storePath = tempDir.resolve("video_dict.json");
    statePath = tempDir.resolve("monitor-state.json");
    stateFile = new MonitorStateFile(objectMapper, new DocumentWriter(clock));
    service =
        new MonitorService(
            store,
            storePath,
            storeFile,
            stateFile,
            statePath,
            new DedupTracker(),
            catalogService,
            transcriptProvider,
            new PromptTemplates(
                new PromptProperties("S {transcript}", "R {language} {transcript}")),
            new ResultRepair(objectMapper),
            OutputLanguage.ENGLISH,
            5,
            clock);
  }

  @Test
  void addSource_shouldPersistAndInferType() {
    TrackedSource source = service.addSource("PLabc", "Talks", null, 3);

    assertThat(source.getType()).isEqualTo(SourceType.PLAYLIST);
    assertThat(service.listSources())
        .singleElement()
        .satisfies(
            s -> {
              assertThat(s.getId()).isEqualTo("PLabc");
              assertThat(s.getName()).isEqualTo("Talks");
              assertThat(s.getLimit()).isEqualTo(3);
            });
  }

  @Test
  void addSource_shouldUpdateExistingSourceKeepingKnownIds() {
    service.addSource("UC1", null, null, null);
    MonitorState state = stateFile.load(statePath);
    state.getSources().get("UC1").setKnownIds(List.of("v1"));
    stateFile.persist(state, statePath);

    service.addSource("UC1", "Renamed", null, 7);

    TrackedSource source = service.listSources().get(0);
    assertThat(source.getName()).isEqualTo("Renamed");
    assertThat(source.getLimit()).isEqualTo(7);
    assertThat(source.getKnownIds()).containsExactly("v1");
  }

  @Test
  void addSource_shouldRejectNonPositiveLimit() {
    assertThatThrownBy(() -> service.addSource("UC1", null, null, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void check_shouldProcessNewItemsOldestFirstAndRememberThem() {
    service.addSource("UC1", "Channel", SourceType.CHANNEL, null);
    when(catalogService.latestItems(SourceType.CHANNEL, "UC1", 5))
        .thenReturn(List.of(item("v2"), item("v1")));
    when(transcriptProvider.fetch("v1")).thenReturn(TranscriptFetchResult.success("one"));
    when(transcriptProvider.fetch("v2")).thenReturn(TranscriptFetchResult.success("two"));
    when(backend.generate("R English one")).thenReturn("{\"score\": 1}");
    when(backend.generate("R English two")).thenReturn("{\"score\": 2}");

    CheckReport report = service.check(List.of(), null, backend);

    assertThat(report).isEqualTo(new CheckReport(1, 2, 2, 0));
    InOrder order = Mockito.inOrder(transcriptProvider);
    order.verify(transcriptProvider).fetch("v1");
    order.verify(transcriptProvider).fetch("v2");
    assertThat(store.getText(List.of("v1", "transcript"))).contains("one");
    assertThat(store.get(List.of("v2", "rating", "English"))).contains(Map.of("score", 2));
    assertThat(store.get(List.of("v1", "metadata", "title"))).contains("Title v1");

    MonitorState state = stateFile.load(statePath);
    assertThat(state.getSources().get("UC1").getKnownIds()).containsExactly("v2", "v1");
    assertThat(state.getAnalyses().get("v1").analyzedAt()).isEqualTo(NOW);
    assertThat(state.getAnalyses().get("v1").ratingStored()).isTrue();
  }

  @Test
  void check_shouldSkipAlreadySeenItems() {
    service.addSource("UC1", null, SourceType.CHANNEL, null);
    MonitorState state = stateFile.load(statePath);
    state.getSources().get("UC1").setKnownIds(List.of("v1"));
    stateFile.persist(state, statePath);
    when(catalogService.latestItems(SourceType.CHANNEL, "UC1", 5)).thenReturn(List.of(item("v1")));

    CheckReport report = service.check(List.of(), null, backend);

    assertThat(report).isEqualTo(new CheckReport(1, 0, 0, 0));
    verifyNoInteractions(transcriptProvider, backend);
  }

  @Test
  void check_shouldSkipFailedItemAndRetryItNextRun() {
    service.addSource("UC1", null, SourceType.CHANNEL, null);
    when(catalogService.latestItems(SourceType.CHANNEL, "UC1", 5))
        .thenReturn(List.of(item("good"), item("bad")));
    when(transcriptProvider.fetch("bad"))
        .thenReturn(
            TranscriptFetchResult.failure(TranscriptErrorKind.TRANSCRIPTS_DISABLED, "disabled"));
    when(transcriptProvider.fetch("good")).thenReturn(TranscriptFetchResult.success("text"));
    when(backend.generate(anyString())).thenReturn("[1]");

    CheckReport report = service.check(List.of(), null, backend);

    assertThat(report).isEqualTo(new CheckReport(1, 2, 1, 1));
    assertThat(store.exists(List.of("bad"))).isFalse();
    MonitorState state = stateFile.load(statePath);
    assertThat(state.getSources().get("UC1").getKnownIds()).containsExactly("good");
    assertThat(state.getAnalyses()).containsOnlyKeys("good");
  }

  @Test
  void check_shouldKeepTranscriptWhenRatingFails() {
    service.addSource("UC1", null, SourceType.CHANNEL, null);
    when(catalogService.latestItems(SourceType.CHANNEL, "UC1", 5)).thenReturn(List.of(item("v1")));
    when(transcriptProvider.fetch("v1")).thenReturn(TranscriptFetchResult.success("text"));
    when(backend.generate(anyString())).thenThrow(new BackendException("quota exceeded"));

    CheckReport report = service.check(List.of(), null, backend);

    assertThat(report.processed()).isEqualTo(1);
    assertThat(store.getText(List.of("v1", "transcript"))).contains("text");
    assertThat(store.exists(List.of("v1", "rating"))).isFalse();
    assertThat(stateFile.load(statePath).getAnalyses().get("v1").ratingStored()).isFalse();
  }

  @Test
  void check_shouldContinueWithNextItemWhenBackendIsUnreachable() {
    service.addSource("UC1", null, SourceType.CHANNEL, null);
    when(catalogService.latestItems(SourceType.CHANNEL, "UC1", 5))
        .thenReturn(List.of(item("v2"), item("v1")));
    when(transcriptProvider.fetch("v1")).thenReturn(TranscriptFetchResult.success("one"));
    when(transcriptProvider.fetch("v2")).thenReturn(TranscriptFetchResult.success("two"));
    Client client =
        Client.builder()
            .apiKey("test-key")
            .httpOptions(HttpOptions.builder().baseUrl("http://127.0.0.1:1/").timeout(2000).build())
            .build();
    GeminiGenerationBackend unreachable =
        new GeminiGenerationBackend(
            client, "summary-model", "rating-model", GenerateContentConfig.builder().build());

    CheckReport report = service.check(List.of(), null, unreachable);

    assertThat(report).isEqualTo(new CheckReport(1, 2, 2, 0));
    assertThat(store.getText(List.of("v2", "transcript"))).contains("two");
    MonitorState state = stateFile.load(statePath);
    assertThat(state.getSources().get("UC1").getKnownIds()).containsExactly("v2", "v1");
    assertThat(state.getAnalyses().get("v1").ratingStored()).isFalse();
    assertThat(state.getAnalyses().get("v2").ratingStored()).isFalse();
  }

  @Test
  void check_shouldInferTypeOfSourceStoredWithoutOne() throws IOException {
    Files.writeString(statePath, "{\"sources\": {\"PLold\": {\"knownIds\": []}}}");
    when(catalogService.latestItems(SourceType.PLAYLIST, "PLold", 5)).thenReturn(List.of());

    CheckReport report = service.check(List.of(), null, backend);

    assertThat(report.sourcesChecked()).isEqualTo(1);
    assertThat(service.listSources())
        .singleElement()
        .satisfies(s -> assertThat(s.getType()).isEqualTo(SourceType.PLAYLIST));
  }

  @Test
  void check_shouldReuseStoredTranscriptAndRating() {
    service.addSource("UC1", null, SourceType.CHANNEL, null);
    store.set(List.of("v1", "transcript"), "text");
    store.set(List.of("v1", "rating", "English"), List.of());
    when(catalogService.latestItems(SourceType.CHANNEL, "UC1", 5)).thenReturn(List.of(item("v1")));

    CheckReport report = service.check(List.of(), null, backend);

    assertThat(report.processed()).isEqualTo(1);
    verifyNoInteractions(transcriptProvider, backend);
    verify(storeFile, never()).persist(store, storePath);
  }

  @Test
  void check_shouldContinueWithNextSourceWhenListingFails() {
    service.addSource("UC1", null, SourceType.CHANNEL, null);
    service.addSource("UC2", null, SourceType.CHANNEL, 2);
    when(catalogService.latestItems(SourceType.CHANNEL, "UC1", 5))
        .thenThrow(new FetchException(TranscriptErrorKind.REQUEST_BLOCKED, "blocked"));
    when(catalogService.latestItems(SourceType.CHANNEL, "UC2", 2)).thenReturn(List.of());

    CheckReport report = service.check(List.of(), null, backend);

    assertThat(report.sourcesChecked()).isEqualTo(1);
  }

  @Test
  void check_shouldHonourSourceFilterAndLimitOverride() {
    service.addSource("UC1", null, SourceType.CHANNEL, null);
    when(catalogService.latestItems(SourceType.PLAYLIST, "PLnew", 9)).thenReturn(List.of());

    CheckReport report = service.check(List.of("PLnew"), 9, backend);

    assertThat(report.sourcesChecked()).isEqualTo(1);
    assertThat(service.listSources())
        .extracting(TrackedSource::getId)
        .containsExactly("UC1", "PLnew");
  }

  @Test
  void check_shouldDoNothingWithoutSources() {
    assertThat(service.check(List.of(), null, backend)).isEqualTo(new CheckReport(0, 0, 0, 0));
    verifyNoInteractions(catalogService);
  }

  private static VideoItem item(String id) {
    return new VideoItem(id, "Title " + id, "2024-06-01T00:00:00Z", VideoItem.watchUrl(id), null);
  }
}
