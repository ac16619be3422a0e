package com.scholary.videodigest.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.videodigest.catalog.SourceType;
import com.scholary.videodigest.config.GeminiProperties;
import com.scholary.videodigest.generation.GenerationBackend;
import com.scholary.videodigest.generation.GenerationBackendFactory;
import com.scholary.videodigest.monitor.TrackedSource;
import com.scholary.videodigest.service.MonitorService;
import com.scholary.videodigest.service.MonitorService.CheckReport;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class MonitorCliRunnerTest {

  @Mock private MonitorService monitorService;
  @Mock private GenerationBackendFactory backendFactory;
  @Mock private GenerationBackend backend;

  private ByteArrayOutputStream output;

  @BeforeEach
  void setUp() {
    output = new ByteArrayOutputStream();
  }

  @Test
  void add_shouldTrackSourceWithOptions() {
    when(monitorService.addSource("PLabc", "Talks", SourceType.PLAYLIST, 3))
        .thenReturn(new TrackedSource("PLabc", "Talks", SourceType.PLAYLIST, 3));

    runner(null).run(args("add", "PLabc", "--name=Talks", "--limit=3", "--type=playlist"));

    assertThat(printed()).contains("Tracking Talks (playlist)");
  }

  @Test
  void add_shouldRequireSourceId() {
    assertThatThrownBy(() -> runner(null).run(args("add")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void add_shouldRejectNonNumericLimit() {
    assertThatThrownBy(() -> runner(null).run(args("add", "UC1", "--limit=many")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void list_shouldPrintTrackedSources() {
    TrackedSource source = new TrackedSource("UC1", null, SourceType.CHANNEL, null);
    source.setKnownIds(List.of("a", "b"));
    when(monitorService.listSources()).thenReturn(List.of(source));

    runner(null).run(args("list"));

    assertThat(printed()).contains("UC1\tchannel\tUC1\tlimit=default\tknown=2");
  }

  @Test
  void check_shouldUseApiKeyOption() {
    when(backendFactory.create("cli-key")).thenReturn(backend);
    when(monitorService.check(List.of("UC1", "UC2"), 4, backend))
        .thenReturn(new CheckReport(2, 3, 2, 1));

    runner(null)
        .run(args("check", "--source=UC1", "--source=UC2", "--limit=4", "--api-key=cli-key"));

    assertThat(printed()).contains("Checked 2 source(s): 3 new, 2 processed, 1 skipped");
  }

  @Test
  void check_shouldBeDefaultCommandAndFallBackToConfiguredKey() {
    when(backendFactory.create("env-key")).thenReturn(backend);
    when(monitorService.check(List.of(), null, backend)).thenReturn(new CheckReport(0, 0, 0, 0));

    runner("env-key").run(args());

    verify(monitorService).check(List.of(), null, backend);
  }

  @Test
  void check_shouldFailWithoutApiKey() {
    assertThatThrownBy(() -> runner(null).run(args("check")))
        .isInstanceOf(IllegalStateException.class);
    verifyNoInteractions(monitorService, backendFactory);
  }

  @Test
  void run_shouldRejectUnknownCommand() {
    assertThatThrownBy(() -> runner(null).run(args("purge")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private MonitorCliRunner runner(String configuredKey) {
    GeminiProperties properties =
        new GeminiProperties(configuredKey, "summary-model", "rating-model", null, 30);
    return new MonitorCliRunner(
        monitorService,
        backendFactory,
        properties,
        new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  private static DefaultApplicationArguments args(String... args) {
    return new DefaultApplicationArguments(args);
  }

  private String printed() {
    return output.toString(StandardCharsets.UTF_8);
  }
}
