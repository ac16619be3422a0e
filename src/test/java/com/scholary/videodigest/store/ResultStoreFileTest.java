package com.scholary.videodigest.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultStoreFileTest {

  @TempDir Path tempDir;

  private ResultStoreFile storeFile;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:15:30.123Z"), ZoneOffset.UTC);
    storeFile = new ResultStoreFile(new ObjectMapper(), new DocumentWriter(clock));
  }

  @Test
  void load_shouldCreateEmptyDocumentWhenMissing() throws IOException {
    Path path = tempDir.resolve("nested/dir/video_dict.json");

    ResultStore store = storeFile.load(path);

    assertThat(store.size()).isZero();
    assertThat(path).exists();
    assertThat(Files.readString(path).trim()).isEqualTo("{ }");
  }

  @Test
  void persist_shouldRoundTripNestedValues() {
    Path path = tempDir.resolve("video_dict.json");
    ResultStore store = storeFile.load(path);
    store.set(List.of("abc", "transcript"), "hello world");
    store.set(List.of("abc", "rating", "English"), List.of(Map.of("ticker", "AAPL")));

    storeFile.persist(store, path);
    ResultStore reloaded = storeFile.load(path);

    assertThat(reloaded.getText(List.of("abc", "transcript"))).contains("hello world");
    assertThat(reloaded.get(List.of("abc", "rating", "English")))
        .contains(List.of(Map.of("ticker", "AAPL")));
  }

  @Test
  void persist_shouldKeepNonAsciiTextReadable() throws IOException {
    Path path = tempDir.resolve("video_dict.json");
    ResultStore store = new ResultStore();
    store.set(List.of("abc", "summary", "German"), "Größe überprüfen");
    store.set(List.of("abc", "summary", "Chinese"), "视频摘要");

    storeFile.persist(store, path);

    String document = Files.readString(path, StandardCharsets.UTF_8);
    assertThat(document).contains("Größe überprüfen").contains("视频摘要");
  }

  @Test
  void persist_shouldKeepInsertionOrder() throws IOException {
    Path path = tempDir.resolve("video_dict.json");
    ResultStore store = new ResultStore();
    store.set(List.of("zzz", "transcript"), "last letter");
    store.set(List.of("aaa", "transcript"), "first letter");

    storeFile.persist(store, path);

    String document = Files.readString(path);
    assertThat(document.indexOf("zzz")).isLessThan(document.indexOf("aaa"));
  }

  @Test
  void load_shouldRejectMalformedDocument() throws IOException {
    Path path = tempDir.resolve("video_dict.json");
    Files.writeString(path, "{not json");

    assertThatThrownBy(() -> storeFile.load(path)).isInstanceOf(MalformedStoreException.class);
  }

  @Test
  void load_shouldRejectNonObjectDocument() throws IOException {
    Path path = tempDir.resolve("video_dict.json");
    Files.writeString(path, "[1, 2, 3]");

    assertThatThrownBy(() -> storeFile.load(path)).isInstanceOf(MalformedStoreException.class);
  }

  @Test
  void persist_shouldBackUpPreviousDocumentWhenSerializationFails() throws IOException {
    Path path = tempDir.resolve("video_dict.json");
    ResultStore store = storeFile.load(path);
    store.set(List.of("abc", "transcript"), "kept");
    storeFile.persist(store, path);
    String previous = Files.readString(path);

    store.set(List.of("abc", "broken"), new Object());

    assertThatThrownBy(() -> storeFile.persist(store, path))
        .isInstanceOf(StorePersistenceException.class);

    assertThat(Files.readString(path)).isEqualTo(previous);
    Path backup = tempDir.resolve("video_dict.json.20240301-101530-123.bak");
    assertThat(backup).exists();
    assertThat(Files.readString(backup)).isEqualTo(previous);
  }

  @Test
  void persist_shouldNotLeaveTemporaryFiles() throws IOException {
    Path path = tempDir.resolve("video_dict.json");
    ResultStore store = new ResultStore();
    store.set(List.of("abc", "transcript"), "t");

    storeFile.persist(store, path);

    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files).containsExactly(path);
    }
  }
}
