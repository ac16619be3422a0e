package com.scholary.videodigest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videodigest.generation.GenerationBackendFactory;
import com.scholary.videodigest.generation.OutputLanguage;
import com.scholary.videodigest.generation.PromptTemplates;
import com.scholary.videodigest.logging.StructuredLogger;
import com.scholary.videodigest.repair.ResultRepair;
import com.scholary.videodigest.store.Category;
import com.scholary.videodigest.store.ResultStore;
import com.scholary.videodigest.store.ResultStoreFile;
import com.scholary.videodigest.stream.CloseableIterator;
import com.scholary.videodigest.stream.StoreSink;
import com.scholary.videodigest.stream.StreamTee;
import com.scholary.videodigest.transcript.TranscriptProvider;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive flow: transcript, summary and rating of a single video.
 *
 * <p>Every result is looked up in the {@link ResultStore} before anything expensive happens:
 *
 * <ol>
 *   <li>Transcript: cached under {@code [videoId, "transcript"]}, fetched on a miss
 *   <li>Summary: cached under {@code [videoId, "summary", language]}; a miss streams from the
 *       backend through a {@link StreamTee} that commits the full text once the caller has read it
 *   <li>Rating: cached under {@code [videoId, "rating", language]}; a miss asks the backend for
 *       JSON, repairs the reply and stores the structured value
 * </ol>
 */
public class DigestService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DigestService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final ResultStore store;
  private final Path storePath;
  private final ResultStoreFile storeFile;
  private final TranscriptProvider transcriptProvider;
  private final GenerationBackendFactory backendFactory;
  private final PromptTemplates promptTemplates;
  private final StreamTee streamTee;
  private final ResultRepair resultRepair;
  private final ObjectMapper objectMapper;

  public DigestService(
      ResultStore store,
      Path storePath,
      ResultStoreFile storeFile,
      TranscriptProvider transcriptProvider,
      GenerationBackendFactory backendFactory,
      PromptTemplates promptTemplates,
      StreamTee streamTee,
      ResultRepair resultRepair,
      ObjectMapper objectMapper) {
    this.store = store;
    this.storePath = storePath;
    this.storeFile = storeFile;
    this.transcriptProvider = transcriptProvider;
    this.backendFactory = backendFactory;
    this.promptTemplates = promptTemplates;
    this.streamTee = streamTee;
    this.resultRepair = resultRepair;
    this.objectMapper = objectMapper;
  }

  /** A transcript and whether it came from the store. */
  public record TranscriptResult(String videoId, String transcript, boolean cached) {}

  /**
   * Get the transcript of a video, fetching and storing it on a miss.
   *
   * @throws com.scholary.videodigest.transcript.FetchException if the transcript is unavailable
   */
  public TranscriptResult transcript(String videoId) {
    List<String> keyPath = Category.TRANSCRIPT.keyPath(videoId);
    Optional<String> cached = store.getText(keyPath);
    if (cached.isPresent()) {
      STRUCTURED_LOGGER.logCacheHit(videoId, Category.TRANSCRIPT.key(), null);
      return new TranscriptResult(videoId, cached.get(), true);
    }

    STRUCTURED_LOGGER.logCacheMiss(videoId, Category.TRANSCRIPT.key(), null);
    String transcript = transcriptProvider.fetch(videoId).orElseThrow();
    store.set(keyPath, transcript);
    storeFile.persist(store, storePath);
    return new TranscriptResult(videoId, transcript, false);
  }

  /**
   * Summarize a video with the default summary template.
   *
   * @see #summarize(String, OutputLanguage, String)
   */
  public CloseableIterator<String> summarize(String videoId, OutputLanguage language) {
    return summarize(videoId, language, null);
  }

  /**
   * Summarize a video as a stream of text fragments.
   *
   * <p>A cached summary is replayed word by word. Otherwise the transcript is fetched (or read from
   * the store) and the backend's stream is teed into the store; the summary is committed when the
   * caller has consumed the whole iterator. A caller that stops early must close the iterator,
   * which releases the backend stream and commits nothing. Summaries from a customized template
   * are neither read from nor written to the store.
   *
   * @param template a custom prompt template, or null for the default
   * @throws com.scholary.videodigest.transcript.FetchException if the transcript is unavailable
   * @throws com.scholary.videodigest.generation.BackendException if the backend rejects the request
   */
  public CloseableIterator<String> summarize(
      String videoId, OutputLanguage language, String template) {
    boolean defaultTemplate = promptTemplates.isDefaultSummary(template);
    List<String> keyPath = Category.SUMMARY.keyPath(videoId, language.displayName());

    if (defaultTemplate) {
      Optional<String> cached = store.getText(keyPath);
      if (cached.isPresent()) {
        STRUCTURED_LOGGER.logCacheHit(videoId, Category.SUMMARY.key(), language.displayName());
        return replay(cached.get());
      }
    }

    STRUCTURED_LOGGER.logCacheMiss(videoId, Category.SUMMARY.key(), language.displayName());
    String transcript = transcript(videoId).transcript();
    String prompt =
        promptTemplates.render(
            defaultTemplate ? promptTemplates.defaultSummaryTemplate() : template,
            language,
            transcript);

    CloseableIterator<String> fragments = backendFactory.defaultBackend().generateStream(prompt);
    StoreSink sink =
        defaultTemplate
            ? new StoreSink(store, storePath, keyPath, true)
            : StoreSink.discarding(store, storePath, keyPath);
    return streamTee.tee(fragments, sink);
  }

  /**
   * Rate a video: ask the backend for structured JSON and store the repaired value.
   *
   * @return the rating as a JSON tree
   * @throws com.scholary.videodigest.transcript.FetchException if the transcript is unavailable
   * @throws com.scholary.videodigest.generation.BackendException if the backend rejects the request
   * @throws com.scholary.videodigest.repair.ResultParseException if the reply is not structured
   */
  public JsonNode rate(String videoId, OutputLanguage language) {
    List<String> keyPath = Category.RATING.keyPath(videoId, language.displayName());
    Optional<Object> cached = store.get(keyPath);
    if (cached.isPresent()) {
      STRUCTURED_LOGGER.logCacheHit(videoId, Category.RATING.key(), language.displayName());
      return objectMapper.valueToTree(cached.get());
    }

    STRUCTURED_LOGGER.logCacheMiss(videoId, Category.RATING.key(), language.displayName());
    String transcript = transcript(videoId).transcript();
    String prompt =
        promptTemplates.render(promptTemplates.defaultRatingTemplate(), language, transcript);
    String reply = backendFactory.defaultBackend().generate(prompt);

    JsonNode rating = resultRepair.parse(reply);
    store.set(keyPath, objectMapper.convertValue(rating, Object.class));
    storeFile.persist(store, storePath);
    LOGGER.info("Rating stored: video={}, language={}", videoId, language.displayName());
    return rating;
  }

  /** Split a stored text into word fragments, each followed by a space. */
  static CloseableIterator<String> replay(String text) {
    String[] words = text.split(" ");
    List<String> fragments = new ArrayList<>(words.length);
    for (String word : words) {
      fragments.add(word + " ");
    }
    return CloseableIterator.of(fragments.iterator());
  }
}
