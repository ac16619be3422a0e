package com.scholary.videodigest.generation;

import com.google.genai.Client;
import com.google.genai.ResponseStream;
import com.google.genai.errors.ApiException;
import com.google.genai.errors.GenAiIOException;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.scholary.videodigest.stream.CloseableIterator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generation backend on the Google Gen AI SDK (Gemini / Gemma models).
 *
 * <p>SDK {@link ApiException}s are rethrown as {@link BackendException} with the HTTP status, both
 * when a request is sent and while a stream is being consumed. Transport failures ({@link
 * GenAiIOException}) become a {@link BackendException} with status 0.
 */
public class GeminiGenerationBackend implements GenerationBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiGenerationBackend.class);

  private final Client client;
  private final String streamModel;
  private final String model;
  private final GenerateContentConfig config;

  public GeminiGenerationBackend(
      Client client, String streamModel, String model, GenerateContentConfig config) {
    this.client = client;
    this.streamModel = streamModel;
    this.model = model;
    this.config = config;
  }

  @Override
  public CloseableIterator<String> generateStream(String prompt) {
    LOGGER.debug("Streaming generation: model={}, promptChars={}", streamModel, prompt.length());
    try {
      ResponseStream<GenerateContentResponse> stream =
          client.models.generateContentStream(streamModel, prompt, config);
      return new FragmentIterator(stream);
    } catch (ApiException e) {
      throw translate(e, streamModel);
    } catch (GenAiIOException e) {
      throw translate(e, streamModel);
    }
  }

  @Override
  public String generate(String prompt) {
    LOGGER.debug("Generation: model={}, promptChars={}", model, prompt.length());
    try {
      GenerateContentResponse response = client.models.generateContent(model, prompt, config);
      String text = response.text();
      if (text == null) {
        throw new BackendException("Backend returned no text for model " + model);
      }
      return text;
    } catch (ApiException e) {
      throw translate(e, model);
    } catch (GenAiIOException e) {
      throw translate(e, model);
    }
  }

  private static BackendException translate(ApiException e, String model) {
    LOGGER.warn("Generation backend error: model={}, status={}", model, e.code(), e);
    return new BackendException(
        String.format("Generation backend failed for model %s: %s", model, e.getMessage()),
        e.code(),
        e);
  }

  private static BackendException translate(GenAiIOException e, String model) {
    LOGGER.warn("Generation backend unreachable: model={}", model, e);
    return new BackendException(
        String.format("Generation backend unreachable for model %s: %s", model, e.getMessage()),
        0,
        e);
  }

  /** Pulls text fragments from the SDK stream, skipping chunks without text. */
  private final class FragmentIterator implements CloseableIterator<String> {

    private final ResponseStream<GenerateContentResponse> stream;
    private final Iterator<GenerateContentResponse> responses;
    private String nextFragment;
    private boolean closed;

    private FragmentIterator(ResponseStream<GenerateContentResponse> stream) {
      this.stream = stream;
      this.responses = stream.iterator();
    }

    @Override
    public boolean hasNext() {
      if (nextFragment != null) {
        return true;
      }
      if (closed) {
        return false;
      }
      try {
        while (responses.hasNext()) {
          String text = responses.next().text();
          if (text != null && !text.isEmpty()) {
            nextFragment = text;
            return true;
          }
        }
      } catch (ApiException e) {
        close();
        throw translate(e, streamModel);
      } catch (GenAiIOException e) {
        close();
        throw translate(e, streamModel);
      }
      close();
      return false;
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException("Generation stream exhausted");
      }
      String fragment = nextFragment;
      nextFragment = null;
      return fragment;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      try {
        stream.close();
      } catch (Exception e) {
        LOGGER.warn("Failed to close generation stream", e);
      }
    }
  }
}
