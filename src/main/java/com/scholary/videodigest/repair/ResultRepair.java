package com.scholary.videodigest.repair;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videodigest.logging.StructuredLogger;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers structured data (a JSON object or array) from a generative backend's text reply.
 *
 * <p>Models are asked for JSON but often wrap it in a fenced code block, surround it with prose,
 * use Python literals or leave trailing commas. Rather than one best-effort regex, the reply goes
 * through the fixed sequence of {@link RepairStep}s; after each transform the candidate is parsed
 * strictly and the first success wins:
 *
 * <ol>
 *   <li>trimmed raw text
 *   <li>fenced code block markers stripped
 *   <li>first {@code {}/{@code [} to last matching bracket extracted
 *   <li>single quotes and {@code True/False/None} normalized
 *   <li>trailing commas removed
 *   <li>control characters stripped
 * </ol>
 *
 * <p>Scalars ({@code 42}, {@code "text"}) are not accepted as structured data.
 */
public class ResultRepair {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResultRepair.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final ObjectMapper strictMapper;
  private final List<RepairStep> steps;

  public ResultRepair(ObjectMapper objectMapper) {
    this.strictMapper =
        objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    this.steps = List.of(RepairStep.values());
  }

  /**
   * Parse a backend reply into a JSON object or array.
   *
   * @param raw the reply text
   * @return the parsed tree
   * @throws ResultParseException if every repair step fails
   */
  public JsonNode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ResultParseException("Reply is empty", raw);
    }

    String candidate = raw;
    JsonProcessingException lastError = null;
    int attempt = 0;

    for (RepairStep step : steps) {
      attempt++;
      candidate = step.apply(candidate);
      try {
        JsonNode node = strictMapper.readTree(candidate);
        if (node != null && node.isContainerNode()) {
          STRUCTURED_LOGGER.logRepairAttempt(step.name(), attempt, true);
          return node;
        }
      } catch (JsonProcessingException e) {
        lastError = e;
      }
      STRUCTURED_LOGGER.logRepairAttempt(step.name(), attempt, false);
    }

    LOGGER.warn("Could not recover structured data after {} attempts", attempt);
    throw new ResultParseException(
        String.format("Reply is not structured data after %d repair attempts", attempt),
        raw,
        lastError);
  }

  /**
   * Parse a backend reply into plain Java collections, ready to be put into a result store.
   *
   * @return a {@code List} or a {@code Map}
   * @throws ResultParseException if every repair step fails
   */
  public Object parseToValue(String raw) {
    return strictMapper.convertValue(parse(raw), Object.class);
  }
}
