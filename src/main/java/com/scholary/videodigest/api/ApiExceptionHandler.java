package com.scholary.videodigest.api;

import com.scholary.videodigest.generation.BackendException;
import com.scholary.videodigest.repair.ResultParseException;
import com.scholary.videodigest.service.InvalidVideoUrlException;
import com.scholary.videodigest.store.StorePersistenceException;
import com.scholary.videodigest.transcript.FetchException;
import com.scholary.videodigest.transcript.TranscriptErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps domain failures to HTTP statuses with an {@link ErrorResponse} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(FetchException.class)
  public ResponseEntity<ErrorResponse> handleFetch(FetchException e) {
    LOGGER.warn("Transcript unavailable: kind={}, message={}", e.getKind(), e.getMessage());
    return respond(statusFor(e.getKind()), "transcript_unavailable", e.getKind().name(), e);
  }

  @ExceptionHandler(BackendException.class)
  public ResponseEntity<ErrorResponse> handleBackend(BackendException e) {
    LOGGER.error("Generation backend failed: status={}", e.getStatusCode(), e);
    return respond(HttpStatus.BAD_GATEWAY, "backend_failed", null, e);
  }

  @ExceptionHandler(ResultParseException.class)
  public ResponseEntity<ErrorResponse> handleParse(ResultParseException e) {
    LOGGER.error("Backend reply is not structured data: {}", e.getRawText());
    return respond(HttpStatus.BAD_GATEWAY, "unstructured_reply", null, e);
  }

  @ExceptionHandler(StorePersistenceException.class)
  public ResponseEntity<ErrorResponse> handlePersistence(StorePersistenceException e) {
    LOGGER.error("Result store could not be written", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "store_failed", null, e);
  }

  @ExceptionHandler({
    InvalidVideoUrlException.class,
    IllegalArgumentException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
    return respond(HttpStatus.BAD_REQUEST, "bad_request", null, e);
  }

  static HttpStatus statusFor(TranscriptErrorKind kind) {
    if (kind == TranscriptErrorKind.VIDEO_UNAVAILABLE) {
      return HttpStatus.NOT_FOUND;
    }
    if (kind == TranscriptErrorKind.REQUEST_BLOCKED) {
      return HttpStatus.TOO_MANY_REQUESTS;
    }
    if (kind == TranscriptErrorKind.RETRIEVAL_FAILED) {
      return HttpStatus.BAD_GATEWAY;
    }
    return HttpStatus.UNPROCESSABLE_ENTITY;
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String error, String kind, Exception e) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(new ErrorResponse(error, kind, e.getMessage()));
  }
}
