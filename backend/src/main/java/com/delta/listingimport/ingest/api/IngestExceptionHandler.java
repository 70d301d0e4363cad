package com.delta.listingimport.ingest.api;

import com.delta.listingimport.ingest.error.IngestException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class IngestExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(IngestExceptionHandler.class);

  @ExceptionHandler(IngestException.class)
  public ResponseEntity<Map<String, String>> handleIngest(IngestException ex) {
    ResponseStatus annotation =
        AnnotatedElementUtils.findMergedAnnotation(ex.getClass(), ResponseStatus.class);
    HttpStatus status = annotation == null ? HttpStatus.INTERNAL_SERVER_ERROR : annotation.code();
    if (status.is5xxServerError()) {
      log.warn("{} -> {}: {}", ex.errorCode(), status.value(), ex.getMessage());
    }
    return ResponseEntity.status(status).body(body(ex.errorCode(), ex.getMessage()));
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(body("validation_error", ex.getMessage()));
  }

  private static Map<String, String> body(String code, String message) {
    return Map.of("error", code, "message", message == null ? code : message);
  }
}
