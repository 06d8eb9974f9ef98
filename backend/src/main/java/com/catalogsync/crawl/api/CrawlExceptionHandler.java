package com.catalogsync.crawl.api;

import com.catalogsync.crawl.service.IllegalSessionTransitionException;
import com.catalogsync.crawl.service.SessionNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(SessionNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "session_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalSessionTransitionException.class)
  public ResponseEntity<Map<String, String>> handleIllegalTransition(IllegalSessionTransitionException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "illegal_transition", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    String message = ex.getMessage() == null ? "invalid request" : ex.getMessage();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", message));
  }
}
