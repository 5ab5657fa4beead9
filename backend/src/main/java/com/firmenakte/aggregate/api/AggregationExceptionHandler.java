package com.firmenakte.aggregate.api;

import com.firmenakte.aggregate.service.InvalidIdentityException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class AggregationExceptionHandler {

  @ExceptionHandler(InvalidIdentityException.class)
  public ResponseEntity<Map<String, String>> handleInvalidIdentity(InvalidIdentityException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_identity", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
  }
}
