package com.smartwealth.sectors.discovery.api;

import com.smartwealth.sectors.discovery.service.CatastrophicDiscoveryException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class DiscoveryExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(CatastrophicDiscoveryException.class)
  public ResponseEntity<Map<String, String>> handleDiscoveryFailure(CatastrophicDiscoveryException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "discovery_failed", "message", String.valueOf(ex.getMessage())));
  }
}
