package com.ukboards.network.api;

import com.ukboards.network.http.QueryTrialsExhaustedException;
import com.ukboards.network.http.RegistryConnectionException;
import com.ukboards.network.http.RegistryPermissionException;
import com.ukboards.network.service.ExceededMaxBranchesException;
import com.ukboards.network.service.NegativeBranchesException;
import com.ukboards.network.util.UnknownCompanyPrefixException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class NetworkExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(NetworkExceptionHandler.class);

  @ExceptionHandler({NegativeBranchesException.class, ExceededMaxBranchesException.class})
  public ResponseEntity<Map<String, String>> handleBranches(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_branches", "message", ex.getMessage()));
  }

  @ExceptionHandler(RegistryPermissionException.class)
  public ResponseEntity<Map<String, String>> handlePermission(RegistryPermissionException ex) {
    log.error("Registry refused {}", ex.getQuery());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "registry_permission", "message", ex.getMessage()));
  }

  @ExceptionHandler(QueryTrialsExhaustedException.class)
  public ResponseEntity<Map<String, String>> handleExhausted(QueryTrialsExhaustedException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "registry_retries_exhausted", "message", ex.getMessage()));
  }

  @ExceptionHandler(RegistryConnectionException.class)
  public ResponseEntity<Map<String, String>> handleConnection(RegistryConnectionException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "registry_unreachable", "message", ex.getMessage()));
  }

  @ExceptionHandler(UnknownCompanyPrefixException.class)
  public ResponseEntity<Map<String, String>> handleUnknownPrefix(UnknownCompanyPrefixException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "unknown_company_prefix", "message", ex.getMessage()));
  }
}
