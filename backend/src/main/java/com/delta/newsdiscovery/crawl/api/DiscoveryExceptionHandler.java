package com.delta.newsdiscovery.crawl.api;

import com.delta.newsdiscovery.crawl.policy.PolicyConfigurationException;
import com.delta.newsdiscovery.crawl.port.CatalogException;
import com.delta.newsdiscovery.crawl.service.ActiveDiscoveryRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class DiscoveryExceptionHandler {

  @ExceptionHandler(ActiveDiscoveryRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveDiscoveryRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_discovery_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(PolicyConfigurationException.class)
  public ResponseEntity<Map<String, String>> handleConfiguration(PolicyConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_configuration", "message", ex.getMessage()));
  }

  @ExceptionHandler(CatalogException.class)
  public ResponseEntity<Map<String, String>> handleCatalog(CatalogException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_catalog", "message", ex.getMessage()));
  }
}
