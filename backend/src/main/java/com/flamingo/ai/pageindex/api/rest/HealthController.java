package com.flamingo.ai.pageindex.api.rest;

import com.flamingo.ai.pageindex.service.document.DocumentIndexService;
import com.flamingo.ai.pageindex.service.index.DocumentIndex;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and system info. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final DocumentIndexService documentIndexService;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "pageindex");
    return ResponseEntity.ok(health);
  }

  /** Returns registry statistics: document count, section count and registered document IDs. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    Map<String, Object> stats = new HashMap<>();
    stats.put("totalDocuments", documentIndexService.count());
    stats.put("totalSections", documentIndexService.totalSections());
    stats.put(
        "documentIds",
        documentIndexService.getAllIndexes().stream().map(DocumentIndex::getDocId).toList());
    stats.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(stats);
  }
}
