package com.flamingo.ai.gedcom.api.rest;

import com.flamingo.ai.gedcom.service.loading.LoadStrategy;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final List<LoadStrategy> loadStrategies;

  /** Returns a simple health check response including the configured load stages. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "gedcom-ingest");
    List<String> stages =
        loadStrategies.stream().map(LoadStrategy::stage).sorted().map(Enum::name).toList();
    health.put("loadStages", stages);
    return ResponseEntity.ok(health);
  }
}
