package com.ospicorp.tsforecast.web;

import com.ospicorp.tsforecast.forecast.service.ModelRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service landing page listing the forecasting models this instance can fit.
 */
@RestController
public class RootController {
  private final ModelRegistry registry;

  public RootController(ModelRegistry registry) {
    this.registry = registry;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "ts-forecast");
    body.put("status", "ok");
    body.put("models", List.copyOf(registry.available().keySet()));
    body.put("endpoints", List.of("/v1/models", "/v1/analysis"));
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
