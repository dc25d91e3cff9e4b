package com.ospicorp.netloadramp.web;

import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {
  private final String serviceName;

  public RootController(@Value("${spring.application.name:net-load-ramp}") String serviceName) {
    this.serviceName = serviceName;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of(
        "service", serviceName,
        "status", "ok",
        "endpoints", List.of("POST /v1/ramps", "GET /v1/ping"));
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
