package com.tasktrack.api.web;

import java.time.Clock;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
class HealthController {

  private final Clock clock;

  HealthController(Clock clock) {
    this.clock = clock;
  }

  @GetMapping("/health")
  HealthResponse health() {
    return new HealthResponse(true, clock.instant().toString());
  }

  record HealthResponse(boolean ok, String now) {}
}
