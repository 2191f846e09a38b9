package com.ospicorp.laiforecast.web;

import com.ospicorp.laiforecast.config.LaiProperties;
import com.ospicorp.laiforecast.pipeline.ForecastReport;
import com.ospicorp.laiforecast.pipeline.LaiForecastService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Service index: what a run will report on and where the last one left its outputs. */
@RestController
public class RootController {

  private final LaiProperties properties;
  private final LaiForecastService service;

  public RootController(LaiProperties properties, LaiForecastService service) {
    this.properties = properties;
    this.service = service;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", "lai-forecast");
    body.put("vegetationClasses", properties.classes().stream()
        .map(LaiProperties.ClassEntry::id)
        .toList());
    body.put("outputDirectory", properties.outputDir().toAbsolutePath().toString());
    service.latest().ifPresentOrElse(report -> {
      body.put("latestRunFinishedAt", report.finishedAt().toString());
      body.put("latestForecasts", report.forecasts().stream().map(ForecastReport::name).toList());
    }, () -> body.put("latestForecasts", List.of()));
    body.put("runs", "/v1/runs");
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
