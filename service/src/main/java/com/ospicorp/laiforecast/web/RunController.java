package com.ospicorp.laiforecast.web;

import com.ospicorp.laiforecast.pipeline.LaiForecastService;
import com.ospicorp.laiforecast.pipeline.RunReport;
import com.ospicorp.laiforecast.pipeline.StatisticsRow;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.NoSuchElementException;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/runs")
@Tag(name = "Runs", description = "Normalization runs and their zonal statistics")
public class RunController {

  private final LaiForecastService service;

  public RunController(LaiForecastService service) {
    this.service = service;
  }

  @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Run the configured normalization job and wait for it to finish")
  public RunReport run() {
    return service.run();
  }

  @GetMapping(value = "/latest", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Report of the most recent run")
  public RunReport latest() {
    return latestReport();
  }

  @GetMapping(value = "/latest/statistics",
      produces = {MediaType.APPLICATION_JSON_VALUE, "text/csv"})
  @Operation(summary = "Zonal statistics of one forecast of the most recent run, as JSON or CSV")
  public List<StatisticsRow> latestStatistics(
      @Parameter(description = "Forecast name (its class map year); optional for a single forecast")
      @RequestParam(required = false) String forecast) {
    return latestReport().forecast(forecast).statistics();
  }

  private RunReport latestReport() {
    return service.latest()
        .orElseThrow(() -> new NoSuchElementException("No run has completed yet"));
  }
}
