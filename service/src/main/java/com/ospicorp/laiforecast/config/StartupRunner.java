package com.ospicorp.laiforecast.config;

import com.ospicorp.laiforecast.pipeline.ForecastReport;
import com.ospicorp.laiforecast.pipeline.LaiForecastService;
import com.ospicorp.laiforecast.pipeline.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class StartupRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(StartupRunner.class);

  private final LaiForecastService service;
  private final LaiProperties properties;

  public StartupRunner(LaiForecastService service, LaiProperties properties) {
    this.service = service;
    this.properties = properties;
  }

  @Override
  public void run(String... args) {
    if (!properties.runOnStartup()) {
      log.info("Startup run disabled via property lai.run-on-startup=false");
      return;
    }
    RunReport report = service.run();
    for (ForecastReport forecast : report.forecasts()) {
      log.info("Startup run wrote forecast {} to {} ({} processed, {} skipped, {} failed)",
          forecast.name(), forecast.outputDirectory(), forecast.summary().processed(),
          forecast.summary().skipped(), forecast.summary().failed());
    }
  }
}
