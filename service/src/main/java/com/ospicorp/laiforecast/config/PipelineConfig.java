package com.ospicorp.laiforecast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.laiforecast.io.BoundarySource;
import com.ospicorp.laiforecast.io.DatedFileCatalog;
import com.ospicorp.laiforecast.io.GeoJsonBoundarySource;
import com.ospicorp.laiforecast.io.GeoTiffRasterStore;
import com.ospicorp.laiforecast.io.RasterStore;
import com.ospicorp.laiforecast.io.RunReportWriter;
import com.ospicorp.laiforecast.io.StatisticsCsvWriter;
import com.ospicorp.laiforecast.normalization.NormalizationEngine;
import com.ospicorp.laiforecast.pipeline.DailyPipelineDriver;
import com.ospicorp.laiforecast.raster.CrsRegistry;
import com.ospicorp.laiforecast.raster.GridAligner;
import com.ospicorp.laiforecast.raster.Reclassifier;
import com.ospicorp.laiforecast.zonal.ZonalAggregator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

  @Bean
  CrsRegistry crsRegistry() {
    return new CrsRegistry();
  }

  @Bean
  GridAligner gridAligner(CrsRegistry crsRegistry) {
    return new GridAligner(crsRegistry);
  }

  @Bean
  ZonalAggregator zonalAggregator() {
    return new ZonalAggregator();
  }

  @Bean
  NormalizationEngine normalizationEngine() {
    return new NormalizationEngine();
  }

  @Bean
  Reclassifier reclassifier(LaiProperties properties) {
    return new Reclassifier(properties.reclassification().toRule());
  }

  @Bean
  DailyPipelineDriver dailyPipelineDriver(GridAligner aligner, ZonalAggregator aggregator,
      NormalizationEngine engine, LaiProperties properties) {
    return new DailyPipelineDriver(aligner, aggregator, engine,
        properties.pipeline().parallelism());
  }

  @Bean
  RasterStore rasterStore(CrsRegistry crsRegistry) {
    return new GeoTiffRasterStore(crsRegistry);
  }

  @Bean
  BoundarySource boundarySource(ObjectMapper objectMapper) {
    return new GeoJsonBoundarySource(objectMapper);
  }

  @Bean
  DatedFileCatalog datedFileCatalog(LaiProperties properties) {
    return new DatedFileCatalog(properties.files().datePattern(),
        properties.files().dateFormat(), properties.files().yearPattern());
  }

  @Bean
  StatisticsCsvWriter statisticsCsvWriter() {
    return new StatisticsCsvWriter();
  }

  @Bean
  RunReportWriter runReportWriter(ObjectMapper objectMapper) {
    return new RunReportWriter(objectMapper);
  }
}
