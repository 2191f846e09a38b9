package com.ospicorp.laiforecast.config;

import com.ospicorp.laiforecast.io.StatisticsCsvWriter;
import com.ospicorp.laiforecast.web.CsvHttpMessageConverter;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final StatisticsCsvWriter statisticsCsvWriter;

  public WebConfig(StatisticsCsvWriter statisticsCsvWriter) {
    this.statisticsCsvWriter = statisticsCsvWriter;
  }

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(0, new CsvHttpMessageConverter(statisticsCsvWriter));
  }
}
