package com.ospicorp.laiforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LaiForecastApplication {

  public static void main(String[] args) {
    SpringApplication.run(LaiForecastApplication.class, args);
  }
}
