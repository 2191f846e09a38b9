package com.ospicorp.laiforecast.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("LAI Forecast Normalizer API")
            .version("v1")
            .description("Runs the per-class LAI normalization job and exposes its zonal statistics")
            .contact(new Contact().name("Remote Sensing Platform Team").email("lai-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
