package com.ospicorp.laiforecast;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.laiforecast.config.LaiProperties;
import com.ospicorp.laiforecast.io.DatedFileCatalog;
import com.ospicorp.laiforecast.pipeline.LaiForecastService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class SmokeTest {

  @Autowired
  private ApplicationContext context;

  @Autowired
  private LaiProperties properties;

  @Test
  void contextLoads() {
    assertThat(context).isNotNull();
    assertThat(context.getBean(LaiForecastService.class).latest()).isEmpty();
  }

  @Test
  void defaultsAreBoundFromApplicationYaml() {
    assertThat(properties.runOnStartup()).isFalse();
    assertThat(properties.toCatalog().ids()).containsExactly(110, 210, 310, 610);
    assertThat(properties.reclassification().digitIndices()).containsExactly(1, 2, 3);
    assertThat(properties.reclassification().replacements())
        .containsEntry(611, 610)
        .containsEntry(612, 610)
        .containsEntry(613, 610);
    assertThat(properties.input().negativeAsNodata()).isTrue();
    assertThat(properties.pipeline().parallelism()).isEqualTo(1);
    assertThat(properties.files().dateFormat()).isEqualTo("uuuuDDD");
    assertThat(properties.files().yearPattern()).isEqualTo(DatedFileCatalog.DEFAULT_YEAR_PATTERN);
    assertThat(properties.forecastClassMapDir()).isNull();
  }
}
