package com.ospicorp.laiforecast.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.laiforecast.io.GeoTiffRasterStore;
import com.ospicorp.laiforecast.raster.CrsRegistry;
import com.ospicorp.laiforecast.raster.GeoTransform;
import com.ospicorp.laiforecast.raster.GridGeometry;
import com.ospicorp.laiforecast.raster.Raster;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RunControllerTest {

  private static final GridGeometry GRID =
      new GridGeometry(2, 2, new GeoTransform(500000d, 4200000d, 10d, -10d), "EPSG:32633");
  private static final GeoTiffRasterStore STORE = new GeoTiffRasterStore(new CrsRegistry());

  @TempDir
  static Path workDir;

  private static final ParameterizedTypeReference<Map<String, Object>> OBJECT =
      new ParameterizedTypeReference<Map<String, Object>>() {};
  private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
      new ParameterizedTypeReference<List<Map<String, Object>>>() {};

  @Autowired
  private TestRestTemplate rest;

  private Map<String, Object> post(String path) {
    ResponseEntity<Map<String, Object>> response =
        rest.exchange(path, HttpMethod.POST, null, OBJECT);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    return response.getBody();
  }

  @BeforeAll
  static void writeInputs() {
    // land-use codes: 1101 -> cropland (110), 6121 -> 612 -> forest (610)
    Raster landUse = new Raster(GRID, new float[] {1101f, 1101f, 6121f, 6121f}, -1f);
    STORE.write(workDir.resolve("landuse/base.tif"), landUse);
    STORE.write(workDir.resolve("landuse/forecast.tif"), landUse);

    STORE.write(workDir.resolve("base/LAI_2023001.tif"),
        new Raster(GRID, new float[] {2f, 4f, 10f, 10f}, Float.NaN));
    STORE.write(workDir.resolve("base/LAI_2023002.tif"),
        new Raster(GRID, new float[] {1f, 1f, 1f, 1f}, Float.NaN));
    STORE.write(workDir.resolve("forecast/LAI_2023001.tif"),
        new Raster(GRID, new float[] {1f, 1f, 5f, 5f}, Float.NaN));
  }

  @DynamicPropertySource
  static void laiProperties(DynamicPropertyRegistry registry) {
    registry.add("lai.base-class-map", () -> workDir.resolve("landuse/base.tif").toString());
    registry.add("lai.forecast-class-map",
        () -> workDir.resolve("landuse/forecast.tif").toString());
    registry.add("lai.base-lai-dir", () -> workDir.resolve("base").toString());
    registry.add("lai.forecast-lai-dir", () -> workDir.resolve("forecast").toString());
    registry.add("lai.output-dir", () -> workDir.resolve("result").toString());
    registry.add("lai.classes[0].id", () -> "110");
    registry.add("lai.classes[0].name", () -> "cropland");
    registry.add("lai.classes[1].id", () -> "610");
    registry.add("lai.classes[1].name", () -> "forest");
  }

  @Test
  @SuppressWarnings("unchecked")
  void runWritesNormalizedRastersAndReports() {
    Map<String, Object> body = post("/v1/runs");

    List<Map<String, Object>> forecasts = (List<Map<String, Object>>) body.get("forecasts");
    assertThat(forecasts).hasSize(1);
    assertThat(forecasts.get(0).get("name")).isEqualTo("forecast");
    Map<String, Object> summary = (Map<String, Object>) forecasts.get(0).get("summary");
    assertThat(summary.get("processed")).isEqualTo(1);
    assertThat(summary.get("skipped")).isEqualTo(1);
    assertThat(summary.get("failed")).isEqualTo(0);
    assertThat(forecasts.get(0)).doesNotContainKey("statistics");

    Path result = workDir.resolve("result");
    assertThat(result.resolve("statistics.csv")).exists();
    assertThat(result.resolve("run-summary.json")).exists();
    assertThat(result.resolve("landuse_base.tif")).exists();
    assertThat(result.resolve("LAI_2023002.tif")).doesNotExist();
    Raster normalized = STORE.read(result.resolve("LAI_2023001.tif"));
    assertThat(normalized.grid()).isEqualTo(GRID);
    assertThat(normalized.toArray()).containsExactly(3f, 3f, 10f, 10f);
    Raster reclassified = STORE.read(result.resolve("landuse_forecast.tif"));
    assertThat(reclassified.toArray()).containsExactly(110f, 110f, 610f, 610f);

    ResponseEntity<Map<String, Object>> latest =
        rest.exchange("/v1/runs/latest", HttpMethod.GET, null, OBJECT);
    assertThat(latest.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(latest.getBody())
        .containsKeys("startedAt", "finishedAt", "outputDirectory", "classMaps", "forecasts");
  }

  @Test
  void statisticsAreServedAsCsv() throws Exception {
    post("/v1/runs");
    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(List.of(MediaType.valueOf("text/csv")));

    ResponseEntity<String> response = rest.exchange("/v1/runs/latest/statistics", HttpMethod.GET,
        new HttpEntity<>(headers), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType().toString()).startsWith("text/csv");
    List<String> lines = response.getBody().lines().toList();
    assertThat(lines).hasSize(5);
    assertThat(lines.get(0)).startsWith("date,vegetation_class,pixel_count,mean_lai,std_lai,period");
    assertThat(lines.get(1)).startsWith("2023-01-01,110,2,3.0,1.0,base,cropland");
    assertThat(lines.get(4)).startsWith("2023-01-01,610,2,5.0,0.0,predicted,forest");
    assertThat(Files.readString(workDir.resolve("result/statistics.csv")))
        .isEqualTo(response.getBody());
  }

  @Test
  void statisticsAreServedAsJsonByDefault() {
    post("/v1/runs");

    ResponseEntity<List<Map<String, Object>>> response =
        rest.exchange("/v1/runs/latest/statistics?forecast=forecast", HttpMethod.GET, null, ROWS);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).hasSize(4);
    Map<String, Object> first = response.getBody().get(0);
    assertThat(first.get("vegetation_class")).isEqualTo(110);
    assertThat(first.get("period")).isEqualTo("base");
    assertThat(first.get("mean_lai")).isEqualTo(3.0);
  }

  @Test
  void unknownForecastIsNotFound() {
    post("/v1/runs");

    ResponseEntity<Map<String, Object>> response =
        rest.exchange("/v1/runs/latest/statistics?forecast=2099", HttpMethod.GET, null, OBJECT);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(String.valueOf(response.getBody().get("detail"))).contains("2099");
  }

  @Test
  void rootListsClassesAndLatestForecasts() {
    post("/v1/runs");

    ResponseEntity<Map<String, Object>> response = rest.exchange("/", HttpMethod.GET, null, OBJECT);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody().get("service")).isEqualTo("lai-forecast");
    assertThat(response.getBody().get("vegetationClasses")).isEqualTo(List.of(110, 610));
    assertThat(response.getBody().get("latestForecasts")).isEqualTo(List.of("forecast"));
    assertThat(response.getBody()).containsKey("latestRunFinishedAt");
  }
}
