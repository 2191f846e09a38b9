package com.ospicorp.laiforecast.config;

import com.ospicorp.laiforecast.raster.ClassCatalog;
import com.ospicorp.laiforecast.raster.ReclassificationRule;
import com.ospicorp.laiforecast.raster.VegetationClass;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties("lai")
public record LaiProperties(
    Path baseClassMap,
    Path forecastClassMap,
    Path forecastClassMapDir,
    Path baseLaiDir,
    Path forecastLaiDir,
    Path boundary,
    @DefaultValue("result") Path outputDir,
    @DefaultValue("false") boolean runOnStartup,
    List<@Valid ClassEntry> classes,
    @DefaultValue @Valid Reclassification reclassification,
    @DefaultValue @Valid FileNaming files,
    @DefaultValue @Valid Input input,
    @DefaultValue @Valid Pipeline pipeline
) {

  public LaiProperties {
    classes = classes == null ? List.of() : List.copyOf(classes);
  }

  public record ClassEntry(@Min(0) int id, String name) {}

  public record Reclassification(
      @DefaultValue({"1", "2", "3"}) List<Integer> digitIndices,
      Map<Integer, Integer> replacements
  ) {

    public ReclassificationRule toRule() {
      return new ReclassificationRule(digitIndices, replacements);
    }
  }

  public record FileNaming(
      @DefaultValue("^[^_]+_(\\d{7})(?:_.*)?$") @NotBlank String datePattern,
      @DefaultValue("uuuuDDD") @NotBlank String dateFormat,
      @DefaultValue("^(?:.*_)?(\\d{4})$") @NotBlank String yearPattern
  ) {}

  public record Input(@DefaultValue("true") boolean negativeAsNodata) {}

  public record Pipeline(@DefaultValue("1") @Min(1) int parallelism) {}

  public ClassCatalog toCatalog() {
    if (classes.isEmpty()) {
      throw new IllegalStateException("No vegetation classes configured under lai.classes");
    }
    List<VegetationClass> declared = new ArrayList<>(classes.size());
    for (ClassEntry entry : classes) {
      declared.add(new VegetationClass(entry.id(), entry.name()));
    }
    return new ClassCatalog(declared);
  }

  /**
   * Fails with the name of the first required input that is not configured. Forecast class maps
   * come either from one file or from a directory of yearly files, never both.
   */
  public void requireInputs() {
    require(baseClassMap, "lai.base-class-map");
    if (forecastClassMap == null && forecastClassMapDir == null) {
      throw new IllegalStateException(
          "Missing required property lai.forecast-class-map or lai.forecast-class-map-dir");
    }
    if (forecastClassMap != null && forecastClassMapDir != null) {
      throw new IllegalStateException(
          "Set only one of lai.forecast-class-map and lai.forecast-class-map-dir");
    }
    require(baseLaiDir, "lai.base-lai-dir");
    require(forecastLaiDir, "lai.forecast-lai-dir");
  }

  private static void require(Path value, String key) {
    if (value == null) {
      throw new IllegalStateException("Missing required property " + key);
    }
  }
}
