package com.ospicorp.laiforecast.raster;

import java.util.Objects;

/**
 * Turns raw land-use codes into vegetation classes. Nodata, negative codes and codes that
 * reduce to 0 carry no class.
 */
public class Reclassifier {

  private final ReclassificationRule rule;

  public Reclassifier(ReclassificationRule rule) {
    this.rule = Objects.requireNonNull(rule, "rule");
  }

  public VegetationClassMap reclassify(Raster landUse) {
    int[] classes = new int[landUse.grid().size()];
    for (int i = 0; i < classes.length; i++) {
      classes[i] = landUse.isValid(i) ? classify(landUse.get(i)) : VegetationClassMap.NO_CLASS;
    }
    return VegetationClassMap.of(landUse.grid(), classes);
  }

  int classify(float code) {
    if (code < 0f) {
      return VegetationClassMap.NO_CLASS;
    }
    String digits = Long.toString((long) code);
    StringBuilder kept = new StringBuilder(rule.digitIndices().size());
    for (int index : rule.digitIndices()) {
      if (index <= digits.length()) {
        kept.append(digits.charAt(index - 1));
      }
    }
    int value = kept.length() == 0 ? 0 : Integer.parseInt(kept.toString());
    value = rule.replacements().getOrDefault(value, value);
    return value == 0 ? VegetationClassMap.NO_CLASS : value;
  }
}
