package com.ospicorp.laiforecast.raster;

import java.util.List;
import java.util.Map;

/**
 * Keeps the digits at the given 1-based positions of a land-use code, then maps the result
 * through {@code replacements}. Example: indices [1, 2, 3] turn 6123 into 612, and a
 * replacement 612 -> 610 merges it into 610.
 */
public record ReclassificationRule(List<Integer> digitIndices, Map<Integer, Integer> replacements) {

  public ReclassificationRule {
    if (digitIndices == null || digitIndices.isEmpty()) {
      throw new IllegalArgumentException("at least one digit index is required");
    }
    for (Integer index : digitIndices) {
      if (index == null || index < 1) {
        throw new IllegalArgumentException("digit indices are 1-based: " + digitIndices);
      }
    }
    digitIndices = List.copyOf(digitIndices);
    replacements = replacements == null ? Map.of() : Map.copyOf(replacements);
  }
}
