package com.ospicorp.laiforecast.normalization;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/** Defined factors per class for one date, plus the classes that had none. */
public final class NormalizationFactors {

  private final Map<Integer, Double> factors;
  private final List<UndefinedFactorWarning> warnings;

  public NormalizationFactors(Map<Integer, Double> factors, List<UndefinedFactorWarning> warnings) {
    this.factors = Collections.unmodifiableMap(new LinkedHashMap<>(factors));
    this.warnings = List.copyOf(warnings);
  }

  public static NormalizationFactors of(Map<Integer, Double> factors) {
    return new NormalizationFactors(factors, List.of());
  }

  public OptionalDouble factorFor(int classId) {
    Double factor = factors.get(classId);
    return factor == null ? OptionalDouble.empty() : OptionalDouble.of(factor);
  }

  public boolean isDefined(int classId) {
    return factors.containsKey(classId);
  }

  public Map<Integer, Double> asMap() {
    return factors;
  }

  public List<UndefinedFactorWarning> warnings() {
    return warnings;
  }
}
