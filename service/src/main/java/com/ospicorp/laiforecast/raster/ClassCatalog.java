package com.ospicorp.laiforecast.raster;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of vegetation classes a run reports on. Iteration follows declaration order.
 */
public final class ClassCatalog {

  private final List<VegetationClass> classes;
  private final Map<Integer, Integer> positions = new LinkedHashMap<>();

  public ClassCatalog(List<VegetationClass> classes) {
    if (classes == null || classes.isEmpty()) {
      throw new IllegalArgumentException("at least one vegetation class must be declared");
    }
    this.classes = List.copyOf(classes);
    for (int i = 0; i < this.classes.size(); i++) {
      VegetationClass vegetationClass = this.classes.get(i);
      if (positions.putIfAbsent(vegetationClass.id(), i) != null) {
        throw new IllegalArgumentException("duplicate vegetation class id " + vegetationClass.id());
      }
    }
  }

  public static ClassCatalog of(VegetationClass... classes) {
    return new ClassCatalog(Arrays.asList(classes));
  }

  public List<VegetationClass> classes() {
    return classes;
  }

  public List<Integer> ids() {
    return List.copyOf(positions.keySet());
  }

  public int size() {
    return classes.size();
  }

  /** Declaration position of {@code id}, or -1 when the class is not declared. */
  public int positionOf(int id) {
    Integer position = positions.get(id);
    return position == null ? -1 : position;
  }
}
