package com.ospicorp.laiforecast.raster;

public record VegetationClass(int id, String name) {

  public VegetationClass {
    if (id < 0) {
      throw new IllegalArgumentException("class id must be non-negative: " + id);
    }
    if (name == null || name.isBlank()) {
      name = "class-" + id;
    }
  }
}
