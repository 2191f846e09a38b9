package com.ospicorp.laiforecast.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Period {
  BASE,
  PREDICTED;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
